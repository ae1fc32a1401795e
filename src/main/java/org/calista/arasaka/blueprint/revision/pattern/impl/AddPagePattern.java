package org.calista.arasaka.blueprint.revision.pattern.impl;

import org.calista.arasaka.blueprint.intent.ParsedInput;
import org.calista.arasaka.blueprint.revision.AppContext;
import org.calista.arasaka.blueprint.revision.ChangeTarget;
import org.calista.arasaka.blueprint.revision.RevisionChange;
import org.calista.arasaka.blueprint.revision.RevisionIntent;
import org.calista.arasaka.blueprint.revision.pattern.RevisionPattern;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.calista.arasaka.blueprint.revision.pattern.RevisionPattern.ci;

/**
 * "add a reports page": one new page, id slugified from the noun.
 */
public final class AddPagePattern implements RevisionPattern {

    private static final List<Pattern> PATTERNS = List.of(
            ci("add\\s+(a\\s+)?(new\\s+)?(\\w+)\\s+page"),
            ci("create\\s+(a\\s+)?(\\w+)\\s+page"),
            ci("i\\s+(need|want)\\s+(a\\s+)?(\\w+)\\s+page")
    );

    private static final List<String> KEYWORDS = List.of("add page", "create page", "new page");

    // "i need a X page" is recognised but names no target
    private static final Pattern TARGET = ci("(?:add|create)\\s+(?:a\\s+)?(?:new\\s+)?(\\w+)\\s+page");

    private static final Pattern SPACES = Pattern.compile("\\s+");

    @Override
    public RevisionIntent intent() {
        return RevisionIntent.ADD_PAGE;
    }

    @Override
    public List<Pattern> patterns() {
        return PATTERNS;
    }

    @Override
    public List<String> keywords() {
        return KEYWORDS;
    }

    @Override
    public String extractTarget(String text, Matcher match) {
        Matcher m = TARGET.matcher(text);
        return m.find() ? m.group(1) : null;
    }

    @Override
    public List<RevisionChange> generateChanges(String target, AppContext context, ParsedInput parsed) {
        if (target == null || target.isEmpty()) return List.of();

        String pageId = SPACES.matcher(target.toLowerCase(Locale.ROOT)).replaceAll("-");
        String pageName = Character.toUpperCase(target.charAt(0)) + target.substring(1);

        return List.of(RevisionChange.add(ChangeTarget.PAGE, pageId,
                Map.of("id", pageId, "name", pageName, "route", "/" + pageId),
                "Add " + pageName + " page"));
    }
}
