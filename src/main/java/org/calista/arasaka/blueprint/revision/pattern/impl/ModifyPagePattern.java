package org.calista.arasaka.blueprint.revision.pattern.impl;

import org.calista.arasaka.blueprint.intent.ParsedInput;
import org.calista.arasaka.blueprint.revision.AppContext;
import org.calista.arasaka.blueprint.revision.ChangeTarget;
import org.calista.arasaka.blueprint.revision.RevisionChange;
import org.calista.arasaka.blueprint.revision.RevisionIntent;
import org.calista.arasaka.blueprint.revision.pattern.RevisionPattern;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.calista.arasaka.blueprint.revision.pattern.RevisionPattern.ci;

/**
 * "rename the jobs page to work orders": renames an existing page.
 * Target is encoded as {@code old:new}.
 */
public final class ModifyPagePattern implements RevisionPattern {

    private static final List<Pattern> PATTERNS = List.of(
            ci("rename\\s+(the\\s+)?(\\w+)\\s+(page\\s+)?to\\s+(\\w+)"),
            ci("change\\s+(the\\s+)?(\\w+)\\s+(page\\s+)?name\\s+to\\s+(\\w+)"),
            ci("call\\s+(the\\s+)?(\\w+)\\s+(page\\s+)?(\\w+)\\s+instead")
    );

    private static final List<String> KEYWORDS = List.of("rename", "change name", "call instead");

    private static final Pattern RENAME = ci("rename\\s+(?:the\\s+)?(\\w+)\\s+(?:page\\s+)?to\\s+(\\w+)");

    @Override
    public RevisionIntent intent() {
        return RevisionIntent.MODIFY_PAGE;
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
        Matcher m = RENAME.matcher(text);
        return m.find() ? m.group(1) + ":" + m.group(2) : null;
    }

    @Override
    public List<RevisionChange> generateChanges(String target, AppContext context, ParsedInput parsed) {
        if (target == null) return List.of();
        int sep = target.indexOf(':');
        if (sep < 0) return List.of();

        String oldName = target.substring(0, sep);
        String newName = target.substring(sep + 1);

        for (AppContext.Page p : context.pages) {
            if (p.id.equalsIgnoreCase(oldName) || p.name.equalsIgnoreCase(oldName)) {
                return List.of(RevisionChange.modify(ChangeTarget.PAGE, p.id,
                        Map.of("name", p.name), Map.of("name", newName),
                        "Rename " + p.name + " to " + newName));
            }
        }
        return List.of();
    }
}
