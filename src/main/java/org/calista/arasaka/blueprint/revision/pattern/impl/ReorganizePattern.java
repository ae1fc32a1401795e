package org.calista.arasaka.blueprint.revision.pattern.impl;

import org.calista.arasaka.blueprint.intent.ParsedInput;
import org.calista.arasaka.blueprint.revision.AppContext;
import org.calista.arasaka.blueprint.revision.ChangeTarget;
import org.calista.arasaka.blueprint.revision.RevisionChange;
import org.calista.arasaka.blueprint.revision.RevisionIntent;
import org.calista.arasaka.blueprint.revision.pattern.RevisionPattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.calista.arasaka.blueprint.revision.pattern.RevisionPattern.ci;

/**
 * Navigation edits. "move X to the sidebar" and "make X the default page" are checked
 * independently, so one utterance may yield both changes.
 */
public final class ReorganizePattern implements RevisionPattern {

    private static final List<Pattern> PATTERNS = List.of(
            ci("move\\s+(the\\s+)?(\\w+)\\s+to\\s+(the\\s+)?(main\\s+menu|sidebar|top)"),
            ci("put\\s+(the\\s+)?(\\w+)\\s+in\\s+(the\\s+)?(main\\s+menu|sidebar|navigation)"),
            ci("make\\s+(the\\s+)?(\\w+)\\s+(the\\s+)?(first|main|default)\\s+(page)?")
    );

    private static final List<String> KEYWORDS = List.of("move", "put", "reorganize", "main menu", "sidebar");

    private static final Pattern MOVE = ci("move\\s+(?:the\\s+)?(\\w+)\\s+to\\s+(?:the\\s+)?(main\\s+menu|sidebar)");
    private static final Pattern MAKE_DEFAULT = ci("make\\s+(?:the\\s+)?(\\w+)\\s+(?:the\\s+)?(first|main|default)");

    @Override
    public RevisionIntent intent() {
        return RevisionIntent.REORGANIZE;
    }

    @Override
    public List<Pattern> patterns() {
        return PATTERNS;
    }

    @Override
    public List<String> keywords() {
        return KEYWORDS;
    }

    /** The whole utterance; both shapes are re-parsed in {@link #generateChanges}. */
    @Override
    public String extractTarget(String text, Matcher match) {
        return text == null || text.isEmpty() ? null : text;
    }

    @Override
    public List<RevisionChange> generateChanges(String target, AppContext context, ParsedInput parsed) {
        List<RevisionChange> out = new ArrayList<>(2);

        Matcher move = MOVE.matcher(target);
        if (move.find()) {
            AppContext.Page p = findPage(context, move.group(1));
            if (p != null) {
                out.add(RevisionChange.modify(ChangeTarget.PAGE, p.id, null,
                        Map.of("showInSidebar", true, "order", 0),
                        "Move " + p.name + " to " + move.group(2)));
            }
        }

        Matcher def = MAKE_DEFAULT.matcher(target);
        if (def.find()) {
            AppContext.Page p = findPage(context, def.group(1));
            if (p != null) {
                out.add(RevisionChange.modify(ChangeTarget.PAGE, p.id, null,
                        Map.of("route", "/", "order", 0),
                        "Make " + p.name + " the default page"));
            }
        }
        return out;
    }

    private static AppContext.Page findPage(AppContext context, String name) {
        String n = name.toLowerCase(Locale.ROOT);
        for (AppContext.Page p : context.pages) {
            if (p.id.toLowerCase(Locale.ROOT).contains(n) || p.name.toLowerCase(Locale.ROOT).contains(n)) return p;
        }
        return null;
    }
}
