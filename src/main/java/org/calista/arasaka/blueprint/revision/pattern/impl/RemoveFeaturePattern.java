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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.calista.arasaka.blueprint.revision.pattern.RevisionPattern.ci;

/**
 * "remove the calendar": removes every page whose id or name contains the feature word.
 */
public final class RemoveFeaturePattern implements RevisionPattern {

    private static final List<Pattern> PATTERNS = List.of(
            ci("remove\\s+(the\\s+)?" + AddFeaturePattern.FEATURES),
            ci("delete\\s+(the\\s+)?" + AddFeaturePattern.FEATURES),
            ci("hide\\s+(the\\s+)?" + AddFeaturePattern.FEATURES),
            ci("i\\s+don'?t\\s+(need|want)\\s+(the\\s+)?" + AddFeaturePattern.FEATURES)
    );

    private static final List<String> KEYWORDS = List.of("remove", "delete", "hide", "dont need", "dont want");

    private static final List<String> TARGETS = List.of(
            "invoicing", "calendar", "scheduling", "messaging", "payments", "dashboard", "reports", "inventory");

    @Override
    public RevisionIntent intent() {
        return RevisionIntent.REMOVE_FEATURE;
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
        return RevisionPattern.firstContained(text, TARGETS);
    }

    @Override
    public List<RevisionChange> generateChanges(String target, AppContext context, ParsedInput parsed) {
        List<RevisionChange> out = new ArrayList<>();
        for (AppContext.Page p : context.pages) {
            if (p.id.contains(target) || p.name.toLowerCase(Locale.ROOT).contains(target)) {
                out.add(RevisionChange.remove(ChangeTarget.PAGE, p.id, p.toMap(), "Remove " + p.name + " page"));
            }
        }
        return out;
    }
}
