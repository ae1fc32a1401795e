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
 * "make it more modern", "use dark mode": one theme change carrying a fixed style bundle.
 */
public final class StyleChangePattern implements RevisionPattern {

    private static final List<Pattern> PATTERNS = List.of(
            ci("make\\s+(it|this|the\\s+\\w+)\\s+(more\\s+)?(modern|minimal|professional|bold|playful|colorful|clean|sleek)"),
            ci("change\\s+(the\\s+)?(style|design|look|theme)\\s+to\\s+(\\w+)"),
            ci("use\\s+(a\\s+)?(dark|light)\\s*(mode|theme)?"),
            ci("(dark|light)\\s*mode")
    );

    private static final List<String> KEYWORDS = List.of(
            "modern", "minimal", "professional", "colorful", "dark", "light", "clean", "sleek", "bold");

    private static final List<String> STYLE_WORDS = List.of(
            "modern", "minimal", "professional", "bold", "playful", "colorful", "clean", "sleek", "dark", "light");

    // "playful" and "sleek" are recognised but carry no bundle
    static final Map<String, Map<String, Object>> STYLES = Map.of(
            "modern", Map.of("borderRadius", "lg", "shadows", true, "animations", true),
            "minimal", Map.of("borderRadius", "sm", "shadows", false, "dense", true),
            "professional", Map.of("borderRadius", "md", "formal", true),
            "bold", Map.of("colors", "vibrant", "fontSize", "large"),
            "colorful", Map.of("colors", "vibrant", "gradients", true),
            "dark", Map.of("mode", "dark"),
            "light", Map.of("mode", "light"),
            "clean", Map.of("whitespace", "generous", "shadows", false)
    );

    @Override
    public RevisionIntent intent() {
        return RevisionIntent.STYLE_CHANGE;
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
        if (match == null) return null;
        return RevisionPattern.firstContained(text, STYLE_WORDS);
    }

    @Override
    public List<RevisionChange> generateChanges(String target, AppContext context, ParsedInput parsed) {
        Map<String, Object> style = STYLES.getOrDefault(target.toLowerCase(Locale.ROOT), Map.of());
        return List.of(RevisionChange.modify(ChangeTarget.STYLE, "theme", null, style,
                "Update theme to " + target + " style"));
    }
}
