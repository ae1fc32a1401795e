package org.calista.arasaka.blueprint.revision.pattern;

import org.calista.arasaka.blueprint.intent.ParsedInput;
import org.calista.arasaka.blueprint.revision.AppContext;
import org.calista.arasaka.blueprint.revision.RevisionChange;
import org.calista.arasaka.blueprint.revision.RevisionIntent;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One entry of the revision library: regexes and keywords that recognise a kind of edit,
 * plus the logic turning the recognised target into changes.
 *
 * Implementations are stateless and shared.
 */
public interface RevisionPattern {

    RevisionIntent intent();

    /** Tried in order against the raw utterance. */
    List<Pattern> patterns();

    /** Case-insensitive substrings. */
    List<String> keywords();

    /**
     * @param match the regex match, or null when reached through keywords only
     * @return the target, or null when this pattern cannot act on the text
     */
    String extractTarget(String text, Matcher match);

    List<RevisionChange> generateChanges(String target, AppContext context, ParsedInput parsed);

    default boolean anyPatternMatches(String text) {
        for (Pattern p : patterns()) {
            if (p.matcher(text).find()) return true;
        }
        return false;
    }

    default int keywordHits(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        int hits = 0;
        for (String kw : keywords()) {
            if (lower.contains(kw.toLowerCase(Locale.ROOT))) hits++;
        }
        return hits;
    }

    static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /** First word of {@code candidates} contained in the lower-cased text, or null. */
    static String firstContained(String text, List<String> candidates) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String c : candidates) {
            if (lower.contains(c)) return c;
        }
        return null;
    }
}
