package org.calista.arasaka.blueprint.tokenizer.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.blueprint.tokenizer.Lexicon;
import org.calista.arasaka.blueprint.tokenizer.PartOfSpeech;
import org.calista.arasaka.blueprint.tokenizer.Token;
import org.calista.arasaka.blueprint.tokenizer.Tokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rule based lexical analyzer:
 * - normalization: lowercase, straight quotes, safe punctuation only, single spaces
 * - whitespace split; punctuation is stripped per token for lemma/tag lookups
 * - suffix-stripping lemmatizer with a small irregular-verb table
 * - POS cascade: lexicons, then numerals, then left-context cues, then suffixes, then default
 *
 * Deterministic and stateless; one instance can be shared across threads.
 */
public final class LexicalTokenizer implements Tokenizer {

    private static final Logger log = LogManager.getLogger(LexicalTokenizer.class);

    private static final Pattern SINGLE_QUOTES = Pattern.compile("[\u2018\u2019]");
    private static final Pattern DOUBLE_QUOTES = Pattern.compile("[\u201C\u201D]");
    private static final Pattern UNSAFE = Pattern.compile("[^\\w\\s'\"$.,!?-]");
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final Pattern TOKEN_PUNCT = Pattern.compile("[.,!?'\"]");

    private static final Pattern INTEGER = Pattern.compile("^\\d+$");
    private static final Pattern MONEY = Pattern.compile("^\\$[\\d,]+");
    private static final Pattern NOUN_SUFFIX = Pattern.compile("(tion|ment|ness|ity|er|or|ist|ism)$");
    private static final Pattern ADJECTIVE_SUFFIX = Pattern.compile("(ful|less|ous|ive|able|ible|al|ical)$");

    private static final int LONG_WORD = 6;

    @Override
    public String normalize(String text) {
        if (text == null || text.isEmpty()) return "";

        String s = text.toLowerCase(Locale.ROOT);
        s = SINGLE_QUOTES.matcher(s).replaceAll("'");
        s = DOUBLE_QUOTES.matcher(s).replaceAll("\"");
        // strip first so removed characters never leave double spaces behind
        s = UNSAFE.matcher(s).replaceAll("");
        s = SPACES.matcher(s).replaceAll(" ");
        return s.trim();
    }

    @Override
    public List<Token> tokenize(String normalizedText) {
        if (normalizedText == null || normalizedText.isBlank()) return List.of();

        String[] words = SPACES.split(normalizedText.trim());
        ArrayList<Token> out = new ArrayList<>(words.length);

        for (int i = 0; i < words.length; i++) {
            String word = words[i];
            String cleaned = TOKEN_PUNCT.matcher(word).replaceAll("");
            String lemma = lemmatize(cleaned);
            PartOfSpeech pos = tag(cleaned, lemma, words, i);
            double importance = importance(cleaned, lemma, pos);
            out.add(new Token(word, lemma, pos, i, importance));
        }

        if (log.isTraceEnabled()) {
            log.trace("tokenize n={} text='{}'", out.size(), normalizedText);
        }
        return List.copyOf(out);
    }

    // -------------------- Lemma --------------------

    /**
     * Suffix-stripping lemmatizer. Rules are checked in order and the first hit wins;
     * {@code -ies} is tested before the generic plural so "companies" becomes "company".
     */
    public static String lemmatize(String word) {
        String lower = word.toLowerCase(Locale.ROOT);

        if (lower.endsWith("ing")) {
            String base = lower.substring(0, lower.length() - 3);
            if (base.endsWith("t") || base.endsWith("n") || base.endsWith("d")) {
                return base;
            }
            return base + "e";
        }
        if (lower.endsWith("ed")) {
            return lower.substring(0, lower.length() - 2);
        }
        if (lower.endsWith("ies")) {
            return lower.substring(0, lower.length() - 3) + "y";
        }
        if (lower.endsWith("s") && !lower.endsWith("ss")) {
            return lower.substring(0, lower.length() - 1);
        }

        String irregular = Lexicon.IRREGULAR_VERBS.get(lower);
        return irregular != null ? irregular : lower;
    }

    // -------------------- POS --------------------

    private static PartOfSpeech tag(String word, String lemma, String[] context, int index) {
        String lower = word.toLowerCase(Locale.ROOT);

        // closed-class lexicons
        if (Lexicon.ACTION_VERBS.contains(lemma)) return PartOfSpeech.VERB;
        if (Lexicon.STYLE_ADJECTIVES.contains(lemma)) return PartOfSpeech.ADJECTIVE;
        if (Lexicon.QUANTITY_WORDS.contains(lemma) || Lexicon.PRIORITY_WORDS.contains(lemma)) return PartOfSpeech.ADJECTIVE;
        if (Lexicon.TIME_WORDS.contains(lemma)) return PartOfSpeech.ADVERB;
        if (Lexicon.STATUS_WORDS.contains(lemma)) return PartOfSpeech.ADJECTIVE;
        if (Lexicon.STOP_WORDS.contains(lower)) {
            if (Lexicon.DETERMINERS.contains(lower)) return PartOfSpeech.DETERMINER;
            if (Lexicon.CONJUNCTIONS.contains(lower)) return PartOfSpeech.CONJUNCTION;
            if (Lexicon.PREPOSITIONS.contains(lower)) return PartOfSpeech.PREPOSITION;
            if (Lexicon.PRONOUNS.contains(lower)) return PartOfSpeech.PRONOUN;
        }

        if (INTEGER.matcher(word).find() || MONEY.matcher(word).find()) return PartOfSpeech.NUMBER;

        // left context
        String prev = index > 0 ? context[index - 1].toLowerCase(Locale.ROOT) : "";
        if (Lexicon.INTENSIFIERS.contains(prev)) return PartOfSpeech.ADJECTIVE;
        if (Lexicon.VERB_CUES.contains(prev)) return PartOfSpeech.VERB;
        if (Lexicon.NOUN_CUES.contains(prev)) return PartOfSpeech.NOUN;

        if (NOUN_SUFFIX.matcher(lower).find()) return PartOfSpeech.NOUN;
        if (ADJECTIVE_SUFFIX.matcher(lower).find()) return PartOfSpeech.ADJECTIVE;

        return lower.length() > 2 && !Lexicon.STOP_WORDS.contains(lower) ? PartOfSpeech.NOUN : PartOfSpeech.UNKNOWN;
    }

    private static double importance(String word, String lemma, PartOfSpeech pos) {
        double score = 0.5;

        if (pos == PartOfSpeech.NOUN) score += 0.3;
        if (pos == PartOfSpeech.VERB) score += 0.2;
        if (pos == PartOfSpeech.ADJECTIVE) score += 0.1;

        if (Lexicon.ACTION_VERBS.contains(lemma)) score += 0.2;
        if (Lexicon.STOP_WORDS.contains(lemma)) score -= 0.4;

        if (word.length() > LONG_WORD) score += 0.1;

        return Math.min(Math.max(score, 0.0), 1.0);
    }
}
