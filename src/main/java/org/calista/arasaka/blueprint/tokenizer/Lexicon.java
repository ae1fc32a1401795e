package org.calista.arasaka.blueprint.tokenizer;

import java.util.Map;
import java.util.Set;

/**
 * Closed-class word lists shared by the tokenizer and the classifiers.
 * All entries are lowercase lemmas.
 */
public final class Lexicon {

    private Lexicon() {}

    public static final Set<String> ACTION_VERBS = Set.of(
            "create", "build", "make", "design", "develop",
            "add", "include", "integrate", "connect",
            "track", "manage", "organize", "handle",
            "schedule", "book", "reserve", "plan",
            "send", "notify", "alert", "remind",
            "invoice", "bill", "charge", "pay",
            "report", "analyze", "monitor", "measure",
            "assign", "delegate", "share", "collaborate",
            "automate", "streamline", "simplify", "optimize",
            "change", "modify", "update", "edit", "fix",
            "remove", "delete", "hide", "disable",
            "show", "display", "view", "see"
    );

    public static final Set<String> STYLE_ADJECTIVES = Set.of(
            "modern", "minimal", "clean", "simple", "sleek",
            "professional", "corporate", "business", "formal",
            "colorful", "vibrant", "bold", "bright", "dark",
            "friendly", "playful", "fun", "casual",
            "elegant", "sophisticated", "premium", "luxurious",
            "compact", "spacious", "dense", "airy"
    );

    public static final Set<String> QUANTITY_WORDS = Set.of(
            "all", "every", "each", "some", "many", "few",
            "multiple", "several", "single", "one", "two",
            "daily", "weekly", "monthly", "yearly", "annual"
    );

    public static final Set<String> PRIORITY_WORDS = Set.of(
            "important", "critical", "urgent", "priority",
            "essential", "required", "necessary", "optional",
            "main", "primary", "secondary", "minor"
    );

    public static final Set<String> TIME_WORDS = Set.of(
            "today", "tomorrow", "yesterday", "now", "later",
            "morning", "afternoon", "evening", "night",
            "before", "after", "during", "while",
            "immediately", "soon", "eventually", "always", "never"
    );

    public static final Set<String> STATUS_WORDS = Set.of(
            "active", "inactive", "pending", "completed", "done",
            "open", "closed", "new", "old", "archived",
            "approved", "rejected", "cancelled", "draft"
    );

    public static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "and", "or", "but", "is", "are", "was", "were",
            "be", "been", "being", "have", "has", "had", "do", "does", "did",
            "will", "would", "could", "should", "may", "might", "must", "shall",
            "can", "to", "of", "in", "for", "on", "with", "at", "by", "from",
            "as", "into", "through", "during", "before", "after", "above", "below",
            "between", "under", "again", "further", "then", "once", "here", "there",
            "when", "where", "why", "how", "all", "each", "few", "more", "most",
            "other", "some", "such", "no", "nor", "not", "only", "own", "same",
            "so", "than", "too", "very", "just", "also", "now", "me", "my", "i",
            "we", "our", "you", "your", "it", "its", "that", "this", "these", "those"
    );

    // stop-word subclasses (only consulted for words already in STOP_WORDS)
    public static final Set<String> DETERMINERS = Set.of("a", "an", "the");
    public static final Set<String> CONJUNCTIONS = Set.of("and", "or", "but");
    public static final Set<String> PREPOSITIONS = Set.of("in", "on", "at", "to", "for", "with", "by", "from");
    public static final Set<String> PRONOUNS = Set.of("i", "me", "my", "we", "our", "you", "your", "it", "they");

    // context cues looked up on the previous word
    public static final Set<String> INTENSIFIERS = Set.of("more", "very", "really", "quite", "so");
    public static final Set<String> VERB_CUES = Set.of("to", "can", "will", "would", "should", "could", "must", "please");
    public static final Set<String> NOUN_CUES = Set.of("a", "an", "the", "my", "your", "our", "their");

    public static final Map<String, String> IRREGULAR_VERBS = Map.of(
            "built", "build",
            "made", "make",
            "sent", "send",
            "paid", "pay",
            "set", "set",
            "put", "put"
    );

    public static boolean isStopWord(String w) {
        return w != null && STOP_WORDS.contains(w);
    }

    public static boolean isActionVerb(String w) {
        return w != null && ACTION_VERBS.contains(w);
    }
}
