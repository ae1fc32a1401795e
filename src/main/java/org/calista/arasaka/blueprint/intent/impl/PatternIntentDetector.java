package org.calista.arasaka.blueprint.intent.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.blueprint.intent.IntentDetector;
import org.calista.arasaka.blueprint.intent.IntentMatch;
import org.calista.arasaka.blueprint.intent.IntentType;
import org.calista.arasaka.blueprint.tokenizer.PartOfSpeech;
import org.calista.arasaka.blueprint.tokenizer.Token;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * PatternIntentDetector: two-tier primary intent classification.
 *
 * Tier 1: ordered (regex, intent, weight) rules over the normalized text. The highest weight wins;
 * equal weights keep the earlier rule. The baseline is {@code create_app} at {@link Config#defaultConfidence}.
 *
 * Tier 2: when the best weight is still below {@link Config#fallbackThreshold}, the verb lemmas decide:
 * create-like verbs, then add-like, then change-like, then remove-like.
 *
 * Blank input is {@code unknown} at 0.
 */
public final class PatternIntentDetector implements IntentDetector {

    private static final Logger log = LogManager.getLogger(PatternIntentDetector.class);

    private record Rule(Pattern pattern, IntentType intent, double weight) {
        static Rule of(String regex, IntentType intent, double weight) {
            return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), intent, weight);
        }
    }

    // order matters: ties keep the earlier rule
    private static final List<Rule> RULES = List.of(
            Rule.of("^(build|create|make|design|develop)\\s+(me\\s+)?(an?\\s+)?(app|application|system|tool)", IntentType.CREATE_APP, 1.0),
            Rule.of("^i\\s+(want|need|would like)\\s+(an?\\s+)?(app|application)", IntentType.CREATE_APP, 0.9),
            Rule.of("(app|application|system|tool)\\s+(for|to)", IntentType.CREATE_APP, 0.7),

            Rule.of("^add\\s+(a\\s+)?(.+?)\\s+(feature|functionality|capability)", IntentType.ADD_FEATURE, 1.0),
            Rule.of("^include\\s+(a\\s+)?(.+)", IntentType.ADD_FEATURE, 0.8),
            Rule.of("^i\\s+also\\s+(want|need)", IntentType.ADD_FEATURE, 0.7),

            Rule.of("^(make|change|update)\\s+(it|this|the\\s+design|the\\s+app)\\s+(more\\s+)?(modern|minimal|colorful|professional)", IntentType.CHANGE_DESIGN, 1.0),
            Rule.of("^(change|update)\\s+(the\\s+)?(color|theme|style|look)", IntentType.CHANGE_DESIGN, 0.9),
            Rule.of("(more\\s+)?(modern|minimal|clean|professional|colorful)", IntentType.CHANGE_DESIGN, 0.5),

            Rule.of("^add\\s+(a\\s+)?(new\\s+)?page", IntentType.ADD_PAGE, 1.0),
            Rule.of("^(create|add)\\s+(a\\s+)?(.+?)\\s+page", IntentType.ADD_PAGE, 0.9),

            Rule.of("^add\\s+(a\\s+)?(.+?)\\s+(table|model|entity|data\\s+type)", IntentType.ADD_ENTITY, 1.0),
            Rule.of("^i\\s+(want|need)\\s+to\\s+track\\s+(.+)", IntentType.ADD_ENTITY, 0.8),

            Rule.of("^(change|modify|update|edit)\\s+(the\\s+)?(.+)", IntentType.MODIFY_APP, 0.7),
            Rule.of("^(rename|move|reorganize)", IntentType.MODIFY_APP, 0.8),

            Rule.of("^(remove|delete|hide|disable)\\s+(the\\s+)?(.+)", IntentType.REMOVE_FEATURE, 0.9),

            Rule.of("^(what|how|why|can\\s+you|show\\s+me)", IntentType.QUERY, 0.8),
            Rule.of("^help", IntentType.HELP, 1.0)
    );

    private static final Set<String> CREATE_VERBS = Set.of("create", "build", "make", "design", "develop");
    private static final Set<String> ADD_VERBS = Set.of("add", "include", "integrate");
    private static final Set<String> CHANGE_VERBS = Set.of("change", "modify", "update", "edit");
    private static final Set<String> REMOVE_VERBS = Set.of("remove", "delete", "hide");

    private final Config cfg;

    public PatternIntentDetector() {
        this(null);
    }

    public PatternIntentDetector(Config config) {
        this.cfg = (config == null ? Config.builder().build() : config).freezeAndValidate();
    }

    @Override
    public IntentMatch detect(String normalizedText, List<Token> tokens) {
        final String text = normalizedText == null ? "" : normalizedText;
        if (text.isBlank()) return new IntentMatch(IntentType.UNKNOWN, 0.0);

        IntentType best = IntentType.CREATE_APP;
        double bestScore = cfg.defaultConfidence;

        for (Rule r : RULES) {
            if (r.weight > bestScore && r.pattern.matcher(text).find()) {
                best = r.intent;
                bestScore = r.weight;
            }
        }

        if (bestScore < cfg.fallbackThreshold) {
            IntentMatch byVerb = fromVerbs(tokens);
            if (byVerb != null) {
                best = byVerb.type();
                bestScore = byVerb.confidence();
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("detect intent={} conf={} text='{}'", best.label(), bestScore, text);
        }
        return new IntentMatch(best, bestScore);
    }

    private static IntentMatch fromVerbs(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) return null;

        boolean create = false, add = false, change = false, remove = false;
        for (Token t : tokens) {
            if (!t.is(PartOfSpeech.VERB)) continue;
            String v = t.lemma();
            create |= CREATE_VERBS.contains(v);
            add |= ADD_VERBS.contains(v);
            change |= CHANGE_VERBS.contains(v);
            remove |= REMOVE_VERBS.contains(v);
        }

        if (create) return new IntentMatch(IntentType.CREATE_APP, 0.7);
        if (add) return new IntentMatch(IntentType.ADD_FEATURE, 0.6);
        if (change) return new IntentMatch(IntentType.MODIFY_APP, 0.6);
        if (remove) return new IntentMatch(IntentType.REMOVE_FEATURE, 0.6);
        return null;
    }

    // -------------------- Config --------------------

    public static final class Config {
        private boolean frozen;

        /** Best pattern weight below this triggers the verb fallback. */
        public double fallbackThreshold = 0.6;

        /** Confidence of the create_app baseline when no rule beats it. */
        public double defaultConfidence = 0.5;

        public static Builder builder() {
            return new Builder();
        }

        public Config freezeAndValidate() {
            if (frozen) return this;

            if (!Double.isFinite(fallbackThreshold)) fallbackThreshold = 0.6;
            if (!Double.isFinite(defaultConfidence)) defaultConfidence = 0.5;

            fallbackThreshold = clamp01(fallbackThreshold);
            defaultConfidence = clamp01(defaultConfidence);

            frozen = true;
            return this;
        }

        private static double clamp01(double v) {
            if (v < 0.0) return 0.0;
            if (v > 1.0) return 1.0;
            return v;
        }

        public static final class Builder {
            private final Config c = new Config();

            public Builder fallbackThreshold(double v) { c.fallbackThreshold = v; return this; }
            public Builder defaultConfidence(double v) { c.defaultConfidence = v; return this; }

            public Config build() {
                return c;
            }
        }
    }
}
