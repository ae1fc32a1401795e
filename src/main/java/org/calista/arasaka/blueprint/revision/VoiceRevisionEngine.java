package org.calista.arasaka.blueprint.revision;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.blueprint.intent.InputParser;
import org.calista.arasaka.blueprint.intent.IntentType;
import org.calista.arasaka.blueprint.intent.ParsedInput;
import org.calista.arasaka.blueprint.revision.pattern.RevisionPattern;
import org.calista.arasaka.blueprint.revision.pattern.impl.AddFeaturePattern;
import org.calista.arasaka.blueprint.revision.pattern.impl.AddPagePattern;
import org.calista.arasaka.blueprint.revision.pattern.impl.ModifyEntityPattern;
import org.calista.arasaka.blueprint.revision.pattern.impl.ModifyPagePattern;
import org.calista.arasaka.blueprint.revision.pattern.impl.RemoveFeaturePattern;
import org.calista.arasaka.blueprint.revision.pattern.impl.ReorganizePattern;
import org.calista.arasaka.blueprint.revision.pattern.impl.StyleChangePattern;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * VoiceRevisionEngine: maps an edit request ("make it more modern", "remove the calendar")
 * onto atomic changes against an {@link AppContext}.
 *
 * Matching walks the pattern library in order. Every matching regex scores via
 * {@link #calculateConfidence}; a keyword-only hit scores {@code min(0.2 * hits, 0.8)}.
 * A candidate replaces the current best only when strictly greater, so library order breaks ties.
 * Candidates whose target cannot be extracted are ignored.
 */
public final class VoiceRevisionEngine {

    private static final Logger log = LogManager.getLogger(VoiceRevisionEngine.class);

    static final String CLARIFY = "I'm not sure what change you'd like to make. Could you be more specific?";
    static final String NOTHING_FOUND = "I didn't find any changes to make. Could you be more specific?";

    private final InputParser parser;
    private final List<RevisionPattern> library;
    private final Config cfg;

    public VoiceRevisionEngine() {
        this(new InputParser(), null);
    }

    public VoiceRevisionEngine(InputParser parser, Config config) {
        this(parser, defaultLibrary(), config);
    }

    public VoiceRevisionEngine(InputParser parser, List<RevisionPattern> library, Config config) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.library = List.copyOf(library);
        this.cfg = (config == null ? Config.builder().build() : config).freezeAndValidate();
    }

    public static List<RevisionPattern> defaultLibrary() {
        return List.of(
                new StyleChangePattern(),
                new AddFeaturePattern(),
                new RemoveFeaturePattern(),
                new ModifyEntityPattern(),
                new AddPagePattern(),
                new ModifyPagePattern(),
                new ReorganizePattern());
    }

    public List<RevisionPattern> library() {
        return library;
    }

    // -------------------- Process --------------------

    public RevisionResult processRevision(String utterance, AppContext context) {
        Objects.requireNonNull(context, "context");
        final String text = utterance == null ? "" : utterance;
        final ParsedInput parsed = parser.parse(text);

        Match best = match(text, parsed);
        if (best == null) {
            if (log.isDebugEnabled()) log.debug("revision no-match text='{}'", text);
            return new RevisionResult(RevisionIntent.MODIFY_APP, 0.3, List.of(), true, CLARIFY);
        }

        List<RevisionChange> changes = best.pattern.generateChanges(best.target, context, parsed);
        RevisionIntent intent = best.pattern.intent();
        boolean confirm = shouldConfirm(intent, changes);

        if (log.isDebugEnabled()) {
            log.debug("revision intent={} target='{}' conf={} changes={} confirm={}",
                    intent.label(), best.target, best.confidence, changes.size(), confirm);
        }
        return new RevisionResult(intent, best.confidence, changes, confirm,
                confirm ? generateConfirmation(intent, changes) : null);
    }

    private static final class Match {
        final RevisionPattern pattern;
        final String target;
        final double confidence;

        Match(RevisionPattern pattern, String target, double confidence) {
            this.pattern = pattern;
            this.target = target;
            this.confidence = confidence;
        }
    }

    private Match match(String text, ParsedInput parsed) {
        Match best = null;

        for (RevisionPattern p : library) {
            for (Pattern regex : p.patterns()) {
                Matcher m = regex.matcher(text);
                if (!m.find()) continue;

                String target = p.extractTarget(text, m);
                if (isBlank(target)) continue;

                double conf = calculateConfidence(p, text, parsed);
                if (best == null || conf > best.confidence) best = new Match(p, target, conf);
            }

            int hits = p.keywordHits(text);
            if (hits > 0) {
                String target = p.extractTarget(text, null);
                if (isBlank(target)) continue;

                double conf = Math.min(hits * 0.2, 0.8);
                if (best == null || conf > best.confidence) best = new Match(p, target, conf);
            }
        }
        return best;
    }

    /**
     * 0.5 base, +0.3 when any regex of the pattern matches, +0.1 per keyword hit (at most +0.3),
     * +0.1 when the primary intent is modify_app, change_design or add_feature; capped at 1.
     */
    public double calculateConfidence(RevisionPattern pattern, String text, ParsedInput parsed) {
        double c = 0.5;
        if (pattern.anyPatternMatches(text)) c += 0.3;
        c += Math.min(pattern.keywordHits(text) * 0.1, 0.3);

        IntentType primary = parsed == null ? null : parsed.intent;
        if (primary == IntentType.MODIFY_APP || primary == IntentType.CHANGE_DESIGN || primary == IntentType.ADD_FEATURE) {
            c += 0.1;
        }
        return Math.min(c, 1.0);
    }

    // -------------------- Confirmation --------------------

    /**
     * Ordered rules: removals always confirm; large change sets confirm; a single style change does not;
     * anything else confirms.
     */
    public boolean shouldConfirm(RevisionIntent intent, List<RevisionChange> changes) {
        if (intent == RevisionIntent.REMOVE_FEATURE || intent == RevisionIntent.REMOVE_PAGE) return true;
        if (changes.size() > cfg.maxListedChanges) return true;
        if (intent == RevisionIntent.STYLE_CHANGE && changes.size() == 1) return false;
        return true;
    }

    public String generateConfirmation(RevisionIntent intent, List<RevisionChange> changes) {
        if (changes.isEmpty()) return NOTHING_FOUND;

        int listed = Math.min(changes.size(), cfg.maxListedChanges);
        List<String> descriptions = new ArrayList<>(listed);
        for (int i = 0; i < listed; i++) descriptions.add(changes.get(i).description());

        String list = String.join(", ", descriptions);
        if (changes.size() > listed) list += " and " + (changes.size() - listed) + " more changes";

        return switch (intent) {
            case STYLE_CHANGE -> "I'll update the style: " + list + ". Sound good?";
            case ADD_FEATURE -> "I'll add the following: " + list + ". Should I proceed?";
            case REMOVE_FEATURE, REMOVE_PAGE -> "This will remove: " + list + ". This cannot be undone. Are you sure?";
            case MODIFY_ENTITY -> "I'll modify the data structure: " + list + ". Proceed?";
            case ADD_PAGE -> "I'll add a new page: " + list + ". Should I continue?";
            case MODIFY_PAGE -> "I'll update the page: " + list + ". Is that correct?";
            case REORGANIZE -> "I'll reorganize: " + list + ". Shall I make these changes?";
            default -> "I'll make the following changes: " + list + ". Continue?";
        };
    }

    // -------------------- Apply --------------------

    /**
     * Returns a new context with the changes applied in order. Page changes add, remove or merge;
     * entity and workflow changes add or remove. Field and style changes leave the context as is.
     */
    public AppContext applyChanges(AppContext context, List<RevisionChange> changes) {
        Objects.requireNonNull(context, "context");
        AppContext out = context;

        for (RevisionChange c : changes) {
            switch (c.target()) {
                case PAGE -> out = applyToPages(out, c);
                case ENTITY -> out = applyToEntities(out, c);
                case WORKFLOW -> out = applyToWorkflows(out, c);
                default -> {
                    if (log.isTraceEnabled()) log.trace("apply skip target={} id={}", c.target().label(), c.targetId());
                }
            }
        }
        return out;
    }

    private static AppContext applyToPages(AppContext ctx, RevisionChange c) {
        List<AppContext.Page> pages = new ArrayList<>(ctx.pages);
        switch (c.type()) {
            case ADD -> pages.add(AppContext.Page.fromMap(withId(c)));
            case REMOVE -> pages.removeIf(p -> p.id.equals(c.targetId()));
            case MODIFY -> pages.replaceAll(p -> p.id.equals(c.targetId()) ? p.merge(c.after()) : p);
        }
        return ctx.withPages(pages);
    }

    private static AppContext applyToEntities(AppContext ctx, RevisionChange c) {
        List<AppContext.Entity> entities = new ArrayList<>(ctx.entities);
        switch (c.type()) {
            case ADD -> entities.add(AppContext.Entity.fromMap(withId(c)));
            case REMOVE -> entities.removeIf(e -> e.id().equals(c.targetId()));
            default -> {
                return ctx;
            }
        }
        return ctx.withEntities(entities);
    }

    private static AppContext applyToWorkflows(AppContext ctx, RevisionChange c) {
        List<AppContext.Workflow> workflows = new ArrayList<>(ctx.workflows);
        switch (c.type()) {
            case ADD -> workflows.add(AppContext.Workflow.fromMap(withId(c)));
            case REMOVE -> workflows.removeIf(w -> w.id().equals(c.targetId()));
            default -> {
                return ctx;
            }
        }
        return ctx.withWorkflows(workflows);
    }

    private static Map<String, Object> withId(RevisionChange c) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", c.targetId());
        if (c.after() != null) m.putAll(c.after());
        return m;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isEmpty();
    }

    // -------------------- Config --------------------

    public static final class Config {
        private boolean frozen;

        /** Descriptions listed in a confirmation; larger change sets always need confirmation. */
        public int maxListedChanges = 3;

        public static Builder builder() {
            return new Builder();
        }

        public Config freezeAndValidate() {
            if (frozen) return this;
            if (maxListedChanges < 1) maxListedChanges = 3;
            frozen = true;
            return this;
        }

        public static final class Builder {
            private final Config c = new Config();

            public Builder maxListedChanges(int v) { c.maxListedChanges = v; return this; }

            public Config build() {
                return c;
            }
        }
    }
}
