package org.calista.arasaka.blueprint.workflow;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.blueprint.intent.ParsedInput;
import org.calista.arasaka.blueprint.intent.SemanticIntent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * WorkflowInferenceEngine: turns a parsed utterance plus known entities and features into workflows.
 *
 * Passes, merged by workflow id with the first writer winning:
 *  1) phrase-matched templates from {@link WorkflowPatterns}, best score first, bound to the first entity
 *  2) CRUD and navigation workflows per entity (plus "complete" for trackable entities)
 *  3) feature-gated workflows (appointments/calendar, invoicing, quotes, reminders)
 *  4) one causal workflow from a "when X then Y" sentence
 *
 * Stateless apart from the id supplier; safe to share when the supplier is.
 */
public final class WorkflowInferenceEngine {

    private static final Logger log = LogManager.getLogger(WorkflowInferenceEngine.class);

    static final double TRIGGER_HIT = 0.3;
    static final double ACTION_HIT = 0.2;
    static final double INTENT_BONUS = 0.15;

    private final Config cfg;

    public WorkflowInferenceEngine() {
        this(null);
    }

    public WorkflowInferenceEngine(Config config) {
        this.cfg = (config == null ? Config.builder().build() : config).freezeAndValidate();
    }

    public List<InferredWorkflow> infer(ParsedInput parsed, List<KnownEntity> entities, Collection<String> featureIds) {
        Objects.requireNonNull(parsed, "parsed");
        final List<KnownEntity> ents = entities == null ? List.of() : entities;
        final Set<String> features = featureIds == null ? Set.of() : new HashSet<>(featureIds);

        LinkedHashMap<String, InferredWorkflow> out = new LinkedHashMap<>();

        for (PatternMatch m : detectPatterns(parsed)) {
            InferredWorkflow w = instantiate(m.pattern, ents, m.confidence);
            if (w != null) out.putIfAbsent(w.id, w);
        }

        for (KnownEntity e : ents) {
            for (InferredWorkflow w : crudWorkflows(e)) out.putIfAbsent(w.id, w);
        }

        for (InferredWorkflow w : featureWorkflows(features)) out.putIfAbsent(w.id, w);

        InferredWorkflow causal = causalWorkflow(parsed, ents);
        if (causal != null) out.putIfAbsent(causal.id, causal);

        if (log.isDebugEnabled()) {
            log.debug("infer entities={} features={} workflows={}", ents.size(), features.size(), out.keySet());
        }
        return List.copyOf(out.values());
    }

    // -------------------- Pass 1: pattern library --------------------

    public static final class PatternMatch {
        public final WorkflowPattern pattern;
        public final double confidence;

        PatternMatch(WorkflowPattern pattern, double confidence) {
            this.pattern = pattern;
            this.confidence = confidence;
        }
    }

    /**
     * Scores every template; keeps those above {@link Config#minPatternScore}, sorted by confidence
     * descending (stable, so library order breaks ties).
     */
    public List<PatternMatch> detectPatterns(ParsedInput parsed) {
        final String text = parsed.normalized;
        List<PatternMatch> out = new ArrayList<>();

        for (WorkflowPattern p : WorkflowPatterns.ALL) {
            double score = 0.0;

            for (String t : p.triggers()) {
                if (text.contains(t)) score += TRIGGER_HIT;
            }
            for (String action : parsed.actions) {
                for (String t : p.triggers()) {
                    if (t.contains(action)) {
                        score += ACTION_HIT;
                        break;
                    }
                }
            }
            if (parsed.has(SemanticIntent.AUTOMATING) && p.trigger().type() == TriggerType.SCHEDULE) {
                score += INTENT_BONUS;
            }
            if (parsed.has(SemanticIntent.COMMUNICATING) && p.hasMessageStep()) {
                score += INTENT_BONUS;
            }

            if (score > cfg.minPatternScore) out.add(new PatternMatch(p, Math.min(score, 1.0)));
        }

        out.sort(Comparator.comparingDouble((PatternMatch m) -> m.confidence).reversed());
        return out;
    }

    /**
     * Binds a template to the first entity; null when there is none.
     */
    static InferredWorkflow instantiate(WorkflowPattern p, List<KnownEntity> entities, double confidence) {
        if (entities.isEmpty()) return null;
        KnownEntity e = entities.get(0);
        TemplateSubstitution sub = new TemplateSubstitution(e.id(), e.name());

        List<WorkflowStep> steps = new ArrayList<>(p.steps().size());
        for (WorkflowStep s : p.steps()) steps.add(sub.apply(s));

        List<WorkflowCondition> conditions = new ArrayList<>(p.conditions().size());
        for (WorkflowCondition c : p.conditions()) conditions.add(sub.apply(c));

        return new InferredWorkflow(
                p.id() + "-" + e.id(),
                sub.apply(p.name()),
                sub.apply(p.description()),
                confidence,
                sub.apply(p.trigger()),
                steps,
                conditions);
    }

    // -------------------- Pass 2: CRUD --------------------

    static List<InferredWorkflow> crudWorkflows(KnownEntity e) {
        final String id = e.id();
        final String name = e.name();
        final String lower = name.toLowerCase(Locale.ROOT);
        List<InferredWorkflow> out = new ArrayList<>(6);

        out.add(new InferredWorkflow("create-" + id, "Create " + name, "Create a new " + lower, 0.9,
                WorkflowTrigger.onComponent(TriggerType.FORM_SUBMIT, id + "-form"),
                List.of(
                        WorkflowStep.of("create", StepType.CREATE, "entityId", id, "source", "form_data"),
                        WorkflowStep.of("notify", StepType.NOTIFY, "message", name + " created!", "type", "success"),
                        WorkflowStep.of("navigate", StepType.NAVIGATE, "pageId", id + "-list"))));

        out.add(new InferredWorkflow("update-" + id, "Update " + name, "Update an existing " + lower, 0.9,
                WorkflowTrigger.onComponent(TriggerType.FORM_SUBMIT, id + "-edit-form"),
                List.of(
                        WorkflowStep.of("update", StepType.UPDATE, "entityId", id, "source", "form_data"),
                        WorkflowStep.of("notify", StepType.NOTIFY, "message", name + " updated!", "type", "success"),
                        WorkflowStep.of("navigate", StepType.NAVIGATE, "pageId", id + "-detail"))));

        out.add(new InferredWorkflow("delete-" + id, "Delete " + name, "Delete a " + lower, 0.9,
                WorkflowTrigger.onComponent(TriggerType.BUTTON_CLICK, id + "-delete-btn"),
                List.of(
                        WorkflowStep.of("delete", StepType.DELETE, "entityId", id),
                        WorkflowStep.of("notify", StepType.NOTIFY, "message", name + " deleted", "type", "info"),
                        WorkflowStep.of("navigate", StepType.NAVIGATE, "pageId", id + "-list"))));

        if (e.hasBehavior("trackable")) {
            out.add(new InferredWorkflow("complete-" + id, "Complete " + name, "Mark " + lower + " as complete", 0.7,
                    WorkflowTrigger.onComponent(TriggerType.BUTTON_CLICK, id + "-complete-btn"),
                    List.of(
                            WorkflowStep.of("update", StepType.UPDATE, "entityId", id, "field", "status", "value", "completed"),
                            WorkflowStep.of("notify", StepType.NOTIFY, "message", name + " completed!", "type", "success"))));
        }

        out.add(new InferredWorkflow("navigate-" + id + "-list", "View " + e.pluralName(),
                "Navigate to " + e.pluralName().toLowerCase(Locale.ROOT) + " list", 0.95,
                WorkflowTrigger.onComponent(TriggerType.BUTTON_CLICK, id + "-back-btn"),
                List.of(WorkflowStep.of("navigate", StepType.NAVIGATE, "pageId", id + "-list"))));

        out.add(new InferredWorkflow("navigate-" + id + "-form", "Add " + name,
                "Navigate to add " + lower + " form", 0.95,
                WorkflowTrigger.onComponent(TriggerType.BUTTON_CLICK, id + "-add-btn"),
                List.of(WorkflowStep.of("navigate", StepType.NAVIGATE, "pageId", id + "-form"))));

        return out;
    }

    // -------------------- Pass 3: features --------------------

    static List<InferredWorkflow> featureWorkflows(Set<String> features) {
        List<InferredWorkflow> out = new ArrayList<>();

        if (features.contains("appointments") || features.contains("calendar")) {
            out.add(new InferredWorkflow("book-appointment", "Book Appointment",
                    "Book a new appointment and send confirmation", 0.8,
                    WorkflowTrigger.onComponent(TriggerType.FORM_SUBMIT, "booking-form"),
                    List.of(
                            WorkflowStep.of("create", StepType.CREATE, "entityId", "appointment", "source", "form_data"),
                            WorkflowStep.of("email", StepType.EMAIL, "to", "{clientEmail}", "subject", "Appointment Confirmed"),
                            WorkflowStep.of("notify", StepType.NOTIFY, "message", "Appointment booked!", "type", "success"))));
        }

        if (features.contains("invoicing")) {
            out.add(new InferredWorkflow("create-invoice-from-job", "Create Invoice from Job",
                    "Create an invoice from a completed job", 0.8,
                    WorkflowTrigger.onComponent(TriggerType.BUTTON_CLICK, "create-invoice-btn"),
                    List.of(
                            WorkflowStep.of("create", StepType.CREATE, "entityId", "invoice", "source", "job_data"),
                            WorkflowStep.of("notify", StepType.NOTIFY, "message", "Invoice created!", "type", "success"),
                            WorkflowStep.of("navigate", StepType.NAVIGATE, "pageId", "invoice-detail"))));
            out.add(new InferredWorkflow("send-invoice", "Send Invoice", "Email invoice to client", 0.8,
                    WorkflowTrigger.onComponent(TriggerType.BUTTON_CLICK, "send-invoice-btn"),
                    List.of(
                            WorkflowStep.of("update", StepType.UPDATE, "entityId", "invoice", "field", "status", "value", "sent"),
                            WorkflowStep.of("email", StepType.EMAIL, "to", "{clientEmail}", "subject", "Invoice"),
                            WorkflowStep.of("notify", StepType.NOTIFY, "message", "Invoice sent!", "type", "success"))));
        }

        if (features.contains("quotes")) {
            out.add(new InferredWorkflow("accept-quote", "Accept Quote", "Accept quote and create job", 0.7,
                    WorkflowTrigger.onComponent(TriggerType.BUTTON_CLICK, "accept-quote-btn"),
                    List.of(
                            WorkflowStep.of("update", StepType.UPDATE, "entityId", "quote", "field", "status", "value", "accepted"),
                            WorkflowStep.of("create", StepType.CREATE, "entityId", "job", "source", "quote_data"),
                            WorkflowStep.of("notify", StepType.NOTIFY, "message", "Quote accepted!", "type", "success"))));
        }

        if (features.contains("reminders")) {
            out.add(new InferredWorkflow("send-reminder", "Send Appointment Reminder",
                    "Send reminder before appointments", 0.7,
                    WorkflowTrigger.cron("0 9 * * *"),
                    List.of(WorkflowStep.of("notify", StepType.NOTIFY,
                            "message", "Reminder: You have an appointment today", "type", "info"))));
        }

        return out;
    }

    // -------------------- Pass 4: causal --------------------

    InferredWorkflow causalWorkflow(ParsedInput parsed, List<KnownEntity> entities) {
        CausalWorkflowParser.Clause clause = CausalWorkflowParser.split(parsed.normalized);
        if (clause == null) return null;

        WorkflowTrigger trigger = CausalWorkflowParser.trigger(clause.condition(), entities);
        if (trigger == null) return null;

        List<WorkflowStep> steps = CausalWorkflowParser.steps(clause.action(), clause.condition(), entities);
        if (steps.isEmpty()) return null;

        return new InferredWorkflow(
                cfg.idSupplier.get(),
                CausalWorkflowParser.name(clause.condition(), clause.action()),
                "When " + clause.condition() + ", " + clause.action(),
                cfg.causalConfidence,
                trigger,
                steps);
    }

    // -------------------- Config --------------------

    public static final class Config {
        private boolean frozen;

        /** Templates must score strictly above this. */
        public double minPatternScore = 0.15;

        /** Fixed confidence of causal workflows. */
        public double causalConfidence = 0.75;

        /** Ids of causal workflows. */
        public Supplier<String> idSupplier = Config::randomId;

        public static Builder builder() {
            return new Builder();
        }

        static String randomId() {
            return "workflow-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        }

        public Config freezeAndValidate() {
            if (frozen) return this;

            if (!Double.isFinite(minPatternScore)) minPatternScore = 0.15;
            if (!Double.isFinite(causalConfidence)) causalConfidence = 0.75;
            causalConfidence = Math.max(0.0, Math.min(1.0, causalConfidence));
            if (idSupplier == null) idSupplier = Config::randomId;

            frozen = true;
            return this;
        }

        public static final class Builder {
            private final Config c = new Config();

            public Builder minPatternScore(double v) { c.minPatternScore = v; return this; }
            public Builder causalConfidence(double v) { c.causalConfidence = v; return this; }
            public Builder idSupplier(Supplier<String> v) { c.idSupplier = v; return this; }

            public Config build() {
                return c;
            }
        }
    }
}
