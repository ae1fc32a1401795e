package org.calista.arasaka.blueprint.ledger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decides the next discovery step from a {@link CertaintyLedger} and the number of questions
 * already asked.
 *
 * Ordered rules, first hit wins:
 * 1) industry known with confidence &ge; {@link Config#minIndustryConfidence} and at least one
 *    primary entity: ready to build
 * 2) {@link Config#maxQuestions} reached: force the build
 * 3) an askable slot is still open: clarify it
 * 4) otherwise ready to build with defaults
 */
public final class LedgerFlow {

    private static final Logger log = LogManager.getLogger(LedgerFlow.class);

    static final String READY_MESSAGE = "I have enough to build a solid first version. We'll refine after you see it.";
    static final String FORCE_MESSAGE = "Let me build what I understand - you can refine it after.";
    static final String DEFAULTS_MESSAGE = "Ready to build! I'll use smart defaults for anything not specified.";

    private static final List<SlotId> GAP_PRIORITY = List.of(SlotId.INDUSTRY, SlotId.SUB_VERTICAL, SlotId.PRIMARY_ENTITIES);

    private final Config cfg;

    public LedgerFlow() {
        this(null);
    }

    public LedgerFlow(Config config) {
        this.cfg = (config == null ? Config.builder().build() : config).freezeAndValidate();
    }

    public int maxQuestions() {
        return cfg.maxQuestions;
    }

    /**
     * @param questionsAsked clarifying questions asked so far in the conversation
     */
    public FlowAction next(CertaintyLedger ledger, int questionsAsked) {
        Objects.requireNonNull(ledger, "ledger");

        FlowAction action;
        SlotValue<String> industry = ledger.industry();
        if (industry.isPresent() && industry.confidence() >= cfg.minIndustryConfidence
                && ledger.primaryEntities().isPresent()) {
            action = FlowAction.ready(READY_MESSAGE);
        } else if (questionsAsked >= cfg.maxQuestions) {
            action = FlowAction.forceBuild(FORCE_MESSAGE);
        } else {
            SlotId gap = firstAskable(slotsToAsk(ledger));
            action = gap == null ? FlowAction.ready(DEFAULTS_MESSAGE) : FlowAction.clarify(gap);
        }

        if (log.isDebugEnabled()) {
            log.debug("flow action={} gap={} asked={}/{}", action.type().label(),
                    action.gap() == null ? "-" : action.gap().key(), questionsAsked, cfg.maxQuestions);
        }
        return action;
    }

    /**
     * Open slot to ask about first: industry, then sub-vertical, then primary entities,
     * then any other slot to ask; null when nothing needs asking.
     */
    public static SlotId mostCriticalGap(CertaintyLedger ledger) {
        List<SlotId> toAsk = slotsToAsk(Objects.requireNonNull(ledger, "ledger"));
        for (SlotId id : GAP_PRIORITY) {
            if (toAsk.contains(id)) return id;
        }
        return toAsk.isEmpty() ? null : toAsk.get(0);
    }

    /**
     * One-line progress text; readiness bands at 80, 60 and 40 percent.
     */
    public static String statusMessage(CertaintyLedger ledger) {
        Objects.requireNonNull(ledger, "ledger");
        long pct = Math.round(ledger.overallReadiness * 100);
        String gaps = String.join(", ", ledger.gapNames());

        if (pct >= 80) return "Ready to build! (" + pct + "% confidence)";
        if (pct >= 60) return "Almost ready (" + pct + "% confidence). Need to clarify: " + gaps;
        if (pct >= 40) return "Getting there (" + pct + "% confidence). Missing: " + gaps;
        return "Need more information (" + pct + "% confidence). Please tell me more about: " + gaps;
    }

    static List<SlotId> slotsToAsk(CertaintyLedger ledger) {
        List<SlotId> out = new ArrayList<>();
        for (Map.Entry<SlotId, SlotDecision> e : SlotDecisions.decideAll(ledger).entrySet()) {
            if (e.getValue() == SlotDecision.ASK) out.add(e.getKey());
        }
        return out;
    }

    private static SlotId firstAskable(List<SlotId> toAsk) {
        for (SlotId id : toAsk) {
            if (SlotDecisions.isAskable(id)) return id;
        }
        return null;
    }

    // -------------------- Config --------------------

    public static final class Config {
        private boolean frozen;

        /** Clarifying questions allowed before the build is forced. */
        public int maxQuestions = 3;

        /** Industry confidence that, together with a primary entity, is enough to build. */
        public double minIndustryConfidence = 0.7;

        public static Builder builder() {
            return new Builder();
        }

        public Config freezeAndValidate() {
            if (frozen) return this;

            if (maxQuestions < 0) maxQuestions = 0;
            if (!Double.isFinite(minIndustryConfidence)) minIndustryConfidence = 0.7;
            if (minIndustryConfidence < 0.0) minIndustryConfidence = 0.0;
            if (minIndustryConfidence > 1.0) minIndustryConfidence = 1.0;

            frozen = true;
            return this;
        }

        public static final class Builder {
            private final Config c = new Config();

            public Builder maxQuestions(int v) { c.maxQuestions = v; return this; }
            public Builder minIndustryConfidence(double v) { c.minIndustryConfidence = v; return this; }

            public Config build() {
                return c;
            }
        }
    }
}
