package org.calista.arasaka.blueprint.ledger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.blueprint.kits.IndustryKit;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Folds one utterance into a {@link CertaintyLedger}.
 *
 * Detector order: industry, sub-vertical, team size, scale, customer-facing, then (kit only)
 * primary entities and workflows, then integrations, then suggestions (kit only).
 * A detector that finds nothing leaves its slot untouched.
 */
public final class LedgerUpdater {

    private static final Logger log = LogManager.getLogger(LedgerUpdater.class);

    static final double KIT_CONFIDENCE = 0.95;
    static final double ENTITY_DISCOUNT = 0.9;
    static final double WORKFLOW_DISCOUNT = 0.85;
    static final double ASSUMED_INTEGRATION_CONFIDENCE = 0.5;

    private final Config cfg;

    public LedgerUpdater() {
        this(null);
    }

    public LedgerUpdater(Config config) {
        this.cfg = (config == null ? Config.builder().build() : config).freezeAndValidate();
    }

    /**
     * @param ledger    previous state (not modified)
     * @param utterance raw user text; null is treated as empty
     * @param kit       externally resolved industry kit, or null
     */
    public CertaintyLedger update(CertaintyLedger ledger, String utterance, IndustryKit kit) {
        Objects.requireNonNull(ledger, "ledger");
        final String input = utterance == null ? "" : utterance;
        final String lower = input.toLowerCase(Locale.ROOT);
        final List<String> evidence = List.of(input);

        CertaintyLedger out = ledger;

        // industry: a supplied kit is authoritative
        double industryConfidence = 0.0;
        SlotDetectors.Detection<String> industry = kit != null
                ? new SlotDetectors.Detection<>(kit.id, KIT_CONFIDENCE, SlotSource.EXPLICIT)
                : SlotDetectors.industry(lower);
        if (industry != null) {
            industryConfidence = industry.confidence();
            out = out.withSlot(SlotId.INDUSTRY, industry.value(), industry.confidence(), industry.source(), evidence);
        }

        SlotValue<String> known = out.industry();
        if (known.isPresent() && known.confidence() >= CertaintyLedger.GAP_CONFIDENCE) {
            SlotDetectors.Detection<String> sub = SlotDetectors.subVertical(lower, known.value());
            if (sub != null) {
                out = out.withSlot(SlotId.SUB_VERTICAL, sub.value(), sub.confidence(), sub.source(), evidence);
            }
        }

        SlotDetectors.Detection<TeamSize> team = SlotDetectors.teamSize(lower);
        if (team != null) {
            out = out.withSlot(SlotId.TEAM_SIZE, team.value(), team.confidence(), team.source(), evidence);
        }

        SlotDetectors.Detection<Object> scale = SlotDetectors.scale(lower);
        if (scale != null) {
            out = out.withSlot(SlotId.SCALE, scale.value(), scale.confidence(), scale.source(), evidence);
        }

        SlotDetectors.Detection<Boolean> facing = SlotDetectors.customerFacing(lower);
        if (facing != null) {
            out = out.withSlot(SlotId.CUSTOMER_FACING, facing.value(), facing.confidence(), facing.source(), evidence);
        }

        if (kit != null) {
            List<String> kitEvidence = List.of("Derived from " + kit.name + " kit");
            if (kit.entities != null && !kit.entities.isEmpty()) {
                out = out.withSlot(SlotId.PRIMARY_ENTITIES, kit.entityNames(),
                        industryConfidence * ENTITY_DISCOUNT, SlotSource.INFERRED, kitEvidence);
            }
            if (kit.workflows != null && !kit.workflows.isEmpty()) {
                out = out.withSlot(SlotId.WORKFLOWS, kit.workflows,
                        industryConfidence * WORKFLOW_DISCOUNT, SlotSource.INFERRED, kitEvidence);
            }
        }

        List<String> detected = SlotDetectors.integrations(lower);
        if (!detected.isEmpty()) {
            out = out.withSlot(SlotId.INTEGRATIONS, detected, SlotDetectors.INTEGRATION_CONFIDENCE, SlotSource.EXPLICIT, evidence);
        } else if (kit != null && kit.suggestedIntegrations != null && !kit.suggestedIntegrations.isEmpty()) {
            List<String> ids = new ArrayList<>(kit.suggestedIntegrations.size());
            for (IndustryKit.SuggestedIntegration i : kit.suggestedIntegrations) ids.add(i.id);
            out = out.withSlot(SlotId.INTEGRATIONS, ids, ASSUMED_INTEGRATION_CONFIDENCE, SlotSource.ASSUMED,
                    List.of("Suggested for " + kit.name));
        }

        if (kit != null) {
            out = out.withSuggestions(suggestionsFromKit(kit, out));
        }

        if (log.isDebugEnabled()) {
            log.debug("ledger update kit={} {}", kit == null ? "<none>" : kit.id, out);
        }
        return out;
    }

    /**
     * Kit integrations not yet in the ledger ("Name: purpose"), then recommended features; capped.
     */
    List<String> suggestionsFromKit(IndustryKit kit, CertaintyLedger ledger) {
        List<String> out = new ArrayList<>();
        List<String> current = ledger.integrations().value() == null ? List.of() : ledger.integrations().value();

        if (kit.suggestedIntegrations != null) {
            for (IndustryKit.SuggestedIntegration i : kit.suggestedIntegrations) {
                if (!current.contains(i.id)) out.add(i.name + ": " + i.purpose);
            }
        }
        out.addAll(kit.recommendedFeatures());

        return out.size() > cfg.maxSuggestions ? List.copyOf(out.subList(0, cfg.maxSuggestions)) : out;
    }

    // -------------------- Config --------------------

    public static final class Config {
        private boolean frozen;

        /** Upper bound of {@link CertaintyLedger#suggestions}. */
        public int maxSuggestions = 5;

        public static Builder builder() {
            return new Builder();
        }

        public Config freezeAndValidate() {
            if (frozen) return this;
            if (maxSuggestions < 0) maxSuggestions = 0;
            frozen = true;
            return this;
        }

        public static final class Builder {
            private final Config c = new Config();

            public Builder maxSuggestions(int v) { c.maxSuggestions = v; return this; }

            public Config build() {
                return c;
            }
        }
    }
}
