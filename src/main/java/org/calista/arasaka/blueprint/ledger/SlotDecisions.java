package org.calista.arasaka.blueprint.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-slot dialogue policy on top of a {@link CertaintyLedger}.
 *
 * <p>Only industry and sub-vertical are "critical" here: they are the only slots that can
 * produce {@link SlotDecision#ASK}. This differs from the ledger's own critical set.</p>
 */
public final class SlotDecisions {

    private SlotDecisions() {}

    public static final Set<SlotId> ASKABLE_SLOTS = Set.of(SlotId.INDUSTRY, SlotId.SUB_VERTICAL);

    private static final ObjectMapper JSON = new ObjectMapper();

    public record Option(String value, String label) {}

    private static final Map<String, List<Option>> SUB_VERTICAL_OPTIONS = Map.of(
            "real-estate", List.of(
                    new Option("rentals", "Rental property management"),
                    new Option("sales", "Buying and selling homes"),
                    new Option("commercial", "Commercial real estate")),
            "fitness-coach", List.of(
                    new Option("personal-training", "Personal training (1-on-1)"),
                    new Option("group-training", "Group classes and bootcamps"),
                    new Option("online", "Online/virtual coaching")),
            "cleaning", List.of(
                    new Option("residential", "Home cleaning"),
                    new Option("commercial", "Office and commercial spaces"),
                    new Option("specialized", "Specialized (move-out, deep clean)"))
    );

    /**
     * Summary of all slot decisions. {@code canProceed} is false when anything must be asked.
     */
    public static final class Summary {
        public final List<SlotId> assumed;
        public final List<SlotId> toConfirm;
        public final List<SlotId> toAsk;
        public final List<SlotId> skipped;
        public final boolean canProceed;

        Summary(List<SlotId> assumed, List<SlotId> toConfirm, List<SlotId> toAsk, List<SlotId> skipped) {
            this.assumed = List.copyOf(assumed);
            this.toConfirm = List.copyOf(toConfirm);
            this.toAsk = List.copyOf(toAsk);
            this.skipped = List.copyOf(skipped);
            this.canProceed = toAsk.isEmpty();
        }
    }

    public static boolean isAskable(SlotId id) {
        return ASKABLE_SLOTS.contains(id);
    }

    /**
     * Ordered rules, first hit wins:
     * explicit &ge; 0.9, then &ge; 0.75 assume; &ge; 0.5 confirm; non-critical &ge; 0.3 assume;
     * critical ask; otherwise skip.
     */
    public static SlotDecision decide(SlotValue<?> slot, SlotId id) {
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(id, "id");
        double c = slot.confidence();

        if (c >= 0.9 && slot.source() == SlotSource.EXPLICIT) return SlotDecision.ASSUME;
        if (c >= 0.75) return SlotDecision.ASSUME;
        if (c >= 0.5) return SlotDecision.CONFIRM;
        if (!isAskable(id) && c >= 0.3) return SlotDecision.ASSUME;
        if (isAskable(id)) return SlotDecision.ASK;
        return SlotDecision.SKIP;
    }

    public static Map<SlotId, SlotDecision> decideAll(CertaintyLedger ledger) {
        Objects.requireNonNull(ledger, "ledger");
        EnumMap<SlotId, SlotDecision> out = new EnumMap<>(SlotId.class);
        for (SlotId id : SlotId.values()) {
            out.put(id, decide(ledger.slot(id), id));
        }
        return out;
    }

    public static Summary summarize(CertaintyLedger ledger) {
        List<SlotId> assumed = new ArrayList<>();
        List<SlotId> toConfirm = new ArrayList<>();
        List<SlotId> toAsk = new ArrayList<>();
        List<SlotId> skipped = new ArrayList<>();

        for (Map.Entry<SlotId, SlotDecision> e : decideAll(ledger).entrySet()) {
            switch (e.getValue()) {
                case ASSUME -> assumed.add(e.getKey());
                case CONFIRM -> toConfirm.add(e.getKey());
                case ASK -> toAsk.add(e.getKey());
                case SKIP -> skipped.add(e.getKey());
            }
        }
        return new Summary(assumed, toConfirm, toAsk, skipped);
    }

    public static boolean hasSubVerticals(String industry) {
        return industry != null && SUB_VERTICAL_OPTIONS.containsKey(industry);
    }

    public static List<Option> subVerticalOptions(String industry) {
        if (industry == null) return List.of();
        return SUB_VERTICAL_OPTIONS.getOrDefault(industry, List.of());
    }

    /**
     * One diagnostic line, e.g. {@code industry: confirm ("plumber", 70% confidence, inferred)}.
     */
    public static String format(SlotId id, SlotValue<?> slot, SlotDecision decision) {
        long pct = Math.round(slot.confidence() * 100);
        String value = slot.isPresent() ? toJson(slot.value()) : "null";
        return id.key() + ": " + decision.label() + " (" + value + ", " + pct + "% confidence, " + slot.source().label() + ")";
    }

    static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            // slot values are strings, numbers, enums and string lists
            throw new IllegalStateException("cannot render slot value " + value, e);
        }
    }
}
