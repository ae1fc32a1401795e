package org.calista.arasaka.blueprint.ledger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * CertaintyLedger: per-slot record of what is known about the app to build.
 *
 * <p>Immutable. Every {@code with*} call returns a new ledger; {@link #gaps} and
 * {@link #overallReadiness} are derived from the slots inside the constructor, so they can
 * never drift from the slot values. Callers keep old instances for undo or audit.</p>
 *
 * <ul>
 *   <li>gap: a critical slot that is absent or below {@value #GAP_CONFIDENCE}; plus the
 *       sub-vertical when the industry is known and has sub-verticals</li>
 *   <li>readiness: critical slots weigh 70%, refinement slots 30%, each split evenly</li>
 * </ul>
 */
public final class CertaintyLedger {

    public static final List<SlotId> CRITICAL_SLOTS = List.of(SlotId.INDUSTRY, SlotId.PRIMARY_ENTITIES);

    public static final List<SlotId> REFINEMENT_SLOTS = List.of(
            SlotId.SCALE, SlotId.TEAM_SIZE, SlotId.INTEGRATIONS, SlotId.COMPLEXITY, SlotId.SUB_VERTICAL);

    /** Industries whose app shape depends on a sub-vertical. */
    public static final Set<String> SUB_VERTICAL_INDUSTRIES = Set.of("real-estate", "fitness-coach", "cleaning");

    public static final double GAP_CONFIDENCE = 0.5;

    public static final double CRITICAL_SHARE = 0.7;
    public static final double REFINEMENT_SHARE = 0.3;

    public static final double MIN_INDUSTRY_CONFIDENCE = 0.7;
    public static final double MIN_READINESS = 0.6;

    private static final CertaintyLedger EMPTY = createEmpty();

    private final EnumMap<SlotId, SlotValue<?>> slots;

    /** Slots still blocking a build, in check order. */
    public final List<SlotId> gaps;
    /** Non-blocking feature hints. */
    public final List<String> suggestions;
    public final double overallReadiness;

    private CertaintyLedger(EnumMap<SlotId, SlotValue<?>> slots, List<String> suggestions) {
        this.slots = slots;
        this.suggestions = List.copyOf(suggestions);
        this.gaps = computeGaps(slots);
        this.overallReadiness = computeReadiness(slots);
    }

    private static CertaintyLedger createEmpty() {
        EnumMap<SlotId, SlotValue<?>> m = new EnumMap<>(SlotId.class);
        for (SlotId id : SlotId.values()) {
            m.put(id, id.isList() ? SlotValue.emptyWith(List.<String>of()) : SlotValue.empty());
        }
        return new CertaintyLedger(m, List.of());
    }

    public static CertaintyLedger empty() {
        return EMPTY;
    }

    // -------------------- Copy-on-write updates --------------------

    /**
     * Returns a ledger with {@code id} replaced. Confidence is clamped into [0,1]
     * (NaN counts as 0); lists are copied.
     *
     * @throws IllegalArgumentException if the value type does not fit the slot
     */
    public CertaintyLedger withSlot(SlotId id, Object value, double confidence, SlotSource source, List<String> evidence) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        if (!id.accepts(value)) {
            throw new IllegalArgumentException("slot " + id.key() + " does not accept " + value.getClass().getSimpleName());
        }

        Object v = value instanceof List<?> list ? List.copyOf(list) : value;
        EnumMap<SlotId, SlotValue<?>> next = new EnumMap<>(slots);
        next.put(id, new SlotValue<>(v, clamp01(confidence), source, evidence));
        return new CertaintyLedger(next, suggestions);
    }

    public CertaintyLedger withSuggestions(List<String> suggestions) {
        Objects.requireNonNull(suggestions, "suggestions");
        return new CertaintyLedger(new EnumMap<>(slots), suggestions);
    }

    // -------------------- Accessors --------------------

    public SlotValue<?> slot(SlotId id) {
        return slots.get(Objects.requireNonNull(id, "id"));
    }

    public Map<SlotId, SlotValue<?>> slots() {
        return Collections.unmodifiableMap(slots);
    }

    @SuppressWarnings("unchecked")
    public SlotValue<String> industry() {
        return (SlotValue<String>) slots.get(SlotId.INDUSTRY);
    }

    @SuppressWarnings("unchecked")
    public SlotValue<String> subVertical() {
        return (SlotValue<String>) slots.get(SlotId.SUB_VERTICAL);
    }

    @SuppressWarnings("unchecked")
    public SlotValue<List<String>> primaryEntities() {
        return (SlotValue<List<String>>) slots.get(SlotId.PRIMARY_ENTITIES);
    }

    @SuppressWarnings("unchecked")
    public SlotValue<List<String>> workflows() {
        return (SlotValue<List<String>>) slots.get(SlotId.WORKFLOWS);
    }

    @SuppressWarnings("unchecked")
    public SlotValue<List<String>> integrations() {
        return (SlotValue<List<String>>) slots.get(SlotId.INTEGRATIONS);
    }

    /** Value is a {@code String} or an {@code Integer}. */
    @SuppressWarnings("unchecked")
    public SlotValue<Object> scale() {
        return (SlotValue<Object>) slots.get(SlotId.SCALE);
    }

    @SuppressWarnings("unchecked")
    public SlotValue<TeamSize> teamSize() {
        return (SlotValue<TeamSize>) slots.get(SlotId.TEAM_SIZE);
    }

    @SuppressWarnings("unchecked")
    public SlotValue<Boolean> customerFacing() {
        return (SlotValue<Boolean>) slots.get(SlotId.CUSTOMER_FACING);
    }

    @SuppressWarnings("unchecked")
    public SlotValue<Complexity> complexity() {
        return (SlotValue<Complexity>) slots.get(SlotId.COMPLEXITY);
    }

    public List<String> gapNames() {
        List<String> out = new ArrayList<>(gaps.size());
        for (SlotId id : gaps) out.add(id.key());
        return out;
    }

    // -------------------- Build gate --------------------

    public boolean isReadyToBuild() {
        return isReadyToBuild(MIN_INDUSTRY_CONFIDENCE, MIN_READINESS);
    }

    /**
     * Independent gates: industry confidence, at least one primary entity, overall readiness.
     */
    public boolean isReadyToBuild(double minIndustryConfidence, double minReadiness) {
        SlotValue<String> ind = industry();
        if (!ind.isPresent() || ind.confidence() < minIndustryConfidence) return false;
        if (!primaryEntities().isPresent()) return false;
        return overallReadiness >= minReadiness;
    }

    // -------------------- Derived fields --------------------

    private static List<SlotId> computeGaps(Map<SlotId, SlotValue<?>> slots) {
        List<SlotId> out = new ArrayList<>(3);

        for (SlotId id : CRITICAL_SLOTS) {
            SlotValue<?> s = slots.get(id);
            if (!s.isPresent() || s.confidence() < GAP_CONFIDENCE) out.add(id);
        }

        SlotValue<?> industry = slots.get(SlotId.INDUSTRY);
        if (industry.isPresent() && industry.confidence() >= GAP_CONFIDENCE
                && SUB_VERTICAL_INDUSTRIES.contains(String.valueOf(industry.value()))) {
            SlotValue<?> sub = slots.get(SlotId.SUB_VERTICAL);
            if (!sub.isPresent() || sub.confidence() < GAP_CONFIDENCE) out.add(SlotId.SUB_VERTICAL);
        }

        return List.copyOf(out);
    }

    private static double computeReadiness(Map<SlotId, SlotValue<?>> slots) {
        double score = 0.0;
        double max = 0.0;

        double criticalWeight = CRITICAL_SHARE / CRITICAL_SLOTS.size();
        for (SlotId id : CRITICAL_SLOTS) {
            SlotValue<?> s = slots.get(id);
            max += criticalWeight;
            if (s.isPresent()) score += s.confidence() * criticalWeight;
        }

        double refinementWeight = REFINEMENT_SHARE / REFINEMENT_SLOTS.size();
        for (SlotId id : REFINEMENT_SLOTS) {
            SlotValue<?> s = slots.get(id);
            max += refinementWeight;
            if (s.isPresent()) score += s.confidence() * refinementWeight;
        }

        return Math.min(1.0, score / max);
    }

    static double clamp01(double v) {
        if (Double.isNaN(v) || v < 0.0) return 0.0;
        return Math.min(v, 1.0);
    }

    @Override
    public String toString() {
        return "CertaintyLedger{gaps=" + gapNames() + ", readiness=" + overallReadiness
                + ", industry=" + industry().value() + "}";
    }
}
