package org.calista.arasaka.blueprint.ledger;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * One confidence-scored fact.
 *
 * @param value      may be null (unknown)
 * @param confidence in [0,1]
 * @param source     how the value was obtained
 * @param evidence   what triggered it, usually the utterance
 */
public record SlotValue<T>(T value, double confidence, SlotSource source, List<String> evidence) {

    public SlotValue {
        Objects.requireNonNull(source, "source");
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public static <T> SlotValue<T> empty() {
        return new SlotValue<>(null, 0.0, SlotSource.DEFAULT, List.of());
    }

    public static <T> SlotValue<T> emptyWith(T value) {
        return new SlotValue<>(value, 0.0, SlotSource.DEFAULT, List.of());
    }

    /**
     * A value counts as present unless it is null, blank, an empty collection or the number 0.
     * {@code Boolean.FALSE} is a known answer and therefore present.
     */
    public boolean isPresent() {
        if (value == null) return false;
        if (value instanceof String s) return !s.isBlank();
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Number n) return n.doubleValue() != 0.0;
        return true;
    }
}
