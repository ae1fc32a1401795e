package org.calista.arasaka.blueprint.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a dialogue controller should do about one slot.
 */
public enum SlotDecision {
    /** Commit silently. */
    ASSUME,
    /** Show the inference and let the user correct it. */
    CONFIRM,
    /** Ask an open question. */
    ASK,
    SKIP;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
