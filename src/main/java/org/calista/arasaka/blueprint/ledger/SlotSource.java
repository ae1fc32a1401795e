package org.calista.arasaka.blueprint.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a slot value was obtained.
 */
public enum SlotSource {
    /** Stated by the user (or supplied as an industry kit). */
    EXPLICIT("explicit"),
    INFERRED("inferred"),
    ASSUMED("assumed"),
    DEFAULT("default");

    private final String label;

    SlotSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
