package org.calista.arasaka.blueprint.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Complexity {
    SIMPLE, MEDIUM, ADVANCED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
