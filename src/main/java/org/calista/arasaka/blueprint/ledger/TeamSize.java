package org.calista.arasaka.blueprint.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TeamSize {
    SOLO, SMALL, MEDIUM, LARGE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
