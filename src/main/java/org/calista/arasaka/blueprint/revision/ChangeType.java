package org.calista.arasaka.blueprint.revision;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChangeType {
    ADD,
    REMOVE,
    MODIFY;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
