package org.calista.arasaka.blueprint.workflow;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConditionOperator {
    EQUALS,
    NOT_EQUALS,
    CONTAINS,
    GREATER_THAN,
    LESS_THAN,
    IS_EMPTY,
    IS_NOT_EMPTY;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
