package org.calista.arasaka.blueprint.workflow;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Action class of a workflow step.
 */
public enum StepType {
    CREATE,
    UPDATE,
    DELETE,
    NOTIFY,
    EMAIL,
    SMS,
    NAVIGATE,
    SET_VARIABLE,
    LOOP,
    CONDITION,
    WAIT,
    WEBHOOK,
    API_CALL;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
