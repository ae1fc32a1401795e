package org.calista.arasaka.blueprint.workflow;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TriggerType {
    FORM_SUBMIT,
    BUTTON_CLICK,
    RECORD_CREATE,
    RECORD_UPDATE,
    RECORD_DELETE,
    SCHEDULE,
    WEBHOOK;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
