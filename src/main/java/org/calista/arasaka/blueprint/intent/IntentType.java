package org.calista.arasaka.blueprint.intent;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Primary intent of an utterance. {@link #label()} is the wire name.
 */
public enum IntentType {
    CREATE_APP("create_app"),
    MODIFY_APP("modify_app"),
    ADD_FEATURE("add_feature"),
    REMOVE_FEATURE("remove_feature"),
    CHANGE_DESIGN("change_design"),
    ADD_PAGE("add_page"),
    ADD_ENTITY("add_entity"),
    ADD_WORKFLOW("add_workflow"),
    QUERY("query"),
    HELP("help"),
    UNKNOWN("unknown");

    private final String label;

    IntentType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
