package org.calista.arasaka.blueprint.intent;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the user conceptually wants to do. Several may co-occur in one utterance.
 */
public enum SemanticIntent {
    TRACKING("tracking"),
    SCHEDULING("scheduling"),
    MANAGING("managing"),
    ORGANIZING("organizing"),
    COMMUNICATING("communicating"),
    BILLING("billing"),
    REPORTING("reporting"),
    COLLABORATING("collaborating"),
    AUTOMATING("automating"),
    MONITORING("monitoring");

    private final String label;

    SemanticIntent(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
