package org.calista.arasaka.blueprint.revision;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a revision change edits. Field and style changes have no slot in {@link AppContext}.
 */
public enum ChangeTarget {
    PAGE,
    ENTITY,
    FIELD,
    WORKFLOW,
    STYLE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
