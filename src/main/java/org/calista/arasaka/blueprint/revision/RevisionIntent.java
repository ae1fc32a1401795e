package org.calista.arasaka.blueprint.revision;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RevisionIntent {
    STYLE_CHANGE,
    ADD_FEATURE,
    REMOVE_FEATURE,
    MODIFY_ENTITY,
    ADD_PAGE,
    MODIFY_PAGE,
    REMOVE_PAGE,
    REORGANIZE,
    /** No pattern matched. */
    MODIFY_APP;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
