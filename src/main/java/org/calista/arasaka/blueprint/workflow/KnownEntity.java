package org.calista.arasaka.blueprint.workflow;

import java.util.List;
import java.util.Objects;

/**
 * Entity already known to the blueprint layer.
 *
 * @param behaviors tags such as "trackable" or "billable"
 */
public record KnownEntity(String id, String name, String pluralName, List<String> behaviors) {

    public KnownEntity {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        if (pluralName == null || pluralName.isBlank()) pluralName = name + "s";
        behaviors = behaviors == null ? List.of() : List.copyOf(behaviors);
    }

    public KnownEntity(String id, String name) {
        this(id, name, null, List.of());
    }

    public boolean hasBehavior(String tag) {
        return behaviors.contains(tag);
    }
}
