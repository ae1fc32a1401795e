package org.calista.arasaka.blueprint.revision;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One atomic edit. {@code before} holds what an undo needs to restore; both maps are null when not applicable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RevisionChange(ChangeType type,
                             ChangeTarget target,
                             String targetId,
                             Map<String, Object> before,
                             Map<String, Object> after,
                             String description) {

    public RevisionChange {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(targetId, "targetId");
        before = freeze(before);
        after = freeze(after);
        description = description == null ? "" : description;
    }

    public static RevisionChange add(ChangeTarget target, String targetId, Map<String, Object> after, String description) {
        return new RevisionChange(ChangeType.ADD, target, targetId, null, after, description);
    }

    public static RevisionChange remove(ChangeTarget target, String targetId, Map<String, Object> before, String description) {
        return new RevisionChange(ChangeType.REMOVE, target, targetId, before, null, description);
    }

    public static RevisionChange modify(ChangeTarget target, String targetId,
                                        Map<String, Object> before, Map<String, Object> after, String description) {
        return new RevisionChange(ChangeType.MODIFY, target, targetId, before, after, description);
    }

    private static Map<String, Object> freeze(Map<String, Object> m) {
        if (m == null) return null;
        return Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }
}
