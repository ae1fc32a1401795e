package org.calista.arasaka.blueprint.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One action of a workflow. {@code config} is free-form; values are strings, numbers,
 * booleans, lists or nested maps. Key order is kept.
 */
public record WorkflowStep(String id, StepType type, Map<String, Object> config) {

    public WorkflowStep {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    /**
     * Builds a step from alternating key/value arguments.
     */
    public static WorkflowStep of(String id, StepType type, Object... keyValues) {
        if (keyValues.length % 2 != 0) throw new IllegalArgumentException("odd key/value count");
        LinkedHashMap<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            m.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new WorkflowStep(id, type, m);
    }

    public Object get(String key) {
        return config.get(key);
    }
}
