package org.calista.arasaka.blueprint.workflow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fills {@code {entity}}, {@code {Entity}} and {@code {entities}} placeholders in workflow templates.
 *
 * <p>Walks maps and lists and rewrites string leaves only; numbers, booleans and unknown
 * placeholders such as {@code {clientEmail}} pass through untouched.</p>
 */
public final class TemplateSubstitution {

    public static final String ENTITY = "{entity}";
    public static final String ENTITY_NAME = "{Entity}";
    public static final String ENTITIES = "{entities}";

    private final String entityId;
    private final String entityName;

    public TemplateSubstitution(String entityId, String entityName) {
        this.entityId = Objects.requireNonNull(entityId, "entityId");
        this.entityName = Objects.requireNonNull(entityName, "entityName");
    }

    public String apply(String s) {
        if (s == null || s.indexOf('{') < 0) return s;
        return s.replace(ENTITY, entityId)
                .replace(ENTITY_NAME, entityName)
                .replace(ENTITIES, entityId + "s");
    }

    public Object applyValue(Object v) {
        if (v instanceof String s) return apply(s);
        if (v instanceof Map<?, ?> m) return applyMap(m);
        if (v instanceof List<?> l) {
            List<Object> out = new ArrayList<>(l.size());
            for (Object o : l) out.add(applyValue(o));
            return out;
        }
        return v;
    }

    public Map<String, Object> applyMap(Map<?, ?> m) {
        LinkedHashMap<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : m.entrySet()) {
            out.put(String.valueOf(e.getKey()), applyValue(e.getValue()));
        }
        return out;
    }

    public WorkflowTrigger apply(WorkflowTrigger t) {
        return new WorkflowTrigger(t.type(), apply(t.entityId()), apply(t.componentId()), apply(t.schedule()));
    }

    public WorkflowStep apply(WorkflowStep s) {
        return new WorkflowStep(apply(s.id()), s.type(), applyMap(s.config()));
    }

    public WorkflowCondition apply(WorkflowCondition c) {
        return new WorkflowCondition(apply(c.field()), c.operator(), applyValue(c.value()), c.thenStep(), c.elseStep());
    }
}
