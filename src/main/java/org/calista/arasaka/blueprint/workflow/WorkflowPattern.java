package org.calista.arasaka.blueprint.workflow;

import java.util.List;
import java.util.Objects;

/**
 * Template matched by trigger phrases. Strings may carry entity placeholders
 * (see {@link TemplateSubstitution}).
 *
 * @param entityBased informational; templates are always instantiated against the first known entity
 */
public record WorkflowPattern(String id,
                              String name,
                              List<String> triggers,
                              boolean entityBased,
                              String description,
                              WorkflowTrigger trigger,
                              List<WorkflowStep> steps,
                              List<WorkflowCondition> conditions) {

    public WorkflowPattern {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(trigger, "trigger");
        triggers = List.copyOf(triggers);
        steps = List.copyOf(steps);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public boolean hasMessageStep() {
        for (WorkflowStep s : steps) {
            if (s.type() == StepType.EMAIL || s.type() == StepType.NOTIFY) return true;
        }
        return false;
    }
}
