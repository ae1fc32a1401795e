package org.calista.arasaka.blueprint.workflow;

import java.util.List;
import java.util.Objects;

/**
 * Generated automation. Immutable; consumers may drop low-confidence ones.
 */
public final class InferredWorkflow {

    public final String id;
    public final String name;
    public final String description;
    public final double confidence;
    public final WorkflowTrigger trigger;
    public final List<WorkflowStep> steps;
    /** Empty when the workflow is unconditional. */
    public final List<WorkflowCondition> conditions;

    public InferredWorkflow(String id,
                            String name,
                            String description,
                            double confidence,
                            WorkflowTrigger trigger,
                            List<WorkflowStep> steps,
                            List<WorkflowCondition> conditions) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.description = description == null ? "" : description;
        this.confidence = confidence;
        this.trigger = Objects.requireNonNull(trigger, "trigger");
        this.steps = List.copyOf(steps);
        this.conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public InferredWorkflow(String id, String name, String description, double confidence,
                            WorkflowTrigger trigger, List<WorkflowStep> steps) {
        this(id, name, description, confidence, trigger, steps, List.of());
    }

    public WorkflowStep step(String stepId) {
        for (WorkflowStep s : steps) {
            if (s.id().equals(stepId)) return s;
        }
        return null;
    }

    @Override
    public String toString() {
        return "InferredWorkflow{" + id + ", conf=" + confidence + ", trigger=" + trigger.type().label()
                + ", steps=" + steps.size() + "}";
    }
}
