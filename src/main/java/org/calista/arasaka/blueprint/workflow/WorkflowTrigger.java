package org.calista.arasaka.blueprint.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Event class plus optional binding. Unused bindings are null.
 *
 * @param schedule cron expression for {@link TriggerType#SCHEDULE}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowTrigger(TriggerType type, String entityId, String componentId, String schedule) {

    public WorkflowTrigger {
        Objects.requireNonNull(type, "type");
    }

    public static WorkflowTrigger onComponent(TriggerType type, String componentId) {
        return new WorkflowTrigger(type, null, componentId, null);
    }

    public static WorkflowTrigger onEntity(TriggerType type, String entityId) {
        return new WorkflowTrigger(type, entityId, null, null);
    }

    public static WorkflowTrigger cron(String schedule) {
        return new WorkflowTrigger(TriggerType.SCHEDULE, null, null, schedule);
    }
}
