package org.calista.arasaka.blueprint.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Guard binding {@code field operator value} to the step that runs when it holds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowCondition(String field, ConditionOperator operator, Object value, String thenStep, String elseStep) {

    public WorkflowCondition {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(thenStep, "thenStep");
    }
}
