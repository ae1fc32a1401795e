package org.calista.arasaka.blueprint.workflow;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateSubstitutionTest {

    private final TemplateSubstitution sub = new TemplateSubstitution("job", "Job");

    @Test
    void replacesAllPlaceholders() {
        assertEquals("Job created for job in jobs", sub.apply("{Entity} created for {entity} in {entities}"));
        assertEquals("{clientEmail}", sub.apply("{clientEmail}"));
        assertEquals("plain", sub.apply("plain"));
        assertNull(sub.apply((String) null));
    }

    @Test
    void walksNestedValues() {
        Map<String, Object> in = Map.of(
                "data", Map.of("id", "{entity}", "amount", "{amount}"),
                "tags", List.of("{entities}", 3),
                "count", 2,
                "urgent", true);

        Map<String, Object> out = sub.applyMap(in);

        assertEquals(Map.of("id", "job", "amount", "{amount}"), out.get("data"));
        assertEquals(List.of("jobs", 3), out.get("tags"));
        assertEquals(2, out.get("count"));
        assertEquals(true, out.get("urgent"));
    }

    @Test
    void instantiatesTemplateParts() {
        WorkflowPattern overdue = WorkflowPatterns.byId("on-overdue");

        WorkflowStep step = sub.apply(overdue.steps().get(0));
        assertEquals("You have overdue jobs", step.get("message"));

        WorkflowCondition cond = sub.apply(overdue.conditions().get(0));
        assertEquals("dueDate", cond.field());
        assertEquals(ConditionOperator.LESS_THAN, cond.operator());
        assertEquals("now", cond.value());
        assertEquals("notify", cond.thenStep());

        WorkflowTrigger trigger = sub.apply(WorkflowPatterns.byId("delete-record").trigger());
        assertEquals("job-delete-btn", trigger.componentId());
        assertNull(trigger.entityId());
    }
}
