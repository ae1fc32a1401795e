package org.calista.arasaka.blueprint.workflow;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class CausalWorkflowParserTest {

    private static final List<KnownEntity> ENTITIES = List.of(
            new KnownEntity("job", "Job"),
            new KnownEntity("invoice", "Invoice"));

    @Test
    void splitsWhenThen() {
        CausalWorkflowParser.Clause c = CausalWorkflowParser.split("when a job is done then email the client");

        assertEquals("a job is done", c.condition());
        assertEquals("email the client", c.action());
    }

    @Test
    void splitsOnComma() {
        CausalWorkflowParser.Clause c = CausalWorkflowParser.split("when a job is done, email the client");

        assertEquals("a job is done", c.condition());
        assertEquals("email the client", c.action());
    }

    @Test
    void noClauseWithoutWhen() {
        assertNull(CausalWorkflowParser.split("email the client"));
        assertNull(CausalWorkflowParser.split(""));
        assertNull(CausalWorkflowParser.split(null));
    }

    @Test
    void triggerFollowsConditionCues() {
        WorkflowTrigger updated = CausalWorkflowParser.trigger("an invoice is updated", ENTITIES);
        assertEquals(TriggerType.RECORD_UPDATE, updated.type());
        assertEquals("invoice", updated.entityId());

        WorkflowTrigger removed = CausalWorkflowParser.trigger("a job is removed", ENTITIES);
        assertEquals(TriggerType.RECORD_DELETE, removed.type());
        assertEquals("job", removed.entityId());

        WorkflowTrigger plain = CausalWorkflowParser.trigger("the job is finished", ENTITIES);
        assertEquals(TriggerType.FORM_SUBMIT, plain.type());
        assertEquals("job-form", plain.componentId());

        assertNull(CausalWorkflowParser.trigger("the job is finished", List.of()));
    }

    @Test
    void unmentionedEntityFallsBackToFirst() {
        assertEquals("job", CausalWorkflowParser.mentioned("it rains", ENTITIES).id());
        assertNull(CausalWorkflowParser.mentioned("it rains", List.of()));
    }

    @Test
    void markCompleteUpdatesTheRecord() {
        List<WorkflowStep> steps = CausalWorkflowParser.steps("mark it complete", "an invoice is paid", ENTITIES);

        assertEquals(1, steps.size());
        WorkflowStep s = steps.get(0);
        assertEquals("update-record", s.id());
        assertEquals(StepType.UPDATE, s.type());
        assertEquals("invoice", s.get("entityId"));
        assertEquals("complete", s.get("field"));
        assertEquals("completed", s.get("value"));
    }

    @Test
    void invoiceActionCreatesInvoiceAndNavigates() {
        List<WorkflowStep> steps = CausalWorkflowParser.steps("create invoice and show invoice", "a job is done", ENTITIES);

        assertEquals(List.of("create-invoice", "navigate"), List.of(steps.get(0).id(), steps.get(1).id()));
        assertEquals("invoice-list", steps.get(1).get("pageId"));
    }

    @Test
    void alertCarriesItsMessage() {
        List<WorkflowStep> steps = CausalWorkflowParser.steps("alert the owner", "a job is late", List.of());

        assertEquals(1, steps.size());
        assertEquals(StepType.NOTIFY, steps.get(0).type());
        assertEquals("the owner", steps.get(0).get("message"));
    }

    @Test
    void unknownActionStillNotifies() {
        List<WorkflowStep> steps = CausalWorkflowParser.steps("do something", "a job is done", ENTITIES);

        assertEquals(1, steps.size());
        assertEquals("Workflow executed", steps.get(0).get("message"));
    }

    @Test
    void emailWording() {
        assertEquals("Booking Confirmation", CausalWorkflowParser.emailSubject("email the client", "a booking is made"));
        assertEquals("Invoice", CausalWorkflowParser.emailSubject("email the invoice", "a job is done"));
        assertEquals("Your request has been confirmed.", CausalWorkflowParser.emailBody("send confirmation"));
        assertEquals("Thank you for your request.", CausalWorkflowParser.emailBody("send email"));
    }

    @Test
    void titleCasedName() {
        assertEquals("When A Job Is Done, Email The Client",
                CausalWorkflowParser.name("a job is done", "email the client"));
    }
}
