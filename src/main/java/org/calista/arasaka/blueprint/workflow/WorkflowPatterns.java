package org.calista.arasaka.blueprint.workflow;

import java.util.List;
import java.util.Map;

import static org.calista.arasaka.blueprint.workflow.StepType.CREATE;
import static org.calista.arasaka.blueprint.workflow.StepType.DELETE;
import static org.calista.arasaka.blueprint.workflow.StepType.EMAIL;
import static org.calista.arasaka.blueprint.workflow.StepType.NAVIGATE;
import static org.calista.arasaka.blueprint.workflow.StepType.NOTIFY;
import static org.calista.arasaka.blueprint.workflow.StepType.UPDATE;

/**
 * Built-in library of phrase-triggered workflow templates, in evaluation order.
 */
public final class WorkflowPatterns {

    private WorkflowPatterns() {}

    private static WorkflowStep step(String id, StepType type, Object... kv) {
        return WorkflowStep.of(id, type, kv);
    }

    public static final List<WorkflowPattern> ALL = List.of(
            // -------------------- CRUD --------------------
            new WorkflowPattern("create-record", "Create Record",
                    List.of("create", "add", "new", "submit", "save"), true,
                    "Create a new record from form submission",
                    WorkflowTrigger.onComponent(TriggerType.FORM_SUBMIT, "{entity}-form"),
                    List.of(
                            step("create", CREATE, "entityId", "{entity}", "source", "form_data"),
                            step("notify", NOTIFY, "message", "{Entity} created successfully!", "type", "success"),
                            step("navigate", NAVIGATE, "pageId", "{entity}-list")),
                    List.of()),
            new WorkflowPattern("update-record", "Update Record",
                    List.of("update", "edit", "modify", "change", "save"), true,
                    "Update an existing record",
                    WorkflowTrigger.onComponent(TriggerType.FORM_SUBMIT, "{entity}-edit-form"),
                    List.of(
                            step("update", UPDATE, "entityId", "{entity}", "source", "form_data"),
                            step("notify", NOTIFY, "message", "{Entity} updated!", "type", "success"),
                            step("navigate", NAVIGATE, "pageId", "{entity}-detail")),
                    List.of()),
            new WorkflowPattern("delete-record", "Delete Record",
                    List.of("delete", "remove", "trash"), true,
                    "Delete a record with confirmation",
                    WorkflowTrigger.onComponent(TriggerType.BUTTON_CLICK, "{entity}-delete-btn"),
                    List.of(
                            step("delete", DELETE, "entityId", "{entity}"),
                            step("notify", NOTIFY, "message", "{Entity} deleted", "type", "info"),
                            step("navigate", NAVIGATE, "pageId", "{entity}-list")),
                    List.of()),

            // -------------------- Status --------------------
            new WorkflowPattern("change-status", "Change Status",
                    List.of("complete", "finish", "done", "close", "approve", "reject", "cancel"), true,
                    "Change the status of a record",
                    WorkflowTrigger.onComponent(TriggerType.BUTTON_CLICK, "{entity}-status-btn"),
                    List.of(
                            step("update-status", UPDATE, "entityId", "{entity}", "field", "status", "value", "{newStatus}"),
                            step("notify", NOTIFY, "message", "Status updated to {newStatus}", "type", "success")),
                    List.of()),

            // -------------------- Notifications --------------------
            new WorkflowPattern("send-email", "Send Email Notification",
                    List.of("email", "send email", "notify by email", "email notification"), true,
                    "Send an email when something happens",
                    WorkflowTrigger.onEntity(TriggerType.RECORD_CREATE, "{entity}"),
                    List.of(
                            step("email", EMAIL, "to", "{recipient}", "subject", "New {Entity}", "body", "A new {entity} has been created.")),
                    List.of()),
            new WorkflowPattern("send-reminder", "Send Reminder",
                    List.of("remind", "reminder", "alert", "notify before"), true,
                    "Send a reminder before a scheduled event",
                    WorkflowTrigger.cron("0 9 * * *"),
                    List.of(
                            step("notify", NOTIFY, "message", "Reminder: {entity} is coming up", "type", "info")),
                    List.of()),

            // -------------------- Assignment --------------------
            new WorkflowPattern("assign-to", "Assign To Team Member",
                    List.of("assign", "delegate", "give to", "hand off"), true,
                    "Assign a record to a team member",
                    WorkflowTrigger.onComponent(TriggerType.BUTTON_CLICK, "{entity}-assign-btn"),
                    List.of(
                            step("assign", UPDATE, "entityId", "{entity}", "field", "assignedTo", "value", "{userId}"),
                            step("notify-assignee", NOTIFY, "message", "You have been assigned a new {entity}", "type", "info", "userId", "{userId}")),
                    List.of()),

            // -------------------- Scheduling --------------------
            new WorkflowPattern("book-appointment", "Book Appointment",
                    List.of("book", "schedule", "reserve", "make appointment"), false,
                    "Book a new appointment",
                    WorkflowTrigger.onComponent(TriggerType.FORM_SUBMIT, "booking-form"),
                    List.of(
                            step("create-appointment", CREATE, "entityId", "appointment", "source", "form_data"),
                            step("send-confirmation", EMAIL, "to", "{clientEmail}", "subject", "Appointment Confirmed", "body", "Your appointment is confirmed for {date}"),
                            step("notify", NOTIFY, "message", "Appointment booked!", "type", "success")),
                    List.of()),

            // -------------------- Billing --------------------
            new WorkflowPattern("create-invoice", "Create Invoice",
                    List.of("invoice", "bill", "charge"), false,
                    "Create an invoice from a job or project",
                    WorkflowTrigger.onComponent(TriggerType.BUTTON_CLICK, "create-invoice-btn"),
                    List.of(
                            step("create-invoice", CREATE, "entityId", "invoice", "source", "job_data"),
                            step("navigate", NAVIGATE, "pageId", "invoice-detail")),
                    List.of()),
            new WorkflowPattern("send-invoice", "Send Invoice",
                    List.of("send invoice", "email invoice"), false,
                    "Email an invoice to the client",
                    WorkflowTrigger.onComponent(TriggerType.BUTTON_CLICK, "send-invoice-btn"),
                    List.of(
                            step("update-status", UPDATE, "entityId", "invoice", "field", "status", "value", "sent"),
                            step("email", EMAIL, "to", "{clientEmail}", "subject", "Invoice #{invoiceNumber}", "attachment", "invoice_pdf"),
                            step("notify", NOTIFY, "message", "Invoice sent!", "type", "success")),
                    List.of()),
            new WorkflowPattern("mark-paid", "Mark as Paid",
                    List.of("paid", "payment received", "mark paid"), false,
                    "Mark an invoice as paid",
                    WorkflowTrigger.onComponent(TriggerType.BUTTON_CLICK, "mark-paid-btn"),
                    List.of(
                            step("update-status", UPDATE, "entityId", "invoice", "field", "status", "value", "paid"),
                            step("create-payment", CREATE, "entityId", "payment",
                                    "data", Map.of("invoiceId", "{invoiceId}", "amount", "{amount}")),
                            step("notify", NOTIFY, "message", "Payment recorded!", "type", "success")),
                    List.of()),

            // -------------------- Quotes --------------------
            new WorkflowPattern("convert-quote", "Convert Quote to Job",
                    List.of("accept quote", "approve quote", "convert quote"), false,
                    "Convert an approved quote into a job",
                    WorkflowTrigger.onComponent(TriggerType.BUTTON_CLICK, "accept-quote-btn"),
                    List.of(
                            step("update-quote", UPDATE, "entityId", "quote", "field", "status", "value", "accepted"),
                            step("create-job", CREATE, "entityId", "job", "source", "quote_data"),
                            step("notify", NOTIFY, "message", "Quote converted to job!", "type", "success"),
                            step("navigate", NAVIGATE, "pageId", "job-detail")),
                    List.of()),

            // -------------------- Scheduled checks --------------------
            new WorkflowPattern("on-overdue", "Overdue Alert",
                    List.of("overdue", "past due", "late"), true,
                    "Alert when something is overdue",
                    WorkflowTrigger.cron("0 8 * * *"),
                    List.of(
                            step("notify", NOTIFY, "message", "You have overdue {entities}", "type", "warning")),
                    List.of(new WorkflowCondition("dueDate", ConditionOperator.LESS_THAN, "now", "notify", null)))
    );

    public static WorkflowPattern byId(String id) {
        for (WorkflowPattern p : ALL) {
            if (p.id().equals(id)) return p;
        }
        return null;
    }
}
