package org.calista.arasaka.blueprint.workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads "when X then Y" sentences: X selects the trigger, keyword classes in Y select the steps.
 */
final class CausalWorkflowParser {

    private CausalWorkflowParser() {}

    record Clause(String condition, String action) {}

    private record ClauseRule(Pattern pattern, int conditionGroup, int actionGroup) {}

    private static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    // first match wins; the last rule is a catch-all that may cut the condition short
    private static final List<ClauseRule> CLAUSE_RULES = List.of(
            new ClauseRule(ci("when\\s+(.+?)\\s+(then|,|do)\\s+(.+)"), 1, 3),
            new ClauseRule(ci("when\\s+user\\s+(.+?)\\s*,?\\s*(then|do)\\s+(.+)"), 1, 3),
            new ClauseRule(ci("when\\s+(.+?)\\s*,\\s*(.+)"), 1, 2),
            new ClauseRule(ci("when\\s+(.+?)\\s*,?\\s*([a-z]+)\\s+(.+)"), 1, 3)
    );

    private static final Pattern CREATE_CUE = ci("book|create|add|new|submit|save");
    private static final Pattern UPDATE_CUE = ci("update|change|modify|edit");
    private static final Pattern DELETE_CUE = ci("delete|remove|trash");

    private static final Pattern EMAIL_ACTION = ci("send\\s+confirmation|send\\s+email|email|notify|notification");
    private static final Pattern INVOICE_ACTION = ci("create\\s+invoice|generate\\s+invoice|invoice");
    private static final Pattern SCHEDULE_ACTION = ci("schedule|book\\s+event|create\\s+event|add\\s+to\\s+calendar");
    private static final Pattern UPDATE_ACTION = ci("update|change|set|mark");
    private static final Pattern NAVIGATE_ACTION = ci("navigate|go\\s+to|show|view");
    private static final Pattern NOTIFY_ACTION = ci("show\\s+notification|display\\s+message|alert");
    private static final Pattern WEBHOOK_ACTION = ci("trigger\\s+webhook|call\\s+webhook|webhook");

    private static final Pattern CONFIRM = ci("confirmation|confirm");
    private static final Pattern INVOICE = ci("invoice");
    private static final Pattern BOOKING = ci("booking|appointment");
    private static final Pattern NOTIFY_MESSAGE = ci("(?:show|display|alert)\\s+(.+)");

    private static final List<String> UPDATE_FIELDS = List.of("status", "state", "complete", "approved");

    private static final Pattern SPACES = Pattern.compile("\\s+");

    static Clause split(String text) {
        if (text == null || text.isEmpty()) return null;
        for (ClauseRule r : CLAUSE_RULES) {
            Matcher m = r.pattern.matcher(text);
            if (m.find()) {
                String condition = m.group(r.conditionGroup).trim();
                String action = m.group(r.actionGroup).trim();
                return new Clause(condition, action);
            }
        }
        return null;
    }

    // -------------------- Trigger --------------------

    static KnownEntity mentioned(String clause, List<KnownEntity> entities) {
        String lower = clause.toLowerCase(Locale.ROOT);
        for (KnownEntity e : entities) {
            if (lower.contains(e.name().toLowerCase(Locale.ROOT)) || lower.contains(e.id().toLowerCase(Locale.ROOT))) {
                return e;
            }
        }
        return entities.isEmpty() ? null : entities.get(0);
    }

    /**
     * Create cues win over update cues, which win over delete cues. Without a cue the trigger is
     * the form of the referenced entity; null when no entity is known either.
     */
    static WorkflowTrigger trigger(String condition, List<KnownEntity> entities) {
        KnownEntity entity = mentioned(condition, entities);
        String entityId = entity == null ? null : entity.id();

        if (CREATE_CUE.matcher(condition).find()) {
            return new WorkflowTrigger(TriggerType.RECORD_CREATE, entityId, entityId == null ? null : entityId + "-form", null);
        }
        if (UPDATE_CUE.matcher(condition).find()) {
            return WorkflowTrigger.onEntity(TriggerType.RECORD_UPDATE, entityId);
        }
        if (DELETE_CUE.matcher(condition).find()) {
            return WorkflowTrigger.onEntity(TriggerType.RECORD_DELETE, entityId);
        }
        if (entityId != null) {
            return new WorkflowTrigger(TriggerType.FORM_SUBMIT, entityId, entityId + "-form", null);
        }
        return null;
    }

    // -------------------- Steps --------------------

    static List<WorkflowStep> steps(String action, String condition, List<KnownEntity> entities) {
        List<WorkflowStep> out = new ArrayList<>();
        KnownEntity entity = mentioned(condition, entities);

        if (EMAIL_ACTION.matcher(action).find()) {
            out.add(WorkflowStep.of("send-email", StepType.EMAIL,
                    "to", "{email}",
                    "subject", emailSubject(action, condition),
                    "body", emailBody(action)));
        }

        if (INVOICE_ACTION.matcher(action).find()) {
            out.add(WorkflowStep.of("create-invoice", StepType.CREATE, "entityId", "invoice", "source", "current_data"));
        }

        if (SCHEDULE_ACTION.matcher(action).find()) {
            out.add(WorkflowStep.of("schedule-event", StepType.CREATE, "entityId", "event", "source", "form_data"));
        }

        if (UPDATE_ACTION.matcher(action).find()) {
            String field = updateField(action);
            if (field != null && entity != null) {
                out.add(WorkflowStep.of("update-record", StepType.UPDATE,
                        "entityId", entity.id(), "field", field, "value", updateValue(action)));
            }
        }

        if (NAVIGATE_ACTION.matcher(action).find()) {
            String pageId = listPageFor(action, entities);
            if (pageId != null) out.add(WorkflowStep.of("navigate", StepType.NAVIGATE, "pageId", pageId));
        }

        if (NOTIFY_ACTION.matcher(action).find()) {
            out.add(WorkflowStep.of("notify", StepType.NOTIFY, "message", notificationMessage(action), "type", "success"));
        }

        if (WEBHOOK_ACTION.matcher(action).find()) {
            out.add(WorkflowStep.of("webhook", StepType.WEBHOOK, "url", "{webhook_url}"));
        }

        if (out.isEmpty() && !condition.isEmpty()) {
            out.add(WorkflowStep.of("notify", StepType.NOTIFY, "message", "Workflow executed", "type", "success"));
        }
        return out;
    }

    static String emailSubject(String action, String condition) {
        if (CONFIRM.matcher(action).find()) return "Confirmation";
        if (INVOICE.matcher(action).find()) return "Invoice";
        if (BOOKING.matcher(condition).find()) return "Booking Confirmation";
        return "Notification";
    }

    static String emailBody(String action) {
        if (CONFIRM.matcher(action).find()) return "Your request has been confirmed.";
        return "Thank you for your request.";
    }

    static String updateField(String action) {
        String lower = action.toLowerCase(Locale.ROOT);
        for (String f : UPDATE_FIELDS) {
            if (lower.contains(f)) return f;
        }
        return null;
    }

    static String updateValue(String action) {
        String lower = action.toLowerCase(Locale.ROOT);
        if (lower.contains("complete")) return "completed";
        if (lower.contains("approve")) return "approved";
        if (lower.contains("reject")) return "rejected";
        return "updated";
    }

    static String listPageFor(String action, List<KnownEntity> entities) {
        String lower = action.toLowerCase(Locale.ROOT);
        for (KnownEntity e : entities) {
            if (lower.contains(e.name().toLowerCase(Locale.ROOT))) return e.id() + "-list";
        }
        return entities.isEmpty() ? null : entities.get(0).id() + "-list";
    }

    static String notificationMessage(String action) {
        Matcher m = NOTIFY_MESSAGE.matcher(action);
        return m.find() ? m.group(1) : "Action completed successfully";
    }

    // -------------------- Naming --------------------

    static String name(String condition, String action) {
        return "When " + titleCase(condition) + ", " + titleCase(action);
    }

    static String titleCase(String s) {
        String[] words = SPACES.split(s);
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < words.length; i++) {
            if (i > 0) sb.append(' ');
            String w = words[i];
            if (w.isEmpty()) continue;
            sb.append(Character.toUpperCase(w.charAt(0))).append(w.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }
}
