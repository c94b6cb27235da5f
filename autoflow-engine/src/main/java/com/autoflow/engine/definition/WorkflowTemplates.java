package com.autoflow.engine.definition;

import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.Condition;
import com.autoflow.core.model.ConditionOperator;
import com.autoflow.core.model.Step;
import com.autoflow.core.model.StepType;
import com.autoflow.core.model.TriggerType;
import com.autoflow.core.model.WorkflowDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in workflow definitions: the editor templates plus one workflow per action kind,
 * which the intake routes compiled actions to.
 */
public final class WorkflowTemplates {

    public static final String EMAIL_TO_TASK = "email-to-task";
    public static final String MEETING_FOLLOWUP = "meeting-followup";
    public static final String SALES_LEAD = "sales-lead";

    public static final String ESCALATION_RESPONSE = "escalation-response";
    public static final String MEETING_SCHEDULING = "meeting-scheduling";
    public static final String FOLLOW_UP_DISPATCH = "follow-up-dispatch";
    public static final String RESEARCH_REQUEST = "research-request";
    public static final String TRIAGE_ROUTING = "triage-routing";
    public static final String DECISION_REVIEW = "decision-review";

    static final String CREATED_BY = "system";

    private static final Map<String, WorkflowDefinition> TEMPLATES;
    private static final Map<ActionKind, String> KIND_WORKFLOWS;

    static {
        Map<String, WorkflowDefinition> templates = new LinkedHashMap<>();
        register(templates, emailToTask());
        register(templates, meetingFollowup());
        register(templates, salesLead());
        register(templates, escalationResponse());
        register(templates, meetingScheduling());
        register(templates, followUpDispatch());
        register(templates, researchRequest());
        register(templates, triageRouting());
        register(templates, decisionReview());
        TEMPLATES = Collections.unmodifiableMap(templates);

        Map<ActionKind, String> kinds = new EnumMap<>(ActionKind.class);
        kinds.put(ActionKind.ESCALATION, ESCALATION_RESPONSE);
        kinds.put(ActionKind.SCHEDULING, MEETING_SCHEDULING);
        kinds.put(ActionKind.FOLLOW_UP, FOLLOW_UP_DISPATCH);
        kinds.put(ActionKind.RESEARCH, RESEARCH_REQUEST);
        kinds.put(ActionKind.TRIAGE, TRIAGE_ROUTING);
        kinds.put(ActionKind.DECISION, DECISION_REVIEW);
        KIND_WORKFLOWS = Collections.unmodifiableMap(kinds);
    }

    private WorkflowTemplates() {
    }

    /**
     * All templates keyed by name, in registration order. Each template's id equals its name.
     */
    public static Map<String, WorkflowDefinition> all() {
        return TEMPLATES;
    }

    public static Optional<WorkflowDefinition> find(String name) {
        return Optional.ofNullable(TEMPLATES.get(name));
    }

    /**
     * Default workflow id for every action kind.
     */
    public static Map<ActionKind, String> kindWorkflows() {
        return KIND_WORKFLOWS;
    }

    private static void register(Map<String, WorkflowDefinition> templates, WorkflowDefinition definition) {
        templates.put(definition.id(), definition);
    }

    // ========== Editor Templates ==========

    private static WorkflowDefinition emailToTask() {
        return WorkflowDefinition.builder()
            .id(EMAIL_TO_TASK)
            .name("Email to Task")
            .description("Create tracker tasks from emails that ask for action")
            .trigger("email-trigger", TriggerType.EMAIL_RECEIVED)
            .step(Step.builder("create-task", StepType.CREATE_TASK)
                .name("Create Task")
                .config(config(
                    "project", "Inbox",
                    "name", "{{email.subject}}",
                    "description", "{{email.body}}"))
                .build())
            .step(Step.builder("send-notification", StepType.SEND_NOTIFICATION)
                .name("Send Notification")
                .config(config(
                    "channel", "#tasks",
                    "message", "New task created: {{create-task.name}}"))
                .build())
            .connect("email-trigger", "create-task",
                Condition.of("email.subject", ConditionOperator.CONTAINS, "action"))
            .connect("create-task", "send-notification")
            .createdBy(CREATED_BY)
            .build();
    }

    private static WorkflowDefinition meetingFollowup() {
        return WorkflowDefinition.builder()
            .id(MEETING_FOLLOWUP)
            .name("Meeting Follow-up")
            .description("Create action items and send a summary after a meeting ends")
            .trigger("meeting-trigger", TriggerType.SCHEDULED)
            .step(Step.builder("generate-summary", StepType.SET_VARIABLE)
                .name("Generate Summary")
                .config(config(
                    "variable", "summary",
                    "value", "Summary of {{meeting.title}}"))
                .build())
            .step(Step.builder("create-action-items", StepType.CREATE_TASK)
                .name("Create Action Items")
                .config(config(
                    "project", "Meeting Follow-ups",
                    "name", "Action items: {{meeting.title}}",
                    "description", "{{generate-summary.summary}}"))
                .build())
            .step(Step.builder("send-summary", StepType.SEND_MESSAGE)
                .name("Send Summary")
                .config(config(
                    "to", "{{meeting.organizer}}",
                    "subject", "Meeting summary: {{meeting.title}}",
                    "body", "{{generate-summary.summary}}. Action items: {{create-action-items.task_id}}"))
                .build())
            .connect("meeting-trigger", "generate-summary")
            .connect("generate-summary", "create-action-items")
            .connect("create-action-items", "send-summary")
            .createdBy(CREATED_BY)
            .build();
    }

    private static WorkflowDefinition salesLead() {
        return WorkflowDefinition.builder()
            .id(SALES_LEAD)
            .name("Sales Lead Processing")
            .description("Track new leads, book a call for enterprise leads and welcome the sender")
            .trigger("lead-trigger", TriggerType.EMAIL_RECEIVED)
            .step(Step.builder("create-lead-task", StepType.CREATE_TASK)
                .name("Create Lead Task")
                .config(config(
                    "project", "Sales Pipeline",
                    "name", "Lead: {{email.subject}}",
                    "description", "{{email.body}}",
                    "priority", "high"))
                .build())
            .step(Step.builder("schedule-followup", StepType.SCHEDULE_EVENT)
                .name("Schedule Follow-up")
                .config(config(
                    "title", "Sales call: {{email.subject}}",
                    "start", "{{call_start}}",
                    "duration_minutes", 30,
                    "attendees", array("{{email.from}}")))
                .continueOnFailure(true)
                .build())
            .step(Step.builder("send-welcome", StepType.SEND_MESSAGE)
                .name("Send Welcome")
                .config(config(
                    "to", "{{email.from}}",
                    "subject", "Thanks for reaching out",
                    "body", "We received your inquiry about {{email.subject}} and will be in touch shortly."))
                .build())
            .connect("lead-trigger", "create-lead-task")
            .connect("create-lead-task", "schedule-followup",
                Condition.of("email.subject", ConditionOperator.CONTAINS, "enterprise"))
            .connect("create-lead-task", "send-welcome")
            .connect("schedule-followup", "send-welcome")
            .createdBy(CREATED_BY)
            .build();
    }

    // ========== Action Kind Workflows ==========

    private static WorkflowDefinition escalationResponse() {
        return WorkflowDefinition.builder()
            .id(ESCALATION_RESPONSE)
            .name("Escalation Response")
            .description("Page the escalation owner and open an incident task")
            .trigger("action", TriggerType.ACTION_COMPILED)
            .step(Step.builder("page-owner", StepType.SEND_NOTIFICATION)
                .name("Page Owner")
                .config(config(
                    "user", "{{escalate_to}}",
                    "message", "{{title}} (priority {{priority}}): {{content}}"))
                .build())
            .step(Step.builder("open-incident", StepType.CREATE_TASK)
                .name("Open Incident")
                .config(config(
                    "project", "Escalations",
                    "name", "{{title}}",
                    "description", "{{content}}",
                    "assignee", "{{escalate_to}}"))
                .build())
            .connect("action", "page-owner")
            .connect("page-owner", "open-incident")
            .createdBy(CREATED_BY)
            .build();
    }

    private static WorkflowDefinition meetingScheduling() {
        return WorkflowDefinition.builder()
            .id(MEETING_SCHEDULING)
            .name("Meeting Scheduling")
            .description("Book the chosen slot and tell the participants")
            .trigger("action", TriggerType.ACTION_COMPILED)
            .step(Step.builder("book-slot", StepType.SCHEDULE_EVENT)
                .name("Book Slot")
                .config(config(
                    "title", "{{title}}",
                    "start", "{{start}}",
                    "end", "{{end}}",
                    "attendees", "{{participants}}"))
                .build())
            .step(Step.builder("notify-participants", StepType.SEND_NOTIFICATION)
                .name("Notify Participants")
                .config(config(
                    "user", "{{user_id}}",
                    "message", "Scheduled {{title}} at {{start}}"))
                .continueOnFailure(true)
                .build())
            .connect("action", "book-slot")
            .connect("book-slot", "notify-participants")
            .createdBy(CREATED_BY)
            .build();
    }

    private static WorkflowDefinition followUpDispatch() {
        return WorkflowDefinition.builder()
            .id(FOLLOW_UP_DISPATCH)
            .name("Follow-up Dispatch")
            .description("Send the follow-up message and track a reminder")
            .trigger("action", TriggerType.ACTION_COMPILED)
            .step(Step.builder("send-follow-up", StepType.SEND_MESSAGE)
                .name("Send Follow-up")
                .config(config(
                    "to", "{{recipients.0}}",
                    "subject", "{{subject}}",
                    "body", "{{body}}"))
                .build())
            .step(Step.builder("track-reminder", StepType.CREATE_TASK)
                .name("Track Reminder")
                .config(config(
                    "project", "Follow-ups",
                    "name", "Reminder: {{subject}}",
                    "due_date", "{{remind_at}}",
                    "assignee", "{{user_id}}"))
                .build())
            .connect("action", "send-follow-up")
            .connect("send-follow-up", "track-reminder")
            .createdBy(CREATED_BY)
            .build();
    }

    private static WorkflowDefinition researchRequest() {
        return WorkflowDefinition.builder()
            .id(RESEARCH_REQUEST)
            .name("Research Request")
            .description("Open a research task for complex requests")
            .trigger("action", TriggerType.ACTION_COMPILED)
            .step(Step.builder("open-research-task", StepType.CREATE_TASK)
                .name("Open Research Task")
                .config(config(
                    "project", "Research",
                    "name", "Research: {{topic}}",
                    "description", "{{content}}",
                    "assignee", "{{user_id}}"))
                .build())
            .step(Step.builder("acknowledge", StepType.SEND_NOTIFICATION)
                .name("Acknowledge")
                .config(config(
                    "user", "{{user_id}}",
                    "message", "Research task {{open-research-task.task_id}} opened for {{topic}}"))
                .continueOnFailure(true)
                .build())
            .connect("action", "open-research-task")
            .connect("open-research-task", "acknowledge")
            .createdBy(CREATED_BY)
            .build();
    }

    private static WorkflowDefinition triageRouting() {
        return WorkflowDefinition.builder()
            .id(TRIAGE_ROUTING)
            .name("Triage Routing")
            .description("Record the triage category and queue the item")
            .trigger("action", TriggerType.ACTION_COMPILED)
            .step(Step.builder("record-category", StepType.SET_VARIABLE)
                .name("Record Category")
                .config(config(
                    "variable", "category",
                    "value", "{{category}}"))
                .build())
            .step(Step.builder("queue-item", StepType.CREATE_TASK)
                .name("Queue Item")
                .config(config(
                    "project", "Triage",
                    "name", "{{title}}",
                    "description", "{{content}}"))
                .build())
            .connect("action", "record-category")
            .connect("record-category", "queue-item")
            .createdBy(CREATED_BY)
            .build();
    }

    private static WorkflowDefinition decisionReview() {
        return WorkflowDefinition.builder()
            .id(DECISION_REVIEW)
            .name("Decision Review")
            .description("Carry out an approved decision and tell the requester")
            .trigger("action", TriggerType.ACTION_COMPILED)
            .step(Step.builder("open-decision-task", StepType.CREATE_TASK)
                .name("Open Decision Task")
                .config(config(
                    "project", "Decisions",
                    "name", "{{title}}",
                    "description", "{{content}}",
                    "assignee", "{{user_id}}"))
                .build())
            .step(Step.builder("notify-requester", StepType.SEND_NOTIFICATION)
                .name("Notify Requester")
                .config(config(
                    "user", "{{user_id}}",
                    "message", "Decision approved: {{title}}"))
                .continueOnFailure(true)
                .build())
            .connect("action", "open-decision-task")
            .connect("open-decision-task", "notify-requester")
            .createdBy(CREATED_BY)
            .build();
    }

    // ========== Helpers ==========

    static ObjectNode config(Object... pairs) {
        if (pairs.length % 2 != 0) {
            throw new IllegalArgumentException("config needs key/value pairs");
        }
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        for (int i = 0; i < pairs.length; i += 2) {
            String key = (String) pairs[i];
            Object value = pairs[i + 1];
            if (value instanceof JsonNode) {
                node.set(key, (JsonNode) value);
            } else if (value instanceof Integer) {
                node.put(key, (Integer) value);
            } else if (value instanceof Boolean) {
                node.put(key, (Boolean) value);
            } else {
                node.put(key, String.valueOf(value));
            }
        }
        return node;
    }

    private static ArrayNode array(String... values) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }
}
