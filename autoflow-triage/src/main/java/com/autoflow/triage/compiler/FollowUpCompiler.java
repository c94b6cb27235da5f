package com.autoflow.triage.compiler;

import com.autoflow.core.model.Action;
import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.ActionPriority;
import com.autoflow.core.model.TriggerEvent;
import com.autoflow.triage.TriageResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Drafts a follow-up message from a template and decides when to send it.
 */
public class FollowUpCompiler implements ActionCompiler {

    public static final String OPERATION = "create_follow_up";

    private static final Map<String, Template> TEMPLATES = Map.of(
        "meeting", new Template(
            "Follow-up: {{title}}",
            "Hi {{recipient}},\n\nThank you for the meeting about {{title}}. "
                + "Here is a summary of what we discussed and the agreed next steps.\n\nBest regards"),
        "task", new Template(
            "Task Update: {{title}}",
            "Hi {{recipient}},\n\nI'm following up on the task \"{{title}}\". "
                + "Could you share the current status?\n\nThanks"),
        "general", new Template(
            "Follow-up: {{subject}}",
            "Hi {{recipient}},\n\nI wanted to follow up on {{subject}}. "
                + "Please let me know if you need anything.\n\nBest regards")
    );

    private static final Map<String, Timing> TIMING = Map.of(
        "urgent", new Timing(2, 24),
        "high", new Timing(24, 72),
        "medium", new Timing(72, 168),
        "low", new Timing(168, 336)
    );

    private final Clock clock;

    public FollowUpCompiler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ActionKind kind() {
        return ActionKind.FOLLOW_UP;
    }

    @Override
    public Action compile(TriageResult triage, TriggerEvent event) {
        JsonNode metadata = event.metadata();
        String type = metadata.path("type").asText("general").toLowerCase(Locale.ROOT);
        if (!TEMPLATES.containsKey(type)) {
            type = "general";
        }
        String urgency = urgencyOf(triage, metadata);

        ActionPriority priority = switch (urgency) {
            case "critical" -> ActionPriority.CRITICAL;
            case "urgent" -> ActionPriority.HIGH;
            default -> ActionPriority.MEDIUM;
        };
        Timing timing = TIMING.getOrDefault(
            "critical".equals(urgency) ? "urgent" : urgency, TIMING.get("medium"));

        String title = metadata.path("title").asText(Payloads.summary(event.content(), 60));
        Map<String, String> values = Map.of(
            "title", title,
            "subject", metadata.path("subject").asText(title),
            "recipient", metadata.path("recipient").asText("team")
        );
        Template template = TEMPLATES.get(type);
        Instant now = clock.instant();

        ObjectNode payload = Payloads.base(triage, event);
        payload.put("type", type);
        payload.put("urgency", urgency);
        payload.put("subject", fill(template.subject(), values));
        payload.put("body", fill(template.body(), values));
        payload.set("recipients", Payloads.stringList(metadata, "recipients", event.userId()));
        payload.put("delay_hours", timing.delayHours());
        payload.put("reminder_hours", timing.reminderHours());
        payload.put("send_at", now.plus(Duration.ofHours(timing.delayHours())).toString());
        payload.put("remind_at", now.plus(Duration.ofHours(timing.reminderHours())).toString());

        return Action.builder(ActionKind.FOLLOW_UP, OPERATION)
            .priority(priority)
            .payload(payload)
            .requiresApproval(priority == ActionPriority.CRITICAL)
            .createdAt(now)
            .build();
    }

    private static String urgencyOf(TriageResult triage, JsonNode metadata) {
        String declared = metadata.path("urgency").asText("").toLowerCase(Locale.ROOT);
        if (!declared.isBlank() && !"normal".equals(declared)) {
            return declared;
        }
        return switch (triage.category()) {
            case URGENT -> "urgent";
            case HIGH_PRIORITY -> "high";
            case ROUTINE -> "medium";
            case LOW_PRIORITY -> "low";
        };
    }

    private static String fill(String template, Map<String, String> values) {
        String result = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            result = result.replace("{{" + entry.getKey() + "}}", entry.getValue());
        }
        return result;
    }

    private record Template(String subject, String body) {
    }

    private record Timing(int delayHours, int reminderHours) {
    }
}
