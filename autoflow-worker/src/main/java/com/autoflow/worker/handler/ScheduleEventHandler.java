package com.autoflow.worker.handler;

import com.autoflow.worker.ConnectorException;
import com.autoflow.worker.StepContext;
import com.autoflow.worker.StepHandler;
import com.autoflow.worker.StepResult;
import com.autoflow.worker.connector.CalendarConnector;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Creates a calendar event. Requires {@code title} and {@code start};
 * {@code end} defaults to start plus {@code duration_minutes}.
 */
public class ScheduleEventHandler implements StepHandler {

    static final int DEFAULT_DURATION_MINUTES = 30;

    private final CalendarConnector connector;

    public ScheduleEventHandler(CalendarConnector connector) {
        this.connector = connector;
    }

    @Override
    public StepResult handle(StepContext context) {
        String title = context.text("title").orElse(null);
        String startText = context.text("start").orElse(null);
        if (title == null || startText == null) {
            return StepResult.invalidConfig("schedule_event requires 'title' and 'start'");
        }

        Instant start;
        Instant end;
        try {
            start = Instant.parse(startText);
            String endText = context.text("end").orElse(null);
            end = endText != null
                ? Instant.parse(endText)
                : start.plus(Duration.ofMinutes(context.getConfig()
                    .path("duration_minutes").asInt(DEFAULT_DURATION_MINUTES)));
        } catch (DateTimeParseException e) {
            return StepResult.invalidConfig("schedule_event has an invalid timestamp: " + e.getParsedString());
        }
        if (!end.isAfter(start)) {
            return StepResult.invalidConfig("schedule_event 'end' must be after 'start'");
        }
        List<String> attendees = context.textList("attendees");

        try {
            String eventId = connector.scheduleEvent(title, start, end, attendees);
            ObjectNode output = context.newOutput();
            output.put("scheduled", true);
            output.put("event_id", eventId);
            output.put("start", start.toString());
            output.put("end", end.toString());
            return StepResult.ok(output);
        } catch (ConnectorException e) {
            return StepResult.from(e);
        }
    }
}
