package com.autoflow.worker.connector;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connectors that only log what they would send.
 * Used when no chat, tracker, mail or calendar integration is configured.
 */
public class LoggingConnectors implements NotificationConnector, TaskTrackerConnector,
        MessagingConnector, CalendarConnector {

    private static final Logger log = LoggerFactory.getLogger(LoggingConnectors.class);

    @Override
    public String sendNotification(String target, boolean directMessage, String message) {
        log.info("Notification to {} ({}): {}", target, directMessage ? "dm" : "channel", message);
        return "ack-" + UUID.randomUUID();
    }

    @Override
    public String createTask(TaskRequest request) {
        log.info("Task '{}' in project {} (assignee={}, due={})",
            request.name(), request.project(), request.assignee(), request.dueDate());
        return "task-" + UUID.randomUUID();
    }

    @Override
    public String sendMessage(String to, String subject, String body) {
        log.info("Message to {}: {}", to, subject);
        return "msg-" + UUID.randomUUID();
    }

    @Override
    public String scheduleEvent(String title, Instant start, Instant end, List<String> attendees) {
        log.info("Event '{}' {} - {} with {}", title, start, end, attendees);
        return "evt-" + UUID.randomUUID();
    }
}
