package com.autoflow.worker.handler;

import com.autoflow.worker.ConnectorException;
import com.autoflow.worker.StepContext;
import com.autoflow.worker.StepHandler;
import com.autoflow.worker.StepResult;
import com.autoflow.worker.connector.NotificationConnector;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;

/**
 * Posts a notification. {@code user} sends a direct message, otherwise {@code channel} is used.
 */
public class SendNotificationHandler implements StepHandler {

    static final String DEFAULT_CHANNEL = "#general";

    private final NotificationConnector connector;

    public SendNotificationHandler(NotificationConnector connector) {
        this.connector = connector;
    }

    @Override
    public StepResult handle(StepContext context) {
        Optional<String> message = context.text("message");
        if (message.isEmpty()) {
            return StepResult.invalidConfig("send_notification requires 'message'");
        }
        Optional<String> user = context.text("user");
        String target = user.orElseGet(() -> context.text("channel").orElse(DEFAULT_CHANNEL));

        try {
            String ack = connector.sendNotification(target, user.isPresent(), message.get());
            ObjectNode output = context.newOutput();
            output.put("notification_sent", true);
            output.put("type", user.isPresent() ? "dm" : "channel");
            output.put("target", target);
            output.put("ack", ack);
            return StepResult.ok(output);
        } catch (ConnectorException e) {
            return StepResult.from(e);
        }
    }
}
