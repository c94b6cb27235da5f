package com.autoflow.worker.handler;

import com.autoflow.worker.ConnectorException;
import com.autoflow.worker.StepContext;
import com.autoflow.worker.StepHandler;
import com.autoflow.worker.StepResult;
import com.autoflow.worker.connector.MessagingConnector;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Sends a message. Requires {@code to}, {@code subject} and {@code body}.
 */
public class SendMessageHandler implements StepHandler {

    private final MessagingConnector connector;

    public SendMessageHandler(MessagingConnector connector) {
        this.connector = connector;
    }

    @Override
    public StepResult handle(StepContext context) {
        String to = context.text("to").orElse(null);
        String subject = context.text("subject").orElse(null);
        String body = context.text("body").orElse(null);
        if (to == null || subject == null || body == null) {
            return StepResult.invalidConfig("send_message requires 'to', 'subject' and 'body'");
        }

        try {
            String messageId = connector.sendMessage(to, subject, body);
            ObjectNode output = context.newOutput();
            output.put("message_sent", true);
            output.put("message_id", messageId);
            output.put("to", to);
            return StepResult.ok(output);
        } catch (ConnectorException e) {
            return StepResult.from(e);
        }
    }
}
