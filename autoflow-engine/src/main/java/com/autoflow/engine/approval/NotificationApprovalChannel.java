package com.autoflow.engine.approval;

import com.autoflow.core.model.ApprovalRequest;
import com.autoflow.worker.ConnectorException;
import com.autoflow.worker.connector.NotificationConnector;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Sends each pending request to its approver as an interactive direct message:
 * {@code {approval_id, title, description, reasoning, confidence_score, actions: [approve, reject]}}.
 */
public class NotificationApprovalChannel implements ApprovalChannel {

    private static final Logger log = LoggerFactory.getLogger(NotificationApprovalChannel.class);

    private final NotificationConnector notifications;
    private final ObjectMapper objectMapper;

    public NotificationApprovalChannel(NotificationConnector notifications, ObjectMapper objectMapper) {
        this.notifications = notifications;
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(ApprovalRequest request) {
        String message = render(request);
        try {
            String ack = notifications.sendNotification(request.approverId(), true, message);
            log.debug("Approval {} published to {} (ack={})", request.id(), request.approverId(), ack);
        } catch (ConnectorException e) {
            throw new ApprovalChannelException(
                "Failed to publish approval " + request.id() + " to " + request.approverId(), e);
        }
    }

    String render(ApprovalRequest request) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("approval_id", request.id().toString());
        message.put("title", "Approval needed: " + request.actionKind().name().toLowerCase(Locale.ROOT) + " ("
            + request.priority().name().toLowerCase(Locale.ROOT) + ")");
        message.put("description", request.description());
        message.put("reasoning", request.reasoning());
        message.put("confidence_score", request.confidenceScore());
        message.putArray("actions").add("approve").add("reject");
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize approval message", e);
        }
    }
}
