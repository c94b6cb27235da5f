package com.autoflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Inbound event fed to the classifier.
 *
 * @param content  free text of the message, email or task
 * @param source   channel the event arrived on
 * @param userId   user the event belongs to, becomes the approval requester
 * @param metadata source-specific fields (participants, follow-up type, urgency)
 */
public record TriggerEvent(
    String content,
    TriggerSource source,
    String userId,
    JsonNode metadata
) {
    public TriggerEvent {
        if (metadata == null || metadata.isNull()) {
            metadata = JsonNodeFactory.instance.objectNode();
        }
    }

    public static TriggerEvent of(String content, TriggerSource source, String userId) {
        return new TriggerEvent(content, source, userId, null);
    }
}
