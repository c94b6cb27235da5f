package com.autoflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Entry node of a workflow graph. The walk starts at {@link #id()}.
 */
public record Trigger(
    String id,
    TriggerType type,
    String name,
    JsonNode config
) {
    public Trigger {
        if (config == null || config.isNull()) {
            config = JsonNodeFactory.instance.objectNode();
        }
    }
}
