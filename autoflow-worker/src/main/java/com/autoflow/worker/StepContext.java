package com.autoflow.worker;

import com.autoflow.core.model.Step;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Context provided to step handlers during dispatch.
 */
public class StepContext {

    private final UUID executionId;
    private final Step step;
    private final int attempt;
    private final JsonNode config;
    private final JsonNode variables;
    private final ObjectMapper objectMapper;

    public StepContext(
            UUID executionId,
            Step step,
            int attempt,
            JsonNode config,
            JsonNode variables,
            ObjectMapper objectMapper) {
        this.executionId = executionId;
        this.step = step;
        this.attempt = attempt;
        this.config = config;
        this.variables = variables;
        this.objectMapper = objectMapper;
    }

    public UUID getExecutionId() {
        return executionId;
    }

    public Step getStep() {
        return step;
    }

    public String getStepId() {
        return step.id();
    }

    public int getAttempt() {
        return attempt;
    }

    /**
     * Step config with placeholders already resolved.
     */
    public JsonNode getConfig() {
        return config;
    }

    /**
     * Snapshot of the execution context at dispatch time.
     */
    public JsonNode getVariables() {
        return variables;
    }

    /**
     * Idempotency key for external calls made by this step.
     * Stable across re-dispatch of the same attempt.
     */
    public String getIdempotencyKey() {
        return executionId + ":" + step.id() + ":" + attempt;
    }

    /**
     * Non-blank text value of a config field.
     */
    public Optional<String> text(String field) {
        JsonNode node = config.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return Optional.empty();
        }
        String value = node.isValueNode() ? node.asText() : node.toString();
        return value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    /**
     * String list from an array field or a comma separated string.
     */
    public List<String> textList(String field) {
        JsonNode node = config.path(field);
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(n -> values.add(n.asText()));
        } else if (node.isTextual()) {
            for (String part : node.asText().split(",")) {
                if (!part.isBlank()) {
                    values.add(part.strip());
                }
            }
        }
        return values;
    }

    public ObjectNode newOutput() {
        return objectMapper.createObjectNode();
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
