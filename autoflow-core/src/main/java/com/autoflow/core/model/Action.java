package com.autoflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A compiled, typed intent to perform one operation.
 * Immutable after creation except for {@link #status()}.
 */
public record Action(
    UUID id,
    ActionKind kind,
    String operation,
    ActionPriority priority,
    JsonNode payload,
    boolean requiresApproval,
    double approvalConfidenceThreshold,
    int maxRetries,
    Duration timeout,
    Instant createdAt,
    ActionStatus status
) {
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.8;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    public Action {
        if (payload == null) {
            payload = JsonNodeFactory.instance.objectNode();
        }
    }

    /**
     * Create a copy with a new status.
     */
    public Action withStatus(ActionStatus newStatus) {
        return new Action(
            id, kind, operation, priority, payload, requiresApproval,
            approvalConfidenceThreshold, maxRetries, timeout, createdAt, newStatus
        );
    }

    public static Builder builder(ActionKind kind, String operation) {
        return new Builder(kind, operation);
    }

    public static class Builder {
        private UUID id = UUID.randomUUID();
        private final ActionKind kind;
        private final String operation;
        private ActionPriority priority = ActionPriority.MEDIUM;
        private JsonNode payload;
        private boolean requiresApproval;
        private double approvalConfidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration timeout = DEFAULT_TIMEOUT;
        private Instant createdAt = Instant.now();

        private Builder(ActionKind kind, String operation) {
            this.kind = kind;
            this.operation = operation;
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder priority(ActionPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder payload(JsonNode payload) {
            this.payload = payload;
            return this;
        }

        public Builder requiresApproval(boolean requiresApproval) {
            this.requiresApproval = requiresApproval;
            return this;
        }

        public Builder approvalConfidenceThreshold(double threshold) {
            this.approvalConfidenceThreshold = threshold;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Action build() {
            return new Action(
                id, kind, operation, priority, payload, requiresApproval,
                approvalConfidenceThreshold, maxRetries, timeout, createdAt, ActionStatus.PENDING
            );
        }
    }
}
