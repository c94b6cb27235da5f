package com.autoflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One triggered run of a workflow definition.
 * Primary source of truth for execution status.
 *
 * Invariants:
 * - status changes only through compare-and-set in the store
 * - retryCount never exceeds maxRetries
 * - checkpointStepId set iff paused at an approval gate
 * - result holds the context snapshot when paused or finished
 * - a null runningTimeout means the supervisor's default applies
 */
public record WorkflowExecution(
    // Primary key
    UUID executionId,

    // Definition pinned at creation
    String workflowId,
    int workflowVersion,

    // State
    ExecutionStatus status,
    String checkpointStepId,

    // Data
    JsonNode triggerPayload,
    JsonNode result,

    // Links
    UUID actionId,
    UUID approvalId,

    // Error tracking
    String error,
    String errorCode,

    // Retry
    int retryCount,
    int maxRetries,
    Instant nextAttemptAt,
    Duration runningTimeout,

    // Timing
    Instant createdAt,
    Instant startedAt,
    Instant updatedAt,
    Instant completedAt
) {
    public WorkflowExecution {
        if (triggerPayload == null) {
            triggerPayload = JsonNodeFactory.instance.objectNode();
        }
    }

    /**
     * Create a new execution in the given initial status.
     */
    public static WorkflowExecution create(
            WorkflowDefinition definition,
            JsonNode triggerPayload,
            UUID actionId,
            int maxRetries,
            ExecutionStatus initialStatus,
            Instant now) {
        return new WorkflowExecution(
            UUID.randomUUID(),
            definition.id(),
            definition.version(),
            initialStatus,
            null,
            triggerPayload,
            null,
            actionId,
            null,
            null,
            null,
            0,
            maxRetries,
            null,
            null,
            now,
            null,
            now,
            null
        );
    }

    /**
     * Check if retries are still available.
     */
    public boolean hasRetriesLeft() {
        return retryCount < maxRetries;
    }

    /**
     * Check if the execution is in a terminal state.
     * FAILED counts as terminal once the retry budget is spent.
     */
    public boolean isTerminal() {
        return status.isTerminal() || (status == ExecutionStatus.FAILED && !hasRetriesLeft());
    }

    public boolean isPausedAtGate() {
        return status == ExecutionStatus.PENDING_APPROVAL && checkpointStepId != null;
    }

    /**
     * Builder for creating modified copies.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private final UUID executionId;
        private final String workflowId;
        private final int workflowVersion;
        private ExecutionStatus status;
        private String checkpointStepId;
        private JsonNode triggerPayload;
        private JsonNode result;
        private final UUID actionId;
        private UUID approvalId;
        private String error;
        private String errorCode;
        private int retryCount;
        private int maxRetries;
        private Instant nextAttemptAt;
        private Duration runningTimeout;
        private final Instant createdAt;
        private Instant startedAt;
        private Instant updatedAt;
        private Instant completedAt;

        public Builder(WorkflowExecution execution) {
            this.executionId = execution.executionId();
            this.workflowId = execution.workflowId();
            this.workflowVersion = execution.workflowVersion();
            this.status = execution.status();
            this.checkpointStepId = execution.checkpointStepId();
            this.triggerPayload = execution.triggerPayload();
            this.result = execution.result();
            this.actionId = execution.actionId();
            this.approvalId = execution.approvalId();
            this.error = execution.error();
            this.errorCode = execution.errorCode();
            this.retryCount = execution.retryCount();
            this.maxRetries = execution.maxRetries();
            this.nextAttemptAt = execution.nextAttemptAt();
            this.runningTimeout = execution.runningTimeout();
            this.createdAt = execution.createdAt();
            this.startedAt = execution.startedAt();
            this.updatedAt = execution.updatedAt();
            this.completedAt = execution.completedAt();
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder checkpointStepId(String checkpointStepId) {
            this.checkpointStepId = checkpointStepId;
            return this;
        }

        public Builder triggerPayload(JsonNode triggerPayload) {
            this.triggerPayload = triggerPayload;
            return this;
        }

        public Builder result(JsonNode result) {
            this.result = result;
            return this;
        }

        public Builder approvalId(UUID approvalId) {
            this.approvalId = approvalId;
            return this;
        }

        public Builder error(String errorCode, String error) {
            this.errorCode = errorCode;
            this.error = error;
            return this;
        }

        public Builder clearError() {
            this.errorCode = null;
            this.error = null;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder nextAttemptAt(Instant nextAttemptAt) {
            this.nextAttemptAt = nextAttemptAt;
            return this;
        }

        public Builder runningTimeout(Duration runningTimeout) {
            this.runningTimeout = runningTimeout;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public WorkflowExecution build() {
            return new WorkflowExecution(
                executionId, workflowId, workflowVersion, status, checkpointStepId,
                triggerPayload, result, actionId, approvalId, error, errorCode,
                retryCount, maxRetries, nextAttemptAt, runningTimeout, createdAt, startedAt,
                updatedAt, completedAt
            );
        }
    }
}
