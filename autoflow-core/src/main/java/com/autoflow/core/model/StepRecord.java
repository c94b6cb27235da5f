package com.autoflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit record for one step reached during a walk.
 * Unreached steps have no record.
 *
 * Invariants:
 * - at most one record per (executionId, attempt, stepId)
 * - result set iff status == COMPLETED
 * - error set iff status == FAILED
 */
public record StepRecord(
    UUID recordId,
    UUID executionId,
    String stepId,
    StepType stepType,
    int attempt,
    StepStatus status,
    Instant startedAt,
    Instant completedAt,
    JsonNode result,
    String error,
    String errorCode
) {
    /**
     * Create a record for a step about to be dispatched.
     */
    public static StepRecord running(UUID executionId, Step step, int attempt, Instant now) {
        return new StepRecord(
            UUID.randomUUID(), executionId, step.id(), step.type(), attempt,
            StepStatus.RUNNING, now, null, null, null, null
        );
    }

    /**
     * Create a record for a step whose own conditions did not pass.
     */
    public static StepRecord skipped(UUID executionId, Step step, int attempt, Instant now) {
        return new StepRecord(
            UUID.randomUUID(), executionId, step.id(), step.type(), attempt,
            StepStatus.SKIPPED, now, now, null, null, null
        );
    }

    /**
     * Create a record for an approval gate awaiting its decision.
     */
    public static StepRecord awaitingApproval(UUID executionId, Step step, int attempt, Instant now) {
        return new StepRecord(
            UUID.randomUUID(), executionId, step.id(), step.type(), attempt,
            StepStatus.PENDING, now, null, null, null, null
        );
    }

    public StepRecord complete(JsonNode output, Instant now) {
        return new StepRecord(
            recordId, executionId, stepId, stepType, attempt,
            StepStatus.COMPLETED, startedAt, now, output, null, null
        );
    }

    public StepRecord fail(String code, String message, Instant now) {
        return new StepRecord(
            recordId, executionId, stepId, stepType, attempt,
            StepStatus.FAILED, startedAt, now, null, message, code
        );
    }
}
