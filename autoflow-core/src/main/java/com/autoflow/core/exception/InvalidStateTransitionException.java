package com.autoflow.core.exception;

import com.autoflow.core.model.ExecutionStatus;
import java.util.UUID;

/**
 * Thrown when an execution status change violates the state machine.
 */
public class InvalidStateTransitionException extends AutoflowException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    private final UUID executionId;
    private final ExecutionStatus fromStatus;
    private final ExecutionStatus toStatus;

    public InvalidStateTransitionException(UUID executionId, ExecutionStatus from, ExecutionStatus to) {
        super(ERROR_CODE, String.format(
            "Invalid transition for execution %s: %s -> %s",
            executionId, from, to
        ));
        this.executionId = executionId;
        this.fromStatus = from;
        this.toStatus = to;
    }

    public UUID getExecutionId() {
        return executionId;
    }

    public ExecutionStatus getFromStatus() {
        return fromStatus;
    }

    public ExecutionStatus getToStatus() {
        return toStatus;
    }
}
