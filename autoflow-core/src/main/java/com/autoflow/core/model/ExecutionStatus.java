package com.autoflow.core.model;

/**
 * Lifecycle states for a workflow execution.
 * Transitions follow a strict state machine, enforced through compare-and-set in the store.
 */
public enum ExecutionStatus {
    /**
     * Created, waiting for a worker to claim it.
     * Transitions: -> RUNNING, PENDING_APPROVAL, CANCELLED
     */
    PENDING,

    /**
     * Walk in progress.
     * Transitions: -> COMPLETED, FAILED, PENDING_APPROVAL, TIMEOUT, CANCELLED
     */
    RUNNING,

    /**
     * Paused until an approver decides.
     * Transitions: -> RUNNING (approved), CANCELLED (rejected)
     */
    PENDING_APPROVAL,

    /**
     * Walk finished. Terminal state.
     */
    COMPLETED,

    /**
     * A step failed. Terminal once retries are exhausted.
     * Transitions: -> RETRYING, CANCELLED
     */
    FAILED,

    /**
     * Running past the supervisor timeout. Terminal state, never retried automatically.
     */
    TIMEOUT,

    /**
     * Failed execution scheduled for another attempt.
     * Transitions: -> RUNNING, CANCELLED
     */
    RETRYING,

    /**
     * Cancelled on request or by rejection. Terminal state.
     */
    CANCELLED;

    /**
     * Check if this state is terminal regardless of retry budget.
     * FAILED is terminal only once retries are exhausted, see {@link WorkflowExecution#isTerminal()}.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == TIMEOUT || this == CANCELLED;
    }

    /**
     * Check if a worker may claim an execution in this state.
     */
    public boolean isClaimable() {
        return this == PENDING || this == RETRYING || this == PENDING_APPROVAL;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == PENDING_APPROVAL || target == CANCELLED;
            case RUNNING -> target == COMPLETED || target == FAILED || target == PENDING_APPROVAL ||
                            target == TIMEOUT || target == CANCELLED || target == RUNNING;
            case PENDING_APPROVAL -> target == RUNNING || target == CANCELLED;
            case FAILED -> target == RETRYING || target == CANCELLED;
            case RETRYING -> target == RUNNING || target == CANCELLED;
            case COMPLETED, TIMEOUT, CANCELLED -> false;
        };
    }
}
