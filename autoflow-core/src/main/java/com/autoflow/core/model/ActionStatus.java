package com.autoflow.core.model;

/**
 * Status of an action. The only mutable field of an {@link Action}.
 */
public enum ActionStatus {
    /** Compiled, approval not yet requested. */
    PENDING,
    /** Waiting on a human approver. */
    AWAITING_APPROVAL,
    /** Approved by a human or auto-approved. */
    APPROVED,
    /** Rejected by the approver. */
    REJECTED
}
