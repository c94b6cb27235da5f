package com.autoflow.core.model;

/**
 * Lifecycle of an approval request.
 * PENDING is the only state that accepts a decision.
 */
public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    AUTO_APPROVED,
    ESCALATED;

    public boolean isResolved() {
        return this != PENDING;
    }

    public boolean isApproved() {
        return this == APPROVED || this == AUTO_APPROVED;
    }
}
