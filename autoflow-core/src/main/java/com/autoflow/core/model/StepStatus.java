package com.autoflow.core.model;

/**
 * Status of one step reached during a walk.
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED;

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }
}
