package com.autoflow.core.exception;

import java.util.Set;

/**
 * Error codes recorded on executions and step records.
 * These are values, not thrown exceptions.
 */
public final class ErrorCodes {

    public static final String STEP_EXECUTION_ERROR = "STEP_EXECUTION_ERROR";
    public static final String CONNECTOR_ERROR = "CONNECTOR_ERROR";
    public static final String INVALID_STEP_CONFIG = "INVALID_STEP_CONFIG";
    public static final String TIMEOUT = "TIMEOUT";
    public static final String RETRY_EXHAUSTED = "RETRY_EXHAUSTED";
    public static final String APPROVER_MISMATCH = "APPROVER_MISMATCH";
    public static final String APPROVAL_REJECTED = "APPROVAL_REJECTED";
    public static final String CYCLE_DETECTED = "CYCLE_DETECTED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    /**
     * Failures that will fail again on every attempt.
     */
    public static final Set<String> NON_RETRYABLE = Set.of(
        INVALID_STEP_CONFIG, CYCLE_DETECTED, APPROVAL_REJECTED
    );

    private ErrorCodes() {
    }
}
