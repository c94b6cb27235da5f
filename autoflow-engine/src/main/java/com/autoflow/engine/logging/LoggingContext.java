package com.autoflow.engine.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * MDC scope for structured logging.
 * Every key set by a scope is restored to its previous value on close, so scopes nest.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forExecution(executionId, workflowId)) {
 *     try (var step = LoggingContext.forStep(stepId, attempt)) {
 *         log.info("Dispatching step"); // carries executionId, workflowId, stepId, attempt
 *     }
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String EXECUTION_ID = "executionId";
    public static final String WORKFLOW_ID = "workflowId";
    public static final String STEP_ID = "stepId";
    public static final String ATTEMPT = "attempt";
    public static final String APPROVAL_ID = "approvalId";

    // Value each key had before this scope set it; null means absent
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LoggingContext() {
    }

    /**
     * Scope for work on one execution.
     */
    public static LoggingContext forExecution(UUID executionId, String workflowId) {
        LoggingContext ctx = new LoggingContext();
        if (executionId != null) {
            ctx.put(EXECUTION_ID, executionId.toString());
        }
        ctx.put(WORKFLOW_ID, workflowId);
        return ctx;
    }

    /**
     * Scope for one step dispatch, nested inside an execution scope.
     */
    public static LoggingContext forStep(String stepId, int attempt) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(STEP_ID, stepId);
        ctx.put(ATTEMPT, String.valueOf(attempt));
        return ctx;
    }

    /**
     * Scope for approval work.
     */
    public static LoggingContext forApproval(UUID approvalId) {
        LoggingContext ctx = new LoggingContext();
        if (approvalId != null) {
            ctx.put(APPROVAL_ID, approvalId.toString());
        }
        return ctx;
    }

    public static String getExecutionId() {
        return MDC.get(EXECUTION_ID);
    }

    public static String getStepId() {
        return MDC.get(STEP_ID);
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }

    /**
     * Clear all MDC context. Call at the end of a worker loop.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
