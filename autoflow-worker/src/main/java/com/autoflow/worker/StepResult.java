package com.autoflow.worker;

import com.autoflow.core.exception.ErrorCodes;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Outcome of one step handler call. Handlers return failures instead of throwing,
 * so the executor decides what a failure means for the walk.
 *
 * Invariants:
 * - ok implies output != null and errorCode == null
 * - !ok implies errorCode != null
 */
public record StepResult(
    boolean ok,
    JsonNode output,
    String errorCode,
    String error,
    boolean retryable
) {
    public static StepResult ok(JsonNode output) {
        return new StepResult(true,
            output == null ? JsonNodeFactory.instance.objectNode() : output,
            null, null, false);
    }

    public static StepResult failure(String errorCode, String error, boolean retryable) {
        return new StepResult(false, null, errorCode, error, retryable);
    }

    /**
     * A failure caused by the step's own configuration. Retrying will not help.
     */
    public static StepResult invalidConfig(String error) {
        return failure(ErrorCodes.INVALID_STEP_CONFIG, error, false);
    }

    public static StepResult from(ConnectorException e) {
        return failure(e.getErrorCode(), e.getMessage(), e.isRetryable());
    }
}
