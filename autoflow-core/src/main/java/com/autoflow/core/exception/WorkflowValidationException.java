package com.autoflow.core.exception;

import java.util.List;

/**
 * Thrown when a workflow definition or a trigger payload is malformed.
 * Raised before any execution record is created.
 */
public class WorkflowValidationException extends AutoflowException {

    public static final String ERROR_CODE = "VALIDATION_ERROR";

    private final List<String> violations;

    public WorkflowValidationException(String message) {
        super(ERROR_CODE, message);
        this.violations = List.of(message);
    }

    public WorkflowValidationException(String subject, List<String> violations) {
        super(ERROR_CODE, String.format(
            "%s is invalid: %s",
            subject, String.join("; ", violations)
        ));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
