package com.autoflow.core.exception;

/**
 * Thrown when a definition, execution or approval request is not found.
 */
public class NotFoundException extends AutoflowException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
