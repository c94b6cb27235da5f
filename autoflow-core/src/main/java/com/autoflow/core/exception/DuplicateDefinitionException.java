package com.autoflow.core.exception;

/**
 * Thrown when a definition version already exists in the store.
 */
public class DuplicateDefinitionException extends AutoflowException {

    public static final String ERROR_CODE = "DUPLICATE_DEFINITION";

    public DuplicateDefinitionException(String workflowId, int version) {
        super(ERROR_CODE, String.format(
            "Workflow definition already exists: %s v%d",
            workflowId, version
        ));
    }
}
