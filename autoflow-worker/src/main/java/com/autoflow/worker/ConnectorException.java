package com.autoflow.worker;

import com.autoflow.core.exception.ErrorCodes;

/**
 * Thrown by connectors when an external call fails.
 */
public class ConnectorException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public ConnectorException(String message) {
        this(ErrorCodes.CONNECTOR_ERROR, message, true);
    }

    public ConnectorException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public ConnectorException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = ErrorCodes.CONNECTOR_ERROR;
        this.retryable = true;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static ConnectorException permanent(String message) {
        return new ConnectorException(ErrorCodes.CONNECTOR_ERROR, message, false);
    }
}
