package com.autoflow.core.exception;

/**
 * Base exception for all engine errors.
 */
public class AutoflowException extends RuntimeException {

    private final String errorCode;

    public AutoflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AutoflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
