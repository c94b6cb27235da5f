package com.autoflow.api.rest;

import com.autoflow.core.exception.AutoflowException;
import com.autoflow.core.exception.DuplicateDefinitionException;
import com.autoflow.core.exception.InvalidStateTransitionException;
import com.autoflow.core.exception.NotFoundException;
import com.autoflow.core.exception.WorkflowValidationException;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * Maps exceptions to {@code {error_code, message, violations?}} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String BAD_REQUEST = "BAD_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(WorkflowValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WorkflowValidationException ex, HttpServletRequest request) {
        List<String> violations = ex.getViolations().isEmpty() ? null : ex.getViolations();
        return respond(HttpStatus.BAD_REQUEST, ex, request, violations);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, ex, request, null);
    }

    @ExceptionHandler({InvalidStateTransitionException.class, DuplicateDefinitionException.class})
    public ResponseEntity<ErrorResponse> handleConflict(AutoflowException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, ex, request, null);
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class,
        IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("{} {} rejected: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(BAD_REQUEST, ex.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("{} {} failed", request.getMethod(), request.getRequestURI(), ex);
        String code = ex instanceof AutoflowException ? ((AutoflowException) ex).getErrorCode() : INTERNAL_ERROR;
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse(code, "Internal error", null));
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, AutoflowException ex,
                                                  HttpServletRequest request, List<String> violations) {
        log.warn("{} {} -> {} {}: {}", request.getMethod(), request.getRequestURI(),
            status.value(), ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(ex.getErrorCode(), ex.getMessage(), violations));
    }

    // ========== DTOs ==========

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(
        String errorCode,
        String message,
        List<String> violations
    ) {}
}
