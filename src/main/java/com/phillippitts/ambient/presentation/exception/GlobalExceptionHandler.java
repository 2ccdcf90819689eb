package com.phillippitts.ambient.presentation.exception;

import com.phillippitts.ambient.exception.ConfigurationValidationException;
import jakarta.validation.ConstraintViolationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Rejected filter, pattern or quiet-hours registration (HTTP 400).
     */
    @ExceptionHandler(ConfigurationValidationException.class)
    ResponseEntity<ApiError> handleInvalidConfiguration(ConfigurationValidationException ex) {
        LOG.warn("Rejected configuration: field={}, reason={}", ex.getField(), ex.getMessage());
        return badRequest(ex.getClass().getSimpleName(), "Invalid " + ex.getField(), ex.getMessage());
    }

    /**
     * Request body failed bean validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return badRequest("ValidationFailed", "Invalid request body", details);
    }

    /**
     * Query parameter outside its bounds (HTTP 400).
     */
    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class,
            MissingServletRequestParameterException.class})
    ResponseEntity<ApiError> handleInvalidParameter(Exception ex) {
        return badRequest("ValidationFailed", "Invalid request parameter", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        return badRequest("MalformedRequest", "Request body could not be read", "Check the JSON syntax and field types");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> badRequest(String code, String message, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
