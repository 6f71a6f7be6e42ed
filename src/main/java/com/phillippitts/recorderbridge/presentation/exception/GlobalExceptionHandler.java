package com.phillippitts.recorderbridge.presentation.exception;

import com.phillippitts.recorderbridge.exception.RecorderException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the REST boundary.
 *
 * Converts recorder failures into typed JSON errors whose {@code errorCode} is the error kind.
 * The dispatcher has already logged the failure, so only the mapping is logged here.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(RecorderException.class)
    ResponseEntity<ApiError> handleRecorderFailure(RecorderException ex) {
        HttpStatus status = statusFor(ex);
        LOG.debug("Recorder failure mapped to {}: kind={}", status.value(), ex.getKind());
        return ResponseEntity
            .status(status)
            .body(new ApiError(
                ex.getKind().name(),
                ex.getMessage(),
                ex.getDetail(),
                Instant.now()
            ));
    }

    /**
     * Client error - malformed request body (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidRequest(MethodArgumentNotValidException ex) {
        LOG.warn("Invalid request: {} field error(s)", ex.getErrorCount());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "InvalidRequest",
                "Request validation failed",
                ex.getBindingResult().getFieldErrors().stream()
                    .map(e -> e.getField() + " " + e.getDefaultMessage())
                    .findFirst()
                    .orElse(null),
                Instant.now()
            ));
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
                "Please contact support",
                Instant.now()
            ));
    }

    private static HttpStatus statusFor(RecorderException ex) {
        return switch (ex.getKind()) {
            case AUDIO_ERROR -> HttpStatus.UNPROCESSABLE_ENTITY;
            case NO_ACTIVE_RECORDING -> HttpStatus.CONFLICT;
            case SEND_ERROR, RECEIVE_ERROR, THREAD_NOT_INITIALIZED -> HttpStatus.SERVICE_UNAVAILABLE;
            case LOCK_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
