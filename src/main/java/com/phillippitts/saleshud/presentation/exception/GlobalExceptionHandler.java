package com.phillippitts.saleshud.presentation.exception;

import com.phillippitts.saleshud.exception.CircuitOpenException;
import com.phillippitts.saleshud.exception.ErrorKind;
import com.phillippitts.saleshud.exception.IllegalMeetingStateException;
import com.phillippitts.saleshud.exception.MeetingNotFoundException;
import com.phillippitts.saleshud.exception.MeetingStartException;
import com.phillippitts.saleshud.exception.ServiceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MeetingNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(MeetingNotFoundException ex) {
        LOG.warn("Meeting not found: {}", ex.getMeetingId());
        return respond(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(), "Meeting not found",
                "No active or recently ended meeting with id " + ex.getMeetingId());
    }

    /**
     * Lifecycle call not valid in the meeting's current state (HTTP 409).
     */
    @ExceptionHandler(IllegalMeetingStateException.class)
    ResponseEntity<ApiError> handleIllegalState(IllegalMeetingStateException ex) {
        LOG.warn("Rejected lifecycle call: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getClass().getSimpleName(), "Operation not allowed",
                ex.getMessage());
    }

    /**
     * Start failed; already rolled back. Authentication and quota problems are upstream faults (502),
     * everything else is treated as transient (503).
     */
    @ExceptionHandler(MeetingStartException.class)
    ResponseEntity<ApiError> handleStartFailure(MeetingStartException ex) {
        LOG.error("Meeting start failed: kind={}", ex.getKind());
        return respond(statusFor(ex.getKind()), ex.getKind().name(), "Meeting could not be started",
                ex.getMessage());
    }

    /**
     * Dependency circuit open: retry after the open period (HTTP 503).
     */
    @ExceptionHandler(CircuitOpenException.class)
    ResponseEntity<ApiError> handleCircuitOpen(CircuitOpenException ex) {
        LOG.warn("Circuit open: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Service temporarily unavailable", "Retry after " + ex.getRetryAt());
    }

    @ExceptionHandler(ServiceException.class)
    ResponseEntity<ApiError> handleServiceFailure(ServiceException ex) {
        LOG.error("Dependency call failed: kind={}", ex.getKind(), ex);
        return respond(statusFor(ex.getKind()), ex.getKind().name(), "Dependency call failed",
                ex.isRetryable() ? "Please retry in a few seconds" : "Contact administrator");
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Invalid request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "InvalidRequest", "Invalid request", ex.getMessage());
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", "An unexpected error occurred",
                "Please contact support with request ID");
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case AUTH_FAILED, QUOTA_EXCEEDED -> HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
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
