package com.phillippitts.callrelay.presentation.exception;

import com.phillippitts.callrelay.exception.CallNotFoundException;
import com.phillippitts.callrelay.exception.CallRelayException;
import com.phillippitts.callrelay.exception.ConnectionNotFoundException;
import com.phillippitts.callrelay.exception.DeliveryFailureException;
import com.phillippitts.callrelay.exception.DuplicateCallException;
import com.phillippitts.callrelay.exception.DuplicateConnectionException;
import com.phillippitts.callrelay.exception.ExternalCapabilityException;
import com.phillippitts.callrelay.exception.InvalidTransitionException;
import com.phillippitts.callrelay.exception.MalformedMessageException;
import com.phillippitts.callrelay.exception.UnsupportedMessageTypeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
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

    /**
     * Unknown call or connection (HTTP 404).
     */
    @ExceptionHandler({CallNotFoundException.class, ConnectionNotFoundException.class})
    ResponseEntity<ApiError> handleNotFound(CallRelayException ex) {
        LOG.info("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex, "Resource not found", ex.getMessage());
    }

    /**
     * Request conflicts with current state (HTTP 409).
     */
    @ExceptionHandler({DuplicateCallException.class, DuplicateConnectionException.class,
            InvalidTransitionException.class})
    ResponseEntity<ApiError> handleConflict(CallRelayException ex) {
        LOG.warn("Conflict: [{}] {}", ex.getErrorCode(), ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex, "Request conflicts with call state", ex.getMessage());
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler({MalformedMessageException.class, UnsupportedMessageTypeException.class})
    ResponseEntity<ApiError> handleMalformed(CallRelayException ex) {
        LOG.warn("Malformed request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex, "Invalid request", ex.getMessage());
    }

    /**
     * Request body failed bean validation or could not be read (HTTP 400).
     */
    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleInvalidBody(Exception ex) {
        LOG.warn("Invalid request body: {}", ex.getClass().getSimpleName());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                MalformedMessageException.CODE,
                "Invalid request",
                "Request body is missing required fields or is not valid JSON",
                Instant.now()
            ));
    }

    /**
     * Device unreachable - retry possible once it reconnects (HTTP 503).
     */
    @ExceptionHandler(DeliveryFailureException.class)
    ResponseEntity<ApiError> handleDeliveryFailure(DeliveryFailureException ex) {
        LOG.warn("Delivery failed: connection={}", ex.getConnectionId());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex, "Device unavailable",
                "The device handling this call is not connected. Retry once it reconnects.");
    }

    /**
     * Transient external failure (HTTP 503).
     */
    @ExceptionHandler(ExternalCapabilityException.class)
    ResponseEntity<ApiError> handleCapabilityFailure(ExternalCapabilityException ex) {
        LOG.error("Capability failed: capability={}, timedOut={}", ex.getCapability(), ex.isTimedOut(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex, "Assistant service temporarily unavailable",
                "Please retry in a few seconds");
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
                "INTERNAL_ERROR",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, CallRelayException ex,
                                                    String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getErrorCode(), message, details, Instant.now()));
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
