package com.phillippitts.draco.presentation.exception;

import com.phillippitts.draco.exception.ComponentLoadException;
import com.phillippitts.draco.exception.ComponentLoadTimeoutException;
import com.phillippitts.draco.exception.UnknownComponentException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
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
     * Client error - component name not registered (HTTP 404).
     */
    @ExceptionHandler(UnknownComponentException.class)
    ResponseEntity<ApiError> handleUnknownComponent(UnknownComponentException ex) {
        LOG.warn("Unknown component requested: {}", ex.getComponentName());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Component not registered",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Transient error - another caller's load is still running (HTTP 503).
     */
    @ExceptionHandler(ComponentLoadTimeoutException.class)
    ResponseEntity<ApiError> handleLoadTimeout(ComponentLoadTimeoutException ex) {
        LOG.warn("Load wait timed out: component={}, waitedMs={}", ex.getComponentName(), ex.getWaitedMillis());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Component is still loading",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Load failure - retry possible, the next request reloads (HTTP 503).
     */
    @ExceptionHandler(ComponentLoadException.class)
    ResponseEntity<ApiError> handleLoadFailure(ComponentLoadException ex) {
        LOG.error("Component load failed: component={}", ex.getComponentName(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Component temporarily unavailable",
                "Load failed; it will be retried on the next request",
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
