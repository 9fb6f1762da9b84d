package com.fanhub.subscription.api.exception;

import com.fanhub.subscription.api.dto.ErrorResponse;
import com.fanhub.subscription.exception.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for the subscription API.
 * Converts domain and infrastructure exceptions into {@link ErrorResponse} bodies.
 *
 * @author FanHub Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * 404 when the player or team does not exist.
     */
    @ExceptionHandler(TargetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleTargetNotFoundException(
            TargetNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Target not found: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.NOT_FOUND, "Target Not Found", ex.getMessage(), request.getRequestURI())
                .addDetail("kind", ex.getKind().getPathSegment())
                .addDetail("targetId", ex.getTargetId());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * 404 when unsubscribing without an active subscription.
     */
    @ExceptionHandler(SubscriptionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSubscriptionNotFoundException(
            SubscriptionNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Subscription not found: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.NOT_FOUND, "Subscription Not Found", ex.getMessage(), request.getRequestURI())
                .addDetail("kind", ex.getKind().getPathSegment())
                .addDetail("targetId", ex.getTargetId());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * 400 when resubscribing inside the cooldown window.
     * Retry-After carries the remaining wait in seconds.
     */
    @ExceptionHandler(ResubscribeTooSoonException.class)
    public ResponseEntity<ErrorResponse> handleResubscribeTooSoonException(
            ResubscribeTooSoonException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resubscribe too soon: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Resubscribe Too Soon", ex.getMessage(), request.getRequestURI())
                .addDetail("kind", ex.getKind().getPathSegment())
                .addDetail("targetId", ex.getTargetId())
                .addDetail("retryAfterSeconds", ex.getRemainingSeconds())
                .addDetail("availableAt", ex.getAvailableAt());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRemainingSeconds()))
                .body(error);
    }

    /**
     * 409 when a single-active kind already has another active target for the user.
     */
    @ExceptionHandler(ActiveSubscriptionConflictException.class)
    public ResponseEntity<ErrorResponse> handleActiveSubscriptionConflictException(
            ActiveSubscriptionConflictException ex,
            HttpServletRequest request
    ) {
        logger.warn("Active subscription conflict: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.CONFLICT, "Active Subscription Exists", ex.getMessage(), request.getRequestURI())
                .addDetail("kind", ex.getKind().getPathSegment())
                .addDetail("activeTargetId", ex.getActiveTargetId());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * 503 when the database or lock service fails. The operation is safe to retry.
     */
    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorageException(
            StorageException ex,
            HttpServletRequest request
    ) {
        logger.error("Storage failure during {}", ex.getOperation(), ex);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Storage Unavailable",
                "Subscription storage is temporarily unavailable. Please retry.",
                request.getRequestURI()
        ).addDetail("operation", ex.getOperation());

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    /**
     * 503 when a read-only transaction cannot be opened or committed.
     */
    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<ErrorResponse> handleDataAccessException(
            RuntimeException ex,
            HttpServletRequest request
    ) {
        logger.error("Database failure on {}", request.getRequestURI(), ex);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Storage Unavailable",
                "Subscription storage is temporarily unavailable. Please retry.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    /**
     * 403 when the caller lacks the required role or identity.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Access denied on {}: {}", request.getRequestURI(), ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.FORBIDDEN, "Access Denied", ex.getMessage(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalStateException(
            IllegalStateException ex,
            HttpServletRequest request
    ) {
        logger.warn("Illegal state: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * 400 for an unknown kind path segment or a blank id.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request
    ) {
        logger.warn("Illegal argument: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * 400 for path variables failing their constraints (e.g. an over-long target id).
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolationException(
            ConstraintViolationException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} constraint violations", ex.getConstraintViolations().size());

        Map<String, String> violations = new LinkedHashMap<>();
        for (ConstraintViolation<?> violation : ex.getConstraintViolations()) {
            violations.put(violation.getPropertyPath().toString(), violation.getMessage());
        }

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST,
                "Validation Failed",
                "Request validation failed. Please check the path parameters.",
                request.getRequestURI()
        ).addDetail("violations", violations);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidationException(
            HandlerMethodValidationException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} parameter errors", ex.getAllValidationResults().size());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST,
                "Validation Failed",
                "Request validation failed. Please check the path parameters.",
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupportedException(
            HttpRequestMethodNotSupportedException ex,
            HttpServletRequest request
    ) {
        ErrorResponse error = ErrorResponse.of(HttpStatus.METHOD_NOT_ALLOWED, "Method Not Allowed", ex.getMessage(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(error);
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR without internal details.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred. Please try again later.",
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
