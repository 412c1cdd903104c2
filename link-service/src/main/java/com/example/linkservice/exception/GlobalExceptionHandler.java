package com.example.linkservice.exception;

import com.example.linkservice.dto.ErrorResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * Global exception handler for REST controllers.
 * Converts exceptions to consistent ErrorResponse format.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(CronSecretNotConfiguredException.class)
    public ResponseEntity<ErrorResponse> handleCronSecretNotConfigured(CronSecretNotConfiguredException ex) {
        log.error("Cron sync rejected: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "CRON_SECRET_NOT_CONFIGURED",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedException ex) {
        log.warn("Unauthorized: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.UNAUTHORIZED,
            "UNAUTHORIZED",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(ServiceUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleServiceUnavailable(ServiceUnavailableException ex) {
        log.error("Service unavailable: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.SERVICE_UNAVAILABLE,
            ex.getCode(),
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(SyncFailedException.class)
    public ResponseEntity<ErrorResponse> handleSyncFailed(SyncFailedException ex) {
        log.error("Edge sync failed: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "SYNC_FAILED",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(LinkNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleLinkNotFound(LinkNotFoundException ex) {
        log.warn("Link not found: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.NOT_FOUND,
            "LINK_NOT_FOUND",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(SlugAlreadyExistsException.class)
    public ResponseEntity<ErrorResponse> handleSlugAlreadyExists(SlugAlreadyExistsException ex) {
        log.warn("Slug conflict: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.CONFLICT,
            "SLUG_ALREADY_EXISTS",
            ex.getMessage(),
            "slug"
        );
    }

    @ExceptionHandler(InvalidSlugException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSlug(InvalidSlugException ex) {
        log.warn("Invalid slug: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "INVALID_SLUG",
            ex.getMessage(),
            "slug"
        );
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<ErrorResponse> handleRejectedExecution(RejectedExecutionException ex) {
        log.warn("Edge sync executor overloaded - rejected task");
        return buildErrorResponse(
            HttpStatus.SERVICE_UNAVAILABLE,
            "SERVICE_OVERLOADED",
            "Edge sync is temporarily overloaded. Please retry later.",
            null
        );
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation error: {}", ex.getMessage());

        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
            errors.put(error.getField(), error.getDefaultMessage())
        );

        String firstField = ex.getBindingResult().getFieldErrors().isEmpty()
            ? null
            : ex.getBindingResult().getFieldErrors().get(0).getField();
        String firstMessage = ex.getBindingResult().getFieldErrors().isEmpty()
            ? "Validation failed"
            : ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();

        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "VALIDATION_ERROR",
            firstMessage,
            firstField,
            errors
        );
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex) {
        log.warn("Constraint violation: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "VALIDATION_ERROR",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "INTERNAL_SERVER_ERROR",
            "An unexpected error occurred",
            null
        );
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(
        HttpStatus status,
        String code,
        String message,
        String field
    ) {
        return buildErrorResponse(status, code, message, field, null);
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(
        HttpStatus status,
        String code,
        String message,
        String field,
        Object details
    ) {
        return ResponseEntity.status(status).body(ErrorResponse.of(code, message, field, details));
    }
}
