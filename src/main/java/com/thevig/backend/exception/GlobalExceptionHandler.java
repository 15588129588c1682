package com.thevig.backend.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String MESSAGE_KEY = "message";

    @ExceptionHandler(DraftException.class)
    public ResponseEntity<Map<String, Object>> handleDraftException(DraftException ex) {
        Map<String, Object> response = createErrorResponse(
                "Draft operation rejected",
                ex.getStatus().value(),
                Map.of(MESSAGE_KEY, ex.getMessage()));
        response.put("code", ex.getCode());
        response.put("retryable", ex.isRetryable());

        log.warn("⚠️ [Draft] {} - {}", ex.getCode(), ex.getMessage());
        return ResponseEntity.status(ex.getStatus()).body(response);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<Map<String, Object>> handleOptimisticLock(ObjectOptimisticLockingFailureException ex) {
        Map<String, Object> response = createErrorResponse(
                "Concurrent update",
                HttpStatus.CONFLICT.value(),
                Map.of(MESSAGE_KEY, "The record was changed by another request"));
        response.put("code", "CONCURRENCY_CONFLICT");
        response.put("retryable", true);

        log.warn("⚠️ [Draft] Optimistic lock failure: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(
            MethodArgumentNotValidException ex) {

        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach((FieldError error) -> errors.put(error.getField(), error.getDefaultMessage()));

        Map<String, Object> response = createErrorResponse(
                "Validation error",
                HttpStatus.BAD_REQUEST.value(),
                errors);

        log.warn("Validation error: {}", errors);
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolationException(
            ConstraintViolationException ex) {

        Map<String, String> errors = new HashMap<>();
        for (ConstraintViolation<?> violation : ex.getConstraintViolations()) {
            errors.put(violation.getPropertyPath().toString(), violation.getMessage());
        }

        Map<String, Object> response = createErrorResponse(
                "Parameter validation error",
                HttpStatus.BAD_REQUEST.value(),
                errors);

        log.warn("Constraint violation: {}", errors);
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler({ MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class })
    public ResponseEntity<Map<String, Object>> handleBadParameter(Exception ex) {
        Map<String, Object> response = createErrorResponse(
                "Invalid parameter",
                HttpStatus.BAD_REQUEST.value(),
                Map.of(MESSAGE_KEY, ex.getMessage()));

        log.warn("Invalid parameter: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(
            IllegalArgumentException ex) {

        Map<String, Object> response = createErrorResponse(
                "Invalid argument",
                HttpStatus.BAD_REQUEST.value(),
                Map.of(MESSAGE_KEY, String.valueOf(ex.getMessage())));

        log.warn("Invalid argument: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatusException(ResponseStatusException ex) {
        Map<String, Object> response = createErrorResponse(
                "Request rejected",
                ex.getStatusCode().value(),
                Map.of(MESSAGE_KEY, String.valueOf(ex.getReason())));

        log.warn("Request rejected ({}): {}", ex.getStatusCode().value(), ex.getReason());
        return ResponseEntity.status(ex.getStatusCode()).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {

        Map<String, Object> response = createErrorResponse(
                "Internal server error",
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                Map.of(MESSAGE_KEY, "An unexpected error occurred"));

        log.error("❌ Unhandled error", ex);
        return ResponseEntity.internalServerError().body(response);
    }

    private Map<String, Object> createErrorResponse(String title, int status, Object details) {
        Map<String, Object> response = new HashMap<>();
        response.put("title", title);
        response.put("status", status);
        response.put("timestamp", Instant.now());
        response.put("details", details);
        return response;
    }
}
