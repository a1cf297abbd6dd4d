package com.example.jobsync.exception;

import com.example.jobsync.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Global exception handler for the admin and webhook APIs.
 * Provides consistent error responses across all endpoints.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        var errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(this::formatFieldError)
                .toList();

        log.warn("Validation failed: {}", errors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.error("Validation failed", errors));
    }

    @ExceptionHandler(JobValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleJobValidation(JobValidationException ex) {
        log.warn("Invalid job: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.error("Validation failed", List.of(ex.getMessage())));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.error("Malformed request body"));
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(JobNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(DuplicateJobException.class)
    public ResponseEntity<ApiResponse<Void>> handleDuplicate(DuplicateJobException ex) {
        log.warn("Duplicate: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.error(ex.getMessage()));
    }

    @ExceptionHandler({DataIntegrityViolationException.class, ObjectOptimisticLockingFailureException.class})
    public ResponseEntity<ApiResponse<Void>> handleConflict(RuntimeException ex) {
        log.warn("Concurrent modification: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.error("The job was modified concurrently, please retry"));
    }

    @ExceptionHandler(SchedulerRejectedException.class)
    public ResponseEntity<ApiResponse<Void>> handleSchedulerRejected(SchedulerRejectedException ex) {
        log.error("Scheduler rejected request with HTTP {}: {}", ex.getStatusCode(), ex.getResponseBody());

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ApiResponse.error("Scheduler answered HTTP " + ex.getStatusCode(), List.of(ex.getResponseBody())));
    }

    @ExceptionHandler(SchedulerResponseException.class)
    public ResponseEntity<ApiResponse<Void>> handleSchedulerResponse(SchedulerResponseException ex) {
        log.error("Unusable scheduler response: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ApiResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(SchedulerUnreachableException.class)
    public ResponseEntity<ApiResponse<Void>> handleSchedulerUnreachable(SchedulerUnreachableException ex) {
        log.error("Scheduler unreachable: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(WebhookRejectedException.class)
    public ResponseEntity<Void> handleWebhookRejected(WebhookRejectedException ex) {
        log.debug("Webhook rejected with {}: {}", ex.getStatus().value(), ex.getMessage());

        return ResponseEntity.status(ex.getStatus()).build();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            log.debug("Request failed: {}", ex.getMessage());
            return ResponseEntity.status(errorResponse.getStatusCode()).body(ApiResponse.error(ex.getMessage()));
        }

        log.error("Unexpected error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("An unexpected error occurred. Please try again later."));
    }

    private String formatFieldError(FieldError error) {
        return String.format("%s: %s", error.getField(), error.getDefaultMessage());
    }
}
