package com.example.transcribe_backend.controller;

import com.example.transcribe_backend.exception.CoordinationStoreUnavailableException;
import com.example.transcribe_backend.exception.JobNotFoundException;
import com.example.transcribe_backend.exception.StorageException;
import com.example.transcribe_backend.exception.TransitionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps domain exceptions to responses. Reason codes raised as {@code ResponseStatusException}
 * are left to Spring.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    /**
     * Degraded mode: no assignments while the coordination store is down, callers retry.
     */
    @ExceptionHandler(CoordinationStoreUnavailableException.class)
    ResponseEntity<ApiError> handleStoreUnavailable(CoordinationStoreUnavailableException ex) {
        LOGGER.warn("Coordination store unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "COORDINATION_STORE_UNAVAILABLE", "Please retry on the next heartbeat");
    }

    @ExceptionHandler(TransitionConflictException.class)
    ResponseEntity<ApiError> handleConflict(TransitionConflictException ex) {
        LOGGER.warn("Transition retries exhausted jobId={}", ex.getJobId());
        return error(HttpStatus.CONFLICT, "TRANSITION_CONFLICT", ex.getMessage());
    }

    @ExceptionHandler(JobNotFoundException.class)
    ResponseEntity<ApiError> handleJobNotFound(JobNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(StorageException.class)
    ResponseEntity<ApiError> handleStorage(StorageException ex) {
        LOGGER.error("Blob storage failure", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR", "Storage failure");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ApiError(code, message, Instant.now()));
    }

    record ApiError(String errorCode, String message, Instant timestamp) {}
}
