package com.example.transcribe_backend.exception;

/**
 * The shared coordination store could not be reached. Callers fail closed: no assignment is
 * made and the runner retries on its next heartbeat.
 */
public class CoordinationStoreUnavailableException extends RuntimeException {
    public CoordinationStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
