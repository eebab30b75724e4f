package com.example.transcribe_backend.dto.web;

/**
 * Returned once at creation; the token is not stored and cannot be shown again.
 */
public record RunnerCreatedResponse(long runnerId, String label, String token) {
}
