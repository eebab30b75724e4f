package com.example.transcribe_backend.dto.web;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Final report for a job: either an error message or a transcript. An error message wins when
 * both are present.
 */
public record RunnerResultRequest(String errorMessage, TranscriptPayload transcript) {
    @JsonIgnore
    public boolean isFailure() {
        return errorMessage != null && !errorMessage.isBlank();
    }
}
