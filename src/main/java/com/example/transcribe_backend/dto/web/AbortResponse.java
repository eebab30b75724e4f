package com.example.transcribe_backend.dto.web;

import com.example.transcribe_backend.util.AbortOutcome;

public record AbortResponse(long jobId, AbortOutcome outcome, String state) {
}
