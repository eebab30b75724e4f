package com.example.transcribe_backend.dto.web;

public record RunnerResultResponse(long jobId, String state) {
}
