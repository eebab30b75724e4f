package com.example.transcribe_backend.dto.web;

/**
 * What a runner needs to start working on its assigned job.
 */
public record JobInfoResponse(long jobId, String fileName, JobSettingsResponse settings) {
}
