package com.example.transcribe_backend.dto.web;

import com.example.transcribe_backend.model.Job;

import java.time.Instant;

public record JobResponse(
        Long id,
        Long ownerId,
        Long settingsId,
        String fileName,
        String state,
        Double progress,
        String errorMessage,
        String runnerName,
        String runnerVersion,
        String runnerGitHash,
        Instant createdAt,
        Instant finishedAt,
        Instant updatedAt
) {
    public static JobResponse from(Job j) {
        return new JobResponse(j.getId(), j.getOwnerId(), j.getSettingsId(), j.getFileName(),
                j.getState().wireName(), j.getProgress(), j.getErrorMessage(),
                j.getRunnerName(), j.getRunnerVersion(), j.getRunnerGitHash(),
                j.getCreatedAt(), j.getFinishedAt(), j.getUpdatedAt());
    }
}
