package com.example.transcribe_backend.dto.web;

import com.example.transcribe_backend.model.JobSettings;

import java.time.Instant;
import java.util.Map;

public record JobSettingsResponse(
        Long id,
        Long ownerId,
        String model,
        String language,
        String task,
        boolean alignment,
        boolean diarization,
        Integer minSpeakers,
        Integer maxSpeakers,
        Map<String, Object> asrSettings,
        boolean emailNotification,
        boolean finalized,
        Instant createdAt
) {
    public static JobSettingsResponse from(JobSettings s) {
        return new JobSettingsResponse(s.getId(), s.getOwnerId(), s.getModel(), s.getLanguage(), s.getTask(),
                s.isAlignment(), s.isDiarization(), s.getMinSpeakers(), s.getMaxSpeakers(),
                s.getAsrSettings(), s.isEmailNotification(), s.isFinalized(), s.getCreatedAt());
    }
}
