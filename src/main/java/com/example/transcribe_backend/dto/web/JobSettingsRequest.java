package com.example.transcribe_backend.dto.web;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record JobSettingsRequest(
        @NotNull Long ownerId,
        @Size(max = 32) String model,
        @Size(max = 8) String language,
        String task,
        Boolean alignment,
        Boolean diarization,
        @Min(1) Integer minSpeakers,
        @Min(1) Integer maxSpeakers,
        Map<String, Object> asrSettings,
        Boolean emailNotification,
        Boolean finalized
) {
    @JsonIgnore
    @AssertTrue(message = "task must be transcribe or translate")
    public boolean isTaskSupported() {
        return task == null || task.equals("transcribe") || task.equals("translate");
    }

    @JsonIgnore
    @AssertTrue(message = "minSpeakers must not exceed maxSpeakers")
    public boolean isSpeakerRangeValid() {
        return minSpeakers == null || maxSpeakers == null || minSpeakers <= maxSpeakers;
    }
}
