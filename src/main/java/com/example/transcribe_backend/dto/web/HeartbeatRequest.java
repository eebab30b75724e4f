package com.example.transcribe_backend.dto.web;

import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Periodic runner report. {@code currentJobId} is the job the runner believes it is working on,
 * {@code progress} is in [0, 1] or absent when unknown. Metadata limits match the attribution
 * columns of the job table.
 */
public record HeartbeatRequest(
        Long currentJobId,
        Double progress,
        @Size(max = 40) String name,
        @Size(max = 64) String version,
        @Size(max = 40) String gitHash,
        String sourceCodeUrl,
        List<String> capabilities
) {
}
