package com.example.transcribe_backend.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

public record RunnerRegisterRequest(
        @NotBlank @Size(max = 40) String name,
        @Size(max = 64) String version,
        @Size(max = 40) String gitHash,
        String sourceCodeUrl,
        List<String> capabilities
) {
}
