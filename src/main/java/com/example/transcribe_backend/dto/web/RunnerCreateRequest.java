package com.example.transcribe_backend.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RunnerCreateRequest(@NotBlank @Size(max = 120) String label) {
}
