package com.example.transcribe_backend.controller;

import com.example.transcribe_backend.dto.web.JobSettingsRequest;
import com.example.transcribe_backend.dto.web.JobSettingsResponse;
import com.example.transcribe_backend.service.JobSettingsService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/job-settings")
public class JobSettingsController {
    private final JobSettingsService settingsService;

    public JobSettingsController(JobSettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public JobSettingsResponse create(@Valid @RequestBody JobSettingsRequest request) {
        return settingsService.create(request);
    }

    @GetMapping("/{id}")
    public JobSettingsResponse get(@PathVariable long id) {
        return settingsService.get(id);
    }

    @PostMapping("/{id}/finalize")
    public JobSettingsResponse finalizeSettings(@PathVariable long id) {
        return settingsService.finalizeSettings(id);
    }
}
