package com.example.transcribe_backend.service;

import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.repository.JobSettingsRepository;
import com.example.transcribe_backend.service.Interfaces.RunnerCapabilityMatcher;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Matches on the model name of the job settings. A runner that declares no capabilities accepts
 * every model; {@code *} does the same explicitly.
 */
@Component
public class ModelCapabilityMatcher implements RunnerCapabilityMatcher {
    private final JobSettingsRepository settingsRepository;

    public ModelCapabilityMatcher(JobSettingsRepository settingsRepository) {
        this.settingsRepository = settingsRepository;
    }

    @Override
    public boolean canRun(RunnerLiveness runner, Job job) {
        var caps = runner.capabilities();
        if (caps.isEmpty() || caps.contains("*")) {
            return true;
        }
        return settingsRepository.findById(job.getSettingsId())
                .map(s -> s.getModel().toLowerCase(Locale.ROOT))
                .map(model -> caps.stream().anyMatch(c -> c.toLowerCase(Locale.ROOT).equals(model)))
                .orElse(false);
    }
}
