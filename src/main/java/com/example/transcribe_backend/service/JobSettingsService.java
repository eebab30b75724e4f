package com.example.transcribe_backend.service;

import com.example.transcribe_backend.dto.web.JobSettingsRequest;
import com.example.transcribe_backend.dto.web.JobSettingsResponse;
import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.model.JobSettings;
import com.example.transcribe_backend.repository.JobRepository;
import com.example.transcribe_backend.repository.JobSettingsRepository;
import com.example.transcribe_backend.statemachine.JobTrigger;
import com.example.transcribe_backend.util.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@Service
public class JobSettingsService {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobSettingsService.class);

    private final JobSettingsRepository settingsRepository;
    private final JobRepository jobRepository;
    private final JobTransitionService transitions;

    public JobSettingsService(JobSettingsRepository settingsRepository,
                              JobRepository jobRepository,
                              JobTransitionService transitions) {
        this.settingsRepository = settingsRepository;
        this.jobRepository = jobRepository;
        this.transitions = transitions;
    }

    public JobSettingsResponse create(JobSettingsRequest req) {
        JobSettings s = new JobSettings(req.ownerId());
        if (req.model() != null && !req.model().isBlank()) s.setModel(req.model().trim());
        if (req.language() != null && !req.language().isBlank()) s.setLanguage(req.language().trim());
        if (req.task() != null) s.setTask(req.task());
        if (req.alignment() != null) s.setAlignment(req.alignment());
        if (req.diarization() != null) s.setDiarization(req.diarization());
        if (s.isDiarization()) {
            s.setMinSpeakers(req.minSpeakers());
            s.setMaxSpeakers(req.maxSpeakers());
        }
        s.setAsrSettings(req.asrSettings());
        if (req.emailNotification() != null) s.setEmailNotification(req.emailNotification());
        if (req.finalized() != null) s.setFinalized(req.finalized());
        JobSettings saved = settingsRepository.save(s);
        LOGGER.debug("Job settings created id={} owner={} model={} finalized={}",
                saved.getId(), saved.getOwnerId(), saved.getModel(), saved.isFinalized());
        return JobSettingsResponse.from(saved);
    }

    public JobSettingsResponse get(long id) {
        return JobSettingsResponse.from(load(id));
    }

    /**
     * Freezes the settings and queues every job that was waiting for them. Calling it again only
     * re-queues jobs still left in {@code not_queued}.
     */
    public JobSettingsResponse finalizeSettings(long id) {
        JobSettings s = load(id);
        if (!s.isFinalized()) {
            s.setFinalized(true);
            s = settingsRepository.save(s);
        }
        List<Job> waiting = jobRepository.findBySettingsIdAndState(s.getId(), JobState.NOT_QUEUED);
        for (Job job : waiting) {
            transitions.apply(job.getId(), JobTrigger.SETTINGS_FINALIZED, JobTransitionService.TransitionInput.none());
        }
        if (!waiting.isEmpty()) {
            LOGGER.info("Settings finalized id={} queuedJobs={}", s.getId(), waiting.size());
        }
        return JobSettingsResponse.from(s);
    }

    JobSettings load(long id) {
        return settingsRepository.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "SETTINGS_NOT_FOUND"));
    }
}
