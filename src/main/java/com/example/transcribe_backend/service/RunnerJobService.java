package com.example.transcribe_backend.service;

import com.example.transcribe_backend.dto.web.JobInfoResponse;
import com.example.transcribe_backend.dto.web.JobSettingsResponse;
import com.example.transcribe_backend.dto.web.RunnerResultRequest;
import com.example.transcribe_backend.dto.web.RunnerResultResponse;
import com.example.transcribe_backend.exception.CoordinationStoreUnavailableException;
import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.repository.JobRepository;
import com.example.transcribe_backend.service.Interfaces.BlobStore;
import com.example.transcribe_backend.service.JobTransitionService.TransitionInput;
import com.example.transcribe_backend.service.JobTransitionService.TransitionResult;
import com.example.transcribe_backend.statemachine.JobTrigger;
import com.example.transcribe_backend.util.JobState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;
import java.util.Objects;
import java.util.UUID;

/**
 * Runner-facing job operations outside the heartbeat: reading job info, fetching audio and
 * reporting the result.
 */
@Service
public class RunnerJobService {
    private static final Logger LOGGER = LoggerFactory.getLogger(RunnerJobService.class);

    private final JobRepository jobRepository;
    private final JobSettingsService settingsService;
    private final JobTransitionService transitions;
    private final RunnerLivenessTracker tracker;
    private final BlobStore blobStore;
    private final ObjectMapper mapper;

    public RunnerJobService(JobRepository jobRepository,
                            JobSettingsService settingsService,
                            JobTransitionService transitions,
                            RunnerLivenessTracker tracker,
                            BlobStore blobStore,
                            ObjectMapper mapper) {
        this.jobRepository = jobRepository;
        this.settingsService = settingsService;
        this.transitions = transitions;
        this.tracker = tracker;
        this.blobStore = blobStore;
        this.mapper = mapper;
    }

    public JobInfoResponse jobInfo(long runnerId) {
        Job job = jobRepository.findByAssignedRunnerId(runnerId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "NO_JOB_ASSIGNED"));
        if (job.getState() == JobState.ABORTING) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "JOB_ABORTED");
        }
        return new JobInfoResponse(job.getId(), job.getFileName(),
                JobSettingsResponse.from(settingsService.load(job.getSettingsId())));
    }

    /**
     * Resolves the audio of a held job. Fetching counts as the runner's acknowledgement of the
     * assignment.
     */
    public Path openAudio(long runnerId, long jobId) {
        Job job = loadHeld(runnerId, jobId);
        if (job.getState() == JobState.ABORTING) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "JOB_ABORTED");
        }
        Path audio = blobStore.resolveAudio(job.getAudioKey());
        TransitionResult result = transitions.apply(jobId, JobTrigger.ARTIFACT_FETCHED, TransitionInput.runner(runnerId));
        if (!result.accepted()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "NOT_ASSIGNED_RUNNER");
        }
        LOGGER.debug("Audio fetched jobId={} runnerId={}", jobId, runnerId);
        return audio;
    }

    /**
     * Records the final report of a held job. A report for a job in {@code aborting} completes the
     * abort instead.
     */
    public RunnerResultResponse submitResult(long runnerId, long jobId, RunnerResultRequest request) {
        if (request == null || (!request.isFailure() && request.transcript() == null)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "RESULT_EMPTY");
        }
        loadHeld(runnerId, jobId);
        TransitionInput input = attribution(runnerId);

        TransitionResult result;
        if (request.isFailure()) {
            result = transitions.apply(jobId, JobTrigger.FAILED, input.withError(request.errorMessage()));
        } else {
            // one blob per report; the cleanup below only ever removes this report's file
            String transcriptKey = jobId + "-" + UUID.randomUUID() + ".json";
            try {
                blobStore.writeTranscript(transcriptKey, mapper.writeValueAsBytes(request.transcript()));
            } catch (JsonProcessingException e) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "TRANSCRIPT_INVALID", e);
            }
            result = transitions.apply(jobId, JobTrigger.SUCCEEDED, input.withTranscript(transcriptKey));
            if (!result.applied() || result.job().getState() != JobState.SUCCESS) {
                blobStore.deleteTranscript(transcriptKey);
            }
        }
        if (!result.applied()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "NOT_ASSIGNED_RUNNER");
        }
        LOGGER.info("Job finished jobId={} runnerId={} state={}", jobId, runnerId, result.job().getState());
        return new RunnerResultResponse(jobId, result.job().getState().wireName());
    }

    private Job loadHeld(long runnerId, long jobId) {
        Job job = jobRepository.findById(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
        if (!Objects.equals(job.getAssignedRunnerId(), runnerId)) {
            LOGGER.warn("Stale runner request jobId={} runnerId={} holder={}", jobId, runnerId, job.getAssignedRunnerId());
            throw new ResponseStatusException(HttpStatus.CONFLICT, "NOT_ASSIGNED_RUNNER");
        }
        return job;
    }

    private TransitionInput attribution(long runnerId) {
        TransitionInput input = TransitionInput.runner(runnerId);
        try {
            return tracker.find(runnerId)
                    .map(r -> input.withAttribution(
                            clip(r.name(), Job.RUNNER_NAME_LENGTH),
                            clip(r.version(), Job.RUNNER_VERSION_LENGTH),
                            clip(r.gitHash(), Job.RUNNER_GIT_HASH_LENGTH)))
                    .orElse(input);
        } catch (CoordinationStoreUnavailableException e) {
            LOGGER.warn("Runner attribution unavailable runnerId={}: {}", runnerId, e.getMessage());
            return input;
        }
    }

    /** Cuts a value to its column length. */
    private static String clip(String value, int maxLength) {
        return value == null || value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
