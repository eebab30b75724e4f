package com.example.transcribe_backend.service;

import com.example.transcribe_backend.api.dto.PageResponse;
import com.example.transcribe_backend.dto.web.AbortResponse;
import com.example.transcribe_backend.dto.web.JobResponse;
import com.example.transcribe_backend.dto.web.TranscriptPayload;
import com.example.transcribe_backend.events.JobEventBus;
import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.model.JobSettings;
import com.example.transcribe_backend.repository.JobRepository;
import com.example.transcribe_backend.service.Interfaces.BlobStore;
import com.example.transcribe_backend.service.JobTransitionService.TransitionInput;
import com.example.transcribe_backend.service.JobTransitionService.TransitionResult;
import com.example.transcribe_backend.statemachine.JobTrigger;
import com.example.transcribe_backend.util.AbortOutcome;
import com.example.transcribe_backend.util.JobEventKind;
import com.example.transcribe_backend.util.JobState;
import com.example.transcribe_backend.util.TranscriptFormat;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Client-facing job operations: submit, read, abort, download and delete.
 */
@Service
public class JobService {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobService.class);
    private static final int MAX_PAGE_SIZE = 100;

    private final JobRepository jobRepository;
    private final JobSettingsService settingsService;
    private final JobTransitionService transitions;
    private final JobEventBus eventBus;
    private final BlobStore blobStore;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JobService(JobRepository jobRepository,
                      JobSettingsService settingsService,
                      JobTransitionService transitions,
                      JobEventBus eventBus,
                      BlobStore blobStore,
                      ObjectMapper mapper,
                      Clock clock) {
        this.jobRepository = jobRepository;
        this.settingsService = settingsService;
        this.transitions = transitions;
        this.eventBus = eventBus;
        this.blobStore = blobStore;
        this.mapper = mapper;
        this.clock = clock;
    }

    public JobResponse submit(long ownerId, long settingsId, MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "FILE_REQUIRED");
        }
        try (InputStream in = file.getInputStream()) {
            return JobResponse.from(submit(ownerId, settingsId, file.getOriginalFilename(), in));
        } catch (IOException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "UPLOAD_UNREADABLE", e);
        }
    }

    /**
     * Stores the audio and creates the job row. Jobs whose settings are not finalized wait in
     * {@code not_queued}.
     */
    public Job submit(long ownerId, long settingsId, String fileName, InputStream audio) {
        JobSettings settings = settingsService.load(settingsId);
        if (!Objects.equals(settings.getOwnerId(), ownerId)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "NOT_SETTINGS_OWNER");
        }
        String audioKey = ownerId + "/" + UUID.randomUUID() + extension(fileName);
        blobStore.writeAudio(audioKey, audio);

        Job job = new Job(ownerId, settingsId, settings.isFinalized() ? JobState.PENDING_RUNNER : JobState.NOT_QUEUED);
        job.setFileName(fileName);
        job.setAudioKey(audioKey);
        job.setUpdatedAt(clock.instant());
        try {
            job = jobRepository.save(job);
        } catch (RuntimeException e) {
            blobStore.deleteAudio(audioKey);
            throw e;
        }
        LOGGER.info("Job submitted jobId={} owner={} state={} file={}", job.getId(), ownerId, job.getState(), fileName);
        eventBus.publish(ownerId, job.getId(), JobEventKind.JOB_CREATED);
        return job;
    }

    public PageResponse<JobResponse> list(long ownerId, int page, int size) {
        int safeSize = Math.min(Math.max(1, size), MAX_PAGE_SIZE);
        Page<Job> result = jobRepository.findByOwnerIdOrderByCreatedAtDescIdDesc(ownerId, PageRequest.of(Math.max(0, page), safeSize));
        return PageResponse.from(result, JobResponse::from);
    }

    public JobResponse get(long ownerId, long jobId) {
        return JobResponse.from(loadOwned(ownerId, jobId));
    }

    /**
     * Requests an abort. Idempotent: repeating it reports the same outcome and leaves the same
     * final state.
     */
    public AbortResponse abort(long ownerId, long jobId) {
        loadOwned(ownerId, jobId);
        TransitionResult result = transitions.apply(jobId, JobTrigger.ABORT_REQUESTED, TransitionInput.none());
        Job job = result.job();
        AbortOutcome outcome = switch (result.outcome()) {
            case APPLIED -> job.getState() == JobState.ABORTING ? AbortOutcome.ABORT_REQUESTED : AbortOutcome.ABORTED;
            case UNCHANGED -> AbortOutcome.ABORT_REQUESTED;
            case REJECTED, CONFLICT -> AbortOutcome.ALREADY_FINISHED;
        };
        LOGGER.info("Abort jobId={} owner={} outcome={} state={}", jobId, ownerId, outcome, job.getState());
        return new AbortResponse(jobId, outcome, job.getState().wireName());
    }

    /**
     * Returns the transcript rendition and marks the job downloaded.
     */
    public TranscriptDownload downloadTranscript(long ownerId, long jobId, TranscriptFormat format) {
        Job job = loadOwned(ownerId, jobId);
        if ((job.getState() != JobState.SUCCESS && job.getState() != JobState.DOWNLOADED) || job.getTranscriptKey() == null) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "TRANSCRIPT_NOT_READY");
        }
        TranscriptPayload payload = readTranscript(job.getTranscriptKey());
        String body;
        if (format == TranscriptFormat.AS_JSON) {
            try {
                body = mapper.writeValueAsString(payload.asJson());
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Serialize transcript failed", e);
            }
        } else {
            body = payload.text(format);
        }
        if (body == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "TRANSCRIPT_FORMAT_MISSING");
        }
        transitions.apply(jobId, JobTrigger.DOWNLOADED, TransitionInput.none());
        String fileName = baseName(job.getFileName()) + "." + format.name().substring(3).toLowerCase(Locale.ROOT);
        return new TranscriptDownload(body, format.contentType(), fileName);
    }

    /**
     * Deletes a finished job together with its blobs.
     */
    public void delete(long ownerId, long jobId) {
        Job job = loadOwned(ownerId, jobId);
        if (!job.getState().isTerminal()
                || jobRepository.deleteIfUnchanged(jobId, job.getVersion(), JobState.TERMINAL) == 0) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "JOB_NOT_FINISHED");
        }
        if (job.getAudioKey() != null) {
            blobStore.deleteAudio(job.getAudioKey());
        }
        if (job.getTranscriptKey() != null) {
            blobStore.deleteTranscript(job.getTranscriptKey());
        }
        LOGGER.info("Job deleted jobId={} owner={}", jobId, ownerId);
        eventBus.publish(ownerId, jobId, JobEventKind.JOB_DELETED);
    }

    private Job loadOwned(long ownerId, long jobId) {
        Job job = jobRepository.findById(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
        if (!Objects.equals(job.getOwnerId(), ownerId)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "NOT_JOB_OWNER");
        }
        return job;
    }

    private TranscriptPayload readTranscript(String key) {
        try {
            return mapper.readValue(new String(blobStore.readTranscript(key), StandardCharsets.UTF_8), TranscriptPayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt transcript key=" + key, e);
        }
    }

    private static String extension(String fileName) {
        if (fileName == null) return "";
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) return "";
        String ext = fileName.substring(dot).toLowerCase(Locale.ROOT);
        return ext.matches("\\.[a-z0-9]{1,8}") ? ext : "";
    }

    private static String baseName(String fileName) {
        if (fileName == null || fileName.isBlank()) return "transcript";
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    public record TranscriptDownload(String body, String contentType, String fileName) {}
}
