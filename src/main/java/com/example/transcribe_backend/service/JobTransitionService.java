package com.example.transcribe_backend.service;

import com.example.transcribe_backend.config.DispatchProperties;
import com.example.transcribe_backend.events.JobEventBus;
import com.example.transcribe_backend.exception.JobNotFoundException;
import com.example.transcribe_backend.exception.TransitionConflictException;
import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.repository.JobRepository;
import com.example.transcribe_backend.statemachine.JobStateMachine;
import com.example.transcribe_backend.statemachine.JobTrigger;
import com.example.transcribe_backend.statemachine.Transition;
import com.example.transcribe_backend.util.JobEventKind;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import static com.example.transcribe_backend.statemachine.TransitionEffect.*;

/**
 * Applies state machine transitions to job rows with an optimistic compare-and-set on the
 * version column. Every replica goes through here, so per-job transitions are totally ordered
 * by the store and a lost race is simply re-evaluated against the fresh row.
 */
@Service
public class JobTransitionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobTransitionService.class);

    public enum Outcome {
        /** The row was updated. */
        APPLIED,
        /** The trigger was accepted but changes nothing (idempotent repeat). */
        UNCHANGED,
        /** The state machine does not accept the trigger in the current state. */
        REJECTED,
        /** Somebody else updated the row first. */
        CONFLICT
    }

    private final JobRepository jobRepository;
    private final JobStateMachine stateMachine;
    private final JobEventBus eventBus;
    private final Clock clock;
    private final DispatchProperties properties;

    public JobTransitionService(JobRepository jobRepository,
                                JobStateMachine stateMachine,
                                JobEventBus eventBus,
                                Clock clock,
                                DispatchProperties properties) {
        this.jobRepository = jobRepository;
        this.stateMachine = stateMachine;
        this.eventBus = eventBus;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Reads the job and applies the trigger, re-reading and retrying while the compare-and-set
     * loses. Never returns {@link Outcome#CONFLICT}.
     *
     * @throws JobNotFoundException        if the job does not exist (any more)
     * @throws TransitionConflictException if every attempt lost the race
     */
    public TransitionResult apply(long jobId, JobTrigger trigger, TransitionInput input) {
        int attempts = Math.max(1, properties.getMaxTransitionAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            Job job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            TransitionResult result = applyOnce(job, trigger, input);
            if (result.outcome() != Outcome.CONFLICT) {
                return result;
            }
            LOGGER.debug("Transition conflict jobId={} trigger={} attempt={}", jobId, trigger, attempt);
        }
        throw new TransitionConflictException(jobId, attempts);
    }

    /**
     * Single compare-and-set attempt against the given snapshot. On success the snapshot is
     * updated in place and returned inside the result.
     */
    public TransitionResult applyOnce(Job job, JobTrigger trigger, TransitionInput input) {
        if (trigger.isRunnerReport() && input.runnerId() != null
                && !Objects.equals(input.runnerId(), job.getAssignedRunnerId())) {
            return new TransitionResult(Outcome.REJECTED, job, null);
        }
        Optional<Transition> next = stateMachine.next(job.getState(), job.getAssignedRunnerId(), trigger);
        if (next.isEmpty()) {
            return new TransitionResult(Outcome.REJECTED, job, null);
        }
        Transition transition = next.get();
        if (transition.isNoop()) {
            return new TransitionResult(Outcome.UNCHANGED, job, transition);
        }

        Instant now = clock.instant();
        Long runnerId = job.getAssignedRunnerId();
        Instant assignedAt = job.getAssignedAt();
        Double progress = job.getProgress();
        String errorMessage = job.getErrorMessage();
        String transcriptKey = job.getTranscriptKey();
        String runnerName = job.getRunnerName();
        String runnerVersion = job.getRunnerVersion();
        String runnerGitHash = job.getRunnerGitHash();
        Instant finishedAt = job.getFinishedAt();

        if (transition.has(ASSIGN_RUNNER)) {
            runnerId = Objects.requireNonNull(input.runnerId(), "runnerId");
            assignedAt = now;
        }
        if (transition.has(RELEASE_RUNNER)) {
            runnerId = null;
            assignedAt = null;
        }
        if (transition.has(RESET_PROGRESS)) {
            progress = null;
        }
        if (transition.has(RECORD_PROGRESS)) {
            if (input.progress() == null || input.progress().equals(progress)) {
                return new TransitionResult(Outcome.UNCHANGED, job, transition);
            }
            progress = input.progress();
        }
        if (transition.has(RECORD_TRANSCRIPT)) {
            transcriptKey = input.transcriptKey();
        }
        if (transition.has(RECORD_ERROR)) {
            errorMessage = transition.errorMessage() != null
                    ? transition.errorMessage()
                    : Objects.requireNonNullElse(input.errorMessage(), "unknown error");
        }
        if (transition.has(ATTRIBUTE_RUNNER)) {
            runnerName = input.runnerName();
            runnerVersion = input.runnerVersion();
            runnerGitHash = input.runnerGitHash();
        }
        if (transition.has(MARK_FINISHED)) {
            finishedAt = now;
        }

        int updated;
        try {
            updated = jobRepository.compareAndSet(job.getId(), job.getVersion(), transition.to(),
                    runnerId, assignedAt, progress, errorMessage, transcriptKey,
                    runnerName, runnerVersion, runnerGitHash, finishedAt, now);
        } catch (ConcurrencyFailureException e) {
            // row lock contention reported by the database instead of a stale version
            LOGGER.debug("Concurrent update jobId={} trigger={}: {}", job.getId(), trigger, e.getMessage());
            updated = 0;
        }
        if (updated == 0) {
            return new TransitionResult(Outcome.CONFLICT, job, transition);
        }

        job.setState(transition.to());
        job.setAssignedRunnerId(runnerId);
        job.setAssignedAt(assignedAt);
        job.setProgress(progress);
        job.setErrorMessage(errorMessage);
        job.setTranscriptKey(transcriptKey);
        job.setRunnerName(runnerName);
        job.setRunnerVersion(runnerVersion);
        job.setRunnerGitHash(runnerGitHash);
        job.setFinishedAt(finishedAt);
        job.setUpdatedAt(now);
        job.setVersion(job.getVersion() + 1);

        if (transition.from() != transition.to()) {
            LOGGER.info("Job transition jobId={} {} -> {} trigger={} runner={}",
                    job.getId(), transition.from(), transition.to(), trigger, runnerId != null ? runnerId : input.runnerId());
        } else {
            LOGGER.debug("Job update jobId={} state={} trigger={} progress={}", job.getId(), transition.to(), trigger, progress);
        }
        eventBus.publish(job.getOwnerId(), job.getId(), JobEventKind.JOB_UPDATED);
        return new TransitionResult(Outcome.APPLIED, job, transition);
    }

    /**
     * @param outcome    what happened
     * @param job        the job snapshot; reflects the new row when {@code outcome} is APPLIED
     * @param transition the evaluated transition, {@code null} when rejected
     */
    public record TransitionResult(Outcome outcome, Job job, @Nullable Transition transition) {
        public boolean applied() {
            return outcome == Outcome.APPLIED;
        }

        public boolean accepted() {
            return outcome == Outcome.APPLIED || outcome == Outcome.UNCHANGED;
        }
    }

    /**
     * Values a trigger may carry.
     *
     * @param runnerId acting runner; for runner reports it must match the holder of the job
     */
    public record TransitionInput(@Nullable Long runnerId,
                                  @Nullable Double progress,
                                  @Nullable String errorMessage,
                                  @Nullable String transcriptKey,
                                  @Nullable String runnerName,
                                  @Nullable String runnerVersion,
                                  @Nullable String runnerGitHash) {

        public static TransitionInput none() {
            return new TransitionInput(null, null, null, null, null, null, null);
        }

        public static TransitionInput runner(long runnerId) {
            return new TransitionInput(runnerId, null, null, null, null, null, null);
        }

        public TransitionInput withProgress(@Nullable Double value) {
            return new TransitionInput(runnerId, value, errorMessage, transcriptKey, runnerName, runnerVersion, runnerGitHash);
        }

        public TransitionInput withError(String message) {
            return new TransitionInput(runnerId, progress, message, transcriptKey, runnerName, runnerVersion, runnerGitHash);
        }

        public TransitionInput withTranscript(String key) {
            return new TransitionInput(runnerId, progress, errorMessage, key, runnerName, runnerVersion, runnerGitHash);
        }

        public TransitionInput withAttribution(@Nullable String name, @Nullable String version, @Nullable String gitHash) {
            return new TransitionInput(runnerId, progress, errorMessage, transcriptKey, name, version, gitHash);
        }
    }
}
