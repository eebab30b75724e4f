package com.example.transcribe_backend.service;

import com.example.transcribe_backend.config.DispatchProperties;
import com.example.transcribe_backend.coordination.CoordinationKeys;
import com.example.transcribe_backend.coordination.CoordinationStore;
import com.example.transcribe_backend.dto.web.HeartbeatRequest;
import com.example.transcribe_backend.dto.web.HeartbeatResponse;
import com.example.transcribe_backend.dto.web.RunnerRegisterRequest;
import com.example.transcribe_backend.exception.CoordinationStoreUnavailableException;
import com.example.transcribe_backend.exception.JobNotFoundException;
import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.repository.JobRepository;
import com.example.transcribe_backend.service.JobTransitionService.TransitionInput;
import com.example.transcribe_backend.service.JobTransitionService.TransitionResult;
import com.example.transcribe_backend.statemachine.JobTrigger;
import com.example.transcribe_backend.util.HeartbeatAction;
import com.example.transcribe_backend.util.JobState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps runner liveness records in the coordination store and turns heartbeats into job
 * transitions. Liveness records are never the source of truth for assignment: the job row is.
 */
@Service
public class RunnerLivenessTracker {
    private static final Logger LOGGER = LoggerFactory.getLogger(RunnerLivenessTracker.class);

    private final CoordinationStore store;
    private final CoordinationKeys keys;
    private final ObjectMapper mapper;
    private final JobRepository jobRepository;
    private final JobTransitionService transitions;
    private final Dispatcher dispatcher;
    private final Clock clock;
    private final DispatchProperties properties;

    public RunnerLivenessTracker(CoordinationStore store,
                                 CoordinationKeys keys,
                                 ObjectMapper mapper,
                                 JobRepository jobRepository,
                                 JobTransitionService transitions,
                                 Dispatcher dispatcher,
                                 Clock clock,
                                 DispatchProperties properties) {
        this.store = store;
        this.keys = keys;
        this.mapper = mapper;
        this.jobRepository = jobRepository;
        this.transitions = transitions;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Creates or refreshes the liveness record without dispatching.
     */
    public RunnerLiveness register(long runnerId, RunnerRegisterRequest request) {
        Long heldJobId = jobRepository.findByAssignedRunnerId(runnerId).map(Job::getId).orElse(null);
        RunnerLiveness record = RunnerLiveness.registered(runnerId, request, clock.millis(), heldJobId);
        write(record);
        LOGGER.info("Runner registered runnerId={} name={} version={} gitHash={}",
                runnerId, request.name(), request.version(), request.gitHash());
        return record;
    }

    /**
     * Refreshes liveness, forwards the report of the held job and, when the runner is free, asks
     * the dispatcher for work.
     *
     * @throws CoordinationStoreUnavailableException when liveness cannot be recorded; no job is
     *                                               assigned in that case
     */
    public HeartbeatResponse heartbeat(long runnerId, HeartbeatRequest request) {
        RunnerLiveness previous = find(runnerId).orElse(null);
        RunnerLiveness record = RunnerLiveness.heartbeat(runnerId, request, previous, clock.millis());
        Job held = jobRepository.findByAssignedRunnerId(runnerId).orElse(null);
        Long reported = request.currentJobId();

        if (reported != null && (held == null || !held.getId().equals(reported))) {
            LOGGER.warn("Stale job report runnerId={} reportedJobId={} heldJobId={}",
                    runnerId, reported, held != null ? held.getId() : null);
            write(record.withCurrentJob(held != null ? held.getId() : null));
            return HeartbeatResponse.dropJob(reported);
        }

        if (held != null) {
            HeartbeatResponse response = reported != null
                    ? forwardReport(runnerId, held, request.progress())
                    : reconcileSilentRunner(runnerId, held);
            if (response != null) {
                write(record.withCurrentJob(response.action() == HeartbeatAction.ASSIGNMENT ? response.jobId() : null));
                return response;
            }
        }

        return dispatch(runnerId, record.withCurrentJob(null));
    }

    /** Forwards a report about the job the runner holds. */
    private HeartbeatResponse forwardReport(long runnerId, Job held, @Nullable Double progress) {
        TransitionInput input = TransitionInput.runner(runnerId).withProgress(progress);
        Job current = held;
        if (current.getState() == JobState.RUNNER_ASSIGNED) {
            current = applyReport(current.getId(), JobTrigger.ARTIFACT_FETCHED, input);
        }
        if (current != null && current.getState() == JobState.RUNNER_IN_PROGRESS && progress != null) {
            current = applyReport(current.getId(), JobTrigger.PROGRESS, input);
        }
        if (current == null || current.getState() == JobState.ABORTING
                || !Objects.equals(current.getAssignedRunnerId(), runnerId)) {
            LOGGER.info("Runner told to drop job jobId={} runnerId={} state={}",
                    held.getId(), runnerId, current != null ? current.getState() : null);
            return HeartbeatResponse.dropJob(held.getId());
        }
        LOGGER.debug("Heartbeat runnerId={} jobId={} state={} progress={}", runnerId, held.getId(), current.getState(), progress);
        return HeartbeatResponse.assignment(held.getId());
    }

    /**
     * Handles a runner that holds a job according to the store but reports none.
     *
     * @return the response, or {@code null} when the runner is free for new work
     */
    @Nullable
    private HeartbeatResponse reconcileSilentRunner(long runnerId, Job held) {
        TransitionInput input = TransitionInput.runner(runnerId);
        switch (held.getState()) {
            case RUNNER_ASSIGNED -> {
                // assignment not picked up yet; deliver again
                return HeartbeatResponse.assignment(held.getId());
            }
            case ABORTING -> {
                applyReport(held.getId(), JobTrigger.ABORT_ACKNOWLEDGED, input);
                LOGGER.info("Abort acknowledged jobId={} runnerId={}", held.getId(), runnerId);
                return null;
            }
            case RUNNER_IN_PROGRESS -> {
                applyReport(held.getId(), JobTrigger.RUNNER_LOST, input);
                LOGGER.info("Runner lost its job, requeued jobId={} runnerId={}", held.getId(), runnerId);
                return null;
            }
            default -> {
                return null;
            }
        }
    }

    /** @return the job after the report, {@code null} if it was deleted meanwhile */
    @Nullable
    private Job applyReport(long jobId, JobTrigger trigger, TransitionInput input) {
        try {
            return transitions.apply(jobId, trigger, input).job();
        } catch (JobNotFoundException e) {
            LOGGER.warn("Job vanished during report jobId={} trigger={}", jobId, trigger);
            return null;
        }
    }

    private HeartbeatResponse dispatch(long runnerId, RunnerLiveness record) {
        write(record);
        Optional<Job> claimed = dispatcher.assignNext(runnerId, record);
        if (claimed.isEmpty()) {
            return HeartbeatResponse.noAssignment();
        }
        Job job = claimed.get();
        try {
            write(record.withCurrentJob(job.getId()));
        } catch (CoordinationStoreUnavailableException e) {
            // the runner would never learn about the claim; put the job back
            LOGGER.warn("Liveness write failed after claim, releasing jobId={} runnerId={}", job.getId(), runnerId);
            transitions.apply(job.getId(), JobTrigger.RUNNER_LOST, TransitionInput.runner(runnerId));
            throw e;
        }
        return HeartbeatResponse.assignment(job.getId());
    }

    /**
     * Deletes the liveness record and requeues the held job, if any.
     */
    public void evict(long runnerId, String reason) {
        dropLiveness(runnerId, reason);
        releaseHeldJob(runnerId, reason);
    }

    /**
     * Requeues a job that sat in {@code runner_assigned} too long and evicts its runner. The
     * requeue is guarded by the version of {@code snapshot}: if the runner fetched the audio (or
     * anything else touched the job) after the snapshot was read, nothing happens.
     *
     * @return {@code true} if the job was requeued and the runner evicted
     */
    public boolean evictForFetchTimeout(Job snapshot) {
        Long runnerId = snapshot.getAssignedRunnerId();
        if (runnerId == null || snapshot.getState() != JobState.RUNNER_ASSIGNED) {
            return false;
        }
        TransitionResult result = transitions.applyOnce(snapshot, JobTrigger.RUNNER_LOST, TransitionInput.runner(runnerId));
        if (!result.applied()) {
            LOGGER.debug("Fetch timeout skipped, job moved on jobId={} runnerId={} outcome={}",
                    snapshot.getId(), runnerId, result.outcome());
            return false;
        }
        LOGGER.info("Job released jobId={} runnerId={} reason=artifact fetch timeout", snapshot.getId(), runnerId);
        dropLiveness(runnerId, "artifact fetch timeout");
        return true;
    }

    private void dropLiveness(long runnerId, String reason) {
        store.delete(keys.runnerLiveness(runnerId));
        store.removeMember(keys.onlineRunners(), Long.toString(runnerId));
        LOGGER.info("Runner evicted runnerId={} reason={}", runnerId, reason);
    }

    /**
     * Evicts only if the record still holds {@code expectedRaw}; a heartbeat that refreshed the
     * record in the meantime wins.
     *
     * @return {@code true} if this call evicted the runner
     */
    public boolean evictIfUnchanged(long runnerId, String expectedRaw, String reason) {
        if (!store.deleteIfEquals(keys.runnerLiveness(runnerId), expectedRaw)) {
            return false;
        }
        store.removeMember(keys.onlineRunners(), Long.toString(runnerId));
        LOGGER.info("Runner evicted runnerId={} reason={}", runnerId, reason);
        releaseHeldJob(runnerId, reason);
        return true;
    }

    /**
     * Requeues the job held by a runner that is gone. An {@code aborting} job is finalized as
     * failed instead.
     *
     * @return {@code true} if a job was released
     */
    public boolean releaseHeldJob(long runnerId, String reason) {
        Optional<Job> held = jobRepository.findByAssignedRunnerId(runnerId);
        if (held.isEmpty()) {
            return false;
        }
        Job job = held.get();
        try {
            TransitionResult result = transitions.apply(job.getId(), JobTrigger.RUNNER_LOST, TransitionInput.runner(runnerId));
            if (result.applied()) {
                LOGGER.info("Job released jobId={} runnerId={} reason={} state={}",
                        job.getId(), runnerId, reason, result.job().getState());
                return true;
            }
        } catch (JobNotFoundException e) {
            LOGGER.debug("Held job already deleted jobId={} runnerId={}", job.getId(), runnerId);
        }
        return false;
    }

    public Optional<RunnerLiveness> find(long runnerId) {
        return findRaw(runnerId).flatMap(this::decode);
    }

    public Optional<String> findRaw(long runnerId) {
        return store.get(keys.runnerLiveness(runnerId));
    }

    /** Decodes a stored record; a corrupt record counts as absent. */
    Optional<RunnerLiveness> decode(String raw) {
        try {
            return Optional.of(mapper.readValue(raw, RunnerLiveness.class));
        } catch (JsonProcessingException e) {
            LOGGER.warn("Ignoring corrupt liveness record raw={} err={}", raw, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private void write(RunnerLiveness record) {
        String raw;
        try {
            raw = mapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Serialize liveness record failed", e);
        }
        store.set(keys.runnerLiveness(record.runnerId()), raw, properties.getHeartbeatTimeout());
        store.addMember(keys.onlineRunners(), Long.toString(record.runnerId()));
    }
}
