package com.example.transcribe_backend.service;

import com.example.transcribe_backend.config.DispatchProperties;
import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.repository.JobRepository;
import com.example.transcribe_backend.service.Interfaces.RunnerCapabilityMatcher;
import com.example.transcribe_backend.statemachine.JobTrigger;
import com.example.transcribe_backend.util.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Hands the oldest eligible queued job to a free runner. The claim is a compare-and-set on the job
 * row, so two replicas dispatching the same candidate cannot both win; the loser moves on to the
 * next candidate.
 */
@Service
public class Dispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(Dispatcher.class);

    private final JobRepository jobRepository;
    private final JobTransitionService transitions;
    private final RunnerCapabilityMatcher capabilityMatcher;
    private final DispatchProperties properties;

    public Dispatcher(JobRepository jobRepository,
                      JobTransitionService transitions,
                      RunnerCapabilityMatcher capabilityMatcher,
                      DispatchProperties properties) {
        this.jobRepository = jobRepository;
        this.transitions = transitions;
        this.capabilityMatcher = capabilityMatcher;
        this.properties = properties;
    }

    /**
     * Claims the next job for the runner.
     *
     * @return the claimed job in {@code runner_assigned}, or empty when nothing eligible is queued
     */
    public Optional<Job> assignNext(long runnerId, RunnerLiveness runner) {
        int batchSize = Math.max(1, properties.getClaimBatchSize());
        int maxContendedRounds = Math.max(1, properties.getMaxTransitionAttempts());
        int page = 0;
        int contendedRounds = 0;

        while (true) {
            List<Job> candidates = jobRepository.findByStateOrderByCreatedAtAscIdAsc(
                    JobState.PENDING_RUNNER, PageRequest.of(page, batchSize));
            if (candidates.isEmpty()) {
                return Optional.empty();
            }

            boolean lostRace = false;
            for (Job candidate : candidates) {
                if (!capabilityMatcher.canRun(runner, candidate)) {
                    continue;
                }
                JobTransitionService.TransitionResult result;
                try {
                    result = transitions.applyOnce(candidate, JobTrigger.ASSIGN,
                            JobTransitionService.TransitionInput.runner(runnerId));
                } catch (DataIntegrityViolationException e) {
                    // unique assigned_runner_id: this runner already holds a job
                    LOGGER.warn("Claim refused, runner already holds a job runnerId={} jobId={}", runnerId, candidate.getId());
                    return Optional.empty();
                }
                if (result.applied()) {
                    LOGGER.info("Runner assigned jobId={} runnerId={}", candidate.getId(), runnerId);
                    return Optional.of(result.job());
                }
                lostRace = true;
                LOGGER.debug("Claim lost jobId={} runnerId={} outcome={}", candidate.getId(), runnerId, result.outcome());
            }

            if (lostRace) {
                // claimed candidates left the queue, restart from the head
                if (++contendedRounds >= maxContendedRounds) {
                    LOGGER.debug("Giving up dispatch after {} contended rounds runnerId={}", contendedRounds, runnerId);
                    return Optional.empty();
                }
                page = 0;
            } else if (candidates.size() < batchSize) {
                return Optional.empty();
            } else {
                page++;
            }
        }
    }
}
