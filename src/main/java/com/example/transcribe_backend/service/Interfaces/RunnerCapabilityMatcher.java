package com.example.transcribe_backend.service.Interfaces;

import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.service.RunnerLiveness;

/**
 * Decides whether a runner can execute a queued job. Consulted by the dispatcher before it tries
 * to claim a candidate.
 */
@FunctionalInterface
public interface RunnerCapabilityMatcher {
    boolean canRun(RunnerLiveness runner, Job job);
}
