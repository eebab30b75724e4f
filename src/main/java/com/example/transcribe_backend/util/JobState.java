package com.example.transcribe_backend.util;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle states of a transcription job.
 */
public enum JobState {
    /** Waiting on a prerequisite, e.g. settings not finalized yet. */
    NOT_QUEUED,
    /** Queued and eligible for assignment. */
    PENDING_RUNNER,
    /** Handed to a runner that has not fetched the audio yet. */
    RUNNER_ASSIGNED,
    /** Runner is transcribing and reports progress. */
    RUNNER_IN_PROGRESS,
    /** Owner requested an abort; waiting for the runner to drop the job. */
    ABORTING,
    SUCCESS,
    FAILED,
    /** Transcript retrieved by the owner. */
    DOWNLOADED;

    public static final Set<JobState> HELD_BY_RUNNER =
            Collections.unmodifiableSet(EnumSet.of(RUNNER_ASSIGNED, RUNNER_IN_PROGRESS, ABORTING));
    public static final Set<JobState> TERMINAL =
            Collections.unmodifiableSet(EnumSet.of(SUCCESS, FAILED, DOWNLOADED));

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isHeldByRunner() {
        return HELD_BY_RUNNER.contains(this);
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
