package com.example.transcribe_backend.exception;

/**
 * A job transition kept losing its compare-and-set after the configured number of attempts.
 */
public class TransitionConflictException extends RuntimeException {
    private final long jobId;

    public TransitionConflictException(long jobId, int attempts) {
        super("Job " + jobId + " changed concurrently " + attempts + " times in a row");
        this.jobId = jobId;
    }

    public long getJobId() {
        return jobId;
    }
}
