package com.example.transcribe_backend.util;

/**
 * What an owner-initiated abort did to the job.
 */
public enum AbortOutcome {
    /** A runner holds the job and was told to drop it. */
    ABORT_REQUESTED,
    /** Nobody held the job; it was failed right away. */
    ABORTED,
    /** The job had already reached a terminal state. */
    ALREADY_FINISHED
}
