package com.example.transcribe_backend.statemachine;

public enum TransitionEffect {
    ASSIGN_RUNNER,
    RELEASE_RUNNER,
    RESET_PROGRESS,
    RECORD_PROGRESS,
    RECORD_TRANSCRIPT,
    RECORD_ERROR,
    ATTRIBUTE_RUNNER,
    MARK_FINISHED,
    /** The holding runner is told to drop the job on its next heartbeat. */
    NOTIFY_RUNNER_DROP
}
