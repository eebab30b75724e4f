package com.example.transcribe_backend.statemachine;

/**
 * Inputs that drive the job state machine.
 */
public enum JobTrigger {
    SETTINGS_FINALIZED(false),
    ASSIGN(false),
    ARTIFACT_FETCHED(true),
    PROGRESS(true),
    SUCCEEDED(true),
    FAILED(true),
    ABORT_REQUESTED(false),
    ABORT_ACKNOWLEDGED(true),
    RUNNER_LOST(true),
    DOWNLOADED(false);

    private final boolean runnerReport;

    JobTrigger(boolean runnerReport) {
        this.runnerReport = runnerReport;
    }

    /**
     * Whether the trigger originates from (or on behalf of) the runner holding the job. Such
     * triggers are only accepted when the job is still assigned to that runner.
     */
    public boolean isRunnerReport() {
        return runnerReport;
    }
}
