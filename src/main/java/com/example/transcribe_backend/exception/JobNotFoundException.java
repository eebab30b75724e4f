package com.example.transcribe_backend.exception;

public class JobNotFoundException extends RuntimeException {
    private final long jobId;

    public JobNotFoundException(long jobId) {
        super("Job " + jobId + " does not exist");
        this.jobId = jobId;
    }

    public long getJobId() {
        return jobId;
    }
}
