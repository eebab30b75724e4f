package com.example.transcribe_backend.events;

import com.example.transcribe_backend.util.JobEventKind;

/**
 * Change notification for a job. Carries no state: subscribers re-read the job.
 */
public record JobChangeEvent(long jobId, JobEventKind kind) {
}
