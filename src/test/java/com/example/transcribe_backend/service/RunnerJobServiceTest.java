package com.example.transcribe_backend.service;

import com.example.transcribe_backend.dto.web.RunnerResultRequest;
import com.example.transcribe_backend.dto.web.TranscriptPayload;
import com.example.transcribe_backend.model.Job;
import com.example.transcribe_backend.repository.JobRepository;
import com.example.transcribe_backend.service.Interfaces.BlobStore;
import com.example.transcribe_backend.service.JobTransitionService.Outcome;
import com.example.transcribe_backend.service.JobTransitionService.TransitionResult;
import com.example.transcribe_backend.statemachine.JobTrigger;
import com.example.transcribe_backend.util.JobState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;

/**
 * Unit tests for {@link RunnerJobService} result handling with mocked collaborators.
 */
class RunnerJobServiceTest {
    private static final long RUNNER = 5L;
    private static final long JOB_ID = 12L;

    private JobRepository jobRepository;
    private JobTransitionService transitions;
    private BlobStore blobStore;
    private RunnerJobService service;

    @BeforeEach
    void setup() {
        jobRepository = Mockito.mock(JobRepository.class);
        transitions = Mockito.mock(JobTransitionService.class);
        blobStore = Mockito.mock(BlobStore.class);
        RunnerLivenessTracker tracker = Mockito.mock(RunnerLivenessTracker.class);
        Mockito.when(tracker.find(anyLong())).thenReturn(Optional.empty());
        service = new RunnerJobService(jobRepository, Mockito.mock(JobSettingsService.class), transitions,
                tracker, blobStore, new ObjectMapper());
    }

    private static Job job(JobState state, Long runnerId) {
        Job job = new Job(42L, 7L, state);
        job.setId(JOB_ID);
        job.setAssignedRunnerId(runnerId);
        return job;
    }

    private static RunnerResultRequest success() {
        return new RunnerResultRequest(null, new TranscriptPayload("hello", null, null, null, Map.of()));
    }

    @Test
    void lateSuccessReportOnlyRemovesItsOwnTranscript() {
        Mockito.when(jobRepository.findById(JOB_ID)).thenReturn(Optional.of(job(JobState.RUNNER_IN_PROGRESS, RUNNER)));
        // reclaimed and finished by another runner between the holder check and the transition
        Job finishedElsewhere = job(JobState.SUCCESS, null);
        finishedElsewhere.setTranscriptKey(JOB_ID + "-winner.json");
        Mockito.when(transitions.apply(eq(JOB_ID), eq(JobTrigger.SUCCEEDED), any()))
                .thenReturn(new TransitionResult(Outcome.REJECTED, finishedElsewhere, null));

        assertThatThrownBy(() -> service.submitResult(RUNNER, JOB_ID, success()))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("NOT_ASSIGNED_RUNNER");

        ArgumentCaptor<String> written = ArgumentCaptor.forClass(String.class);
        Mockito.verify(blobStore).writeTranscript(written.capture(), any());
        Mockito.verify(blobStore).deleteTranscript(written.getValue());
        Mockito.verify(blobStore, Mockito.never()).deleteTranscript(finishedElsewhere.getTranscriptKey());
        assertThat(written.getValue()).startsWith(JOB_ID + "-").endsWith(".json");
    }

    @Test
    void everySuccessReportGetsItsOwnTranscriptKey() {
        Mockito.when(jobRepository.findById(JOB_ID)).thenReturn(Optional.of(job(JobState.RUNNER_IN_PROGRESS, RUNNER)));
        Mockito.when(transitions.apply(eq(JOB_ID), eq(JobTrigger.SUCCEEDED), any()))
                .thenAnswer(invocation -> new TransitionResult(Outcome.APPLIED, job(JobState.SUCCESS, null), null));

        service.submitResult(RUNNER, JOB_ID, success());
        service.submitResult(RUNNER, JOB_ID, success());

        ArgumentCaptor<String> written = ArgumentCaptor.forClass(String.class);
        Mockito.verify(blobStore, Mockito.times(2)).writeTranscript(written.capture(), any());
        assertThat(written.getAllValues()).doesNotHaveDuplicates();
        Mockito.verify(blobStore, Mockito.never()).deleteTranscript(any());
    }

    @Test
    void reportFromRunnerThatNoLongerHoldsJobWritesNothing() {
        Mockito.when(jobRepository.findById(JOB_ID)).thenReturn(Optional.of(job(JobState.RUNNER_IN_PROGRESS, 99L)));

        assertThatThrownBy(() -> service.submitResult(RUNNER, JOB_ID, success()))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("NOT_ASSIGNED_RUNNER");

        Mockito.verify(blobStore, Mockito.never()).writeTranscript(any(), any());
    }
}
