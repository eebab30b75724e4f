package com.example.transcribe_backend.statemachine;

import com.example.transcribe_backend.util.JobState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Optional;

import static com.example.transcribe_backend.statemachine.TransitionEffect.*;
import static org.assertj.core.api.Assertions.assertThat;

class JobStateMachineTest {

    private static final Long RUNNER = 7L;

    private final JobStateMachine machine = new JobStateMachine();

    @Test
    void assignClaimsOnlyUnassignedPendingJobs() {
        Transition t = machine.next(JobState.PENDING_RUNNER, null, JobTrigger.ASSIGN).orElseThrow();
        assertThat(t.to()).isEqualTo(JobState.RUNNER_ASSIGNED);
        assertThat(t.has(ASSIGN_RUNNER)).isTrue();

        assertThat(machine.next(JobState.PENDING_RUNNER, RUNNER, JobTrigger.ASSIGN)).isEmpty();
        assertThat(machine.next(JobState.RUNNER_ASSIGNED, RUNNER, JobTrigger.ASSIGN)).isEmpty();
        assertThat(machine.next(JobState.NOT_QUEUED, null, JobTrigger.ASSIGN)).isEmpty();
    }

    @Test
    void artifactFetchStartsWorkAndRepeatsAreNoops() {
        Transition first = machine.next(JobState.RUNNER_ASSIGNED, RUNNER, JobTrigger.ARTIFACT_FETCHED).orElseThrow();
        assertThat(first.to()).isEqualTo(JobState.RUNNER_IN_PROGRESS);

        Transition again = machine.next(JobState.RUNNER_IN_PROGRESS, RUNNER, JobTrigger.ARTIFACT_FETCHED).orElseThrow();
        assertThat(again.isNoop()).isTrue();
    }

    @Test
    void progressOnlyRecordedWhileInProgress() {
        Transition t = machine.next(JobState.RUNNER_IN_PROGRESS, RUNNER, JobTrigger.PROGRESS).orElseThrow();
        assertThat(t.to()).isEqualTo(JobState.RUNNER_IN_PROGRESS);
        assertThat(t.has(RECORD_PROGRESS)).isTrue();

        assertThat(machine.next(JobState.RUNNER_ASSIGNED, RUNNER, JobTrigger.PROGRESS)).isEmpty();
    }

    @Test
    void successAndFailureReleaseRunnerAndAttribute() {
        Transition ok = machine.next(JobState.RUNNER_IN_PROGRESS, RUNNER, JobTrigger.SUCCEEDED).orElseThrow();
        assertThat(ok.to()).isEqualTo(JobState.SUCCESS);
        assertThat(ok.effects()).contains(RELEASE_RUNNER, RECORD_TRANSCRIPT, ATTRIBUTE_RUNNER, MARK_FINISHED);

        Transition failed = machine.next(JobState.RUNNER_ASSIGNED, RUNNER, JobTrigger.FAILED).orElseThrow();
        assertThat(failed.to()).isEqualTo(JobState.FAILED);
        assertThat(failed.effects()).contains(RELEASE_RUNNER, RECORD_ERROR, ATTRIBUTE_RUNNER);
        assertThat(failed.errorMessage()).isNull();
    }

    @Test
    void abortBeforeAssignmentFailsImmediately() {
        Transition t = machine.next(JobState.PENDING_RUNNER, null, JobTrigger.ABORT_REQUESTED).orElseThrow();
        assertThat(t.to()).isEqualTo(JobState.FAILED);
        assertThat(t.errorMessage()).isEqualTo(JobStateMachine.ABORTED_BEFORE_ASSIGNMENT);

        Transition notQueued = machine.next(JobState.NOT_QUEUED, null, JobTrigger.ABORT_REQUESTED).orElseThrow();
        assertThat(notQueued.to()).isEqualTo(JobState.FAILED);
    }

    @Test
    void abortOfHeldJobWaitsForRunner() {
        Transition t = machine.next(JobState.RUNNER_IN_PROGRESS, RUNNER, JobTrigger.ABORT_REQUESTED).orElseThrow();
        assertThat(t.to()).isEqualTo(JobState.ABORTING);
        assertThat(t.has(NOTIFY_RUNNER_DROP)).isTrue();
        assertThat(t.has(RELEASE_RUNNER)).isFalse();

        assertThat(machine.next(JobState.ABORTING, RUNNER, JobTrigger.ABORT_REQUESTED).orElseThrow().isNoop()).isTrue();
    }

    @Test
    void abortingEndsFailedWhateverTheRunnerDoes() {
        for (JobTrigger trigger : new JobTrigger[]{JobTrigger.ABORT_ACKNOWLEDGED, JobTrigger.RUNNER_LOST,
                JobTrigger.SUCCEEDED, JobTrigger.FAILED}) {
            Transition t = machine.next(JobState.ABORTING, RUNNER, trigger).orElseThrow();
            assertThat(t.to()).as(trigger.name()).isEqualTo(JobState.FAILED);
            assertThat(t.errorMessage()).isEqualTo(JobStateMachine.ABORTED_BY_USER);
            assertThat(t.has(RELEASE_RUNNER)).isTrue();
        }
    }

    @Test
    void runnerLossRequeuesInsteadOfFailing() {
        Transition t = machine.next(JobState.RUNNER_IN_PROGRESS, RUNNER, JobTrigger.RUNNER_LOST).orElseThrow();
        assertThat(t.to()).isEqualTo(JobState.PENDING_RUNNER);
        assertThat(t.effects()).contains(RELEASE_RUNNER, RESET_PROGRESS);
    }

    @Test
    void downloadIsIdempotent() {
        assertThat(machine.next(JobState.SUCCESS, null, JobTrigger.DOWNLOADED).orElseThrow().to())
                .isEqualTo(JobState.DOWNLOADED);
        assertThat(machine.next(JobState.DOWNLOADED, null, JobTrigger.DOWNLOADED).orElseThrow().isNoop()).isTrue();
        assertThat(machine.next(JobState.FAILED, null, JobTrigger.DOWNLOADED)).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(value = JobState.class, names = {"SUCCESS", "FAILED", "DOWNLOADED"})
    void terminalStatesNeverLeaveTerminality(JobState terminal) {
        for (JobTrigger trigger : JobTrigger.values()) {
            Optional<Transition> t = machine.next(terminal, RUNNER, trigger);
            t.ifPresent(tr -> assertThat(tr.to().isTerminal()).as("%s + %s", terminal, trigger).isTrue());
            if (trigger != JobTrigger.DOWNLOADED) {
                assertThat(t).as("%s + %s", terminal, trigger).isEmpty();
            }
        }
    }
}
