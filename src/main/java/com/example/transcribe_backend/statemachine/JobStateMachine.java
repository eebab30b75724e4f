package com.example.transcribe_backend.statemachine;

import com.example.transcribe_backend.util.JobState;
import jakarta.annotation.Nullable;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.example.transcribe_backend.statemachine.TransitionEffect.*;

/**
 * Pure transition table for jobs. Every replica computes transitions with this class and then
 * applies them with a compare-and-set against the job row, so it must stay free of I/O.
 */
@Component
public class JobStateMachine {
    public static final String ABORTED_BEFORE_ASSIGNMENT = "aborted before assignment";
    public static final String ABORTED_BY_USER = "aborted by user";

    /**
     * Computes the transition for a trigger.
     *
     * @param state          current state of the job
     * @param assignedRunner runner currently holding the job, if any
     * @param trigger        incoming trigger
     * @return the transition, or empty when the trigger is not accepted in this state
     */
    public Optional<Transition> next(JobState state, @Nullable Long assignedRunner, JobTrigger trigger) {
        if (state.isTerminal()) {
            if (trigger != JobTrigger.DOWNLOADED) {
                return Optional.empty();
            }
            return switch (state) {
                case SUCCESS -> Optional.of(Transition.to(state, JobState.DOWNLOADED));
                case DOWNLOADED -> Optional.of(Transition.unchanged(state));
                default -> Optional.empty();
            };
        }
        return Optional.ofNullable(switch (trigger) {
            case SETTINGS_FINALIZED -> state == JobState.NOT_QUEUED
                    ? Transition.to(state, JobState.PENDING_RUNNER)
                    : null;
            case ASSIGN -> state == JobState.PENDING_RUNNER && assignedRunner == null
                    ? Transition.to(state, JobState.RUNNER_ASSIGNED, ASSIGN_RUNNER, RESET_PROGRESS)
                    : null;
            case ARTIFACT_FETCHED -> switch (state) {
                case RUNNER_ASSIGNED -> Transition.to(state, JobState.RUNNER_IN_PROGRESS, RESET_PROGRESS);
                case RUNNER_IN_PROGRESS -> Transition.unchanged(state);
                default -> null;
            };
            case PROGRESS -> state == JobState.RUNNER_IN_PROGRESS
                    ? Transition.to(state, state, RECORD_PROGRESS)
                    : null;
            case SUCCEEDED -> switch (state) {
                case RUNNER_ASSIGNED, RUNNER_IN_PROGRESS -> Transition.to(state, JobState.SUCCESS,
                        RELEASE_RUNNER, RECORD_TRANSCRIPT, ATTRIBUTE_RUNNER, MARK_FINISHED);
                case ABORTING -> abortFinished(state);
                default -> null;
            };
            case FAILED -> switch (state) {
                case RUNNER_ASSIGNED, RUNNER_IN_PROGRESS -> Transition.to(state, JobState.FAILED,
                        RELEASE_RUNNER, RECORD_ERROR, ATTRIBUTE_RUNNER, MARK_FINISHED);
                case ABORTING -> abortFinished(state);
                default -> null;
            };
            case ABORT_REQUESTED -> switch (state) {
                case NOT_QUEUED, PENDING_RUNNER -> Transition.to(state, JobState.FAILED, RECORD_ERROR, MARK_FINISHED)
                        .withErrorMessage(ABORTED_BEFORE_ASSIGNMENT);
                case RUNNER_ASSIGNED, RUNNER_IN_PROGRESS -> assignedRunner != null
                        ? Transition.to(state, JobState.ABORTING, NOTIFY_RUNNER_DROP)
                        : Transition.to(state, JobState.FAILED, RECORD_ERROR, MARK_FINISHED)
                                .withErrorMessage(ABORTED_BEFORE_ASSIGNMENT);
                case ABORTING -> Transition.unchanged(state);
                default -> null;
            };
            case ABORT_ACKNOWLEDGED -> state == JobState.ABORTING ? abortFinished(state) : null;
            case RUNNER_LOST -> switch (state) {
                case RUNNER_ASSIGNED, RUNNER_IN_PROGRESS -> Transition.to(state, JobState.PENDING_RUNNER,
                        RELEASE_RUNNER, RESET_PROGRESS);
                case ABORTING -> abortFinished(state);
                default -> null;
            };
            case DOWNLOADED -> null;
        });
    }

    private static Transition abortFinished(JobState state) {
        return Transition.to(state, JobState.FAILED, RELEASE_RUNNER, RECORD_ERROR, MARK_FINISHED)
                .withErrorMessage(ABORTED_BY_USER);
    }
}
