package com.example.transcribe_backend.statemachine;

import com.example.transcribe_backend.util.JobState;
import jakarta.annotation.Nullable;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Result of feeding a trigger to the state machine.
 *
 * @param from         state the transition starts from
 * @param to           resulting state
 * @param effects      field updates and notifications implied by the transition
 * @param errorMessage fixed error message to record, or {@code null} to use the reported one
 */
public record Transition(JobState from, JobState to, Set<TransitionEffect> effects, @Nullable String errorMessage) {

    public Transition {
        effects = effects.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(effects));
    }

    static Transition to(JobState from, JobState to, TransitionEffect... effects) {
        return new Transition(from, to, effects.length == 0 ? Set.of() : EnumSet.of(effects[0], effects), null);
    }

    static Transition unchanged(JobState state) {
        return new Transition(state, state, Set.of(), null);
    }

    Transition withErrorMessage(String message) {
        return new Transition(from, to, effects, message);
    }

    public boolean has(TransitionEffect effect) {
        return effects.contains(effect);
    }

    /** A self-loop that changes nothing and needs no write. */
    public boolean isNoop() {
        return from == to && effects.isEmpty();
    }
}
