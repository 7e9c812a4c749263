package io.surfworks.evalhub.executor;

import io.surfworks.evalhub.result.EvaluationResult;

import java.util.List;
import java.util.Objects;

/**
 * What an executor reports when polled for a submitted evaluation.
 *
 * @param state   where the execution stands
 * @param results per-benchmark results (only for {@link State#SUCCEEDED})
 * @param error   error text (only for {@link State#FAILED})
 */
public record ExecutionPoll(State state, List<EvaluationResult> results, String error) {

    /**
     * Execution states as seen by the caller.
     */
    public enum State {
        /** Accepted but not yet started */
        QUEUED,

        /** Started and working */
        RUNNING,

        /** Finished with results */
        SUCCEEDED,

        /** Finished with an error */
        FAILED;

        public boolean isTerminal() {
            return this == SUCCEEDED || this == FAILED;
        }
    }

    public ExecutionPoll {
        Objects.requireNonNull(state, "state cannot be null");
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static ExecutionPoll queued() {
        return new ExecutionPoll(State.QUEUED, List.of(), null);
    }

    public static ExecutionPoll running() {
        return new ExecutionPoll(State.RUNNING, List.of(), null);
    }

    public static ExecutionPoll succeeded(List<EvaluationResult> results) {
        return new ExecutionPoll(State.SUCCEEDED, results, null);
    }

    public static ExecutionPoll failed(String error) {
        return new ExecutionPoll(State.FAILED, List.of(), error);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }
}
