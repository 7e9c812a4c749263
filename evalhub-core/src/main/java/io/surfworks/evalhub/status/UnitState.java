package io.surfworks.evalhub.status;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time view of one evaluation unit.
 *
 * @param evaluationId   the evaluation unit's ID
 * @param status         current lifecycle state
 * @param stateChangedAt when the unit entered this state
 * @param startedAt      when the current attempt entered {@code initializing} (null before dispatch)
 * @param completedAt    when the unit reached a terminal state (null until then)
 * @param attempts       number of dispatches so far
 * @param errorMessage   last error text (null if none)
 */
public record UnitState(
        String evaluationId,
        EvaluationStatus status,
        Instant stateChangedAt,
        Instant startedAt,
        Instant completedAt,
        int attempts,
        String errorMessage
) {

    public UnitState {
        Objects.requireNonNull(evaluationId, "evaluationId cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(stateChangedAt, "stateChangedAt cannot be null");
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Time spent since dispatch, up to completion or {@code now}.
     */
    public Duration elapsed(Instant now) {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        Instant end = completedAt != null ? completedAt : now;
        return Duration.between(startedAt, end);
    }
}
