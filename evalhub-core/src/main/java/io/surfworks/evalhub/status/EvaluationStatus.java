package io.surfworks.evalhub.status;

import java.util.Locale;
import java.util.Optional;

/**
 * Possible states of an evaluation unit during its lifecycle.
 *
 * <p>{@code INITIALIZING} and {@code COMPLETING} bracket {@code RUNNING}: the first
 * covers dispatch to an executor, the second the time between receiving raw results
 * and storing them.
 */
public enum EvaluationStatus {
    /** Waiting for a worker */
    PENDING("pending"),

    /** Dispatched to an executor, not yet acknowledged */
    INITIALIZING("initializing"),

    /** Executor acknowledged and is working */
    RUNNING("running"),

    /** Results received, being stored */
    COMPLETING("completing"),

    /** Results stored */
    COMPLETED("completed"),

    /** Finished with an error */
    FAILED("failed"),

    /** Cancelled by the caller */
    CANCELLED("cancelled"),

    /** Exceeded its wall-clock timeout */
    TIMEOUT("timeout");

    private final String id;

    EvaluationStatus(String id) {
        this.id = id;
    }

    /**
     * Wire identifier, e.g. {@code "running"}.
     */
    public String id() {
        return id;
    }

    /**
     * Returns true if this is a terminal state (the unit will not change state again).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == TIMEOUT;
    }

    /**
     * Returns true if this state indicates successful completion.
     */
    public boolean isSuccess() {
        return this == COMPLETED;
    }

    /**
     * Returns true if the unit is counted as failed ({@code failed} or {@code timeout}).
     */
    public boolean isFailure() {
        return this == FAILED || this == TIMEOUT;
    }

    public static Optional<EvaluationStatus> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (EvaluationStatus status : values()) {
            if (status.id.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
