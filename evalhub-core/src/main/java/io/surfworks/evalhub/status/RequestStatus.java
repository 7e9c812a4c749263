package io.surfworks.evalhub.status;

import java.util.Locale;
import java.util.Optional;

/**
 * Aggregate status of a request, derived from the states of its evaluation units.
 */
public enum RequestStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String id;

    RequestStatus(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static Optional<RequestStatus> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (RequestStatus status : values()) {
            if (status.id.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
