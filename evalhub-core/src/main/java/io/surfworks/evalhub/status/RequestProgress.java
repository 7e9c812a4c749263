package io.surfworks.evalhub.status;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Point-in-time view of a request's progress.
 *
 * @param requestId          the request ID
 * @param status             derived aggregate status
 * @param totalEvaluations   number of evaluation units
 * @param completedEvaluations units in {@code completed}
 * @param failedEvaluations  units in {@code failed} or {@code timeout}
 * @param progressPercentage terminal units over total units, 0 to 100
 * @param cancelRequested    whether the request itself was cancelled
 * @param createdAt          when the request was registered
 * @param updatedAt          last unit transition
 * @param units              per-unit states, in request order
 */
public record RequestProgress(
        String requestId,
        RequestStatus status,
        int totalEvaluations,
        int completedEvaluations,
        int failedEvaluations,
        double progressPercentage,
        boolean cancelRequested,
        Instant createdAt,
        Instant updatedAt,
        List<UnitState> units
) {

    public RequestProgress {
        Objects.requireNonNull(requestId, "requestId cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        units = units == null ? List.of() : List.copyOf(units);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public UnitState unit(String evaluationId) {
        for (UnitState unit : units) {
            if (unit.evaluationId().equals(evaluationId)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unknown evaluation: " + evaluationId);
    }
}
