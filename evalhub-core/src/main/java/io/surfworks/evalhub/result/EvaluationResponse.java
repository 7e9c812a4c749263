package io.surfworks.evalhub.result;

import io.surfworks.evalhub.status.RequestStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of a request returned to the caller.
 *
 * @param requestId            original request ID
 * @param status               aggregate request status
 * @param totalEvaluations     number of evaluation units
 * @param completedEvaluations units that completed
 * @param failedEvaluations    units that failed or timed out
 * @param results              per-benchmark results, in request order
 * @param aggregatedMetrics    {@code <metric>_mean/_min/_max/_count} over all results
 * @param experimentUrl        tracking experiment URL (null if unavailable)
 * @param createdAt            request creation timestamp
 * @param updatedAt            last update timestamp
 * @param estimatedCompletion  estimated completion time (null if unknown)
 * @param progressPercentage   0 to 100
 * @param callbackError        last callback delivery error (null if none)
 */
public record EvaluationResponse(
        String requestId,
        RequestStatus status,
        int totalEvaluations,
        int completedEvaluations,
        int failedEvaluations,
        List<EvaluationResult> results,
        Map<String, Object> aggregatedMetrics,
        String experimentUrl,
        Instant createdAt,
        Instant updatedAt,
        Instant estimatedCompletion,
        double progressPercentage,
        String callbackError
) {

    public EvaluationResponse {
        Objects.requireNonNull(requestId, "requestId cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");

        results = results == null ? List.of() : List.copyOf(results);
        aggregatedMetrics = aggregatedMetrics == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(aggregatedMetrics));
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public EvaluationResponse withCallbackError(String value) {
        return new EvaluationResponse(requestId, status, totalEvaluations, completedEvaluations,
                failedEvaluations, results, aggregatedMetrics, experimentUrl, createdAt, updatedAt,
                estimatedCompletion, progressPercentage, value);
    }
}
