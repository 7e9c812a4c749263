package io.surfworks.evalhub.result;

import io.surfworks.evalhub.status.EvaluationStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one benchmark run by one backend for one evaluation unit.
 *
 * @param evaluationId  owning evaluation unit
 * @param backendName   backend that ran the benchmark
 * @param benchmarkName benchmark name
 * @param status        status of the unit when the result was recorded
 * @param metrics       metric name to numeric or string value, in reporting order
 * @param artifacts     artifact name to location
 * @param errorMessage  error text (if failed)
 * @param startedAt     start timestamp (null if unknown)
 * @param completedAt   completion timestamp (null if unknown)
 * @param trackingRunId run ID in the tracking system (null if not tracked)
 */
public record EvaluationResult(
        String evaluationId,
        String backendName,
        String benchmarkName,
        EvaluationStatus status,
        Map<String, Object> metrics,
        Map<String, String> artifacts,
        String errorMessage,
        Instant startedAt,
        Instant completedAt,
        String trackingRunId
) {

    public EvaluationResult {
        Objects.requireNonNull(evaluationId, "evaluationId cannot be null");
        Objects.requireNonNull(backendName, "backendName cannot be null");
        Objects.requireNonNull(benchmarkName, "benchmarkName cannot be null");
        Objects.requireNonNull(status, "status cannot be null");

        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        artifacts = artifacts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }

    /**
     * Creates a completed result.
     */
    public static EvaluationResult success(
            String evaluationId,
            String backendName,
            String benchmarkName,
            Map<String, Object> metrics,
            Map<String, String> artifacts
    ) {
        return new EvaluationResult(evaluationId, backendName, benchmarkName, EvaluationStatus.COMPLETED,
                metrics, artifacts, null, null, null, null);
    }

    /**
     * Creates a failed result.
     */
    public static EvaluationResult failure(
            String evaluationId,
            String backendName,
            String benchmarkName,
            EvaluationStatus status,
            String errorMessage
    ) {
        return new EvaluationResult(evaluationId, backendName, benchmarkName, status,
                Map.of(), Map.of(), errorMessage, null, null, null);
    }

    /**
     * Wall-clock duration, or null if either timestamp is missing.
     */
    public Duration duration() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt);
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }

    public EvaluationResult withTimes(Instant started, Instant completed) {
        return new EvaluationResult(evaluationId, backendName, benchmarkName, status,
                metrics, artifacts, errorMessage, started, completed, trackingRunId);
    }
}
