package io.surfworks.evalhub.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * A batch of evaluation units submitted together.
 *
 * @param requestId      Unique request ID (generated when not supplied)
 * @param evaluations    Ordered evaluation units
 * @param experimentName Tracking experiment name override (optional)
 * @param tags           Tags for the tracking experiment
 * @param asyncMode      Whether the caller wants an immediate response
 * @param callbackUrl    Where to post the final response (optional)
 * @param createdAt      Creation timestamp, fixed for the request's lifetime
 * @param explicitNulls  Optional fields the caller sent as an explicit null
 * @param omitted        Defaulted fields the caller left out
 */
public record EvaluationRequest(
        String requestId,
        List<EvaluationSpec> evaluations,
        String experimentName,
        Map<String, String> tags,
        boolean asyncMode,
        String callbackUrl,
        Instant createdAt,
        Set<String> explicitNulls,
        Set<String> omitted
) {

    /** Upper bound on evaluation units per request */
    public static final int MAX_EVALUATIONS = 100;

    public EvaluationRequest {
        requestId = requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
        evaluations = evaluations == null ? List.of() : List.copyOf(evaluations);
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        createdAt = createdAt == null ? Instant.now() : createdAt;
        explicitNulls = explicitNulls == null ? Set.of() : Set.copyOf(explicitNulls);
        omitted = omitted == null ? Set.of() : Set.copyOf(omitted);
    }

    /**
     * Creates an asynchronous request with a fresh ID for the given evaluations.
     */
    public static EvaluationRequest of(List<EvaluationSpec> evaluations) {
        return new EvaluationRequest(null, evaluations, null, Map.of(), true, null, null, Set.of(), Set.of());
    }

    /**
     * Returns a copy with different evaluations; ID and creation time are preserved.
     */
    public EvaluationRequest withEvaluations(List<EvaluationSpec> value) {
        return new EvaluationRequest(requestId, value, experimentName, tags, asyncMode,
                callbackUrl, createdAt, explicitNulls, omitted);
    }

    public EvaluationRequest withAsyncMode(boolean value) {
        return new EvaluationRequest(requestId, evaluations, experimentName, tags, value,
                callbackUrl, createdAt, explicitNulls, omitted);
    }

    public EvaluationRequest withCallbackUrl(String value) {
        return new EvaluationRequest(requestId, evaluations, experimentName, tags, asyncMode,
                value, createdAt, explicitNulls, omitted);
    }

    public boolean hasCallback() {
        return callbackUrl != null && !callbackUrl.isBlank();
    }

    /**
     * Returns the total number of benchmark units across all evaluations.
     */
    public int benchmarkCount() {
        int count = 0;
        for (EvaluationSpec evaluation : evaluations) {
            count += evaluation.benchmarkCount();
        }
        return count;
    }
}
