package io.surfworks.evalhub.validation;

import io.surfworks.evalhub.config.EvalHubConfig;
import io.surfworks.evalhub.model.BackendSpec;
import io.surfworks.evalhub.model.BenchmarkSpec;
import io.surfworks.evalhub.model.EvaluationRequest;
import io.surfworks.evalhub.model.EvaluationSpec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Rejects malformed requests before any expansion or execution.
 *
 * <p>Validation is fail-fast: the first violation found is thrown, with the indexed
 * path of the offending element (e.g. {@code evaluations[2].backends[0].benchmarks[1]}).
 * The validator has no side effects and may be shared between threads.
 */
public final class RequestValidator {

    private final EvalHubConfig config;

    public RequestValidator(EvalHubConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Validates a request.
     *
     * @param request the request to check
     * @throws ValidationException describing the first violation
     */
    public void validate(EvaluationRequest request) throws ValidationException {
        Objects.requireNonNull(request, "request cannot be null");

        List<EvaluationSpec> evaluations = request.evaluations();
        if (evaluations.isEmpty()) {
            throw new ValidationException("evaluations", "request must contain at least one evaluation");
        }
        if (evaluations.size() > EvaluationRequest.MAX_EVALUATIONS) {
            throw new ValidationException("evaluations", "request cannot contain more than "
                    + EvaluationRequest.MAX_EVALUATIONS + " evaluations (got " + evaluations.size() + ")");
        }

        Set<String> evaluationIds = new HashSet<>();
        for (int i = 0; i < evaluations.size(); i++) {
            String context = "evaluations[" + i + "]";
            EvaluationSpec evaluation = evaluations.get(i);
            validateEvaluation(evaluation, context);
            if (!evaluationIds.add(evaluation.id())) {
                throw new ValidationException(context + ".id", "duplicate evaluation id '" + evaluation.id() + "'");
            }
        }
    }

    private void validateEvaluation(EvaluationSpec spec, String context) throws ValidationException {
        if (isBlank(spec.modelName())) {
            throw new ValidationException(context + ".model_name", "model_name is required");
        }
        if (!spec.hasBackends() && !spec.hasRiskCategory()) {
            throw new ValidationException(context, "must specify either backends or risk_category");
        }
        if (spec.timeoutMinutes() <= 0) {
            throw new ValidationException(context + ".timeout_minutes", "timeout_minutes must be positive");
        }
        if (spec.retryAttempts() < 0) {
            throw new ValidationException(context + ".retry_attempts", "retry_attempts cannot be negative");
        }

        Set<String> backendNames = new HashSet<>();
        List<BackendSpec> backends = spec.backends();
        for (int j = 0; j < backends.size(); j++) {
            String backendContext = context + ".backends[" + j + "]";
            BackendSpec backend = backends.get(j);
            validateBackend(backend, backendContext);
            if (!backendNames.add(backend.name())) {
                throw new ValidationException(backendContext + ".name",
                        "duplicate backend name '" + backend.name() + "'");
            }
        }
    }

    private void validateBackend(BackendSpec backend, String context) throws ValidationException {
        if (isBlank(backend.name())) {
            throw new ValidationException(context + ".name", "name is required");
        }
        if (backend.benchmarks().isEmpty()) {
            throw new ValidationException(context + ".benchmarks", "must specify at least one benchmark");
        }
        if (!backend.isCustom() && !config.isKnownBackend(backend.name())) {
            throw new ValidationException(context + ".name",
                    "unsupported backend '" + backend.name() + "'. Supported backends: "
                            + new ArrayList<>(config.backendConfigs().keySet()));
        }

        Set<String> benchmarkNames = new HashSet<>();
        List<BenchmarkSpec> benchmarks = backend.benchmarks();
        for (int k = 0; k < benchmarks.size(); k++) {
            String benchmarkContext = context + ".benchmarks[" + k + "]";
            BenchmarkSpec benchmark = benchmarks.get(k);
            validateBenchmark(benchmark, benchmarkContext);
            if (!benchmarkNames.add(benchmark.name())) {
                throw new ValidationException(benchmarkContext + ".name",
                        "duplicate benchmark name '" + benchmark.name() + "'");
            }
        }
    }

    private void validateBenchmark(BenchmarkSpec benchmark, String context) throws ValidationException {
        if (isBlank(benchmark.name())) {
            throw new ValidationException(context + ".name", "name is required");
        }
        if (benchmark.tasks().isEmpty()) {
            throw new ValidationException(context + ".tasks", "must specify at least one task");
        }
        for (int t = 0; t < benchmark.tasks().size(); t++) {
            if (isBlank(benchmark.tasks().get(t))) {
                throw new ValidationException(context + ".tasks[" + t + "]", "task cannot be blank");
            }
        }
        if (benchmark.numFewshot() != null && benchmark.numFewshot() < 0) {
            throw new ValidationException(context + ".num_fewshot", "num_fewshot cannot be negative");
        }
        if (benchmark.batchSize() != null && benchmark.batchSize() <= 0) {
            throw new ValidationException(context + ".batch_size", "batch_size must be positive");
        }
        if (benchmark.limit() != null && benchmark.limit() <= 0) {
            throw new ValidationException(context + ".limit", "limit must be positive");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
