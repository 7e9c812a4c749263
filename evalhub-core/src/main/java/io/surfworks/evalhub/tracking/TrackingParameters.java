package io.surfworks.evalhub.tracking;

import io.surfworks.evalhub.model.BackendSpec;
import io.surfworks.evalhub.model.BenchmarkSpec;
import io.surfworks.evalhub.model.EvaluationSpec;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the parameter set logged for an evaluation unit's run.
 *
 * <p>Unit-level values use plain keys ({@code model_name}, {@code model_config_<k>},
 * {@code metadata_<k>}). Backend and benchmark values are prefixed with their path
 * ({@code <backend>/backend_config_<k>}, {@code <backend>/<benchmark>/num_fewshot}) since
 * one run covers every benchmark of the unit.
 */
public final class TrackingParameters {

    private TrackingParameters() {
    }

    public static Map<String, String> forEvaluation(EvaluationSpec evaluation) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("evaluation_id", evaluation.id());
        params.put("model_name", evaluation.modelName());
        params.put("timeout_minutes", String.valueOf(evaluation.timeoutMinutes()));
        params.put("retry_attempts", String.valueOf(evaluation.retryAttempts()));
        params.put("priority", String.valueOf(evaluation.priority()));
        if (evaluation.hasRiskCategory()) {
            params.put("risk_category", evaluation.riskCategory());
        }
        evaluation.modelConfiguration().asMap().forEach(
                (key, value) -> params.put("model_config_" + key, String.valueOf(value)));

        for (BackendSpec backend : evaluation.backends()) {
            String backendPrefix = backend.name() + "/";
            if (backend.type() != null) {
                params.put(backendPrefix + "backend_type", backend.type().id());
            }
            backend.config().asMap().forEach(
                    (key, value) -> params.put(backendPrefix + "backend_config_" + key, String.valueOf(value)));

            for (BenchmarkSpec benchmark : backend.benchmarks()) {
                String prefix = backendPrefix + benchmark.name() + "/";
                params.put(prefix + "tasks", String.join(",", benchmark.tasks()));
                if (benchmark.numFewshot() != null) {
                    params.put(prefix + "num_fewshot", String.valueOf(benchmark.numFewshot()));
                }
                if (benchmark.batchSize() != null) {
                    params.put(prefix + "batch_size", String.valueOf(benchmark.batchSize()));
                }
                if (benchmark.limit() != null) {
                    params.put(prefix + "limit", String.valueOf(benchmark.limit()));
                }
                if (benchmark.device() != null) {
                    params.put(prefix + "device", benchmark.device());
                }
                benchmark.config().asMap().forEach(
                        (key, value) -> params.put(prefix + "benchmark_config_" + key, String.valueOf(value)));
            }
        }

        evaluation.metadata().asMap().forEach(
                (key, value) -> params.put("metadata_" + key, String.valueOf(value)));
        return params;
    }
}
