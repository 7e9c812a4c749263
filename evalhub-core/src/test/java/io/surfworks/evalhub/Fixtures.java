package io.surfworks.evalhub;

import io.surfworks.evalhub.model.BackendSpec;
import io.surfworks.evalhub.model.BackendType;
import io.surfworks.evalhub.model.BenchmarkSpec;
import io.surfworks.evalhub.model.EvaluationRequest;
import io.surfworks.evalhub.model.EvaluationSpec;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared request builders for tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static BenchmarkSpec benchmark(String name) {
        return BenchmarkSpec.of(name, List.of(name));
    }

    public static BackendSpec harness(String... benchmarks) {
        return backend("lm-evaluation-harness", BackendType.LM_EVALUATION_HARNESS, benchmarks);
    }

    public static BackendSpec backend(String name, BackendType type, String... benchmarks) {
        List<BenchmarkSpec> specs = new ArrayList<>();
        for (String benchmark : benchmarks) {
            specs.add(benchmark(benchmark));
        }
        return BackendSpec.of(name, type, specs);
    }

    public static EvaluationSpec evaluation(String id, BackendSpec... backends) {
        return EvaluationSpec.builder()
                .id(id)
                .modelName("test-model")
                .backends(backends)
                .build();
    }

    public static EvaluationSpec riskEvaluation(String id, String riskCategory) {
        return EvaluationSpec.builder()
                .id(id)
                .modelName("test-model")
                .riskCategory(riskCategory)
                .build();
    }

    public static EvaluationRequest request(EvaluationSpec... evaluations) {
        return EvaluationRequest.of(List.of(evaluations));
    }
}
