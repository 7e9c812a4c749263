package io.surfworks.evalhub.defaults;

import io.surfworks.evalhub.config.EvalHubConfig;
import io.surfworks.evalhub.expand.BackendKindPolicy;
import io.surfworks.evalhub.model.BackendSpec;
import io.surfworks.evalhub.model.BackendType;
import io.surfworks.evalhub.model.BenchmarkSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Merges caller-supplied backend and benchmark settings with system defaults.
 *
 * <p>Backend configuration starts from the backend's default map and the caller's
 * map is laid over it, so caller keys win and untouched defaults survive. Every
 * benchmark then gets {@code batch_size = 1} and {@code device = "auto"} when unset,
 * and benchmarks on the few-shot harness get {@code num_fewshot = 5} when unset.
 *
 * <p>Caller values are never overwritten and applying the engine twice gives the
 * same result as applying it once. Inputs are not modified; copies are returned.
 */
public final class DefaultingEngine {

    /** Batch size used when the caller leaves it unset */
    public static final int DEFAULT_BATCH_SIZE = 1;

    /** Few-shot count used on the evaluation harness when the caller leaves it unset */
    public static final int DEFAULT_HARNESS_FEWSHOT = 5;

    private final EvalHubConfig config;
    private final BackendKindPolicy kindPolicy;

    public DefaultingEngine(EvalHubConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.kindPolicy = BackendKindPolicy.from(config);
    }

    /**
     * Returns a copy of the backend with defaults applied.
     */
    public BackendSpec applyDefaults(BackendSpec backend) {
        Objects.requireNonNull(backend, "backend cannot be null");

        BackendType kind = backend.type() != null ? backend.type() : kindPolicy.kindOf(backend.name());

        List<BenchmarkSpec> benchmarks = new ArrayList<>(backend.benchmarks().size());
        for (BenchmarkSpec benchmark : backend.benchmarks()) {
            benchmarks.add(applyBenchmarkDefaults(benchmark, kind));
        }

        return new BackendSpec(
                backend.name(),
                kind,
                backend.endpoint(),
                config.backendDefaults(backend.name()).overlay(backend.config()),
                benchmarks,
                backend.explicitNulls(),
                backend.omitted()
        );
    }

    /**
     * Returns a copy of the benchmark with defaults for the given backend kind applied.
     */
    public BenchmarkSpec applyBenchmarkDefaults(BenchmarkSpec benchmark, BackendType kind) {
        BenchmarkSpec result = benchmark;
        if (result.batchSize() == null) {
            result = result.withBatchSize(DEFAULT_BATCH_SIZE);
        }
        if (result.device() == null) {
            result = result.withDevice(BenchmarkSpec.DEVICE_AUTO);
        }
        if (kind == BackendType.LM_EVALUATION_HARNESS && result.numFewshot() == null) {
            result = result.withNumFewshot(DEFAULT_HARNESS_FEWSHOT);
        }
        return result;
    }
}
