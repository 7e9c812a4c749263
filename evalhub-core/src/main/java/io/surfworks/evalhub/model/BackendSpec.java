package io.surfworks.evalhub.model;

import java.util.List;
import java.util.Set;

/**
 * An execution engine selection plus the benchmarks to run on it.
 *
 * @param name          Backend identifier, unique within its evaluation
 * @param type          Backend kind (null when the caller omitted it)
 * @param endpoint      Optional engine endpoint
 * @param config        Backend configuration (caller overrides, or merged after defaulting)
 * @param benchmarks    Ordered benchmarks to run
 * @param explicitNulls Optional fields the caller sent as an explicit null
 * @param omitted       Defaulted fields the caller left out
 */
public record BackendSpec(
        String name,
        BackendType type,
        String endpoint,
        ConfigMap config,
        List<BenchmarkSpec> benchmarks,
        Set<String> explicitNulls,
        Set<String> omitted
) {

    public BackendSpec {
        config = config == null ? ConfigMap.empty() : config;
        benchmarks = benchmarks == null ? List.of() : List.copyOf(benchmarks);
        explicitNulls = explicitNulls == null ? Set.of() : Set.copyOf(explicitNulls);
        omitted = omitted == null ? Set.of() : Set.copyOf(omitted);
    }

    /**
     * Creates a backend with no endpoint and no configuration overrides.
     */
    public static BackendSpec of(String name, BackendType type, List<BenchmarkSpec> benchmarks) {
        return new BackendSpec(name, type, null, ConfigMap.empty(), benchmarks, Set.of(), Set.of());
    }

    public boolean isCustom() {
        return type == BackendType.CUSTOM;
    }

    public BackendSpec withBenchmarks(List<BenchmarkSpec> value) {
        return new BackendSpec(name, type, endpoint, config, value, explicitNulls, omitted);
    }

    /**
     * Returns the number of benchmark units on this backend.
     */
    public int benchmarkCount() {
        return benchmarks.size();
    }
}
