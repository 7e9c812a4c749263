package io.surfworks.evalhub.config;

import java.util.List;
import java.util.Objects;

/**
 * Benchmarks selected for a risk category.
 *
 * @param benchmarks Benchmark names, in run order
 * @param numFewshot Few-shot count applied to every benchmark (null for engine default)
 * @param limit      Sample limit applied to every benchmark (null for no limit)
 */
public record RiskCategoryProfile(
        List<String> benchmarks,
        Integer numFewshot,
        Integer limit
) {

    public RiskCategoryProfile {
        Objects.requireNonNull(benchmarks, "benchmarks cannot be null");
        if (benchmarks.isEmpty()) {
            throw new IllegalArgumentException("benchmarks cannot be empty");
        }
        benchmarks = List.copyOf(benchmarks);
    }

    public static RiskCategoryProfile of(List<String> benchmarks, Integer numFewshot, Integer limit) {
        return new RiskCategoryProfile(benchmarks, numFewshot, limit);
    }
}
