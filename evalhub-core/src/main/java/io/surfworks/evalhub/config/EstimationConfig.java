package io.surfworks.evalhub.config;

/**
 * Constants for completion-time estimation.
 *
 * @param minutesPerBenchmark   Average minutes one benchmark unit takes
 * @param queuingPenalty        Multiplier applied when benchmarks exceed the concurrency ceiling
 * @param minimumMinutes        Floor for any estimate
 */
public record EstimationConfig(
        int minutesPerBenchmark,
        double queuingPenalty,
        int minimumMinutes
) {

    public EstimationConfig {
        if (minutesPerBenchmark <= 0) {
            throw new IllegalArgumentException("minutesPerBenchmark must be positive");
        }
        if (queuingPenalty < 1.0) {
            throw new IllegalArgumentException("queuingPenalty must be at least 1.0");
        }
        if (minimumMinutes < 0) {
            throw new IllegalArgumentException("minimumMinutes cannot be negative");
        }
    }

    public static EstimationConfig defaults() {
        return new EstimationConfig(5, 1.5, 10);
    }
}
