package io.surfworks.evalhub.model;

import java.util.List;
import java.util.Set;

/**
 * A named set of tasks with run parameters, owned by one backend.
 *
 * <p>Only shape is enforced here: collections are normalized to immutable copies.
 * Value rules (non-empty tasks, positive batch size, ...) belong to the validator.
 *
 * @param name          Benchmark name, unique within its backend
 * @param tasks         Ordered task identifiers
 * @param numFewshot    Few-shot example count (null if unset)
 * @param batchSize     Batch size (null if unset)
 * @param limit         Sample limit (null if unset)
 * @param device        Device hint (null if unset)
 * @param config        Free-form benchmark configuration
 * @param explicitNulls Optional fields the caller sent as an explicit null
 * @param omitted       Defaulted fields the caller left out
 */
public record BenchmarkSpec(
        String name,
        List<String> tasks,
        Integer numFewshot,
        Integer batchSize,
        Integer limit,
        String device,
        ConfigMap config,
        Set<String> explicitNulls,
        Set<String> omitted
) {

    /** Device sentinel meaning "let the engine decide" */
    public static final String DEVICE_AUTO = "auto";

    public BenchmarkSpec {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        config = config == null ? ConfigMap.empty() : config;
        explicitNulls = explicitNulls == null ? Set.of() : Set.copyOf(explicitNulls);
        omitted = omitted == null ? Set.of() : Set.copyOf(omitted);
    }

    /**
     * Creates a benchmark with the given name and tasks and nothing else set.
     */
    public static BenchmarkSpec of(String name, List<String> tasks) {
        return new BenchmarkSpec(name, tasks, null, null, null, null, ConfigMap.empty(), Set.of(), Set.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public BenchmarkSpec withNumFewshot(Integer value) {
        return new BenchmarkSpec(name, tasks, value, batchSize, limit, device, config, explicitNulls, omitted);
    }

    public BenchmarkSpec withBatchSize(Integer value) {
        return new BenchmarkSpec(name, tasks, numFewshot, value, limit, device, config, explicitNulls, omitted);
    }

    public BenchmarkSpec withLimit(Integer value) {
        return new BenchmarkSpec(name, tasks, numFewshot, batchSize, value, device, config, explicitNulls, omitted);
    }

    public BenchmarkSpec withDevice(String value) {
        return new BenchmarkSpec(name, tasks, numFewshot, batchSize, limit, value, config, explicitNulls, omitted);
    }

    /**
     * Builder for BenchmarkSpec.
     */
    public static class Builder {
        private String name;
        private List<String> tasks;
        private Integer numFewshot;
        private Integer batchSize;
        private Integer limit;
        private String device;
        private ConfigMap config = ConfigMap.empty();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder tasks(List<String> tasks) {
            this.tasks = tasks;
            return this;
        }

        public Builder tasks(String... tasks) {
            this.tasks = List.of(tasks);
            return this;
        }

        public Builder numFewshot(Integer numFewshot) {
            this.numFewshot = numFewshot;
            return this;
        }

        public Builder batchSize(Integer batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder device(String device) {
            this.device = device;
            return this;
        }

        public Builder config(ConfigMap config) {
            this.config = config;
            return this;
        }

        public BenchmarkSpec build() {
            return new BenchmarkSpec(name, tasks, numFewshot, batchSize, limit, device, config, Set.of(), Set.of());
        }
    }
}
