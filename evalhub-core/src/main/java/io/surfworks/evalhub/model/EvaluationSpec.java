package io.surfworks.evalhub.model;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * One evaluation unit: a model plus either explicit backends or a risk category.
 *
 * @param id                 Unique evaluation ID (generated when not supplied)
 * @param name               Human-readable name (optional)
 * @param description        Description (optional)
 * @param modelName          Model identifier
 * @param modelConfiguration Model configuration
 * @param backends           Backends to run on (may be empty when a risk category is set)
 * @param riskCategory       Risk category label for automatic benchmark selection (optional)
 * @param priority           Higher is more urgent, unbounded
 * @param timeoutMinutes     Wall-clock budget for the unit
 * @param retryAttempts      Retries allowed after an execution failure
 * @param metadata           Free-form metadata
 * @param explicitNulls      Optional fields the caller sent as an explicit null
 * @param omitted            Defaulted fields the caller left out
 */
public record EvaluationSpec(
        String id,
        String name,
        String description,
        String modelName,
        ConfigMap modelConfiguration,
        List<BackendSpec> backends,
        String riskCategory,
        int priority,
        int timeoutMinutes,
        int retryAttempts,
        ConfigMap metadata,
        Set<String> explicitNulls,
        Set<String> omitted
) {

    /** Default timeout when the caller does not set one */
    public static final int DEFAULT_TIMEOUT_MINUTES = 60;

    /** Default retry budget when the caller does not set one */
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;

    public EvaluationSpec {
        id = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
        modelConfiguration = modelConfiguration == null ? ConfigMap.empty() : modelConfiguration;
        backends = backends == null ? List.of() : List.copyOf(backends);
        metadata = metadata == null ? ConfigMap.empty() : metadata;
        explicitNulls = explicitNulls == null ? Set.of() : Set.copyOf(explicitNulls);
        omitted = omitted == null ? Set.of() : Set.copyOf(omitted);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasBackends() {
        return !backends.isEmpty();
    }

    public boolean hasRiskCategory() {
        return riskCategory != null && !riskCategory.isBlank();
    }

    public Duration timeout() {
        return Duration.ofMinutes(timeoutMinutes);
    }

    /**
     * Returns the number of benchmark units across all backends.
     */
    public int benchmarkCount() {
        int count = 0;
        for (BackendSpec backend : backends) {
            count += backend.benchmarkCount();
        }
        return count;
    }

    /**
     * Returns a copy with the given backends, leaving everything else untouched.
     */
    public EvaluationSpec withBackends(List<BackendSpec> value) {
        return new EvaluationSpec(id, name, description, modelName, modelConfiguration, value,
                riskCategory, priority, timeoutMinutes, retryAttempts, metadata, explicitNulls, omitted);
    }

    /**
     * Builder for EvaluationSpec.
     */
    public static class Builder {
        private String id;
        private String name;
        private String description;
        private String modelName;
        private ConfigMap modelConfiguration = ConfigMap.empty();
        private List<BackendSpec> backends = List.of();
        private String riskCategory;
        private int priority;
        private int timeoutMinutes = DEFAULT_TIMEOUT_MINUTES;
        private int retryAttempts = DEFAULT_RETRY_ATTEMPTS;
        private ConfigMap metadata = ConfigMap.empty();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder modelConfiguration(ConfigMap modelConfiguration) {
            this.modelConfiguration = modelConfiguration;
            return this;
        }

        public Builder backends(List<BackendSpec> backends) {
            this.backends = backends;
            return this;
        }

        public Builder backends(BackendSpec... backends) {
            this.backends = List.of(backends);
            return this;
        }

        public Builder riskCategory(String riskCategory) {
            this.riskCategory = riskCategory;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder timeoutMinutes(int timeoutMinutes) {
            this.timeoutMinutes = timeoutMinutes;
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        public Builder metadata(ConfigMap metadata) {
            this.metadata = metadata;
            return this;
        }

        public EvaluationSpec build() {
            return new EvaluationSpec(id, name, description, modelName, modelConfiguration, backends,
                    riskCategory, priority, timeoutMinutes, retryAttempts, metadata, Set.of(), Set.of());
        }
    }
}
