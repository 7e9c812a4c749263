package io.surfworks.evalhub.config;

import io.surfworks.evalhub.model.BackendType;
import io.surfworks.evalhub.model.ConfigMap;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for evalhub.
 *
 * <p>One instance is built at startup (see {@link EvalHubConfigLoader}) and handed to
 * each component's constructor. Tests start from {@link #defaults()} and adjust it
 * with the {@code with*} methods.
 *
 * @param version                  Service version, recorded on tracking experiments
 * @param maxConcurrentEvaluations Ceiling on simultaneously in-flight evaluation units
 * @param defaultTimeoutMinutes    Timeout for units that do not set one
 * @param maxRetryAttempts         Upper bound on any unit's retry budget
 * @param backendConfigs           Known backends and their default configuration, in expansion order
 * @param backendKinds             Backend name to kind, used when synthesizing backends
 * @param fallbackBackendKind      Kind for synthesized backends missing from {@code backendKinds}
 * @param riskCategories           Risk category label to benchmark selection
 * @param tracking                 Tracking server settings
 * @param callback                 Callback delivery settings
 * @param estimation               Completion-time estimation constants
 * @param pollInterval             Delay between executor status polls
 * @param executorCommand          Command line for the external executor (may be empty)
 * @param requestRetention         How long a finished request stays queryable before it is evicted
 */
public record EvalHubConfig(
        String version,
        int maxConcurrentEvaluations,
        int defaultTimeoutMinutes,
        int maxRetryAttempts,
        Map<String, ConfigMap> backendConfigs,
        Map<String, BackendType> backendKinds,
        BackendType fallbackBackendKind,
        Map<String, RiskCategoryProfile> riskCategories,
        TrackingConfig tracking,
        CallbackConfig callback,
        EstimationConfig estimation,
        Duration pollInterval,
        List<String> executorCommand,
        Duration requestRetention
) {

    public static final String VERSION = "0.1.0";

    /** Backend identifier of the few-shot evaluation harness */
    public static final String LM_EVAL_BACKEND = "lm-evaluation-harness";

    /** Backend identifier of the load-testing tool */
    public static final String GUIDELLM_BACKEND = "guidellm";

    public static final int DEFAULT_MAX_CONCURRENT = 10;
    public static final int DEFAULT_TIMEOUT_MINUTES = 60;
    public static final int DEFAULT_MAX_RETRY_ATTEMPTS = 3;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_REQUEST_RETENTION = Duration.ofHours(1);

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "evalhub"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "evalhub.json";

    public EvalHubConfig {
        Objects.requireNonNull(version, "version cannot be null");
        Objects.requireNonNull(backendConfigs, "backendConfigs cannot be null");
        Objects.requireNonNull(backendKinds, "backendKinds cannot be null");
        Objects.requireNonNull(fallbackBackendKind, "fallbackBackendKind cannot be null");
        Objects.requireNonNull(riskCategories, "riskCategories cannot be null");
        Objects.requireNonNull(tracking, "tracking cannot be null");
        Objects.requireNonNull(callback, "callback cannot be null");
        Objects.requireNonNull(estimation, "estimation cannot be null");
        Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
        Objects.requireNonNull(requestRetention, "requestRetention cannot be null");

        if (maxConcurrentEvaluations <= 0) {
            throw new IllegalArgumentException("maxConcurrentEvaluations must be positive");
        }
        if (defaultTimeoutMinutes <= 0) {
            throw new IllegalArgumentException("defaultTimeoutMinutes must be positive");
        }
        if (maxRetryAttempts < 0) {
            throw new IllegalArgumentException("maxRetryAttempts cannot be negative");
        }
        if (requestRetention.isNegative()) {
            throw new IllegalArgumentException("requestRetention cannot be negative");
        }

        // expansion walks backends in declaration order, so keep it
        backendConfigs = Collections.unmodifiableMap(new LinkedHashMap<>(backendConfigs));
        backendKinds = Collections.unmodifiableMap(new LinkedHashMap<>(backendKinds));
        riskCategories = Collections.unmodifiableMap(new LinkedHashMap<>(riskCategories));
        executorCommand = executorCommand == null ? List.of() : List.copyOf(executorCommand);
    }

    /**
     * Returns the built-in configuration.
     */
    public static EvalHubConfig defaults() {
        Map<String, ConfigMap> backends = new LinkedHashMap<>();
        backends.put(LM_EVAL_BACKEND, ConfigMap.of(
                "image", "eval-harness:latest",
                "resources", Map.of("cpu", "2", "memory", "4Gi"),
                "timeout", 3600));
        backends.put(GUIDELLM_BACKEND, ConfigMap.of(
                "image", "guidellm:latest",
                "resources", Map.of("cpu", "1", "memory", "2Gi"),
                "timeout", 1800));

        Map<String, BackendType> kinds = new LinkedHashMap<>();
        kinds.put(LM_EVAL_BACKEND, BackendType.LM_EVALUATION_HARNESS);
        kinds.put(GUIDELLM_BACKEND, BackendType.GUIDELLM);

        List<String> low = List.of("hellaswag", "arc_easy");
        List<String> medium = List.of("hellaswag", "arc_easy", "arc_challenge", "winogrande");
        List<String> high = List.of("hellaswag", "arc_easy", "arc_challenge", "winogrande", "mmlu");
        List<String> critical = List.of("hellaswag", "arc_easy", "arc_challenge", "winogrande", "mmlu", "gsm8k");

        Map<String, RiskCategoryProfile> risk = new LinkedHashMap<>();
        risk.put("low", RiskCategoryProfile.of(low, 5, 100));
        risk.put("medium", RiskCategoryProfile.of(medium, 5, 500));
        risk.put("high", RiskCategoryProfile.of(high, 5, 1000));
        risk.put("critical", RiskCategoryProfile.of(critical, 5, null));

        return new EvalHubConfig(
                VERSION,
                DEFAULT_MAX_CONCURRENT,
                DEFAULT_TIMEOUT_MINUTES,
                DEFAULT_MAX_RETRY_ATTEMPTS,
                backends,
                kinds,
                BackendType.GUIDELLM,
                risk,
                TrackingConfig.defaults(),
                CallbackConfig.defaults(),
                EstimationConfig.defaults(),
                DEFAULT_POLL_INTERVAL,
                List.of(),
                DEFAULT_REQUEST_RETENTION
        );
    }

    /**
     * Returns the config file path.
     */
    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    /**
     * Returns true if the backend name is one the system knows how to run.
     */
    public boolean isKnownBackend(String name) {
        return backendConfigs.containsKey(name);
    }

    /**
     * Returns the default configuration for a backend, or an empty map for unknown ones.
     */
    public ConfigMap backendDefaults(String name) {
        ConfigMap defaults = backendConfigs.get(name);
        return defaults == null ? ConfigMap.empty() : defaults;
    }

    public EvalHubConfig withMaxConcurrentEvaluations(int value) {
        return new EvalHubConfig(version, value, defaultTimeoutMinutes, maxRetryAttempts,
                backendConfigs, backendKinds, fallbackBackendKind, riskCategories,
                tracking, callback, estimation, pollInterval, executorCommand, requestRetention);
    }

    public EvalHubConfig withDefaultTimeoutMinutes(int value) {
        return new EvalHubConfig(version, maxConcurrentEvaluations, value, maxRetryAttempts,
                backendConfigs, backendKinds, fallbackBackendKind, riskCategories,
                tracking, callback, estimation, pollInterval, executorCommand, requestRetention);
    }

    public EvalHubConfig withMaxRetryAttempts(int value) {
        return new EvalHubConfig(version, maxConcurrentEvaluations, defaultTimeoutMinutes, value,
                backendConfigs, backendKinds, fallbackBackendKind, riskCategories,
                tracking, callback, estimation, pollInterval, executorCommand, requestRetention);
    }

    /**
     * Returns a new config with the backend table replaced.
     */
    public EvalHubConfig withBackends(Map<String, ConfigMap> configs, Map<String, BackendType> kinds) {
        return new EvalHubConfig(version, maxConcurrentEvaluations, defaultTimeoutMinutes, maxRetryAttempts,
                configs, kinds, fallbackBackendKind, riskCategories,
                tracking, callback, estimation, pollInterval, executorCommand, requestRetention);
    }

    /**
     * Returns a new config with one backend added or replaced.
     */
    public EvalHubConfig withBackend(String name, BackendType kind, ConfigMap defaults) {
        Map<String, ConfigMap> configs = new LinkedHashMap<>(backendConfigs);
        configs.put(name, defaults);
        Map<String, BackendType> kinds = new LinkedHashMap<>(backendKinds);
        kinds.put(name, kind);
        return withBackends(configs, kinds);
    }

    public EvalHubConfig withFallbackBackendKind(BackendType value) {
        return new EvalHubConfig(version, maxConcurrentEvaluations, defaultTimeoutMinutes, maxRetryAttempts,
                backendConfigs, backendKinds, value, riskCategories,
                tracking, callback, estimation, pollInterval, executorCommand, requestRetention);
    }

    public EvalHubConfig withRiskCategories(Map<String, RiskCategoryProfile> value) {
        return new EvalHubConfig(version, maxConcurrentEvaluations, defaultTimeoutMinutes, maxRetryAttempts,
                backendConfigs, backendKinds, fallbackBackendKind, value,
                tracking, callback, estimation, pollInterval, executorCommand, requestRetention);
    }

    /**
     * Returns a new config with one risk category added or replaced.
     */
    public EvalHubConfig withRiskCategory(String name, RiskCategoryProfile profile) {
        Map<String, RiskCategoryProfile> risk = new LinkedHashMap<>(riskCategories);
        risk.put(name, profile);
        return withRiskCategories(risk);
    }

    public EvalHubConfig withTracking(TrackingConfig value) {
        return new EvalHubConfig(version, maxConcurrentEvaluations, defaultTimeoutMinutes, maxRetryAttempts,
                backendConfigs, backendKinds, fallbackBackendKind, riskCategories,
                value, callback, estimation, pollInterval, executorCommand, requestRetention);
    }

    public EvalHubConfig withCallback(CallbackConfig value) {
        return new EvalHubConfig(version, maxConcurrentEvaluations, defaultTimeoutMinutes, maxRetryAttempts,
                backendConfigs, backendKinds, fallbackBackendKind, riskCategories,
                tracking, value, estimation, pollInterval, executorCommand, requestRetention);
    }

    public EvalHubConfig withEstimation(EstimationConfig value) {
        return new EvalHubConfig(version, maxConcurrentEvaluations, defaultTimeoutMinutes, maxRetryAttempts,
                backendConfigs, backendKinds, fallbackBackendKind, riskCategories,
                tracking, callback, value, pollInterval, executorCommand, requestRetention);
    }

    public EvalHubConfig withPollInterval(Duration value) {
        return new EvalHubConfig(version, maxConcurrentEvaluations, defaultTimeoutMinutes, maxRetryAttempts,
                backendConfigs, backendKinds, fallbackBackendKind, riskCategories,
                tracking, callback, estimation, value, executorCommand, requestRetention);
    }

    public EvalHubConfig withExecutorCommand(List<String> value) {
        return new EvalHubConfig(version, maxConcurrentEvaluations, defaultTimeoutMinutes, maxRetryAttempts,
                backendConfigs, backendKinds, fallbackBackendKind, riskCategories,
                tracking, callback, estimation, pollInterval, value, requestRetention);
    }

    public EvalHubConfig withRequestRetention(Duration value) {
        return new EvalHubConfig(version, maxConcurrentEvaluations, defaultTimeoutMinutes, maxRetryAttempts,
                backendConfigs, backendKinds, fallbackBackendKind, riskCategories,
                tracking, callback, estimation, pollInterval, executorCommand, value);
    }
}
