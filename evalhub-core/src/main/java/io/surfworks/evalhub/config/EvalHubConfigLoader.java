package io.surfworks.evalhub.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.evalhub.json.JsonValues;
import io.surfworks.evalhub.model.BackendType;
import io.surfworks.evalhub.model.ConfigMap;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Loads and saves EvalHubConfig.
 *
 * <p>Configuration sources (in order of precedence):
 * <ol>
 *   <li>{@code with*} overrides applied by the caller</li>
 *   <li>Config file ({@code ~/.config/evalhub/evalhub.json} or an explicit path)</li>
 *   <li>Built-in defaults</li>
 * </ol>
 *
 * <p>A {@code backends} or {@code riskCategories} section in the file replaces the
 * corresponding built-in table as a whole; every other key overrides one value.
 */
public final class EvalHubConfigLoader {

    private static final Logger LOG = Logger.getLogger(EvalHubConfigLoader.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private EvalHubConfigLoader() {
    }

    /**
     * Loads configuration from the default config file, or defaults if there is none.
     *
     * @return the loaded configuration
     * @throws ConfigurationException if the file exists but cannot be used
     */
    public static EvalHubConfig load() throws ConfigurationException {
        Path configFile = EvalHubConfig.configFile();
        if (!Files.exists(configFile)) {
            LOG.fine("No config file at " + configFile + ", using defaults");
            return EvalHubConfig.defaults();
        }
        return load(configFile);
    }

    /**
     * Loads configuration from a specific file on top of the defaults.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public static EvalHubConfig load(Path configFile) throws ConfigurationException {
        if (!Files.isRegularFile(configFile)) {
            throw new ConfigurationException("Config file not found: " + configFile);
        }
        try {
            JsonNode root = JSON.readTree(configFile.toFile());
            if (root == null || !root.isObject()) {
                throw new ConfigurationException("Config file " + configFile + " must contain a JSON object");
            }
            EvalHubConfig config = apply(root, EvalHubConfig.defaults());
            LOG.info("Loaded configuration from " + configFile);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config file " + configFile + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid config file " + configFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(EvalHubConfig config, Path configFile) throws IOException {
        if (configFile.getParent() != null) {
            Files.createDirectories(configFile.getParent());
        }
        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), toJson(config));
    }

    /**
     * Renders a configuration as the JSON document {@link #load(Path)} accepts.
     */
    public static ObjectNode toJson(EvalHubConfig config) {
        ObjectNode root = JSON.createObjectNode();
        root.put("maxConcurrentEvaluations", config.maxConcurrentEvaluations());
        root.put("defaultTimeoutMinutes", config.defaultTimeoutMinutes());
        root.put("maxRetryAttempts", config.maxRetryAttempts());

        ObjectNode backends = root.putObject("backends");
        for (Map.Entry<String, ConfigMap> entry : config.backendConfigs().entrySet()) {
            ObjectNode backend = backends.putObject(entry.getKey());
            BackendType kind = config.backendKinds().get(entry.getKey());
            if (kind != null) {
                backend.put("kind", kind.id());
            }
            backend.set("config", JsonValues.toNode(JSON, entry.getValue().asMap()));
        }
        root.put("fallbackBackendKind", config.fallbackBackendKind().id());

        ObjectNode risk = root.putObject("riskCategories");
        for (Map.Entry<String, RiskCategoryProfile> entry : config.riskCategories().entrySet()) {
            ObjectNode category = risk.putObject(entry.getKey());
            ArrayNode names = category.putArray("benchmarks");
            entry.getValue().benchmarks().forEach(names::add);
            if (entry.getValue().numFewshot() != null) {
                category.put("numFewshot", entry.getValue().numFewshot());
            }
            if (entry.getValue().limit() != null) {
                category.put("limit", entry.getValue().limit());
            }
        }

        TrackingConfig tracking = config.tracking();
        ObjectNode trackingNode = root.putObject("tracking");
        trackingNode.put("enabled", tracking.enabled());
        trackingNode.put("trackingUri", tracking.trackingUri());
        trackingNode.put("experimentPrefix", tracking.experimentPrefix());
        if (tracking.artifactLocation() != null) {
            trackingNode.put("artifactLocation", tracking.artifactLocation());
        }

        ObjectNode callback = root.putObject("callback");
        callback.put("timeoutSeconds", config.callback().timeout().toSeconds());
        callback.put("retryAttempts", config.callback().retryAttempts());
        callback.put("retryDelayMillis", config.callback().retryDelay().toMillis());

        ObjectNode estimation = root.putObject("estimation");
        estimation.put("minutesPerBenchmark", config.estimation().minutesPerBenchmark());
        estimation.put("queuingPenalty", config.estimation().queuingPenalty());
        estimation.put("minimumMinutes", config.estimation().minimumMinutes());

        root.put("pollIntervalMillis", config.pollInterval().toMillis());
        root.put("requestRetentionSeconds", config.requestRetention().toSeconds());
        if (!config.executorCommand().isEmpty()) {
            ArrayNode command = root.putArray("executorCommand");
            config.executorCommand().forEach(command::add);
        }
        return root;
    }

    private static EvalHubConfig apply(JsonNode root, EvalHubConfig base) throws ConfigurationException {
        EvalHubConfig config = base
                .withMaxConcurrentEvaluations(getInt(root, "maxConcurrentEvaluations", base.maxConcurrentEvaluations()))
                .withDefaultTimeoutMinutes(getInt(root, "defaultTimeoutMinutes", base.defaultTimeoutMinutes()))
                .withMaxRetryAttempts(getInt(root, "maxRetryAttempts", base.maxRetryAttempts()));

        // Parse backend table
        if (root.has("backends")) {
            Map<String, ConfigMap> configs = new LinkedHashMap<>();
            Map<String, BackendType> kinds = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = root.get("backends").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode backendNode = field.getValue();
                configs.put(field.getKey(), JsonValues.toConfigMap(backendNode.get("config")));
                if (backendNode.has("kind")) {
                    kinds.put(field.getKey(), parseKind(backendNode.get("kind").asText()));
                }
            }
            config = config.withBackends(configs, kinds);
        }
        if (root.has("fallbackBackendKind")) {
            config = config.withFallbackBackendKind(parseKind(root.get("fallbackBackendKind").asText()));
        }

        // Parse risk category table
        if (root.has("riskCategories")) {
            Map<String, RiskCategoryProfile> risk = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = root.get("riskCategories").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode categoryNode = field.getValue();
                List<String> benchmarks = new ArrayList<>();
                for (JsonNode name : categoryNode.path("benchmarks")) {
                    benchmarks.add(name.asText());
                }
                Integer fewshot = categoryNode.hasNonNull("numFewshot") ? categoryNode.get("numFewshot").asInt() : null;
                Integer limit = categoryNode.hasNonNull("limit") ? categoryNode.get("limit").asInt() : null;
                risk.put(field.getKey(), RiskCategoryProfile.of(benchmarks, fewshot, limit));
            }
            config = config.withRiskCategories(risk);
        }

        // Parse tracking config
        if (root.has("tracking")) {
            JsonNode node = root.get("tracking");
            TrackingConfig tracking = base.tracking();
            tracking = tracking
                    .withEnabled(node.path("enabled").asBoolean(tracking.enabled()))
                    .withTrackingUri(getString(node, "trackingUri", tracking.trackingUri()))
                    .withExperimentPrefix(getString(node, "experimentPrefix", tracking.experimentPrefix()))
                    .withArtifactLocation(getString(node, "artifactLocation", tracking.artifactLocation()));
            config = config.withTracking(tracking);
        }

        // Parse callback config
        if (root.has("callback")) {
            JsonNode node = root.get("callback");
            CallbackConfig callback = base.callback();
            config = config.withCallback(new CallbackConfig(
                    Duration.ofSeconds(getInt(node, "timeoutSeconds", (int) callback.timeout().toSeconds())),
                    getInt(node, "retryAttempts", callback.retryAttempts()),
                    Duration.ofMillis(node.path("retryDelayMillis").asLong(callback.retryDelay().toMillis()))
            ));
        }

        if (root.has("estimation")) {
            JsonNode node = root.get("estimation");
            EstimationConfig estimation = base.estimation();
            config = config.withEstimation(new EstimationConfig(
                    getInt(node, "minutesPerBenchmark", estimation.minutesPerBenchmark()),
                    node.path("queuingPenalty").asDouble(estimation.queuingPenalty()),
                    getInt(node, "minimumMinutes", estimation.minimumMinutes())
            ));
        }

        if (root.has("pollIntervalMillis")) {
            config = config.withPollInterval(Duration.ofMillis(root.get("pollIntervalMillis").asLong()));
        }

        if (root.has("requestRetentionSeconds")) {
            config = config.withRequestRetention(Duration.ofSeconds(root.get("requestRetentionSeconds").asLong()));
        }

        if (root.has("executorCommand")) {
            List<String> command = new ArrayList<>();
            for (JsonNode part : root.get("executorCommand")) {
                command.add(part.asText());
            }
            config = config.withExecutorCommand(command);
        }

        return config;
    }

    private static BackendType parseKind(String id) throws ConfigurationException {
        return BackendType.fromId(id)
                .orElseThrow(() -> new ConfigurationException("Unknown backend kind: " + id));
    }

    private static String getString(JsonNode node, String field, String defaultValue) {
        if (node.hasNonNull(field)) {
            return node.get(field).asText();
        }
        return defaultValue;
    }

    private static int getInt(JsonNode node, String field, int defaultValue) {
        if (node.hasNonNull(field)) {
            return node.get(field).asInt();
        }
        return defaultValue;
    }
}
