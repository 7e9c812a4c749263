package io.surfworks.evalhub.tracking;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.evalhub.config.EvalHubConfig;
import io.surfworks.evalhub.config.TrackingConfig;
import io.surfworks.evalhub.model.EvaluationRequest;
import io.surfworks.evalhub.model.EvaluationSpec;
import io.surfworks.evalhub.result.EvaluationResult;
import io.surfworks.evalhub.status.EvaluationStatus;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Tracking sink backed by an MLflow tracking server (REST API 2.0).
 *
 * <p>Endpoints used:
 * <ul>
 *   <li>{@code GET  experiments/get-by-name}: reuse an experiment with the same name</li>
 *   <li>{@code POST experiments/create}: create the request's experiment</li>
 *   <li>{@code POST runs/create}: one run per evaluation unit</li>
 *   <li>{@code POST runs/log-batch}: parameters and metrics</li>
 *   <li>{@code POST runs/update}: final run status</li>
 * </ul>
 *
 * <p>Result metrics are logged as {@code <backend>/<benchmark>/<metric>}; numeric values
 * become MLflow metrics, anything else becomes a {@code metric_<name>} parameter.
 */
public final class MlflowTrackingSink implements TrackingSink {

    private static final Logger LOG = Logger.getLogger(MlflowTrackingSink.class.getName());

    private static final DateTimeFormatter NAME_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    /** MLflow rejects longer parameter values */
    static final int MAX_PARAM_VALUE_LENGTH = 500;

    /** MLflow accepts at most this many parameters per log-batch call */
    static final int MAX_PARAMS_PER_BATCH = 100;

    private final TrackingConfig config;
    private final String serviceVersion;
    private final HttpClient httpClient;
    private final ObjectMapper jsonMapper;

    public MlflowTrackingSink(TrackingConfig config) {
        this(config, EvalHubConfig.VERSION);
    }

    public MlflowTrackingSink(TrackingConfig config, String serviceVersion) {
        this.config = config;
        this.serviceVersion = serviceVersion;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectionTimeout())
                .build();
        this.jsonMapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return "mlflow";
    }

    @Override
    public String createExperiment(EvaluationRequest request) throws TrackingException {
        String experimentName = experimentName(request, config.experimentPrefix());

        JsonNode existing = get("experiments/get-by-name?experiment_name="
                + URLEncoder.encode(experimentName, StandardCharsets.UTF_8));
        if (existing != null) {
            String experimentId = existing.path("experiment").path("experiment_id").asText(null);
            if (experimentId != null) {
                LOG.info("Using existing MLflow experiment " + experimentName + " (" + experimentId + ")");
                return experimentId;
            }
        }

        ObjectNode body = jsonMapper.createObjectNode();
        body.put("name", experimentName);
        if (config.artifactLocation() != null) {
            body.put("artifact_location", config.artifactLocation());
        }
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("request_id", request.requestId());
        tags.put("created_at", request.createdAt().toString());
        tags.put("evaluation_count", String.valueOf(request.evaluations().size()));
        tags.put("service_version", serviceVersion);
        tags.putAll(request.tags());
        body.set("tags", keyValues(tags));

        JsonNode result = post("experiments/create", body);
        String experimentId = result.path("experiment_id").asText(null);
        if (experimentId == null) {
            throw new TrackingException("MLflow did not return an experiment ID for " + experimentName);
        }
        LOG.info("Created MLflow experiment " + experimentName + " (" + experimentId + ")");
        return experimentId;
    }

    @Override
    public String startRun(String experimentId, EvaluationSpec evaluation) throws TrackingException {
        ObjectNode body = jsonMapper.createObjectNode();
        body.put("experiment_id", experimentId);
        body.put("run_name", runName(evaluation));
        body.put("start_time", System.currentTimeMillis());

        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("evaluation_id", evaluation.id());
        tags.put("model_name", evaluation.modelName());
        tags.put("priority", String.valueOf(evaluation.priority()));
        if (evaluation.hasRiskCategory()) {
            tags.put("risk_category", evaluation.riskCategory());
        }
        body.set("tags", keyValues(tags));

        JsonNode result = post("runs/create", body);
        String runId = result.path("run").path("info").path("run_id").asText(null);
        if (runId == null) {
            throw new TrackingException("MLflow did not return a run ID for evaluation " + evaluation.id());
        }
        LOG.fine("Started MLflow run " + runId + " for evaluation " + evaluation.id());
        return runId;
    }

    @Override
    public void logParameters(String runId, Map<String, String> parameters) throws TrackingException {
        List<Map.Entry<String, String>> entries = new ArrayList<>(parameters.entrySet());
        for (int start = 0; start < entries.size(); start += MAX_PARAMS_PER_BATCH) {
            ObjectNode body = jsonMapper.createObjectNode();
            body.put("run_id", runId);
            ArrayNode params = body.putArray("params");
            for (Map.Entry<String, String> entry : entries.subList(start,
                    Math.min(entries.size(), start + MAX_PARAMS_PER_BATCH))) {
                params.addObject()
                        .put("key", entry.getKey())
                        .put("value", truncate(entry.getValue()));
            }
            post("runs/log-batch", body);
        }
    }

    @Override
    public void logResult(String runId, EvaluationResult result) throws TrackingException {
        String prefix = result.backendName() + "/" + result.benchmarkName() + "/";
        long timestamp = System.currentTimeMillis();

        ObjectNode body = jsonMapper.createObjectNode();
        body.put("run_id", runId);
        ArrayNode metrics = body.putArray("metrics");
        ArrayNode params = body.putArray("params");

        for (Map.Entry<String, Object> metric : result.metrics().entrySet()) {
            if (metric.getValue() instanceof Number number) {
                metrics.addObject()
                        .put("key", prefix + metric.getKey())
                        .put("value", number.doubleValue())
                        .put("timestamp", timestamp)
                        .put("step", 0);
            } else {
                params.addObject()
                        .put("key", prefix + "metric_" + metric.getKey())
                        .put("value", truncate(String.valueOf(metric.getValue())));
            }
        }

        Duration duration = result.duration();
        if (duration != null) {
            metrics.addObject()
                    .put("key", prefix + "duration_seconds")
                    .put("value", duration.toMillis() / 1000.0)
                    .put("timestamp", timestamp)
                    .put("step", 0);
        }
        params.addObject().put("key", prefix + "status").put("value", result.status().id());
        if (result.errorMessage() != null) {
            params.addObject().put("key", prefix + "error_message").put("value", truncate(result.errorMessage()));
        }
        for (Map.Entry<String, String> artifact : result.artifacts().entrySet()) {
            params.addObject()
                    .put("key", prefix + "artifact_" + artifact.getKey())
                    .put("value", truncate(artifact.getValue()));
        }

        post("runs/log-batch", body);
    }

    @Override
    public void endRun(String runId, EvaluationStatus status) throws TrackingException {
        ObjectNode body = jsonMapper.createObjectNode();
        body.put("run_id", runId);
        body.put("status", runStatus(status));
        body.put("end_time", System.currentTimeMillis());
        post("runs/update", body);
    }

    @Override
    public String experimentUrl(String experimentId) {
        return config.baseUrl() + "/#/experiments/" + experimentId;
    }

    /**
     * {@code <prefix>_<name>} where name is the request's experiment name, or
     * {@code <model>_<timestamp>} for a single-model request, or
     * {@code multi_model_<timestamp>}.
     */
    static String experimentName(EvaluationRequest request, String prefix) {
        String baseName;
        if (request.experimentName() != null && !request.experimentName().isBlank()) {
            baseName = request.experimentName();
        } else {
            String timestamp = NAME_TIMESTAMP.format(request.createdAt());
            Set<String> models = new LinkedHashSet<>();
            for (EvaluationSpec evaluation : request.evaluations()) {
                models.add(evaluation.modelName());
            }
            baseName = models.size() == 1
                    ? models.iterator().next() + "_" + timestamp
                    : "multi_model_" + timestamp;
        }
        return prefix + "_" + baseName;
    }

    static String runStatus(EvaluationStatus status) {
        return switch (status) {
            case COMPLETED -> "FINISHED";
            case CANCELLED -> "KILLED";
            default -> "FAILED";
        };
    }

    private static String runName(EvaluationSpec evaluation) {
        if (evaluation.name() != null && !evaluation.name().isBlank()) {
            return evaluation.name();
        }
        return evaluation.modelName() + "_" + evaluation.id().substring(0, Math.min(8, evaluation.id().length()));
    }

    private ArrayNode keyValues(Map<String, String> values) {
        ArrayNode array = jsonMapper.createArrayNode();
        values.forEach((key, value) -> array.addObject().put("key", key).put("value", value));
        return array;
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_PARAM_VALUE_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_PARAM_VALUE_LENGTH);
    }

    private JsonNode post(String endpoint, ObjectNode body) throws TrackingException {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(config.apiUrl() + endpoint))
                    .header("Content-Type", "application/json")
                    .timeout(config.requestTimeout())
                    .POST(HttpRequest.BodyPublishers.ofString(jsonMapper.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new TrackingException("MLflow " + endpoint + " failed (HTTP "
                        + response.statusCode() + "): " + response.body());
            }
            return response.body().isBlank()
                    ? jsonMapper.createObjectNode()
                    : jsonMapper.readTree(response.body());

        } catch (IllegalArgumentException e) {
            throw new TrackingException("Invalid MLflow URL " + config.apiUrl() + endpoint + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new TrackingException("Failed to call MLflow " + endpoint, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrackingException("Interrupted while calling MLflow " + endpoint, e);
        }
    }

    /**
     * GETs an endpoint; returns null on 404.
     */
    private JsonNode get(String endpoint) throws TrackingException {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(config.apiUrl() + endpoint))
                    .timeout(config.requestTimeout())
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() == 404) {
                return null;
            }
            if (response.statusCode() != 200) {
                throw new TrackingException("MLflow " + endpoint + " failed (HTTP "
                        + response.statusCode() + "): " + response.body());
            }
            return jsonMapper.readTree(response.body());

        } catch (IllegalArgumentException e) {
            throw new TrackingException("Invalid MLflow URL " + config.apiUrl() + endpoint + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new TrackingException("Failed to call MLflow " + endpoint, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrackingException("Interrupted while calling MLflow " + endpoint, e);
        }
    }
}
