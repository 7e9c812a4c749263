package io.surfworks.evalhub.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.evalhub.config.EvalHubConfig;
import io.surfworks.evalhub.model.BackendSpec;
import io.surfworks.evalhub.model.BackendType;
import io.surfworks.evalhub.model.BenchmarkSpec;
import io.surfworks.evalhub.model.ConfigMap;
import io.surfworks.evalhub.model.EvaluationRequest;
import io.surfworks.evalhub.model.EvaluationSpec;
import io.surfworks.evalhub.result.EvaluationResponse;
import io.surfworks.evalhub.result.EvaluationResult;
import io.surfworks.evalhub.validation.ValidationException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes the JSON wire form of requests and responses.
 *
 * <p>Field names are snake_case. Optional fields keep the difference between being
 * absent and being sent as {@code null}: a field read as an explicit null is written
 * back as {@code null}, an absent one is omitted. Fields that take a default when
 * missing (collections, maps, priority, timeout, retries, async mode) follow the same
 * rule for as long as they still hold that default; once something else sets them they
 * are written out.
 *
 * <p>Any decoding problem (malformed document, wrong value type) is reported as a
 * {@link ValidationException} whose path names the offending value.
 */
public final class EvalHubJson {

    // Fields that read as a default when absent or null
    private static final List<String> REQUEST_DEFAULTED = List.of("evaluations", "tags", "async_mode");
    private static final List<String> EVALUATION_DEFAULTED = List.of(
            "model_configuration", "backends", "priority", "timeout_minutes", "retry_attempts", "metadata");
    private static final List<String> BACKEND_DEFAULTED = List.of("config", "benchmarks");
    private static final List<String> BENCHMARK_DEFAULTED = List.of("tasks", "config");

    private final ObjectMapper mapper;
    private final int defaultTimeoutMinutes;

    public EvalHubJson() {
        this(EvalHubConfig.defaults());
    }

    public EvalHubJson(EvalHubConfig config) {
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.defaultTimeoutMinutes = config.defaultTimeoutMinutes();
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    // ===== Requests =====

    /**
     * Parses a request document.
     *
     * @throws ValidationException if the document is malformed or a value has the wrong type
     */
    public EvaluationRequest readRequest(String json) throws ValidationException {
        return readRequest(parse(json));
    }

    public EvaluationRequest readRequest(JsonNode root) throws ValidationException {
        requireObject(root, "$");

        Set<String> nulls = new HashSet<>();
        Set<String> omitted = new HashSet<>();
        for (String field : REQUEST_DEFAULTED) {
            presence(root, field, nulls, omitted);
        }

        List<EvaluationSpec> evaluations = new ArrayList<>();
        JsonNode evaluationsNode = root.get("evaluations");
        if (evaluationsNode != null && !evaluationsNode.isNull()) {
            requireArray(evaluationsNode, "evaluations");
            for (int i = 0; i < evaluationsNode.size(); i++) {
                evaluations.add(readEvaluation(evaluationsNode.get(i), "evaluations[" + i + "]"));
            }
        }

        return new EvaluationRequest(
                optionalString(root, "request_id", "request_id", null),
                evaluations,
                optionalString(root, "experiment_name", "experiment_name", nulls),
                stringMap(root.get("tags"), "tags"),
                optionalBoolean(root, "async_mode", "async_mode", true),
                optionalString(root, "callback_url", "callback_url", nulls),
                optionalInstant(root, "created_at", "created_at"),
                nulls,
                omitted
        );
    }

    public ObjectNode writeRequest(EvaluationRequest request) {
        Set<String> nulls = request.explicitNulls();
        Set<String> omitted = request.omitted();
        ObjectNode root = mapper.createObjectNode();
        root.put("request_id", request.requestId());
        if (!writtenAsDefault(root, "evaluations", request.evaluations().isEmpty(), nulls, omitted)) {
            ArrayNode evaluations = root.putArray("evaluations");
            for (EvaluationSpec evaluation : request.evaluations()) {
                evaluations.add(writeEvaluation(evaluation));
            }
        }
        putOptional(root, "experiment_name", request.experimentName(), nulls);
        if (!writtenAsDefault(root, "tags", request.tags().isEmpty(), nulls, omitted)) {
            ObjectNode tags = root.putObject("tags");
            request.tags().forEach(tags::put);
        }
        if (!writtenAsDefault(root, "async_mode", request.asyncMode(), nulls, omitted)) {
            root.put("async_mode", request.asyncMode());
        }
        putOptional(root, "callback_url", request.callbackUrl(), nulls);
        root.put("created_at", request.createdAt().toString());
        return root;
    }

    // ===== Evaluation units =====

    public EvaluationSpec readEvaluation(JsonNode node, String path) throws ValidationException {
        requireObject(node, path);
        Set<String> nulls = new HashSet<>();
        Set<String> omitted = new HashSet<>();
        for (String field : EVALUATION_DEFAULTED) {
            presence(node, field, nulls, omitted);
        }

        List<BackendSpec> backends = new ArrayList<>();
        JsonNode backendsNode = node.get("backends");
        if (backendsNode != null && !backendsNode.isNull()) {
            requireArray(backendsNode, path + ".backends");
            for (int j = 0; j < backendsNode.size(); j++) {
                backends.add(readBackend(backendsNode.get(j), path + ".backends[" + j + "]"));
            }
        }

        return new EvaluationSpec(
                optionalString(node, "id", path + ".id", null),
                optionalString(node, "name", path + ".name", nulls),
                optionalString(node, "description", path + ".description", nulls),
                optionalString(node, "model_name", path + ".model_name", null),
                configMap(node.get("model_configuration"), path + ".model_configuration"),
                backends,
                optionalString(node, "risk_category", path + ".risk_category", nulls),
                optionalInt(node, "priority", path + ".priority", 0),
                optionalInt(node, "timeout_minutes", path + ".timeout_minutes", defaultTimeoutMinutes),
                optionalInt(node, "retry_attempts", path + ".retry_attempts", EvaluationSpec.DEFAULT_RETRY_ATTEMPTS),
                configMap(node.get("metadata"), path + ".metadata"),
                nulls,
                omitted
        );
    }

    /**
     * Writes a unit in its wire form, keeping the caller's absent and null fields.
     */
    public ObjectNode writeEvaluation(EvaluationSpec evaluation) {
        return writeEvaluation(evaluation, false);
    }

    /**
     * Writes a unit with every field set to its effective value, defaults included.
     * This is the form handed to executors.
     */
    public ObjectNode writeEffectiveEvaluation(EvaluationSpec evaluation) {
        return writeEvaluation(evaluation, true);
    }

    private ObjectNode writeEvaluation(EvaluationSpec evaluation, boolean effective) {
        Set<String> nulls = effective ? Set.of() : evaluation.explicitNulls();
        Set<String> omitted = effective ? Set.of() : evaluation.omitted();
        ObjectNode node = mapper.createObjectNode();
        node.put("id", evaluation.id());
        putOptional(node, "name", evaluation.name(), evaluation.explicitNulls());
        putOptional(node, "description", evaluation.description(), evaluation.explicitNulls());
        node.put("model_name", evaluation.modelName());
        if (!writtenAsDefault(node, "model_configuration", evaluation.modelConfiguration().isEmpty(),
                nulls, omitted)) {
            node.set("model_configuration", configNode(evaluation.modelConfiguration()));
        }
        if (!writtenAsDefault(node, "backends", evaluation.backends().isEmpty(), nulls, omitted)) {
            ArrayNode backends = node.putArray("backends");
            for (BackendSpec backend : evaluation.backends()) {
                backends.add(writeBackend(backend, effective));
            }
        }
        putOptional(node, "risk_category", evaluation.riskCategory(), evaluation.explicitNulls());
        if (!writtenAsDefault(node, "priority", evaluation.priority() == 0, nulls, omitted)) {
            node.put("priority", evaluation.priority());
        }
        if (!writtenAsDefault(node, "timeout_minutes", evaluation.timeoutMinutes() == defaultTimeoutMinutes,
                nulls, omitted)) {
            node.put("timeout_minutes", evaluation.timeoutMinutes());
        }
        if (!writtenAsDefault(node, "retry_attempts",
                evaluation.retryAttempts() == EvaluationSpec.DEFAULT_RETRY_ATTEMPTS, nulls, omitted)) {
            node.put("retry_attempts", evaluation.retryAttempts());
        }
        if (!writtenAsDefault(node, "metadata", evaluation.metadata().isEmpty(), nulls, omitted)) {
            node.set("metadata", configNode(evaluation.metadata()));
        }
        return node;
    }

    private BackendSpec readBackend(JsonNode node, String path) throws ValidationException {
        requireObject(node, path);
        Set<String> nulls = new HashSet<>();
        Set<String> omitted = new HashSet<>();
        for (String field : BACKEND_DEFAULTED) {
            presence(node, field, nulls, omitted);
        }

        BackendType type = null;
        String typeId = optionalString(node, "type", path + ".type", nulls);
        if (typeId != null) {
            type = BackendType.fromId(typeId).orElseThrow(() -> new ValidationException(
                    path + ".type", "unknown backend type '" + typeId + "'"));
        }

        List<BenchmarkSpec> benchmarks = new ArrayList<>();
        JsonNode benchmarksNode = node.get("benchmarks");
        if (benchmarksNode != null && !benchmarksNode.isNull()) {
            requireArray(benchmarksNode, path + ".benchmarks");
            for (int k = 0; k < benchmarksNode.size(); k++) {
                benchmarks.add(readBenchmark(benchmarksNode.get(k), path + ".benchmarks[" + k + "]"));
            }
        }

        return new BackendSpec(
                optionalString(node, "name", path + ".name", null),
                type,
                optionalString(node, "endpoint", path + ".endpoint", nulls),
                configMap(node.get("config"), path + ".config"),
                benchmarks,
                nulls,
                omitted
        );
    }

    private ObjectNode writeBackend(BackendSpec backend, boolean effective) {
        Set<String> nulls = effective ? Set.of() : backend.explicitNulls();
        Set<String> omitted = effective ? Set.of() : backend.omitted();
        ObjectNode node = mapper.createObjectNode();
        node.put("name", backend.name());
        putOptional(node, "type", backend.type() != null ? backend.type().id() : null, backend.explicitNulls());
        putOptional(node, "endpoint", backend.endpoint(), backend.explicitNulls());
        if (!writtenAsDefault(node, "config", backend.config().isEmpty(), nulls, omitted)) {
            node.set("config", configNode(backend.config()));
        }
        if (!writtenAsDefault(node, "benchmarks", backend.benchmarks().isEmpty(), nulls, omitted)) {
            ArrayNode benchmarks = node.putArray("benchmarks");
            for (BenchmarkSpec benchmark : backend.benchmarks()) {
                benchmarks.add(writeBenchmark(benchmark, effective));
            }
        }
        return node;
    }

    private BenchmarkSpec readBenchmark(JsonNode node, String path) throws ValidationException {
        requireObject(node, path);
        Set<String> nulls = new HashSet<>();
        Set<String> omitted = new HashSet<>();
        for (String field : BENCHMARK_DEFAULTED) {
            presence(node, field, nulls, omitted);
        }

        List<String> tasks = new ArrayList<>();
        JsonNode tasksNode = node.get("tasks");
        if (tasksNode != null && !tasksNode.isNull()) {
            requireArray(tasksNode, path + ".tasks");
            for (int t = 0; t < tasksNode.size(); t++) {
                JsonNode task = tasksNode.get(t);
                if (!task.isTextual()) {
                    throw new ValidationException(path + ".tasks[" + t + "]", "must be a string");
                }
                tasks.add(task.asText());
            }
        }

        return new BenchmarkSpec(
                optionalString(node, "name", path + ".name", null),
                tasks,
                optionalInteger(node, "num_fewshot", path + ".num_fewshot", nulls),
                optionalInteger(node, "batch_size", path + ".batch_size", nulls),
                optionalInteger(node, "limit", path + ".limit", nulls),
                optionalString(node, "device", path + ".device", nulls),
                configMap(node.get("config"), path + ".config"),
                nulls,
                omitted
        );
    }

    private ObjectNode writeBenchmark(BenchmarkSpec benchmark, boolean effective) {
        Set<String> nulls = effective ? Set.of() : benchmark.explicitNulls();
        Set<String> omitted = effective ? Set.of() : benchmark.omitted();
        ObjectNode node = mapper.createObjectNode();
        node.put("name", benchmark.name());
        if (!writtenAsDefault(node, "tasks", benchmark.tasks().isEmpty(), nulls, omitted)) {
            ArrayNode tasks = node.putArray("tasks");
            benchmark.tasks().forEach(tasks::add);
        }
        putOptional(node, "num_fewshot", benchmark.numFewshot(), benchmark.explicitNulls());
        putOptional(node, "batch_size", benchmark.batchSize(), benchmark.explicitNulls());
        putOptional(node, "limit", benchmark.limit(), benchmark.explicitNulls());
        putOptional(node, "device", benchmark.device(), benchmark.explicitNulls());
        if (!writtenAsDefault(node, "config", benchmark.config().isEmpty(), nulls, omitted)) {
            node.set("config", configNode(benchmark.config()));
        }
        return node;
    }

    // ===== Responses =====

    public ObjectNode writeResponse(EvaluationResponse response) {
        ObjectNode root = mapper.createObjectNode();
        root.put("request_id", response.requestId());
        root.put("status", response.status().id());
        root.put("total_evaluations", response.totalEvaluations());
        root.put("completed_evaluations", response.completedEvaluations());
        root.put("failed_evaluations", response.failedEvaluations());
        ArrayNode results = root.putArray("results");
        for (EvaluationResult result : response.results()) {
            results.add(writeResult(result));
        }
        root.set("aggregated_metrics", JsonValues.toNode(mapper, response.aggregatedMetrics()));
        root.put("experiment_url", response.experimentUrl());
        root.put("created_at", response.createdAt().toString());
        root.put("updated_at", response.updatedAt().toString());
        root.put("estimated_completion",
                response.estimatedCompletion() != null ? response.estimatedCompletion().toString() : null);
        root.put("progress_percentage", response.progressPercentage());
        if (response.callbackError() != null) {
            root.put("callback_error", response.callbackError());
        }
        return root;
    }

    public ObjectNode writeResult(EvaluationResult result) {
        ObjectNode node = mapper.createObjectNode();
        node.put("evaluation_id", result.evaluationId());
        node.put("backend_name", result.backendName());
        node.put("benchmark_name", result.benchmarkName());
        node.put("status", result.status().id());
        node.set("metrics", JsonValues.toNode(mapper, result.metrics()));
        node.set("artifacts", JsonValues.toNode(mapper, result.artifacts()));
        node.put("error_message", result.errorMessage());
        node.put("started_at", result.startedAt() != null ? result.startedAt().toString() : null);
        node.put("completed_at", result.completedAt() != null ? result.completedAt().toString() : null);
        Duration duration = result.duration();
        if (duration != null) {
            node.put("duration_seconds", duration.toMillis() / 1000.0);
        } else {
            node.putNull("duration_seconds");
        }
        node.put("tracking_run_id", result.trackingRunId());
        return node;
    }

    // ===== Text =====

    public String toJson(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // Trees built by this class only hold JSON-native values
            throw new IllegalStateException("Failed to serialize JSON tree", e);
        }
    }

    public JsonNode parse(String json) throws ValidationException {
        try {
            JsonNode root = mapper.readTree(json);
            if (root == null || root.isMissingNode()) {
                throw new ValidationException("$", "document is empty");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ValidationException("$", "malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    // ===== Field helpers =====

    private static void requireObject(JsonNode node, String path) throws ValidationException {
        if (node == null || !node.isObject()) {
            throw new ValidationException(path, "must be a JSON object");
        }
    }

    private static void requireArray(JsonNode node, String path) throws ValidationException {
        if (!node.isArray()) {
            throw new ValidationException(path, "must be an array");
        }
    }

    private static String optionalString(JsonNode parent, String field, String path, Set<String> nulls)
            throws ValidationException {
        JsonNode node = parent.get(field);
        if (node == null) {
            return null;
        }
        if (node.isNull()) {
            if (nulls != null) {
                nulls.add(field);
            }
            return null;
        }
        if (!node.isTextual()) {
            throw new ValidationException(path, "must be a string");
        }
        return node.asText();
    }

    private static Integer optionalInteger(JsonNode parent, String field, String path, Set<String> nulls)
            throws ValidationException {
        JsonNode node = parent.get(field);
        if (node == null) {
            return null;
        }
        if (node.isNull()) {
            nulls.add(field);
            return null;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new ValidationException(path, "must be an integer");
        }
        return node.intValue();
    }

    private static int optionalInt(JsonNode parent, String field, String path, int defaultValue)
            throws ValidationException {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new ValidationException(path, "must be an integer");
        }
        return node.intValue();
    }

    private static boolean optionalBoolean(JsonNode parent, String field, String path, boolean defaultValue)
            throws ValidationException {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isBoolean()) {
            throw new ValidationException(path, "must be a boolean");
        }
        return node.booleanValue();
    }

    private static Instant optionalInstant(JsonNode parent, String field, String path)
            throws ValidationException {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new ValidationException(path, "must be an ISO-8601 timestamp");
        }
        String text = node.asText();
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            // Timestamps without an offset are taken as UTC
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException inner) {
                throw new ValidationException(path, "must be an ISO-8601 timestamp", inner);
            }
        }
    }

    private static ConfigMap configMap(JsonNode node, String path) throws ValidationException {
        if (node == null || node.isNull()) {
            return ConfigMap.empty();
        }
        if (!node.isObject()) {
            throw new ValidationException(path, "must be a JSON object");
        }
        return JsonValues.toConfigMap(node);
    }

    private static Map<String, String> stringMap(JsonNode node, String path) throws ValidationException {
        Map<String, String> map = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return map;
        }
        if (!node.isObject()) {
            throw new ValidationException(path, "must be a JSON object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new ValidationException(path + "." + field.getKey(), "must be a string");
            }
            map.put(field.getKey(), field.getValue().asText());
        }
        return map;
    }

    private JsonNode configNode(ConfigMap config) {
        return JsonValues.toNode(mapper, config.asMap());
    }

    private static void presence(JsonNode parent, String field, Set<String> nulls, Set<String> omitted) {
        JsonNode node = parent.get(field);
        if (node == null) {
            omitted.add(field);
        } else if (node.isNull()) {
            nulls.add(field);
        }
    }

    /**
     * Writes nothing or an explicit null for a field still at its default, as it was read.
     *
     * @return true if the caller must not write the value itself
     */
    private static boolean writtenAsDefault(ObjectNode node, String field, boolean atDefault,
                                            Set<String> nulls, Set<String> omitted) {
        if (!atDefault) {
            return false;
        }
        if (nulls.contains(field)) {
            node.putNull(field);
            return true;
        }
        return omitted.contains(field);
    }

    private static void putOptional(ObjectNode node, String field, String value, Set<String> nulls) {
        if (value != null) {
            node.put(field, value);
        } else if (nulls.contains(field)) {
            node.putNull(field);
        }
    }

    private static void putOptional(ObjectNode node, String field, Integer value, Set<String> nulls) {
        if (value != null) {
            node.put(field, value);
        } else if (nulls.contains(field)) {
            node.putNull(field);
        }
    }
}
