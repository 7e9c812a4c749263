package io.surfworks.evalhub.tracking;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.surfworks.evalhub.StubServer;
import io.surfworks.evalhub.config.TrackingConfig;
import io.surfworks.evalhub.model.BenchmarkSpec;
import io.surfworks.evalhub.model.EvaluationRequest;
import io.surfworks.evalhub.model.EvaluationSpec;
import io.surfworks.evalhub.result.EvaluationResult;
import io.surfworks.evalhub.status.EvaluationStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.surfworks.evalhub.Fixtures.evaluation;
import static io.surfworks.evalhub.Fixtures.harness;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MlflowTrackingSink against an in-process HTTP server.
 */
class MlflowTrackingSinkTest {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Instant CREATED = Instant.parse("2024-05-01T12:30:45Z");

    private StubServer server;
    private MlflowTrackingSink sink;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubServer().respond(r -> {
            if (r.path().contains("experiments/get-by-name")) {
                return new StubServer.Reply(404, "{\"error_code\": \"RESOURCE_DOES_NOT_EXIST\"}");
            }
            if (r.path().endsWith("experiments/create")) {
                return StubServer.Reply.ok("{\"experiment_id\": \"7\"}");
            }
            if (r.path().endsWith("runs/create")) {
                return StubServer.Reply.ok("{\"run\": {\"info\": {\"run_id\": \"run-1\"}}}");
            }
            return StubServer.Reply.ok("{}");
        });
        sink = new MlflowTrackingSink(TrackingConfig.defaults().withTrackingUri(server.url()), "9.9.9");
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private static EvaluationRequest request(String experimentName, EvaluationSpec... evaluations) {
        return new EvaluationRequest("req-1", List.of(evaluations), experimentName, Map.of("team", "qa"),
                true, null, CREATED, Set.of(), Set.of());
    }

    private static Map<String, String> keyValues(JsonNode array) {
        Map<String, String> values = new LinkedHashMap<>();
        array.forEach(entry -> values.put(entry.get("key").asText(), entry.get("value").asText()));
        return values;
    }

    // ===== Experiments =====

    @Test
    void createsExperimentWithTags() throws Exception {
        String experimentId = sink.createExperiment(request("nightly", evaluation("e1", harness("arc_easy"))));

        assertEquals("7", experimentId);
        assertEquals(server.url() + "/#/experiments/7", sink.experimentUrl(experimentId));

        JsonNode body = JSON.readTree(server.requests("/api/2.0/mlflow/experiments/create").get(0).body());
        assertEquals("eval-hub_nightly", body.get("name").asText());
        Map<String, String> tags = keyValues(body.get("tags"));
        assertEquals("req-1", tags.get("request_id"));
        assertEquals("1", tags.get("evaluation_count"));
        assertEquals("9.9.9", tags.get("service_version"));
        assertEquals("qa", tags.get("team"));
    }

    @Test
    void reusesExistingExperiment() throws Exception {
        server.respond(r -> StubServer.Reply.ok("{\"experiment\": {\"experiment_id\": \"3\"}}"));

        assertEquals("3", sink.createExperiment(request("nightly", evaluation("e1", harness("arc_easy")))));
        assertTrue(server.requests("/api/2.0/mlflow/experiments/create").isEmpty());
    }

    @Test
    void experimentNameFallsBackToModelAndTimestamp() {
        EvaluationRequest single = request(null, evaluation("e1", harness("arc_easy")));
        assertEquals("eval-hub_test-model_20240501_123045", MlflowTrackingSink.experimentName(single, "eval-hub"));

        EvaluationSpec other = EvaluationSpec.builder().id("e2").modelName("other").backends(harness("a")).build();
        EvaluationRequest multi = request(" ", evaluation("e1", harness("arc_easy")), other);
        assertEquals("p_multi_model_20240501_123045", MlflowTrackingSink.experimentName(multi, "p"));
    }

    @Test
    void serverErrorBecomesTrackingException() {
        server.respond(r -> new StubServer.Reply(500, "boom"));

        TrackingException e = assertThrows(TrackingException.class,
                () -> sink.createExperiment(request("x", evaluation("e1", harness("arc_easy")))));
        assertTrue(e.getMessage().contains("HTTP 500"));
    }

    // ===== Runs =====

    @Test
    void startsRunWithUnitTags() throws Exception {
        EvaluationSpec unit = EvaluationSpec.builder()
                .id("abcdef123456").modelName("llama").backends(harness("arc_easy")).riskCategory("low").build();

        assertEquals("run-1", sink.startRun("7", unit));

        JsonNode body = JSON.readTree(server.requests("/api/2.0/mlflow/runs/create").get(0).body());
        assertEquals("7", body.get("experiment_id").asText());
        assertEquals("llama_abcdef12", body.get("run_name").asText());
        Map<String, String> tags = keyValues(body.get("tags"));
        assertEquals("abcdef123456", tags.get("evaluation_id"));
        assertEquals("low", tags.get("risk_category"));
    }

    @Test
    void parametersAreBatchedAndTruncated() throws Exception {
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i < 150; i++) {
            params.put("p" + i, "v");
        }
        params.put("long", "x".repeat(800));

        sink.logParameters("run-1", params);

        List<StubServer.Recorded> batches = server.requests("/api/2.0/mlflow/runs/log-batch");
        assertEquals(2, batches.size());
        JsonNode second = JSON.readTree(batches.get(1).body()).get("params");
        assertEquals(51, second.size());
        assertEquals(MlflowTrackingSink.MAX_PARAM_VALUE_LENGTH, keyValues(second).get("long").length());
    }

    @Test
    void resultMetricsAreKeyedByBackendAndBenchmark() throws Exception {
        EvaluationResult result = EvaluationResult
                .success("e1", "lm-evaluation-harness", "arc_easy", Map.of("acc", 0.8, "label", "good"), Map.of())
                .withTimes(CREATED, CREATED.plusSeconds(30));

        sink.logResult("run-1", result);

        JsonNode body = JSON.readTree(server.requests("/api/2.0/mlflow/runs/log-batch").get(0).body());
        Map<String, String> metrics = keyValues(body.get("metrics"));
        Map<String, String> params = keyValues(body.get("params"));
        assertEquals(0.8, Double.parseDouble(metrics.get("lm-evaluation-harness/arc_easy/acc")));
        assertEquals(30.0, Double.parseDouble(metrics.get("lm-evaluation-harness/arc_easy/duration_seconds")));
        assertEquals("good", params.get("lm-evaluation-harness/arc_easy/metric_label"));
        assertEquals("completed", params.get("lm-evaluation-harness/arc_easy/status"));
    }

    @Test
    void endRunMapsStatus() throws Exception {
        sink.endRun("run-1", EvaluationStatus.TIMEOUT);

        JsonNode body = JSON.readTree(server.requests("/api/2.0/mlflow/runs/update").get(0).body());
        assertEquals("FAILED", body.get("status").asText());
        assertEquals("FINISHED", MlflowTrackingSink.runStatus(EvaluationStatus.COMPLETED));
        assertEquals("KILLED", MlflowTrackingSink.runStatus(EvaluationStatus.CANCELLED));
    }

    @Test
    void unreachableServerBecomesTrackingException() {
        MlflowTrackingSink offline = new MlflowTrackingSink(
                TrackingConfig.defaults().withTrackingUri("http://127.0.0.1:1"));
        assertThrows(TrackingException.class, () -> offline.endRun("run-1", EvaluationStatus.COMPLETED));
    }

    @Test
    void malformedTrackingUriBecomesTrackingException() {
        MlflowTrackingSink schemeless = new MlflowTrackingSink(
                TrackingConfig.defaults().withTrackingUri("localhost:5000"));

        TrackingException e = assertThrows(TrackingException.class,
                () -> schemeless.createExperiment(request("x", evaluation("e1", harness("arc_easy")))));
        assertTrue(e.getMessage().contains("Invalid MLflow URL"));
        assertThrows(TrackingException.class,
                () -> schemeless.startRun("exp-1", evaluation("e1", harness("arc_easy"))));
    }

    // ===== Parameters =====

    @Test
    void trackingParametersArePathKeyed() {
        EvaluationSpec unit = evaluation("e1", harness("arc_easy").withBenchmarks(List.of(
                BenchmarkSpec.of("arc_easy", List.of("arc_easy", "arc_e2")).withNumFewshot(5))));

        Map<String, String> params = TrackingParameters.forEvaluation(unit);

        assertEquals("e1", params.get("evaluation_id"));
        assertEquals("test-model", params.get("model_name"));
        assertEquals("lm-evaluation-harness", params.get("lm-evaluation-harness/backend_type"));
        assertEquals("5", params.get("lm-evaluation-harness/arc_easy/num_fewshot"));
        assertTrue(params.get("lm-evaluation-harness/arc_easy/tasks").contains("arc_e2"));
    }
}
