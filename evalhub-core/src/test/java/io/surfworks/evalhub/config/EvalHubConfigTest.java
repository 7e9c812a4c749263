package io.surfworks.evalhub.config;

import io.surfworks.evalhub.model.BackendType;
import io.surfworks.evalhub.model.ConfigMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EvalHubConfig and EvalHubConfigLoader.
 */
class EvalHubConfigTest {

    @TempDir
    Path tempDir;

    // ===== EvalHubConfig tests =====

    @Test
    void defaultsReturnsValidConfig() {
        EvalHubConfig config = EvalHubConfig.defaults();

        assertEquals(10, config.maxConcurrentEvaluations());
        assertEquals(60, config.defaultTimeoutMinutes());
        assertEquals(3, config.maxRetryAttempts());
        assertEquals(List.of("lm-evaluation-harness", "guidellm"), List.copyOf(config.backendConfigs().keySet()));
        assertEquals(List.of("low", "medium", "high", "critical"), List.copyOf(config.riskCategories().keySet()));
        assertTrue(config.executorCommand().isEmpty());
        assertEquals(Duration.ofHours(1), config.requestRetention());
    }

    @Test
    void knownBackendsComeFromTable() {
        EvalHubConfig config = EvalHubConfig.defaults();

        assertTrue(config.isKnownBackend("guidellm"));
        assertFalse(config.isKnownBackend("my-engine"));
        assertTrue(config.backendDefaults("my-engine").isEmpty());
    }

    @Test
    void withBackendCreatesNewInstance() {
        EvalHubConfig base = EvalHubConfig.defaults();
        EvalHubConfig modified = base.withBackend("nemo", BackendType.NEMO_EVALUATOR, ConfigMap.of("image", "nemo"));

        assertFalse(base.isKnownBackend("nemo"));
        assertTrue(modified.isKnownBackend("nemo"));
        assertEquals(BackendType.NEMO_EVALUATOR, modified.backendKinds().get("nemo"));
    }

    @Test
    void rejectsNonPositiveConcurrency() {
        EvalHubConfig base = EvalHubConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> base.withMaxConcurrentEvaluations(0));
    }

    @Test
    void rejectsNegativeRetention() {
        EvalHubConfig base = EvalHubConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> base.withRequestRetention(Duration.ofSeconds(-1)));
        assertEquals(Duration.ZERO, base.withRequestRetention(Duration.ZERO).requestRetention());
    }

    @Test
    void trackingApiUrlStripsTrailingSlash() {
        TrackingConfig tracking = TrackingConfig.defaults().withTrackingUri("http://mlflow:5000/");

        assertEquals("http://mlflow:5000", tracking.baseUrl());
        assertEquals("http://mlflow:5000/api/2.0/mlflow/", tracking.apiUrl());
    }

    @Test
    void riskProfileRequiresBenchmarks() {
        assertThrows(IllegalArgumentException.class, () -> RiskCategoryProfile.of(List.of(), 5, null));
    }

    @Test
    void callbackRequiresOneAttempt() {
        assertThrows(IllegalArgumentException.class,
                () -> new CallbackConfig(Duration.ofSeconds(1), 0, Duration.ZERO));
    }

    // ===== EvalHubConfigLoader tests =====

    @Test
    void loadOverridesSingleValues() throws Exception {
        Path file = tempDir.resolve("evalhub.json");
        Files.writeString(file, """
                {
                  "maxConcurrentEvaluations": 4,
                  "tracking": {"trackingUri": "http://mlflow:5000", "enabled": false},
                  "pollIntervalMillis": 250,
                  "executorCommand": ["python", "-m", "runner"]
                }
                """);

        EvalHubConfig config = EvalHubConfigLoader.load(file);

        assertEquals(4, config.maxConcurrentEvaluations());
        assertEquals(60, config.defaultTimeoutMinutes());
        assertEquals("http://mlflow:5000", config.tracking().trackingUri());
        assertFalse(config.tracking().enabled());
        assertEquals("eval-hub", config.tracking().experimentPrefix());
        assertEquals(Duration.ofMillis(250), config.pollInterval());
        assertEquals(List.of("python", "-m", "runner"), config.executorCommand());
        // Untouched tables keep their defaults
        assertEquals(4, config.riskCategories().size());
    }

    @Test
    void loadReplacesTablesAsWhole() throws Exception {
        Path file = tempDir.resolve("evalhub.json");
        Files.writeString(file, """
                {
                  "backends": {
                    "nemo": {"kind": "nemo-evaluator", "config": {"image": "nemo:1"}}
                  },
                  "riskCategories": {
                    "tiny": {"benchmarks": ["arc_easy"], "limit": 10}
                  }
                }
                """);

        EvalHubConfig config = EvalHubConfigLoader.load(file);

        assertEquals(List.of("nemo"), List.copyOf(config.backendConfigs().keySet()));
        assertEquals(BackendType.NEMO_EVALUATOR, config.backendKinds().get("nemo"));
        assertEquals("nemo:1", config.backendDefaults("nemo").get("image").orElseThrow());
        assertEquals(List.of("tiny"), List.copyOf(config.riskCategories().keySet()));
        assertEquals(10, config.riskCategories().get("tiny").limit());
        assertNull(config.riskCategories().get("tiny").numFewshot());
    }

    @Test
    void loadMissingFileThrows() {
        assertThrows(ConfigurationException.class,
                () -> EvalHubConfigLoader.load(tempDir.resolve("missing.json")));
    }

    @Test
    void loadMalformedFileThrows() throws IOException {
        Path file = tempDir.resolve("evalhub.json");
        Files.writeString(file, "{not json");

        assertThrows(ConfigurationException.class, () -> EvalHubConfigLoader.load(file));
    }

    @Test
    void loadUnknownBackendKindThrows() throws IOException {
        Path file = tempDir.resolve("evalhub.json");
        Files.writeString(file, "{\"fallbackBackendKind\": \"quantum\"}");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> EvalHubConfigLoader.load(file));
        assertTrue(e.getMessage().contains("quantum"));
    }

    @Test
    void loadInvalidValueThrows() throws IOException {
        Path file = tempDir.resolve("evalhub.json");
        Files.writeString(file, "{\"maxConcurrentEvaluations\": 0}");

        assertThrows(ConfigurationException.class, () -> EvalHubConfigLoader.load(file));
    }

    @Test
    void saveThenLoadKeepsSettings() throws Exception {
        EvalHubConfig original = EvalHubConfig.defaults()
                .withMaxConcurrentEvaluations(3)
                .withTracking(TrackingConfig.defaults().withExperimentPrefix("nightly"))
                .withExecutorCommand(List.of("runner"))
                .withRequestRetention(Duration.ofMinutes(5));
        Path file = tempDir.resolve("nested/evalhub.json");

        EvalHubConfigLoader.save(original, file);
        EvalHubConfig loaded = EvalHubConfigLoader.load(file);

        assertEquals(3, loaded.maxConcurrentEvaluations());
        assertEquals("nightly", loaded.tracking().experimentPrefix());
        assertEquals(List.of("runner"), loaded.executorCommand());
        assertEquals(Duration.ofMinutes(5), loaded.requestRetention());
        assertEquals(original.riskCategories(), loaded.riskCategories());
        assertEquals(original.backendKinds(), loaded.backendKinds());
    }
}
