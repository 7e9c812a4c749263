package io.surfworks.evalhub.expand;

import io.surfworks.evalhub.config.ConfigurationException;
import io.surfworks.evalhub.config.EvalHubConfig;
import io.surfworks.evalhub.config.RiskCategoryProfile;
import io.surfworks.evalhub.model.BackendSpec;
import io.surfworks.evalhub.model.BackendType;
import io.surfworks.evalhub.model.BenchmarkSpec;
import io.surfworks.evalhub.model.ConfigMap;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RiskCategoryExpander and BackendKindPolicy.
 */
class RiskCategoryExpanderTest {

    private final RiskCategoryExpander expander = new RiskCategoryExpander(EvalHubConfig.defaults());

    @Test
    void lowCategoryExpandsToEveryConfiguredBackend() throws ConfigurationException {
        List<BackendSpec> backends = expander.expand("low", "llama");

        assertEquals(2, backends.size());
        assertEquals("lm-evaluation-harness", backends.get(0).name());
        assertEquals(BackendType.LM_EVALUATION_HARNESS, backends.get(0).type());
        assertEquals("guidellm", backends.get(1).name());
        assertEquals(BackendType.GUIDELLM, backends.get(1).type());

        for (BackendSpec backend : backends) {
            assertTrue(backend.config().isEmpty());
            List<BenchmarkSpec> benchmarks = backend.benchmarks();
            assertEquals(List.of("hellaswag", "arc_easy"), benchmarks.stream().map(BenchmarkSpec::name).toList());
            for (BenchmarkSpec benchmark : benchmarks) {
                assertEquals(List.of(benchmark.name()), benchmark.tasks());
                assertEquals(5, benchmark.numFewshot());
                assertEquals(100, benchmark.limit());
                assertNull(benchmark.batchSize());
                assertNull(benchmark.device());
            }
        }
    }

    @Test
    void criticalCategoryHasNoLimit() throws ConfigurationException {
        List<BackendSpec> backends = expander.expand("critical", "llama");

        BenchmarkSpec last = backends.get(0).benchmarks().get(5);
        assertEquals("gsm8k", last.name());
        assertNull(last.limit());
    }

    @Test
    void expansionIsDeterministic() throws ConfigurationException {
        assertEquals(expander.expand("medium", "a"), expander.expand("medium", "b"));
    }

    @Test
    void unmappedCategoryThrows() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> expander.expand("extreme", "llama"));
        assertTrue(e.getMessage().contains("extreme"));
    }

    @Test
    void customCategoriesCanBeConfigured() throws ConfigurationException {
        EvalHubConfig config = EvalHubConfig.defaults()
                .withRiskCategory("smoke", RiskCategoryProfile.of(List.of("arc_easy"), null, 10));

        List<BackendSpec> backends = new RiskCategoryExpander(config).expand("smoke", "llama");

        assertEquals(1, backends.get(0).benchmarks().size());
        assertNull(backends.get(0).benchmarks().get(0).numFewshot());
    }

    @Test
    void unmappedBackendGetsFallbackKind() throws ConfigurationException {
        Map<String, ConfigMap> configs = new LinkedHashMap<>();
        configs.put("in-house", ConfigMap.empty());
        EvalHubConfig config = EvalHubConfig.defaults()
                .withBackends(configs, Map.of())
                .withFallbackBackendKind(BackendType.CUSTOM);

        List<BackendSpec> backends = new RiskCategoryExpander(config).expand("low", "llama");

        assertEquals(BackendType.CUSTOM, backends.get(0).type());
    }

    @Test
    void noConfiguredBackendsThrows() {
        EvalHubConfig config = EvalHubConfig.defaults().withBackends(Map.of(), Map.of());
        assertThrows(ConfigurationException.class, () -> new RiskCategoryExpander(config).expand("low", "llama"));
    }

    @Test
    void kindPolicyReportsMapping() {
        BackendKindPolicy policy = BackendKindPolicy.from(EvalHubConfig.defaults());

        assertTrue(policy.isMapped("guidellm"));
        assertFalse(policy.isMapped("other"));
        assertEquals(BackendType.GUIDELLM, policy.kindOf("other"));
    }
}
