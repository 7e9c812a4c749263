package io.surfworks.evalhub.pipeline;

import io.surfworks.evalhub.config.ConfigurationException;
import io.surfworks.evalhub.config.EvalHubConfig;
import io.surfworks.evalhub.model.BackendSpec;
import io.surfworks.evalhub.model.EvaluationRequest;
import io.surfworks.evalhub.model.EvaluationSpec;
import io.surfworks.evalhub.validation.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.surfworks.evalhub.Fixtures.evaluation;
import static io.surfworks.evalhub.Fixtures.harness;
import static io.surfworks.evalhub.Fixtures.request;
import static io.surfworks.evalhub.Fixtures.riskEvaluation;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RequestResolver.
 */
class RequestResolverTest {

    private final RequestResolver resolver = new RequestResolver(EvalHubConfig.defaults());

    @Test
    void expandsRiskCategoryAndAppliesDefaults() throws Exception {
        EvaluationRequest original = request(riskEvaluation("e1", "low"));

        EvaluationRequest resolved = resolver.resolve(original);

        EvaluationSpec unit = resolved.evaluations().get(0);
        assertEquals(2, unit.backends().size());
        assertEquals(4, resolved.benchmarkCount());
        for (BackendSpec backend : unit.backends()) {
            assertFalse(backend.config().isEmpty());
            backend.benchmarks().forEach(b -> {
                assertEquals(1, b.batchSize());
                assertEquals("auto", b.device());
            });
        }
        assertEquals(original.requestId(), resolved.requestId());
        assertEquals(original.createdAt(), resolved.createdAt());
    }

    @Test
    void explicitBackendsWinOverRiskCategory() throws Exception {
        EvaluationSpec both = EvaluationSpec.builder()
                .id("e1").modelName("m")
                .backends(harness("mmlu"))
                .riskCategory("critical")
                .build();

        EvaluationSpec unit = resolver.resolve(request(both)).evaluations().get(0);

        assertEquals(1, unit.backends().size());
        assertEquals(List.of("mmlu"), unit.backends().get(0).benchmarks().stream().map(b -> b.name()).toList());
        assertEquals(5, unit.backends().get(0).benchmarks().get(0).numFewshot());
        assertEquals("critical", unit.riskCategory());
    }

    @Test
    void validationRunsFirst() {
        EvaluationSpec bare = EvaluationSpec.builder().id("e1").modelName("m").build();
        assertThrows(ValidationException.class, () -> resolver.resolve(request(bare)));
    }

    @Test
    void unmappedRiskCategoryIsConfigurationError() {
        assertThrows(ConfigurationException.class, () -> resolver.resolve(request(riskEvaluation("e1", "extreme"))));
    }

    @Test
    void keepsEvaluationOrder() throws Exception {
        EvaluationRequest resolved = resolver.resolve(request(
                evaluation("b", harness("arc_easy")),
                riskEvaluation("a", "low"),
                evaluation("c", harness("hellaswag"))));

        assertEquals(List.of("b", "a", "c"), resolved.evaluations().stream().map(EvaluationSpec::id).toList());
    }
}
