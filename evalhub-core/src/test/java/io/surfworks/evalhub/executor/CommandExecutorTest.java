package io.surfworks.evalhub.executor;

import io.surfworks.evalhub.model.EvaluationSpec;
import io.surfworks.evalhub.result.EvaluationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static io.surfworks.evalhub.Fixtures.evaluation;
import static io.surfworks.evalhub.Fixtures.harness;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CommandExecutor.
 */
class CommandExecutorTest {

    private static final String OUTPUT = """
            [{"backend": "lm-evaluation-harness", "benchmark": "arc_easy",
              "metrics": {"accuracy": 0.81},
              "tasks": {"arc_easy": {"acc": 0.81, "acc_norm": 0.78}},
              "groups": {"reasoning": {"score": 0.7, "groups": {"science": {"score": 0.6}}}},
              "artifacts": {"log": "/tmp/run.log"}}]
            """;

    private final EvaluationSpec unit = evaluation("e1", harness("arc_easy"));
    private CommandExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.close();
        }
    }

    private static CommandExecutor shell(String script) {
        return new CommandExecutor(List.of("sh", "-c", script));
    }

    // ===== Output parsing =====

    @Test
    void parsesNestedOutputIntoFlatMetrics() throws ExecutorException {
        executor = shell("true");
        List<EvaluationResult> results = executor.parseResults(OUTPUT, unit);

        assertEquals(1, results.size());
        EvaluationResult result = results.get(0);
        assertEquals("e1", result.evaluationId());
        assertEquals("arc_easy", result.benchmarkName());
        assertEquals(List.of("accuracy", "tasks/arc_easy/acc", "tasks/arc_easy/acc_norm",
                        "groups/reasoning/score", "groups/reasoning/groups/science/score"),
                List.copyOf(result.metrics().keySet()));
        assertEquals(Map.of("log", "/tmp/run.log"), result.artifacts());
    }

    @Test
    void rejectsNonArrayOutput() {
        executor = shell("true");
        assertThrows(ExecutorException.class, () -> executor.parseResults("{\"accuracy\": 1}", unit));
    }

    @Test
    void rejectsMalformedOutput() {
        executor = shell("true");
        assertThrows(ExecutorException.class, () -> executor.parseResults("not json", unit));
    }

    @Test
    void rejectsRecordWithoutBenchmark() {
        executor = shell("true");
        ExecutorException e = assertThrows(ExecutorException.class,
                () -> executor.parseResults("[{\"backend\": \"guidellm\"}]", unit));
        assertTrue(e.getMessage().contains("result 0"));
    }

    // ===== Process execution =====

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void successfulCommandReportsResults() throws ExecutorException {
        executor = shell("cat > /dev/null; printf '%s' '[{\"backend\": \"lm-evaluation-harness\","
                + " \"benchmark\": \"arc_easy\", \"metrics\": {\"accuracy\": 0.5}}]'");

        String handle = executor.submit(unit);
        ExecutionPoll poll = executor.awaitCompletion(handle, Duration.ofSeconds(10), Duration.ofMillis(20));

        assertEquals(ExecutionPoll.State.SUCCEEDED, poll.state());
        assertEquals(0.5, poll.results().get(0).metrics().get("accuracy"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void reportedExecutionIsForgotten() throws ExecutorException {
        executor = shell("cat > /dev/null; echo '[]'");

        String handle = executor.submit(unit);
        assertEquals(1, executor.activeExecutions());
        executor.awaitCompletion(handle, Duration.ofSeconds(10), Duration.ofMillis(20));

        assertEquals(0, executor.activeExecutions());
        assertThrows(ExecutorException.class, () -> executor.poll(handle));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void commandReceivesUnitOnStdin() throws ExecutorException {
        // Echo the model name back as a metric value
        executor = shell("model=$(sed -n 's/.*\"model_name\" *: *\"\\([^\"]*\\)\".*/\\1/p' | head -n 1);"
                + " printf '[{\"backend\": \"b\", \"benchmark\": \"x\", \"metrics\": {\"model\": \"%s\"}}]' \"$model\"");

        String handle = executor.submit(unit);
        ExecutionPoll poll = executor.awaitCompletion(handle, Duration.ofSeconds(10), Duration.ofMillis(20));

        assertEquals(ExecutionPoll.State.SUCCEEDED, poll.state());
        assertEquals("test-model", poll.results().get(0).metrics().get("model"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void nonZeroExitFailsWithStderr() throws ExecutorException {
        executor = shell("echo 'CUDA out of memory' >&2; exit 3");

        String handle = executor.submit(unit);
        ExecutionPoll poll = executor.awaitCompletion(handle, Duration.ofSeconds(10), Duration.ofMillis(20));

        assertEquals(ExecutionPoll.State.FAILED, poll.state());
        assertEquals("Exit code 3: CUDA out of memory", poll.error());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void cancelStopsLongRunningCommand() throws ExecutorException {
        executor = shell("sleep 30");

        String handle = executor.submit(unit);
        assertEquals(ExecutionPoll.State.RUNNING, executor.poll(handle).state());
        assertTrue(executor.cancel(handle));

        assertEquals(0, executor.activeExecutions());
        assertThrows(ExecutorException.class, () -> executor.poll(handle));
        assertFalse(executor.cancel(handle));
    }

    @Test
    void missingProgramFailsSubmit() {
        executor = new CommandExecutor(List.of("/nonexistent/evaluator-binary"));
        assertThrows(ExecutorException.class, () -> executor.submit(unit));
    }

    @Test
    void unknownHandleThrows() {
        executor = shell("true");
        assertThrows(ExecutorException.class, () -> executor.poll("cmd-missing"));
        assertFalse(executor.cancel("cmd-missing"));
    }

    @Test
    void closedExecutorRejectsSubmissions() {
        executor = shell("true");
        executor.close();
        assertThrows(ExecutorException.class, () -> executor.submit(unit));
    }
}
