package io.surfworks.evalhub.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.surfworks.evalhub.json.EvalHubJson;
import io.surfworks.evalhub.json.JsonValues;
import io.surfworks.evalhub.model.EvaluationSpec;
import io.surfworks.evalhub.result.EvaluationResult;
import io.surfworks.evalhub.result.ResultTree;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Executor that runs an external command once per evaluation unit.
 *
 * <p>The resolved unit is written to the command's stdin as JSON. On success the
 * command prints a JSON array to stdout, one record per benchmark run:
 * <pre>
 * [{"backend": "lm-evaluation-harness", "benchmark": "arc_easy",
 *   "metrics": {"accuracy": 0.81},
 *   "tasks":   {"arc_easy": {"acc": 0.81, "acc_norm": 0.78}},
 *   "groups":  {"reasoning": {"score": 0.7, "groups": {"...": {}}}},
 *   "artifacts": {"log": "/tmp/run.log"}}]
 * </pre>
 * Nested {@code tasks} and {@code groups} are flattened into {@code tasks/arc_easy/acc}
 * style metric keys. A non-zero exit code fails the execution with the command's stderr.
 *
 * <p>An execution is forgotten once a poll has reported its outcome or it was cancelled;
 * later calls with its handle fail as unknown.
 */
public final class CommandExecutor implements EvaluationExecutor {

    private static final Logger LOG = Logger.getLogger(CommandExecutor.class.getName());

    private final List<String> command;
    private final EvalHubJson json;
    private final ObjectMapper mapper;
    private final Map<String, Execution> executions = new ConcurrentHashMap<>();
    private final AtomicInteger threadCounter = new AtomicInteger(0);
    private final ExecutorService readers;
    private volatile boolean closed;

    public CommandExecutor(List<String> command) {
        this(command, new EvalHubJson());
    }

    public CommandExecutor(List<String> command, EvalHubJson json) {
        this.command = List.copyOf(command);
        this.json = json;
        this.mapper = json.mapper();
        this.readers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "evalhub-command-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String name() {
        return "command";
    }

    @Override
    public String submit(EvaluationSpec evaluation) throws ExecutorException {
        ensureOpen();
        if (command.isEmpty()) {
            throw new ExecutorException("No executor command configured");
        }

        byte[] payload = json.toJson(json.writeEffectiveEvaluation(evaluation)).getBytes(StandardCharsets.UTF_8);

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new ExecutorException("Failed to start executor command " + command + ": " + e.getMessage(), e);
        }

        String handle = "cmd-" + UUID.randomUUID().toString().substring(0, 8);
        Future<ProcessOutcome> outcome = readers.submit(() -> runToEnd(process, payload));
        executions.put(handle, new Execution(evaluation, process, outcome));

        LOG.fine("Started " + command.get(0) + " for evaluation " + evaluation.id() + " as " + handle);
        return handle;
    }

    @Override
    public ExecutionPoll poll(String handle) throws ExecutorException {
        Execution execution = getExecution(handle);

        if (!execution.outcome.isDone()) {
            // A started process counts as acknowledged
            return ExecutionPoll.running();
        }
        executions.remove(handle);

        ProcessOutcome outcome;
        try {
            outcome = execution.outcome.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException("Interrupted while reading output of " + handle, e);
        } catch (ExecutionException e) {
            return ExecutionPoll.failed("Failed to read executor output: " + e.getCause().getMessage());
        }

        if (outcome.exitCode() != 0) {
            return ExecutionPoll.failed("Exit code " + outcome.exitCode() + ": " + outcome.stderr().trim());
        }
        try {
            return ExecutionPoll.succeeded(parseResults(outcome.stdout(), execution.evaluation));
        } catch (ExecutorException e) {
            return ExecutionPoll.failed(e.getMessage());
        }
    }

    @Override
    public boolean cancel(String handle) {
        Execution execution = executions.remove(handle);
        if (execution == null) {
            return false;
        }
        execution.process.destroy();
        LOG.fine("Cancelled execution " + handle);
        return true;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;

        for (Execution execution : executions.values()) {
            if (execution.process.isAlive()) {
                execution.process.destroyForcibly();
            }
        }
        executions.clear();
        readers.shutdownNow();
    }

    /**
     * Parses the command's stdout into one result per reported benchmark run.
     */
    List<EvaluationResult> parseResults(String stdout, EvaluationSpec evaluation) throws ExecutorException {
        JsonNode root;
        try {
            root = mapper.readTree(stdout);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Malformed executor output: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new ExecutorException("Malformed executor output: expected a JSON array of results");
        }

        List<EvaluationResult> results = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode record = root.get(i);
            String backend = record.path("backend").asText(null);
            String benchmark = record.path("benchmark").asText(null);
            if (backend == null || benchmark == null) {
                throw new ExecutorException("Malformed executor output: result " + i
                        + " must name its backend and benchmark");
            }

            Map<String, Object> tree = new LinkedHashMap<>(JsonValues.toConfigMap(record.get("metrics")).asMap());
            if (record.has("tasks")) {
                tree.put("tasks", JsonValues.toJava(record.get("tasks")));
            }
            if (record.has("groups")) {
                tree.put("groups", JsonValues.toJava(record.get("groups")));
            }

            Map<String, String> artifacts = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = record.path("artifacts").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                artifacts.put(field.getKey(), field.getValue().asText());
            }

            results.add(EvaluationResult.success(evaluation.id(), backend, benchmark,
                    ResultTree.fromMap(tree).flatten(), artifacts));
        }
        return results;
    }

    private ProcessOutcome runToEnd(Process process, byte[] payload) throws Exception {
        Future<String> stderr = readers.submit(() -> readAll(process.getErrorStream()));
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(payload);
        } catch (IOException e) {
            LOG.fine("Executor command did not read its input: " + e.getMessage());
        }
        String stdout = readAll(process.getInputStream());
        int exitCode = process.waitFor();
        return new ProcessOutcome(exitCode, stdout, stderr.get());
    }

    private static String readAll(InputStream in) throws IOException {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Number of executions not yet reported or cancelled.
     */
    int activeExecutions() {
        return executions.size();
    }

    private Execution getExecution(String handle) throws ExecutorException {
        Execution execution = executions.get(handle);
        if (execution == null) {
            throw new ExecutorException("Execution not found: " + handle);
        }
        return execution;
    }

    private void ensureOpen() throws ExecutorException {
        if (closed) {
            throw new ExecutorException("Executor is closed");
        }
    }

    private record ProcessOutcome(int exitCode, String stdout, String stderr) {
    }

    private static final class Execution {
        private final EvaluationSpec evaluation;
        private final Process process;
        private final Future<ProcessOutcome> outcome;

        Execution(EvaluationSpec evaluation, Process process, Future<ProcessOutcome> outcome) {
            this.evaluation = evaluation;
            this.process = process;
            this.outcome = outcome;
        }
    }
}
