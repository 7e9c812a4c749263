package io.surfworks.evalhub.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.surfworks.evalhub.aggregate.ResultAggregator;
import io.surfworks.evalhub.config.ConfigurationException;
import io.surfworks.evalhub.config.EvalHubConfig;
import io.surfworks.evalhub.config.EvalHubConfigLoader;
import io.surfworks.evalhub.executor.CommandExecutor;
import io.surfworks.evalhub.json.EvalHubJson;
import io.surfworks.evalhub.model.EvaluationRequest;
import io.surfworks.evalhub.orchestrator.EvaluationOrchestrator;
import io.surfworks.evalhub.pipeline.RequestResolver;
import io.surfworks.evalhub.result.EvaluationResponse;
import io.surfworks.evalhub.result.EvaluationResult;
import io.surfworks.evalhub.status.RequestStatus;
import io.surfworks.evalhub.tracking.MlflowTrackingSink;
import io.surfworks.evalhub.tracking.NoOpTrackingSink;
import io.surfworks.evalhub.tracking.TrackingSink;
import io.surfworks.evalhub.validation.ValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.logging.LogManager;

/**
 * EvalHub CLI - evaluation request tool.
 *
 * <p>Commands:
 * <ul>
 *   <li>validate - Validate and resolve a request file</li>
 *   <li>estimate - Estimate the duration of a request</li>
 *   <li>run - Run a request with the command executor</li>
 *   <li>config - Show/set configuration</li>
 * </ul>
 *
 * <p>Exit codes: 0 on success, 1 when a request is rejected or fails, 2 on usage errors.
 */
public class EvalHubCli {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final List<String> FLAGS_WITH_VALUES = List.of("--config", "--command", "--set");

    /** How often progress is reported while a request runs */
    private static final Duration PROGRESS_INTERVAL = Duration.ofSeconds(5);

    private final PrintStream out;
    private final PrintStream err;

    EvalHubCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        configureLogging();
        int exitCode = new EvalHubCli(System.out, System.err).execute(args);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    int execute(String[] args) {
        if (args.length == 0) {
            printHelp();
            return EXIT_USAGE;
        }

        String command = args[0];

        // Handle global flags (only when they're the command itself)
        if (command.equals("--help") || command.equals("-h")) {
            printHelp();
            return EXIT_OK;
        }
        if (command.equals("--version") || command.equals("-v")) {
            out.println("evalhub " + EvalHubConfig.VERSION);
            return EXIT_OK;
        }
        String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);

        try {
            return switch (command) {
                case "validate" -> handleValidate(commandArgs);
                case "estimate" -> handleEstimate(commandArgs);
                case "run" -> handleRun(commandArgs);
                case "config" -> handleConfig(commandArgs);
                default -> {
                    err.println("Unknown command: " + command);
                    err.println("Run 'evalhub --help' for usage.");
                    yield EXIT_USAGE;
                }
            };
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (ValidationException e) {
            err.println("Invalid request: " + e.getMessage());
            return EXIT_FAILED;
        } catch (ConfigurationException e) {
            err.println("Configuration error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return EXIT_FAILED;
        }
    }

    private int handleValidate(String[] args)
            throws UsageException, ValidationException, ConfigurationException, IOException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: evalhub validate <request.json> [--config <file>]");
            out.println();
            out.println("Validate a request, expand risk categories, apply defaults and print the result.");
            return EXIT_OK;
        }

        EvalHubConfig config = loadConfig(args);
        EvalHubJson json = new EvalHubJson(config);
        EvaluationRequest request = readRequest(requestFile(args), json);

        EvaluationRequest resolved = new RequestResolver(config).resolve(request);
        out.println(JSON.writeValueAsString(json.writeRequest(resolved)));
        return EXIT_OK;
    }

    private int handleEstimate(String[] args)
            throws UsageException, ValidationException, ConfigurationException, IOException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: evalhub estimate <request.json> [--config <file>] [--json]");
            out.println();
            out.println("Print the benchmark count and estimated duration of a request.");
            return EXIT_OK;
        }

        EvalHubConfig config = loadConfig(args);
        EvalHubJson json = new EvalHubJson(config);
        EvaluationRequest request = readRequest(requestFile(args), json);

        EvaluationRequest resolved = new RequestResolver(config).resolve(request);
        ResultAggregator aggregator = new ResultAggregator(config);
        int benchmarks = aggregator.totalBenchmarkCount(resolved);
        int minutes = aggregator.estimateCompletionMinutes(resolved);

        if (hasFlag(args, "--json")) {
            out.println(JSON.writeValueAsString(
                    new EstimateResponse(resolved.evaluations().size(), benchmarks, minutes)));
        } else {
            out.println("Evaluations: " + resolved.evaluations().size());
            out.println("Benchmarks: " + benchmarks);
            out.println("Estimated Duration: " + minutes + " minutes");
        }
        return EXIT_OK;
    }

    private int handleRun(String[] args)
            throws UsageException, ValidationException, ConfigurationException, IOException, InterruptedException {
        if (hasFlag(args, "--help")) {
            printRunHelp();
            return EXIT_OK;
        }

        EvalHubConfig config = loadConfig(args);
        String commandLine = getFlagValue(args, "--command");
        if (commandLine != null) {
            config = config.withExecutorCommand(List.of(commandLine.trim().split("\\s+")));
        }
        if (config.executorCommand().isEmpty()) {
            throw new UsageException("no executor command; pass --command or set executorCommand in the config file");
        }

        EvalHubJson json = new EvalHubJson(config);
        EvaluationRequest request = readRequest(requestFile(args), json);
        boolean quiet = hasFlag(args, "--quiet");

        TrackingSink trackingSink = config.tracking().enabled()
                ? new MlflowTrackingSink(config.tracking())
                : new NoOpTrackingSink();

        EvaluationResponse response;
        try (EvaluationOrchestrator orchestrator = new EvaluationOrchestrator(
                config, new CommandExecutor(config.executorCommand(), json), trackingSink)) {

            response = orchestrator.submit(request);
            if (!quiet) {
                err.println("Request " + response.requestId() + " accepted: "
                        + response.totalEvaluations() + " evaluations");
            }
            while (!response.isTerminal()) {
                response = orchestrator.awaitCompletion(response.requestId(), PROGRESS_INTERVAL);
                if (!quiet && !response.isTerminal()) {
                    err.printf("  %s  %.0f%%  (%d completed, %d failed)%n",
                            response.status().id(),
                            response.progressPercentage(),
                            response.completedEvaluations(),
                            response.failedEvaluations());
                }
            }
        }

        if (hasFlag(args, "--summary")) {
            printSummary(response);
        } else {
            out.println(JSON.writeValueAsString(json.writeResponse(response)));
        }
        return response.status() == RequestStatus.COMPLETED ? EXIT_OK : EXIT_FAILED;
    }

    private int handleConfig(String[] args) throws UsageException, ConfigurationException, IOException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: evalhub config [--config <file>] [--set <key>=<value>]");
            out.println();
            out.println("Options:");
            out.println("  --config <file>  Config file to read (and write with --set)");
            out.println("  --set            Set a configuration value");
            out.println();
            out.println("Config keys:");
            out.println("  maxConcurrentEvaluations  - Worker pool size");
            out.println("  defaultTimeoutMinutes     - Default per-evaluation timeout");
            out.println("  maxRetryAttempts          - Upper bound on retries per evaluation");
            out.println("  tracking.enabled          - Send results to the tracking server (true/false)");
            out.println("  tracking.trackingUri      - Tracking server URL");
            out.println("  tracking.experimentPrefix - Prefix for experiment names");
            return EXIT_OK;
        }

        EvalHubConfig config = loadConfig(args);
        String setValue = getFlagValue(args, "--set");

        if (setValue != null) {
            String[] parts = setValue.split("=", 2);
            if (parts.length != 2) {
                throw new UsageException("invalid format, use --set key=value");
            }
            config = applySetting(config, parts[0], parts[1]);

            String configFile = getFlagValue(args, "--config");
            Path target = configFile != null ? Path.of(configFile) : EvalHubConfig.configFile();
            EvalHubConfigLoader.save(config, target);
            err.println("Configuration updated: " + target);
        }

        out.println(JSON.writeValueAsString(EvalHubConfigLoader.toJson(config)));
        return EXIT_OK;
    }

    // ===== Helper methods =====

    static EvalHubConfig applySetting(EvalHubConfig config, String key, String value) throws UsageException {
        try {
            return switch (key) {
                case "maxConcurrentEvaluations" -> config.withMaxConcurrentEvaluations(Integer.parseInt(value));
                case "defaultTimeoutMinutes" -> config.withDefaultTimeoutMinutes(Integer.parseInt(value));
                case "maxRetryAttempts" -> config.withMaxRetryAttempts(Integer.parseInt(value));
                case "tracking.enabled" -> config.withTracking(
                        config.tracking().withEnabled(Boolean.parseBoolean(value)));
                case "tracking.trackingUri" -> config.withTracking(config.tracking().withTrackingUri(value));
                case "tracking.experimentPrefix" -> config.withTracking(
                        config.tracking().withExperimentPrefix(value));
                default -> throw new UsageException("unknown config key: " + key);
            };
        } catch (NumberFormatException e) {
            throw new UsageException(key + " must be an integer, got '" + value + "'");
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    private static EvalHubConfig loadConfig(String[] args) throws ConfigurationException {
        String configFile = getFlagValue(args, "--config");
        return configFile != null
                ? EvalHubConfigLoader.load(Path.of(configFile))
                : EvalHubConfigLoader.load();
    }

    private static EvaluationRequest readRequest(Path file, EvalHubJson json) throws ValidationException, IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Request file not found: " + file);
        }
        return json.readRequest(Files.readString(file));
    }

    /**
     * The first argument that is neither a flag nor a flag's value.
     */
    private static Path requestFile(String[] args) throws UsageException {
        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--")) {
                if (FLAGS_WITH_VALUES.contains(args[i])) {
                    i++;
                }
                continue;
            }
            return Path.of(args[i]);
        }
        throw new UsageException("a request file is required");
    }

    private void printSummary(EvaluationResponse response) {
        out.println("Request " + response.requestId());
        out.println("-".repeat(60));
        out.println("Status: " + response.status().id());
        out.println("Evaluations: " + response.totalEvaluations() + " total, "
                + response.completedEvaluations() + " completed, "
                + response.failedEvaluations() + " failed");
        if (response.experimentUrl() != null) {
            out.println("Experiment: " + response.experimentUrl());
        }
        out.println();
        for (EvaluationResult result : response.results()) {
            out.printf("  %-12s  %-24s  %-16s  %s%n",
                    result.evaluationId(),
                    result.backendName(),
                    result.benchmarkName(),
                    result.errorMessage() != null
                            ? result.status().id() + ": " + result.errorMessage()
                            : result.status().id());
        }
        if (!response.aggregatedMetrics().isEmpty()) {
            out.println();
            out.println("Aggregated Metrics:");
            for (Map.Entry<String, Object> metric : response.aggregatedMetrics().entrySet()) {
                out.println("  " + metric.getKey() + " = " + metric.getValue());
            }
        }
    }

    private static void configureLogging() {
        try (InputStream in = EvalHubCli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging configuration: " + e.getMessage());
        }
    }

    private static boolean hasFlag(String[] args, String flag) {
        return Arrays.asList(args).contains(flag);
    }

    private static String getFlagValue(String[] args, String flag) {
        List<String> argList = Arrays.asList(args);
        int index = argList.indexOf(flag);
        if (index >= 0 && index < args.length - 1) {
            return args[index + 1];
        }
        return null;
    }

    // ===== Help output =====

    private void printHelp() {
        out.println("EvalHub CLI - Model evaluation request tool");
        out.println();
        out.println("Usage: evalhub <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  validate      Validate a request and print it with defaults applied");
        out.println("  estimate      Estimate how long a request will take");
        out.println("  run           Run a request and print the final response");
        out.println("  config        Show/set configuration");
        out.println();
        out.println("Options:");
        out.println("  -h, --help    Show help for a command");
        out.println("  -v, --version Show version");
        out.println();
        out.println("Examples:");
        out.println("  evalhub validate request.json");
        out.println("  evalhub estimate request.json --json");
        out.println("  evalhub run request.json --command ./run-eval.sh --summary");
        out.println("  evalhub config --set maxConcurrentEvaluations=4");
    }

    private void printRunHelp() {
        out.println("Usage: evalhub run <request.json> [options]");
        out.println();
        out.println("Run every evaluation of a request and print the final response as JSON.");
        out.println("The executor command receives each resolved evaluation as JSON on stdin");
        out.println("and prints a JSON array of benchmark results on stdout.");
        out.println();
        out.println("Options:");
        out.println("  --config <file>     Config file (default: ~/.config/evalhub/evalhub.json)");
        out.println("  --command <cmd>     Executor command, overrides executorCommand in the config");
        out.println("  --summary           Print a table instead of JSON");
        out.println("  --quiet             Do not report progress on stderr");
        out.println();
        out.println("Examples:");
        out.println("  evalhub run request.json --command ./run-eval.sh");
        out.println("  evalhub run request.json --config ci.json --summary");
    }

    /**
     * Bad command-line input.
     */
    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    // ===== Response records for JSON output =====

    record EstimateResponse(int evaluations, int benchmarks, int estimatedMinutes) {}
}
