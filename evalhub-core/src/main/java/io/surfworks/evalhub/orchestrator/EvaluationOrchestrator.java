package io.surfworks.evalhub.orchestrator;

import io.surfworks.evalhub.aggregate.ResultAggregator;
import io.surfworks.evalhub.callback.CallbackException;
import io.surfworks.evalhub.callback.CallbackNotifier;
import io.surfworks.evalhub.config.ConfigurationException;
import io.surfworks.evalhub.config.EvalHubConfig;
import io.surfworks.evalhub.executor.EvaluationExecutor;
import io.surfworks.evalhub.executor.ExecutionPoll;
import io.surfworks.evalhub.executor.ExecutorException;
import io.surfworks.evalhub.json.EvalHubJson;
import io.surfworks.evalhub.model.BackendSpec;
import io.surfworks.evalhub.model.BenchmarkSpec;
import io.surfworks.evalhub.model.EvaluationRequest;
import io.surfworks.evalhub.model.EvaluationSpec;
import io.surfworks.evalhub.pipeline.RequestResolver;
import io.surfworks.evalhub.result.EvaluationResponse;
import io.surfworks.evalhub.result.EvaluationResult;
import io.surfworks.evalhub.status.EvaluationStatus;
import io.surfworks.evalhub.status.RequestProgress;
import io.surfworks.evalhub.status.StatusTracker;
import io.surfworks.evalhub.status.UnitState;
import io.surfworks.evalhub.tracking.TrackingException;
import io.surfworks.evalhub.tracking.TrackingParameters;
import io.surfworks.evalhub.tracking.TrackingSink;
import io.surfworks.evalhub.validation.ValidationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Runs requests end to end: resolve, track, execute, aggregate, notify.
 *
 * <p>Every evaluation unit becomes one task on a fixed pool of
 * {@code maxConcurrentEvaluations} workers; units beyond the ceiling wait in
 * {@code pending}, higher priority first. A worker drives its unit through
 * {@code initializing -> running -> completing -> completed}, polling the executor and
 * checking the unit's deadline on every poll. Executor failures put the unit back in
 * {@code pending} while its retry budget lasts.
 *
 * <p>Tracking failures are logged and otherwise ignored. When a request first reaches a
 * terminal status, its callback (if any) is delivered once on a separate thread.
 *
 * <p>A finished request stays queryable for {@code requestRetention} after its callback
 * was attempted and its last worker exited; then it is forgotten.
 */
public final class EvaluationOrchestrator implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(EvaluationOrchestrator.class.getName());

    private final EvalHubConfig config;
    private final RequestResolver resolver;
    private final StatusTracker tracker;
    private final ResultAggregator aggregator;
    private final EvaluationExecutor executor;
    private final TrackingSink trackingSink;
    private final CallbackNotifier callbackNotifier;
    private final Clock clock;

    private final Map<String, RequestRun> runs = new ConcurrentHashMap<>();
    private final ThreadPoolExecutor workers;
    private final ExecutorService notifications;
    private final ScheduledExecutorService housekeeping;
    private final AtomicInteger threadCounter = new AtomicInteger(0);
    private final AtomicLong taskSequence = new AtomicLong(0);
    private volatile boolean closed;

    public EvaluationOrchestrator(EvalHubConfig config, EvaluationExecutor executor, TrackingSink trackingSink) {
        this(config, executor, trackingSink,
                new CallbackNotifier(config.callback(), new EvalHubJson(config)), Clock.systemUTC());
    }

    public EvaluationOrchestrator(
            EvalHubConfig config,
            EvaluationExecutor executor,
            TrackingSink trackingSink,
            CallbackNotifier callbackNotifier,
            Clock clock
    ) {
        this.config = config;
        this.resolver = new RequestResolver(config);
        this.tracker = new StatusTracker(clock);
        this.aggregator = new ResultAggregator(config);
        this.executor = executor;
        this.trackingSink = trackingSink;
        this.callbackNotifier = callbackNotifier;
        this.clock = clock;

        int poolSize = config.maxConcurrentEvaluations();
        this.workers = new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
                new PriorityBlockingQueue<>(), r -> {
                    Thread t = new Thread(r, "evalhub-worker-" + threadCounter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        this.notifications = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "evalhub-callback");
            t.setDaemon(true);
            return t;
        });
        this.housekeeping = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "evalhub-housekeeping");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Resolves and starts a request.
     *
     * <p>Returns at once in async mode; otherwise waits until every unit is terminal.
     *
     * @return the response as of return
     * @throws ValidationException    if the request is malformed or was already submitted
     * @throws ConfigurationException if the request cannot be resolved with this configuration
     */
    public EvaluationResponse submit(EvaluationRequest request) throws ValidationException, ConfigurationException {
        if (closed) {
            throw new IllegalStateException("Orchestrator is closed");
        }
        if (runs.containsKey(request.requestId())) {
            throw new ValidationException("request_id", "request " + request.requestId() + " was already submitted");
        }

        EvaluationRequest resolved = resolver.resolve(request);

        List<String> evaluationIds = new ArrayList<>();
        for (EvaluationSpec evaluation : resolved.evaluations()) {
            evaluationIds.add(evaluation.id());
        }
        try {
            tracker.register(resolved.requestId(), evaluationIds, resolved.createdAt());
        } catch (IllegalStateException e) {
            throw new ValidationException("request_id", "request " + request.requestId() + " was already submitted", e);
        }
        RequestRun run = new RequestRun(resolved);
        runs.put(resolved.requestId(), run);

        createExperiment(run);

        LOG.info("Accepted request " + resolved.requestId() + ": " + evaluationIds.size()
                + " evaluations, " + resolved.benchmarkCount() + " benchmarks, estimated "
                + aggregator.estimateCompletionMinutes(resolved) + " minutes");

        run.activeTasks.set(resolved.evaluations().size());
        for (EvaluationSpec evaluation : resolved.evaluations()) {
            workers.execute(new UnitTask(run, evaluation, taskSequence.incrementAndGet()));
        }

        if (!resolved.asyncMode()) {
            try {
                run.done.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warning("Interrupted while waiting for request " + resolved.requestId());
            }
        }
        return response(run);
    }

    /**
     * Returns the current response for a request, if it is known and not yet evicted.
     */
    public Optional<EvaluationResponse> status(String requestId) {
        RequestRun run = runs.get(requestId);
        return run == null ? Optional.empty() : Optional.of(response(run));
    }

    /**
     * Cancels a request. Units already terminal are unaffected; in-flight executions are
     * asked to stop.
     *
     * @return true if any unit was cancelled
     */
    public boolean cancel(String requestId) {
        RequestRun run = runs.get(requestId);
        if (run == null) {
            return false;
        }
        List<String> cancelled = tracker.cancelRequest(requestId);
        for (String evaluationId : cancelled) {
            String handle = run.handles.get(evaluationId);
            if (handle != null) {
                cancelExecution(handle);
            }
        }
        checkFinished(run);
        return !cancelled.isEmpty();
    }

    /**
     * Waits until a request is terminal (and its callback attempted) or the timeout passes.
     *
     * @return the response at that moment; check {@link EvaluationResponse#isTerminal()}
     * @throws NoSuchElementException if the request is unknown
     * @throws InterruptedException if interrupted while waiting
     */
    public EvaluationResponse awaitCompletion(String requestId, Duration timeout) throws InterruptedException {
        RequestRun run = runs.get(requestId);
        if (run == null) {
            throw new NoSuchElementException("Request not found: " + requestId);
        }
        run.done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return response(run);
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;

        workers.shutdownNow();
        notifications.shutdown();
        housekeeping.shutdownNow();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warning("Workers did not stop within 10 seconds");
            }
            if (!notifications.awaitTermination(10, TimeUnit.SECONDS)) {
                notifications.shutdownNow();
            }
        } catch (InterruptedException e) {
            notifications.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor.close();
    }

    // ===== Unit execution =====

    private void runUnit(RequestRun run, EvaluationSpec evaluation) {
        String requestId = run.request.requestId();
        String evaluationId = evaluation.id();
        int retryBudget = Math.min(evaluation.retryAttempts(), config.maxRetryAttempts());
        int retries = 0;

        while (true) {
            if (!tracker.markInitializing(requestId, evaluationId)) {
                // Cancelled while queued
                return;
            }
            if (retries == 0) {
                startTrackingRun(run, evaluation);
            }

            Outcome outcome;
            String handle = null;
            try {
                handle = executor.submit(evaluation);
                run.handles.put(evaluationId, handle);
                outcome = pollUntilDone(run, evaluation, handle);
            } catch (ExecutorException e) {
                outcome = tracker.status(requestId, evaluationId).isTerminal()
                        ? Outcome.cancelled()
                        : Outcome.failed(e.getMessage());
            }

            switch (outcome.kind()) {
                case SUCCEEDED -> {
                    complete(run, evaluation, outcome.results());
                    return;
                }
                case TIMED_OUT -> {
                    if (handle != null) {
                        cancelExecution(handle);
                    }
                    if (tracker.markTimedOut(requestId, evaluationId, evaluation.timeout())) {
                        LOG.warning("Evaluation " + evaluationId + " timed out after "
                                + evaluation.timeoutMinutes() + " minutes");
                        finishUnit(run, evaluationId, EvaluationStatus.TIMEOUT);
                    }
                    return;
                }
                case CANCELLED -> {
                    if (handle != null) {
                        cancelExecution(handle);
                    }
                    finishUnit(run, evaluationId, EvaluationStatus.CANCELLED);
                    return;
                }
                case FAILED -> {
                    if (retries < retryBudget && tracker.requeue(requestId, evaluationId, outcome.error())) {
                        retries++;
                        LOG.warning("Evaluation " + evaluationId + " failed (" + outcome.error() + "), retry "
                                + retries + "/" + retryBudget);
                        continue;
                    }
                    if (tracker.markFailed(requestId, evaluationId, outcome.error())) {
                        LOG.warning("Evaluation " + evaluationId + " failed: " + outcome.error());
                        finishUnit(run, evaluationId, EvaluationStatus.FAILED);
                    }
                    return;
                }
                default -> throw new IllegalStateException("Unexpected outcome: " + outcome.kind());
            }
        }
    }

    private Outcome pollUntilDone(RequestRun run, EvaluationSpec evaluation, String handle)
            throws ExecutorException {
        String requestId = run.request.requestId();
        String evaluationId = evaluation.id();

        while (true) {
            if (tracker.status(requestId, evaluationId).isTerminal()) {
                return Outcome.cancelled();
            }
            if (tracker.isOverdue(requestId, evaluationId, evaluation.timeout())) {
                return Outcome.timedOut();
            }

            ExecutionPoll poll = executor.poll(handle);
            switch (poll.state()) {
                case RUNNING -> tracker.markRunning(requestId, evaluationId);
                case SUCCEEDED -> {
                    tracker.markRunning(requestId, evaluationId);
                    return Outcome.succeeded(poll.results());
                }
                case FAILED -> {
                    return Outcome.failed(poll.error() != null ? poll.error() : "Execution failed");
                }
                default -> {
                    // still queued on the executor side
                }
            }

            try {
                Thread.sleep(config.pollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Outcome.failed("Interrupted while waiting for the executor");
            }
        }
    }

    private void complete(RequestRun run, EvaluationSpec evaluation, List<EvaluationResult> raw) {
        String requestId = run.request.requestId();
        String evaluationId = evaluation.id();

        if (!tracker.markCompleting(requestId, evaluationId)) {
            return;
        }
        List<EvaluationResult> matched;
        try {
            matched = matchRequested(evaluation, raw);
        } catch (ExecutorException e) {
            if (tracker.markFailed(requestId, evaluationId, e.getMessage())) {
                LOG.warning("Evaluation " + evaluationId + " returned unusable results: " + e.getMessage());
                finishUnit(run, evaluationId, EvaluationStatus.FAILED);
            }
            return;
        }

        UnitState unit = tracker.progress(requestId).unit(evaluationId);
        Instant now = clock.instant();
        String runId = run.runIds.get(evaluationId);

        List<EvaluationResult> results = new ArrayList<>(matched.size());
        for (EvaluationResult result : matched) {
            EvaluationResult stored = new EvaluationResult(
                    evaluationId,
                    result.backendName(),
                    result.benchmarkName(),
                    EvaluationStatus.COMPLETED,
                    result.metrics(),
                    result.artifacts(),
                    result.errorMessage(),
                    result.startedAt() != null ? result.startedAt() : unit.startedAt(),
                    result.completedAt() != null ? result.completedAt() : now,
                    runId
            );
            if (runId != null) {
                try {
                    trackingSink.logResult(runId, stored);
                } catch (TrackingException | RuntimeException e) {
                    LOG.warning("Failed to log result of " + evaluationId + " to " + trackingSink.name()
                            + ": " + e.getMessage());
                }
            }
            results.add(stored);
        }
        run.results.put(evaluationId, List.copyOf(results));

        if (tracker.markCompleted(requestId, evaluationId)) {
            LOG.info("Evaluation " + evaluationId + " completed with " + results.size() + " results");
            finishUnit(run, evaluationId, EvaluationStatus.COMPLETED);
        }
    }

    /**
     * Orders executor results by the unit's benchmarks; every requested benchmark must
     * have exactly one result and nothing else may be reported.
     */
    static List<EvaluationResult> matchRequested(EvaluationSpec evaluation, List<EvaluationResult> raw)
            throws ExecutorException {
        if (raw.isEmpty()) {
            throw new ExecutorException("Executor returned no results");
        }
        Set<String> requested = new LinkedHashSet<>();
        for (BackendSpec backend : evaluation.backends()) {
            for (BenchmarkSpec benchmark : backend.benchmarks()) {
                requested.add(backend.name() + "/" + benchmark.name());
            }
        }

        Map<String, EvaluationResult> byBenchmark = new LinkedHashMap<>();
        for (EvaluationResult result : raw) {
            String key = result.backendName() + "/" + result.benchmarkName();
            if (!requested.contains(key)) {
                throw new ExecutorException("Executor returned a result for unrequested benchmark " + key);
            }
            if (byBenchmark.putIfAbsent(key, result) != null) {
                throw new ExecutorException("Executor returned more than one result for " + key);
            }
        }

        List<String> missing = new ArrayList<>();
        List<EvaluationResult> ordered = new ArrayList<>(requested.size());
        for (String key : requested) {
            EvaluationResult result = byBenchmark.get(key);
            if (result == null) {
                missing.add(key);
            } else {
                ordered.add(result);
            }
        }
        if (!missing.isEmpty()) {
            throw new ExecutorException("Executor returned no result for " + String.join(", ", missing));
        }
        return ordered;
    }

    private void finishUnit(RequestRun run, String evaluationId, EvaluationStatus status) {
        String runId = run.runIds.get(evaluationId);
        if (runId != null) {
            try {
                trackingSink.endRun(runId, status);
            } catch (TrackingException | RuntimeException e) {
                LOG.warning("Failed to end tracking run " + runId + ": " + e.getMessage());
            }
        }
        checkFinished(run);
    }

    private void checkFinished(RequestRun run) {
        RequestProgress progress = tracker.progress(run.request.requestId());
        if (!progress.isTerminal() || !run.finished.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Request " + run.request.requestId() + " finished: " + progress.status().id()
                + " (" + progress.completedEvaluations() + " completed, "
                + progress.failedEvaluations() + " failed)");

        try {
            notifications.execute(() -> {
                try {
                    deliverCallback(run);
                } finally {
                    finish(run);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.warning("Callback for request " + run.request.requestId() + " skipped: orchestrator closed");
            finish(run);
        }
    }

    private void finish(RequestRun run) {
        run.finalResponse = response(run);
        run.done.countDown();
        scheduleEviction(run);
    }

    // ===== Retention =====

    private void scheduleEviction(RequestRun run) {
        if (run.finalResponse == null || run.activeTasks.get() > 0
                || !run.evictionScheduled.compareAndSet(false, true)) {
            return;
        }
        Duration retention = config.requestRetention();
        if (retention.isZero()) {
            evict(run);
            return;
        }
        try {
            housekeeping.schedule(() -> evict(run), retention.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.fine("Not evicting request " + run.request.requestId() + ": orchestrator closed");
        }
    }

    private void evict(RequestRun run) {
        String requestId = run.request.requestId();
        // Tracker first, so a resubmission never finds a stale tracker entry
        tracker.remove(requestId);
        runs.remove(requestId, run);
        LOG.fine("Evicted request " + requestId);
    }

    private void deliverCallback(RequestRun run) {
        EvaluationRequest request = run.request;
        if (!request.asyncMode() || !request.hasCallback()) {
            return;
        }
        try {
            callbackNotifier.send(request.callbackUrl(), response(run));
        } catch (CallbackException e) {
            run.callbackError = e.getMessage();
            LOG.warning("Callback for request " + request.requestId() + " failed after "
                    + e.attempts() + " attempts: " + e.getMessage());
        }
    }

    private void cancelExecution(String handle) {
        try {
            executor.cancel(handle);
        } catch (ExecutorException e) {
            LOG.warning("Failed to cancel execution " + handle + ": " + e.getMessage());
        }
    }

    // ===== Tracking =====

    private void createExperiment(RequestRun run) {
        try {
            String experimentId = trackingSink.createExperiment(run.request);
            if (experimentId != null) {
                run.experimentId = experimentId;
                run.experimentUrl = trackingSink.experimentUrl(experimentId);
            }
        } catch (TrackingException | RuntimeException e) {
            LOG.warning("Failed to create tracking experiment for request " + run.request.requestId()
                    + ": " + e.getMessage());
        }
    }

    private void startTrackingRun(RequestRun run, EvaluationSpec evaluation) {
        if (run.experimentId == null) {
            return;
        }
        try {
            String runId = trackingSink.startRun(run.experimentId, evaluation);
            if (runId != null) {
                run.runIds.put(evaluation.id(), runId);
                trackingSink.logParameters(runId, TrackingParameters.forEvaluation(evaluation));
            }
        } catch (TrackingException | RuntimeException e) {
            LOG.warning("Failed to start tracking run for evaluation " + evaluation.id() + ": " + e.getMessage());
        }
    }

    // ===== Response assembly =====

    private EvaluationResponse response(RequestRun run) {
        EvaluationResponse finalResponse = run.finalResponse;
        if (finalResponse != null) {
            return finalResponse;
        }
        EvaluationRequest request = run.request;
        RequestProgress progress = tracker.progress(request.requestId());

        List<EvaluationResult> results = new ArrayList<>();
        for (EvaluationSpec evaluation : request.evaluations()) {
            List<EvaluationResult> stored = run.results.get(evaluation.id());
            if (stored != null) {
                results.addAll(stored);
                continue;
            }
            UnitState unit = progress.unit(evaluation.id());
            if (unit.isTerminal()) {
                results.addAll(unsuccessfulResults(evaluation, unit, run.runIds.get(evaluation.id())));
            }
        }

        Instant estimatedCompletion = request.createdAt()
                .plus(Duration.ofMinutes(aggregator.estimateCompletionMinutes(request)));

        return new EvaluationResponse(
                request.requestId(),
                progress.status(),
                progress.totalEvaluations(),
                progress.completedEvaluations(),
                progress.failedEvaluations(),
                results,
                aggregator.aggregate(results),
                run.experimentUrl,
                request.createdAt(),
                progress.updatedAt(),
                estimatedCompletion,
                progress.progressPercentage(),
                run.callbackError
        );
    }

    /**
     * One result per benchmark for a unit that ended without results.
     */
    private static List<EvaluationResult> unsuccessfulResults(EvaluationSpec evaluation, UnitState unit, String runId) {
        String error = unit.errorMessage() != null
                ? unit.errorMessage()
                : "Evaluation " + unit.status().id();
        List<EvaluationResult> results = new ArrayList<>();
        for (BackendSpec backend : evaluation.backends()) {
            for (BenchmarkSpec benchmark : backend.benchmarks()) {
                results.add(new EvaluationResult(evaluation.id(), backend.name(), benchmark.name(),
                        unit.status(), Map.of(), Map.of(), error, unit.startedAt(), unit.completedAt(), runId));
            }
        }
        return results;
    }

    // ===== Internals =====

    private static final class RequestRun {
        private final EvaluationRequest request;
        private final Map<String, List<EvaluationResult>> results = new ConcurrentHashMap<>();
        private final Map<String, String> handles = new ConcurrentHashMap<>();
        private final Map<String, String> runIds = new ConcurrentHashMap<>();
        private final AtomicBoolean finished = new AtomicBoolean(false);
        private final AtomicBoolean evictionScheduled = new AtomicBoolean(false);
        private final AtomicInteger activeTasks = new AtomicInteger(0);
        private final CountDownLatch done = new CountDownLatch(1);
        private volatile EvaluationResponse finalResponse;
        private volatile String experimentId;
        private volatile String experimentUrl;
        private volatile String callbackError;

        RequestRun(EvaluationRequest request) {
            this.request = request;
        }
    }

    /**
     * Queued unit; higher priority first, then submission order.
     */
    private final class UnitTask implements Runnable, Comparable<UnitTask> {
        private final RequestRun run;
        private final EvaluationSpec evaluation;
        private final long sequence;

        UnitTask(RequestRun run, EvaluationSpec evaluation, long sequence) {
            this.run = run;
            this.evaluation = evaluation;
            this.sequence = sequence;
        }

        @Override
        public void run() {
            try {
                runUnit(run, evaluation);
            } catch (RuntimeException e) {
                LOG.severe("Unexpected error running evaluation " + evaluation.id() + ": " + e);
                if (tracker.markFailed(run.request.requestId(), evaluation.id(), "Internal error: " + e.getMessage())) {
                    finishUnit(run, evaluation.id(), EvaluationStatus.FAILED);
                }
            } finally {
                run.activeTasks.decrementAndGet();
                scheduleEviction(run);
            }
        }

        @Override
        public int compareTo(UnitTask other) {
            int byPriority = Integer.compare(other.evaluation.priority(), evaluation.priority());
            return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
        }
    }

    private enum OutcomeKind { SUCCEEDED, FAILED, TIMED_OUT, CANCELLED }

    private record Outcome(OutcomeKind kind, List<EvaluationResult> results, String error) {
        static Outcome succeeded(List<EvaluationResult> results) {
            return new Outcome(OutcomeKind.SUCCEEDED, results, null);
        }

        static Outcome failed(String error) {
            return new Outcome(OutcomeKind.FAILED, List.of(), error);
        }

        static Outcome timedOut() {
            return new Outcome(OutcomeKind.TIMED_OUT, List.of(), null);
        }

        static Outcome cancelled() {
            return new Outcome(OutcomeKind.CANCELLED, List.of(), null);
        }
    }
}
