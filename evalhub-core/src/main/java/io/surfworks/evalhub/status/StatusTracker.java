package io.surfworks.evalhub.status;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Tracks the lifecycle of every evaluation unit and derives each request's aggregate status.
 *
 * <p>Transitions:
 * <pre>
 *   pending      -&gt; initializing        (dispatch; records start time)
 *   initializing -&gt; running             (executor acknowledged)
 *   running      -&gt; completing          (raw results received)
 *   completing   -&gt; completed           (results stored)
 *   initializing | running | completing -&gt; pending   (retry)
 *   initializing | running -&gt; timeout   (deadline exceeded)
 *   any non-terminal -&gt; failed | cancelled
 * </pre>
 *
 * <p>A transition whose guard does not hold is ignored and reported as {@code false}.
 * All mutations for one request are serialized on that request's lock, so concurrent
 * unit completions never interleave their counter updates.
 */
public final class StatusTracker {

    private static final Logger LOG = Logger.getLogger(StatusTracker.class.getName());

    private static final Set<EvaluationStatus> RETRYABLE = EnumSet.of(
            EvaluationStatus.INITIALIZING, EvaluationStatus.RUNNING, EvaluationStatus.COMPLETING);

    private static final Set<EvaluationStatus> TIMEABLE = EnumSet.of(
            EvaluationStatus.INITIALIZING, EvaluationStatus.RUNNING);

    private final Clock clock;
    private final Map<String, TrackedRequest> requests = new ConcurrentHashMap<>();

    public StatusTracker() {
        this(Clock.systemUTC());
    }

    public StatusTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Registers a request with its evaluation units, all in {@code pending}.
     *
     * @throws IllegalStateException if the request ID is already registered
     */
    public void register(String requestId, List<String> evaluationIds, Instant createdAt) {
        Objects.requireNonNull(requestId, "requestId cannot be null");
        Instant now = clock.instant();
        TrackedRequest request = new TrackedRequest(requestId, createdAt != null ? createdAt : now, now);
        for (String evaluationId : evaluationIds) {
            request.units.put(evaluationId, new TrackedUnit(evaluationId, now));
        }
        if (requests.putIfAbsent(requestId, request) != null) {
            throw new IllegalStateException("Request already registered: " + requestId);
        }
        LOG.fine("Registered request " + requestId + " with " + evaluationIds.size() + " evaluations");
    }

    public boolean contains(String requestId) {
        return requests.containsKey(requestId);
    }

    /**
     * Forgets a request.
     */
    public void remove(String requestId) {
        requests.remove(requestId);
    }

    // ===== Unit transitions =====

    /**
     * {@code pending -> initializing}. Starts the unit's wall-clock deadline.
     */
    public boolean markInitializing(String requestId, String evaluationId) {
        TrackedRequest request = request(requestId);
        synchronized (request) {
            TrackedUnit unit = request.unit(evaluationId);
            if (unit.status != EvaluationStatus.PENDING) {
                return false;
            }
            Instant now = move(request, unit, EvaluationStatus.INITIALIZING);
            unit.startedAt = now;
            unit.attempts++;
            return true;
        }
    }

    /**
     * {@code initializing -> running}.
     */
    public boolean markRunning(String requestId, String evaluationId) {
        return guarded(requestId, evaluationId, EvaluationStatus.INITIALIZING, EvaluationStatus.RUNNING);
    }

    /**
     * {@code running -> completing}.
     */
    public boolean markCompleting(String requestId, String evaluationId) {
        return guarded(requestId, evaluationId, EvaluationStatus.RUNNING, EvaluationStatus.COMPLETING);
    }

    /**
     * {@code completing -> completed}.
     */
    public boolean markCompleted(String requestId, String evaluationId) {
        return guarded(requestId, evaluationId, EvaluationStatus.COMPLETING, EvaluationStatus.COMPLETED);
    }

    /**
     * Any non-terminal state {@code -> failed}, recording the error text.
     */
    public boolean markFailed(String requestId, String evaluationId, String errorMessage) {
        TrackedRequest request = request(requestId);
        synchronized (request) {
            TrackedUnit unit = request.unit(evaluationId);
            if (unit.status.isTerminal()) {
                return false;
            }
            unit.errorMessage = errorMessage;
            move(request, unit, EvaluationStatus.FAILED);
            return true;
        }
    }

    /**
     * Any non-terminal state {@code -> cancelled}.
     */
    public boolean markCancelled(String requestId, String evaluationId) {
        TrackedRequest request = request(requestId);
        synchronized (request) {
            TrackedUnit unit = request.unit(evaluationId);
            if (unit.status.isTerminal()) {
                return false;
            }
            move(request, unit, EvaluationStatus.CANCELLED);
            return true;
        }
    }

    /**
     * {@code initializing | running -> timeout}.
     */
    public boolean markTimedOut(String requestId, String evaluationId, Duration timeout) {
        TrackedRequest request = request(requestId);
        synchronized (request) {
            TrackedUnit unit = request.unit(evaluationId);
            if (!TIMEABLE.contains(unit.status)) {
                return false;
            }
            unit.errorMessage = "Evaluation exceeded timeout of " + timeout.toMinutes() + " minutes";
            move(request, unit, EvaluationStatus.TIMEOUT);
            return true;
        }
    }

    /**
     * Puts an in-flight unit back in {@code pending} for another attempt.
     */
    public boolean requeue(String requestId, String evaluationId, String errorMessage) {
        TrackedRequest request = request(requestId);
        synchronized (request) {
            TrackedUnit unit = request.unit(evaluationId);
            if (!RETRYABLE.contains(unit.status)) {
                return false;
            }
            unit.errorMessage = errorMessage;
            unit.startedAt = null;
            move(request, unit, EvaluationStatus.PENDING);
            return true;
        }
    }

    /**
     * Returns true if the unit is dispatched or running and its current attempt has
     * been going for longer than {@code timeout}.
     */
    public boolean isOverdue(String requestId, String evaluationId, Duration timeout) {
        TrackedRequest request = request(requestId);
        synchronized (request) {
            TrackedUnit unit = request.unit(evaluationId);
            if (!TIMEABLE.contains(unit.status) || unit.startedAt == null) {
                return false;
            }
            return Duration.between(unit.startedAt, clock.instant()).compareTo(timeout) > 0;
        }
    }

    /**
     * Cancels a request: every non-terminal unit moves to {@code cancelled}; terminal
     * units are left alone.
     *
     * @return IDs of the units that were cancelled by this call
     */
    public List<String> cancelRequest(String requestId) {
        TrackedRequest request = request(requestId);
        synchronized (request) {
            request.cancelRequested = true;
            List<String> cancelled = new ArrayList<>();
            for (TrackedUnit unit : request.units.values()) {
                if (!unit.status.isTerminal()) {
                    move(request, unit, EvaluationStatus.CANCELLED);
                    cancelled.add(unit.evaluationId);
                }
            }
            LOG.info("Cancelled request " + requestId + " (" + cancelled.size() + " evaluations stopped)");
            return cancelled;
        }
    }

    // ===== Queries =====

    public EvaluationStatus status(String requestId, String evaluationId) {
        TrackedRequest request = request(requestId);
        synchronized (request) {
            return request.unit(evaluationId).status;
        }
    }

    public boolean isCancelRequested(String requestId) {
        TrackedRequest request = request(requestId);
        synchronized (request) {
            return request.cancelRequested;
        }
    }

    public RequestStatus aggregateStatus(String requestId) {
        return progress(requestId).status();
    }

    /**
     * Takes a consistent snapshot of a request.
     *
     * @throws NoSuchElementException if the request is unknown
     */
    public RequestProgress progress(String requestId) {
        TrackedRequest request = request(requestId);
        synchronized (request) {
            List<UnitState> units = new ArrayList<>(request.units.size());
            List<EvaluationStatus> statuses = new ArrayList<>(request.units.size());
            int completed = 0;
            int failed = 0;
            for (TrackedUnit unit : request.units.values()) {
                units.add(unit.snapshot());
                statuses.add(unit.status);
                if (unit.status.isSuccess()) {
                    completed++;
                } else if (unit.status.isFailure()) {
                    failed++;
                }
            }
            return new RequestProgress(
                    requestId,
                    deriveStatus(statuses),
                    units.size(),
                    completed,
                    failed,
                    progressPercentage(statuses),
                    request.cancelRequested,
                    request.createdAt,
                    request.updatedAt,
                    units
            );
        }
    }

    /**
     * Derives a request's status from its units' states.
     *
     * <ul>
     *   <li>any unit non-terminal: {@code running} once some unit has left {@code pending},
     *       otherwise {@code pending}</li>
     *   <li>all units {@code completed}: {@code completed}</li>
     *   <li>any unit {@code failed} or {@code timeout}: {@code failed}</li>
     *   <li>otherwise (some unit cancelled): {@code cancelled}</li>
     * </ul>
     */
    public static RequestStatus deriveStatus(Collection<EvaluationStatus> statuses) {
        if (statuses.isEmpty()) {
            return RequestStatus.PENDING;
        }
        boolean inFlight = false;
        boolean started = false;
        boolean allCompleted = true;
        boolean anyFailed = false;
        for (EvaluationStatus status : statuses) {
            if (!status.isTerminal()) {
                inFlight = true;
            }
            if (status != EvaluationStatus.PENDING) {
                started = true;
            }
            if (!status.isSuccess()) {
                allCompleted = false;
            }
            if (status.isFailure()) {
                anyFailed = true;
            }
        }
        if (inFlight) {
            return started ? RequestStatus.RUNNING : RequestStatus.PENDING;
        }
        if (allCompleted) {
            return RequestStatus.COMPLETED;
        }
        return anyFailed ? RequestStatus.FAILED : RequestStatus.CANCELLED;
    }

    /**
     * Terminal units over total units, as a percentage.
     */
    public static double progressPercentage(Collection<EvaluationStatus> statuses) {
        if (statuses.isEmpty()) {
            return 0.0;
        }
        long terminal = statuses.stream().filter(EvaluationStatus::isTerminal).count();
        return terminal * 100.0 / statuses.size();
    }

    // ===== Internals =====

    private boolean guarded(String requestId, String evaluationId, EvaluationStatus from, EvaluationStatus to) {
        TrackedRequest request = request(requestId);
        synchronized (request) {
            TrackedUnit unit = request.unit(evaluationId);
            if (unit.status != from) {
                return false;
            }
            move(request, unit, to);
            return true;
        }
    }

    private Instant move(TrackedRequest request, TrackedUnit unit, EvaluationStatus to) {
        Instant now = clock.instant();
        LOG.fine("Evaluation " + unit.evaluationId + ": " + unit.status.id() + " -> " + to.id());
        unit.status = to;
        unit.stateChangedAt = now;
        if (to.isTerminal()) {
            unit.completedAt = now;
        }
        request.updatedAt = now;
        return now;
    }

    private TrackedRequest request(String requestId) {
        TrackedRequest request = requests.get(requestId);
        if (request == null) {
            throw new NoSuchElementException("Request not found: " + requestId);
        }
        return request;
    }

    private static final class TrackedRequest {
        private final String requestId;
        private final Instant createdAt;
        private final Map<String, TrackedUnit> units = new LinkedHashMap<>();
        private Instant updatedAt;
        private boolean cancelRequested;

        TrackedRequest(String requestId, Instant createdAt, Instant updatedAt) {
            this.requestId = requestId;
            this.createdAt = createdAt;
            this.updatedAt = updatedAt;
        }

        TrackedUnit unit(String evaluationId) {
            TrackedUnit unit = units.get(evaluationId);
            if (unit == null) {
                throw new NoSuchElementException(
                        "Evaluation " + evaluationId + " not found in request " + requestId);
            }
            return unit;
        }
    }

    private static final class TrackedUnit {
        private final String evaluationId;
        private EvaluationStatus status = EvaluationStatus.PENDING;
        private Instant stateChangedAt;
        private Instant startedAt;
        private Instant completedAt;
        private int attempts;
        private String errorMessage;

        TrackedUnit(String evaluationId, Instant now) {
            this.evaluationId = evaluationId;
            this.stateChangedAt = now;
        }

        UnitState snapshot() {
            return new UnitState(evaluationId, status, stateChangedAt, startedAt, completedAt,
                    attempts, errorMessage);
        }
    }
}
