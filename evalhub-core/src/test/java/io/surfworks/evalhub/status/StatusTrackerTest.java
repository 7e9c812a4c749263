package io.surfworks.evalhub.status;

import io.surfworks.evalhub.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static io.surfworks.evalhub.status.EvaluationStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StatusTracker.
 */
class StatusTrackerTest {

    private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");

    private MutableClock clock;
    private StatusTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        tracker = new StatusTracker(clock);
    }

    private void runToCompletion(String requestId, String evaluationId) {
        assertTrue(tracker.markInitializing(requestId, evaluationId));
        assertTrue(tracker.markRunning(requestId, evaluationId));
        assertTrue(tracker.markCompleting(requestId, evaluationId));
        assertTrue(tracker.markCompleted(requestId, evaluationId));
    }

    @Nested
    class Transitions {

        @BeforeEach
        void register() {
            tracker.register("r1", List.of("e1"), START);
        }

        @Test
        void newUnitsArePending() {
            assertEquals(PENDING, tracker.status("r1", "e1"));
            assertEquals(RequestStatus.PENDING, tracker.aggregateStatus("r1"));
        }

        @Test
        void happyPathRecordsTimes() {
            tracker.markInitializing("r1", "e1");
            clock.advance(Duration.ofMinutes(3));
            tracker.markRunning("r1", "e1");
            tracker.markCompleting("r1", "e1");
            tracker.markCompleted("r1", "e1");

            UnitState unit = tracker.progress("r1").unit("e1");
            assertEquals(COMPLETED, unit.status());
            assertEquals(START, unit.startedAt());
            assertEquals(START.plus(Duration.ofMinutes(3)), unit.completedAt());
            assertEquals(1, unit.attempts());
            assertEquals(Duration.ofMinutes(3), unit.elapsed(clock.instant()));
        }

        @Test
        void guardsRejectSkippedStates() {
            assertFalse(tracker.markRunning("r1", "e1"));
            assertFalse(tracker.markCompleting("r1", "e1"));
            assertFalse(tracker.markCompleted("r1", "e1"));
            assertEquals(PENDING, tracker.status("r1", "e1"));
        }

        @Test
        void terminalStatesAreFinal() {
            tracker.markFailed("r1", "e1", "boom");

            assertFalse(tracker.markInitializing("r1", "e1"));
            assertFalse(tracker.markCancelled("r1", "e1"));
            assertFalse(tracker.markFailed("r1", "e1", "again"));
            assertFalse(tracker.requeue("r1", "e1", "retry"));
            assertEquals("boom", tracker.progress("r1").unit("e1").errorMessage());
        }

        @Test
        void requeueResetsStartAndCountsAttempts() {
            tracker.markInitializing("r1", "e1");
            tracker.markRunning("r1", "e1");
            assertTrue(tracker.requeue("r1", "e1", "executor crashed"));

            UnitState requeued = tracker.progress("r1").unit("e1");
            assertEquals(PENDING, requeued.status());
            assertNull(requeued.startedAt());
            assertEquals("executor crashed", requeued.errorMessage());

            clock.advance(Duration.ofMinutes(1));
            tracker.markInitializing("r1", "e1");
            UnitState retried = tracker.progress("r1").unit("e1");
            assertEquals(2, retried.attempts());
            assertEquals(START.plus(Duration.ofMinutes(1)), retried.startedAt());
        }

        @Test
        void pendingUnitCannotBeRequeued() {
            assertFalse(tracker.requeue("r1", "e1", "nope"));
        }

        @Test
        void timeoutOnlyFromDispatchedOrRunning() {
            assertFalse(tracker.markTimedOut("r1", "e1", Duration.ofMinutes(5)));

            tracker.markInitializing("r1", "e1");
            assertTrue(tracker.markTimedOut("r1", "e1", Duration.ofMinutes(5)));

            UnitState unit = tracker.progress("r1").unit("e1");
            assertEquals(TIMEOUT, unit.status());
            assertEquals("Evaluation exceeded timeout of 5 minutes", unit.errorMessage());
            assertEquals(RequestStatus.FAILED, tracker.aggregateStatus("r1"));
        }

        @Test
        void overdueMeasuresCurrentAttempt() {
            Duration timeout = Duration.ofMinutes(10);
            assertFalse(tracker.isOverdue("r1", "e1", timeout));

            tracker.markInitializing("r1", "e1");
            tracker.markRunning("r1", "e1");
            clock.advance(Duration.ofMinutes(10));
            assertFalse(tracker.isOverdue("r1", "e1", timeout));
            clock.advance(Duration.ofSeconds(1));
            assertTrue(tracker.isOverdue("r1", "e1", timeout));

            tracker.requeue("r1", "e1", "retry");
            tracker.markInitializing("r1", "e1");
            assertFalse(tracker.isOverdue("r1", "e1", timeout));
        }

        @Test
        void unknownIdsThrow() {
            assertThrows(NoSuchElementException.class, () -> tracker.status("missing", "e1"));
            assertThrows(NoSuchElementException.class, () -> tracker.status("r1", "missing"));
        }

        @Test
        void duplicateRegistrationThrows() {
            assertThrows(IllegalStateException.class, () -> tracker.register("r1", List.of("x"), START));
        }

        @Test
        void removeForgetsRequest() {
            assertTrue(tracker.contains("r1"));
            tracker.remove("r1");
            assertFalse(tracker.contains("r1"));
        }
    }

    @Nested
    class Progress {

        @Test
        void twoOfFourTerminalIsFiftyPercent() {
            tracker.register("r1", List.of("a", "b", "c", "d"), START);
            runToCompletion("r1", "a");
            tracker.markInitializing("r1", "b");
            tracker.markFailed("r1", "b", "boom");
            tracker.markInitializing("r1", "c");
            tracker.markRunning("r1", "c");

            RequestProgress progress = tracker.progress("r1");

            assertEquals(4, progress.totalEvaluations());
            assertEquals(1, progress.completedEvaluations());
            assertEquals(1, progress.failedEvaluations());
            assertEquals(50.0, progress.progressPercentage());
            assertEquals(RequestStatus.RUNNING, progress.status());
            assertFalse(progress.isTerminal());
        }

        @Test
        void timeoutCountsAsFailed() {
            tracker.register("r1", List.of("a", "b"), START);
            tracker.markInitializing("r1", "a");
            tracker.markTimedOut("r1", "a", Duration.ofMinutes(1));
            runToCompletion("r1", "b");

            RequestProgress progress = tracker.progress("r1");
            assertEquals(1, progress.failedEvaluations());
            assertEquals(1, progress.completedEvaluations());
            assertEquals(100.0, progress.progressPercentage());
        }

        @Test
        void snapshotIsUnaffectedByLaterChanges() {
            tracker.register("r1", List.of("a"), START);
            RequestProgress before = tracker.progress("r1");
            runToCompletion("r1", "a");

            assertEquals(PENDING, before.unit("a").status());
            assertEquals(0.0, before.progressPercentage());
        }

        @Test
        void unitsKeepRegistrationOrder() {
            tracker.register("r1", List.of("z", "a", "m"), START);
            assertEquals(List.of("z", "a", "m"),
                    tracker.progress("r1").units().stream().map(UnitState::evaluationId).toList());
        }

        @Test
        void concurrentCompletionsAreAllCounted() throws InterruptedException {
            int units = 50;
            List<String> ids = new ArrayList<>();
            for (int i = 0; i < units; i++) {
                ids.add("e" + i);
            }
            tracker.register("r1", ids, START);

            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch go = new CountDownLatch(1);
            for (String id : ids) {
                pool.execute(() -> {
                    try {
                        go.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    runToCompletion("r1", id);
                });
            }
            go.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

            RequestProgress progress = tracker.progress("r1");
            assertEquals(units, progress.completedEvaluations());
            assertEquals(RequestStatus.COMPLETED, progress.status());
        }
    }

    @Nested
    class Cancellation {

        @Test
        void cancelLeavesTerminalUnitsAlone() {
            tracker.register("r1", List.of("pending", "running", "done"), START);
            tracker.markInitializing("r1", "running");
            tracker.markRunning("r1", "running");
            runToCompletion("r1", "done");

            List<String> cancelled = tracker.cancelRequest("r1");

            assertEquals(List.of("pending", "running"), cancelled);
            assertEquals(CANCELLED, tracker.status("r1", "pending"));
            assertEquals(CANCELLED, tracker.status("r1", "running"));
            assertEquals(COMPLETED, tracker.status("r1", "done"));
            assertTrue(tracker.isCancelRequested("r1"));
            assertEquals(RequestStatus.CANCELLED, tracker.aggregateStatus("r1"));
        }

        @Test
        void cancelledQueuedUnitIsNotDispatched() {
            tracker.register("r1", List.of("a"), START);
            tracker.cancelRequest("r1");
            assertFalse(tracker.markInitializing("r1", "a"));
        }

        @Test
        void cancelAfterCompletionChangesNothing() {
            tracker.register("r1", List.of("a"), START);
            runToCompletion("r1", "a");

            assertTrue(tracker.cancelRequest("r1").isEmpty());
            assertEquals(RequestStatus.COMPLETED, tracker.aggregateStatus("r1"));
        }
    }

    @Nested
    class Derivation {

        @Test
        void emptyIsPending() {
            assertEquals(RequestStatus.PENDING, StatusTracker.deriveStatus(List.of()));
            assertEquals(0.0, StatusTracker.progressPercentage(List.of()));
        }

        @Test
        void anyInFlightIsRunning() {
            assertEquals(RequestStatus.RUNNING, StatusTracker.deriveStatus(List.of(COMPLETED, PENDING)));
            assertEquals(RequestStatus.RUNNING, StatusTracker.deriveStatus(List.of(FAILED, RUNNING)));
            assertEquals(RequestStatus.PENDING, StatusTracker.deriveStatus(List.of(PENDING, PENDING)));
        }

        @Test
        void allCompletedIsCompleted() {
            assertEquals(RequestStatus.COMPLETED, StatusTracker.deriveStatus(List.of(COMPLETED, COMPLETED)));
        }

        @Test
        void failureBeatsCancellation() {
            assertEquals(RequestStatus.FAILED, StatusTracker.deriveStatus(List.of(COMPLETED, FAILED, CANCELLED)));
            assertEquals(RequestStatus.FAILED, StatusTracker.deriveStatus(List.of(TIMEOUT, COMPLETED)));
        }

        @Test
        void cancelledWithoutFailureIsCancelled() {
            assertEquals(RequestStatus.CANCELLED, StatusTracker.deriveStatus(List.of(COMPLETED, CANCELLED)));
        }

        @Test
        void statusIdsRoundTrip() {
            for (EvaluationStatus status : EvaluationStatus.values()) {
                assertEquals(status, EvaluationStatus.fromId(status.id()).orElseThrow());
            }
            assertTrue(EvaluationStatus.fromId("bogus").isEmpty());
        }
    }
}
