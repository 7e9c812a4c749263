package io.surfworks.evalhub.executor;

import io.surfworks.evalhub.model.EvaluationSpec;

import java.time.Duration;

/**
 * Service Provider Interface for the engines that actually run evaluations.
 *
 * <p>An executor receives a fully resolved evaluation unit, runs every benchmark of
 * every backend in it, and reports one result per (backend, benchmark) pair.
 * Failures of the underlying engine are reported either by throwing
 * {@link ExecutorException} or by a {@link ExecutionPoll.State#FAILED} poll; callers
 * treat both the same way.
 *
 * <p>Implementations must be thread-safe.
 */
public interface EvaluationExecutor extends AutoCloseable {

    /**
     * Returns the name of this executor (e.g., "command", "mock").
     */
    String name();

    /**
     * Submits an evaluation unit for execution.
     *
     * @param evaluation the resolved evaluation unit
     * @return handle identifying this execution
     * @throws ExecutorException if submission fails
     */
    String submit(EvaluationSpec evaluation) throws ExecutorException;

    /**
     * Reports the current state of an execution without blocking.
     *
     * @param handle handle returned by {@link #submit}
     * @return current state, with results once finished
     * @throws ExecutorException if the state cannot be determined
     */
    ExecutionPoll poll(String handle) throws ExecutorException;

    /**
     * Asks the executor to stop an execution. Best-effort.
     *
     * @param handle handle returned by {@link #submit}
     * @return true if the execution was known and asked to stop
     * @throws ExecutorException if cancellation fails
     */
    boolean cancel(String handle) throws ExecutorException;

    /**
     * Waits for an execution to finish (blocking with timeout).
     *
     * @param handle       handle returned by {@link #submit}
     * @param timeout      maximum time to wait
     * @param pollInterval time between polls
     * @return the terminal poll
     * @throws ExecutorException if polling fails, the wait is interrupted, or it times out
     */
    default ExecutionPoll awaitCompletion(String handle, Duration timeout, Duration pollInterval)
            throws ExecutorException {
        long deadlineMillis = System.currentTimeMillis() + timeout.toMillis();

        while (System.currentTimeMillis() < deadlineMillis) {
            ExecutionPoll poll = poll(handle);
            if (poll.isTerminal()) {
                return poll;
            }
            try {
                Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(),
                        deadlineMillis - System.currentTimeMillis())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExecutorException("Interrupted while waiting for execution " + handle, e);
            }
        }

        throw new ExecutorException("Timeout waiting for execution " + handle + " after " + timeout);
    }

    /**
     * Closes this executor and releases any resources.
     */
    @Override
    void close();
}
