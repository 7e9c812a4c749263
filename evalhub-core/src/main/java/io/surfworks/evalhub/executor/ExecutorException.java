package io.surfworks.evalhub.executor;

import io.surfworks.evalhub.EvalHubException;

/**
 * Exception thrown when an execution engine fails to run an evaluation unit.
 */
public class ExecutorException extends EvalHubException {

    public ExecutorException(String message) {
        super(message);
    }

    public ExecutorException(String message, Throwable cause) {
        super(message, cause);
    }
}
