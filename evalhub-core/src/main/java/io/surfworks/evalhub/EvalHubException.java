package io.surfworks.evalhub;

/**
 * Base class for the checked exceptions raised by evalhub.
 */
public class EvalHubException extends Exception {

    public EvalHubException(String message) {
        super(message);
    }

    public EvalHubException(String message, Throwable cause) {
        super(message, cause);
    }
}
