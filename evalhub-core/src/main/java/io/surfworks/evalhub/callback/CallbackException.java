package io.surfworks.evalhub.callback;

import io.surfworks.evalhub.EvalHubException;

/**
 * Thrown when a completion callback could not be delivered.
 */
public class CallbackException extends EvalHubException {

    private final int attempts;

    public CallbackException(String message, int attempts) {
        super(message);
        this.attempts = attempts;
    }

    public CallbackException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    /**
     * Returns how many delivery attempts were made.
     */
    public int attempts() {
        return attempts;
    }
}
