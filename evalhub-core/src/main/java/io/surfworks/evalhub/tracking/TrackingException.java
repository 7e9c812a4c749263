package io.surfworks.evalhub.tracking;

import io.surfworks.evalhub.EvalHubException;

/**
 * Checked exception for experiment-tracking sink operations.
 */
public class TrackingException extends EvalHubException {

    public TrackingException(String message) {
        super(message);
    }

    public TrackingException(String message, Throwable cause) {
        super(message, cause);
    }
}
