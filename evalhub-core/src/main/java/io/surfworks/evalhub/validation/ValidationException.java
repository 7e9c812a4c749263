package io.surfworks.evalhub.validation;

import io.surfworks.evalhub.EvalHubException;

/**
 * Thrown when a caller-supplied request is malformed.
 *
 * <p>The offending location is kept separately from the reason so callers can
 * point at the exact field, e.g. {@code evaluations[2].backends[0].benchmarks[1]}.
 */
public class ValidationException extends EvalHubException {

    private final String path;
    private final String reason;

    public ValidationException(String path, String reason) {
        super(path == null || path.isEmpty() ? reason : path + ": " + reason);
        this.path = path == null ? "" : path;
        this.reason = reason;
    }

    public ValidationException(String path, String reason, Throwable cause) {
        super(path == null || path.isEmpty() ? reason : path + ": " + reason, cause);
        this.path = path == null ? "" : path;
        this.reason = reason;
    }

    /**
     * Returns the indexed path of the offending element (empty for request-level errors).
     */
    public String path() {
        return path;
    }

    /**
     * Returns the reason without the path prefix.
     */
    public String reason() {
        return reason;
    }
}
