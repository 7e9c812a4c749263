package io.surfworks.evalhub.config;

import io.surfworks.evalhub.EvalHubException;

/**
 * Thrown when server-side configuration cannot satisfy a request,
 * for example an unmapped risk category.
 */
public class ConfigurationException extends EvalHubException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
