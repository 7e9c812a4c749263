package io.surfworks.evalhub.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Delivery settings for completion callbacks.
 *
 * @param timeout       Per-attempt request timeout
 * @param retryAttempts Total delivery attempts (at least 1)
 * @param retryDelay    Pause between attempts
 */
public record CallbackConfig(
        Duration timeout,
        int retryAttempts,
        Duration retryDelay
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);

    public CallbackConfig {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        Objects.requireNonNull(retryDelay, "retryDelay cannot be null");
        if (retryAttempts < 1) {
            throw new IllegalArgumentException("retryAttempts must be at least 1");
        }
    }

    public static CallbackConfig defaults() {
        return new CallbackConfig(DEFAULT_TIMEOUT, DEFAULT_RETRY_ATTEMPTS, DEFAULT_RETRY_DELAY);
    }
}
