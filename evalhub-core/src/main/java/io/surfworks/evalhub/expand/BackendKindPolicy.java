package io.surfworks.evalhub.expand;

import io.surfworks.evalhub.config.EvalHubConfig;
import io.surfworks.evalhub.model.BackendType;

import java.util.Map;
import java.util.Objects;

/**
 * Explicit backend-name to kind table used when backends are synthesized.
 *
 * <p>Names missing from the table get the configured fallback kind.
 */
public final class BackendKindPolicy {

    private final Map<String, BackendType> kinds;
    private final BackendType fallback;

    public BackendKindPolicy(Map<String, BackendType> kinds, BackendType fallback) {
        this.kinds = Map.copyOf(Objects.requireNonNull(kinds, "kinds cannot be null"));
        this.fallback = Objects.requireNonNull(fallback, "fallback cannot be null");
    }

    public static BackendKindPolicy from(EvalHubConfig config) {
        return new BackendKindPolicy(config.backendKinds(), config.fallbackBackendKind());
    }

    /**
     * Returns the kind of the named backend.
     */
    public BackendType kindOf(String backendName) {
        return kinds.getOrDefault(backendName, fallback);
    }

    /**
     * Returns true if the name has an explicit entry rather than the fallback.
     */
    public boolean isMapped(String backendName) {
        return kinds.containsKey(backendName);
    }
}
