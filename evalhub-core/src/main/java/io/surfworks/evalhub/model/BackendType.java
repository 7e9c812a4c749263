package io.surfworks.evalhub.model;

import java.util.Optional;

/**
 * Kinds of execution engine that can run benchmarks.
 */
public enum BackendType {
    /** Few-shot evaluation harness */
    LM_EVALUATION_HARNESS("lm-evaluation-harness"),

    /** Load and performance testing tool */
    GUIDELLM("guidellm"),

    /** Remote evaluator container */
    NEMO_EVALUATOR("nemo-evaluator"),

    /** Caller-provided engine, exempt from the known-backend check */
    CUSTOM("custom");

    private final String id;

    BackendType(String id) {
        this.id = id;
    }

    /**
     * Returns the wire identifier (e.g. "lm-evaluation-harness").
     */
    public String id() {
        return id;
    }

    /**
     * Looks up a kind by its wire identifier, case-insensitively.
     */
    public static Optional<BackendType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (BackendType type : values()) {
            if (type.id.equalsIgnoreCase(id)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
