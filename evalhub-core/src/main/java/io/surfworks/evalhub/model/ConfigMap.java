package io.surfworks.evalhub.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, insertion-ordered key/value container for free-form configuration.
 *
 * <p>Values are whatever the caller supplied (strings, numbers, booleans, lists,
 * nested maps, or {@code null}). Merging is shallow: {@link #overlay(ConfigMap)}
 * replaces a key as a whole, nested maps are not merged.
 */
public final class ConfigMap {

    private static final ConfigMap EMPTY = new ConfigMap(Map.of());

    private final Map<String, Object> entries;

    private ConfigMap(Map<String, Object> entries) {
        this.entries = entries;
    }

    /**
     * Returns the empty map.
     */
    public static ConfigMap empty() {
        return EMPTY;
    }

    /**
     * Copies the given map. A {@code null} map yields {@link #empty()}.
     */
    public static ConfigMap of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : values.entrySet()) {
            copy.put(Objects.requireNonNull(e.getKey(), "config keys cannot be null"), e.getValue());
        }
        return new ConfigMap(Collections.unmodifiableMap(copy));
    }

    /**
     * Creates a map from alternating key/value arguments.
     */
    public static ConfigMap of(String key, Object value, Object... more) {
        if (more.length % 2 != 0) {
            throw new IllegalArgumentException("key/value arguments must come in pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        for (int i = 0; i < more.length; i += 2) {
            map.put((String) more[i], more[i + 1]);
        }
        return of(map);
    }

    /**
     * Returns this map's entries as defaults with {@code override}'s entries on top.
     * Keys present in both take the override's value; everything else is kept.
     */
    public ConfigMap overlay(ConfigMap override) {
        if (override == null || override.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return override;
        }
        Map<String, Object> merged = new LinkedHashMap<>(entries);
        merged.putAll(override.entries);
        return new ConfigMap(Collections.unmodifiableMap(merged));
    }

    /**
     * Returns a copy with one entry added or replaced.
     */
    public ConfigMap with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(entries);
        copy.put(Objects.requireNonNull(key, "key cannot be null"), value);
        return new ConfigMap(Collections.unmodifiableMap(copy));
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Returns an unmodifiable view of the entries.
     */
    public Map<String, Object> asMap() {
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConfigMap other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
