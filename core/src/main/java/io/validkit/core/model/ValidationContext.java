package io.validkit.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only side channel handed to conditions, refinements, preprocess and transform callbacks
 * (current user, request metadata, locale, ...). It is never part of the validated data.
 */
public final class ValidationContext {

    private static final ValidationContext EMPTY = new ValidationContext(Map.of());

    private final Map<String, Object> values;

    private ValidationContext(Map<String, Object> values) {
        this.values = values;
    }

    /** Creates a context from a copy of the given map; {@code null} yields the empty context. */
    public static ValidationContext of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new ValidationContext(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /** Creates a context with a single entry. */
    public static ValidationContext of(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return new ValidationContext(Collections.unmodifiableMap(map));
    }

    /** Returns the shared empty context. */
    public static ValidationContext empty() {
        return EMPTY;
    }

    /** Value for {@code key}, or {@code null} if absent. */
    public Object get(String key) {
        return values.get(key);
    }

    public Object getOrDefault(String key, Object fallback) {
        return values.getOrDefault(key, fallback);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Unmodifiable map view. */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationContext that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ValidationContext" + values.keySet();
    }
}
