package io.validkit.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single validation failure: where it happened, what went wrong, and which kind of failure it
 * is.
 *
 * <p>The {@code path} is an ordered list of segments relative to the top-level parse call. Object
 * keys are {@link String} segments, array positions are {@link Integer} segments, e.g. {@code
 * ["user", "addresses", 0, "zip"]}. Equality is structural.
 */
public record ValidationError(List<Object> path, String message, ErrorCode code) {

    public ValidationError {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(code, "code must not be null");
        if (path == null || path.isEmpty()) {
            path = List.of();
        } else {
            for (Object segment : path) {
                if (!(segment instanceof String) && !(segment instanceof Integer)) {
                    throw new IllegalArgumentException(
                            "path segments must be String keys or Integer indexes, got: " + segment);
                }
            }
            path = List.copyOf(path);
        }
    }

    /** Creates an error at the given path. */
    public static ValidationError of(List<Object> path, String message, ErrorCode code) {
        return new ValidationError(path, message, code);
    }

    /** Dotted rendering of the path ({@code "user.addresses.0.zip"}); empty for the root. */
    public String fullPath() {
        return path.stream().map(String::valueOf).collect(Collectors.joining("."));
    }

    /** Copy of this error with another message; path and code are kept. */
    public ValidationError withMessage(String newMessage) {
        return new ValidationError(path, newMessage, code);
    }

    /** Copy of this error with {@code prefix} prepended to the path. */
    public ValidationError withPathPrefix(List<Object> prefix) {
        if (prefix.isEmpty()) {
            return this;
        }
        List<Object> combined = new ArrayList<>(prefix.size() + path.size());
        combined.addAll(prefix);
        combined.addAll(path);
        return new ValidationError(combined, message, code);
    }

    /** Map view with {@code path}, {@code message} and {@code code} entries. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("path", path);
        map.put("message", message);
        map.put("code", code.value());
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        String fullPath = fullPath();
        return fullPath.isEmpty() ? message : fullPath + ": " + message;
    }
}
