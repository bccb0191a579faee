package io.validkit.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable, ordered sequence of {@link ValidationError}s produced by one failed parse.
 *
 * <p>{@link #add(ValidationError)} and {@link #merge(ErrorCollection)} return new collections; an
 * instance never changes after construction.
 */
public final class ErrorCollection implements Iterable<ValidationError> {

    private static final ErrorCollection EMPTY = new ErrorCollection(List.of());

    private final List<ValidationError> errors;

    private ErrorCollection(List<ValidationError> errors) {
        this.errors = errors;
    }

    /** Creates a collection holding a copy of the given errors, in order. */
    public static ErrorCollection of(List<ValidationError> errors) {
        if (errors == null || errors.isEmpty()) {
            return EMPTY;
        }
        return new ErrorCollection(List.copyOf(errors));
    }

    /** Creates a collection from the given errors, in order. */
    public static ErrorCollection of(ValidationError... errors) {
        return of(Arrays.asList(errors));
    }

    /** Returns the shared empty collection. */
    public static ErrorCollection empty() {
        return EMPTY;
    }

    public int size() {
        return errors.size();
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public ValidationError get(int index) {
        return errors.get(index);
    }

    /** First error, or {@code null} when empty. */
    public ValidationError first() {
        return errors.isEmpty() ? null : errors.get(0);
    }

    /** New collection with {@code error} appended. */
    public ErrorCollection add(ValidationError error) {
        List<ValidationError> combined = new ArrayList<>(errors);
        combined.add(error);
        return new ErrorCollection(Collections.unmodifiableList(combined));
    }

    /** New collection with the errors of {@code other} appended. */
    public ErrorCollection merge(ErrorCollection other) {
        if (other.isEmpty()) {
            return this;
        }
        List<ValidationError> combined = new ArrayList<>(errors);
        combined.addAll(other.errors);
        return new ErrorCollection(Collections.unmodifiableList(combined));
    }

    /**
     * Errors whose path starts with the given segments.
     *
     * @param prefix leading path segments, e.g. {@code forPath("user", "addresses", 0)}
     */
    public ErrorCollection forPath(Object... prefix) {
        List<Object> wanted = Arrays.asList(prefix);
        return of(errors.stream()
                .filter(e -> e.path().size() >= wanted.size()
                        && e.path().subList(0, wanted.size()).equals(wanted))
                .collect(Collectors.toList()));
    }

    /** The bare messages, in order. */
    public List<String> messages() {
        return errors.stream().map(ValidationError::message).collect(Collectors.toUnmodifiableList());
    }

    /** Messages prefixed with their dotted path ({@code "user.name: is required"}). */
    public List<String> fullMessages() {
        return errors.stream().map(ValidationError::toString).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Groups messages by dotted path, preserving first-seen order. Root-level errors are keyed by
     * the empty string. This is the shape attribute-style error bags expect.
     */
    public Map<String, List<String>> toMap() {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (ValidationError error : errors) {
            grouped.computeIfAbsent(error.fullPath(), k -> new ArrayList<>()).add(error.message());
        }
        grouped.replaceAll((k, v) -> List.copyOf(v));
        return Collections.unmodifiableMap(grouped);
    }

    /** Unmodifiable list view. */
    public List<ValidationError> toList() {
        return errors;
    }

    public Stream<ValidationError> stream() {
        return errors.stream();
    }

    @Override
    public Iterator<ValidationError> iterator() {
        return errors.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ErrorCollection that)) return false;
        return errors.equals(that.errors);
    }

    @Override
    public int hashCode() {
        return errors.hashCode();
    }

    @Override
    public String toString() {
        return "ErrorCollection" + fullMessages();
    }
}
