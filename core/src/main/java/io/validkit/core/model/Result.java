package io.validkit.core.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a validation pass. Exactly one of two variants:
 *
 * <ul>
 *   <li>{@link Success}: the input validated; {@link #data()} holds the coerced output.
 *   <li>{@link Failure}: the input did not validate; {@link #errors()} holds every error found.
 * </ul>
 *
 * <p>Both variants are immutable. {@link #map(Function)} and {@link #flatMap(Function)} only run
 * their function on a {@code Success}; a {@code Failure} passes through untouched.
 *
 * @param <T> type of the success payload
 */
public sealed interface Result<T> {

    /** Creates a successful result. */
    static <T> Result<T> success(T data) {
        return new Success<>(data);
    }

    /** Creates a failed result carrying the given errors. */
    static <T> Result<T> failure(ErrorCollection errors) {
        return new Failure<>(errors);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /** The payload, or {@code null} for a failure. */
    T data();

    /** The errors; always empty for a success. */
    ErrorCollection errors();

    /** The payload, or {@code fallback} for a failure. */
    T valueOr(T fallback);

    /** The payload, or the value computed from the errors for a failure. */
    T valueOrGet(Function<? super ErrorCollection, ? extends T> fallback);

    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    <U> Result<U> flatMap(Function<? super T, Result<U>> mapper);

    /** Successful variant. */
    record Success<T>(T data) implements Result<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public ErrorCollection errors() {
            return ErrorCollection.empty();
        }

        @Override
        public T valueOr(T fallback) {
            return data;
        }

        @Override
        public T valueOrGet(Function<? super ErrorCollection, ? extends T> fallback) {
            return data;
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(data));
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return Objects.requireNonNull(mapper.apply(data), "flatMap function must not return null");
        }

        @Override
        public String toString() {
            return "Success[" + data + "]";
        }
    }

    /** Failed variant. */
    record Failure<T>(ErrorCollection errors) implements Result<T> {

        public Failure {
            Objects.requireNonNull(errors, "errors must not be null for Failure");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T data() {
            return null;
        }

        @Override
        public T valueOr(T fallback) {
            return fallback;
        }

        @Override
        public T valueOrGet(Function<? super ErrorCollection, ? extends T> fallback) {
            return fallback.apply(errors);
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Failure<>(errors);
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return new Failure<>(errors);
        }

        @Override
        public String toString() {
            return "Failure" + errors.fullMessages();
        }
    }
}
