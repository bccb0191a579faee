package io.validkit.core.type;

/**
 * Outcome of a single coercion attempt: either a coerced value (possibly {@code null}) or a
 * failure. Keeps "coercion failed" distinct from a legitimate {@code null} result.
 */
public sealed interface Coercion {

    /** A successful coercion. */
    static Coercion of(Object value) {
        return new Coerced(value);
    }

    /** The failed coercion. */
    static Coercion failed() {
        return Failed.INSTANCE;
    }

    boolean isFailed();

    /** Carries the coerced value. */
    record Coerced(Object value) implements Coercion {
        @Override
        public boolean isFailed() {
            return false;
        }
    }

    /** Marks a value that could not be coerced. */
    enum Failed implements Coercion {
        INSTANCE;

        @Override
        public boolean isFailed() {
            return true;
        }
    }
}
