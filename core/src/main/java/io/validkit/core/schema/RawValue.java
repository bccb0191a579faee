package io.validkit.core.schema;

/**
 * A field's slot in the input: either present (possibly with a {@code null} value) or missing.
 * Never stored in output data.
 */
public sealed interface RawValue {

    static RawValue of(Object value) {
        return new Present(value);
    }

    static RawValue missing() {
        return Missing.INSTANCE;
    }

    boolean isMissing();

    /** The key was present in the input. */
    record Present(Object value) implements RawValue {
        @Override
        public boolean isMissing() {
            return false;
        }
    }

    /** The key was absent from the input. */
    enum Missing implements RawValue {
        INSTANCE;

        @Override
        public boolean isMissing() {
            return true;
        }
    }
}
