package io.validkit.core.model;

import java.util.Objects;

/**
 * Symbolic kind of a validation failure ({@code required}, {@code type_error}, {@code min}, ...).
 *
 * <p>The built-in kinds are exposed as constants. Custom constraints and types may mint their own
 * codes through {@link #of(String)}; equality is by value.
 */
public record ErrorCode(String value) {

    public static final ErrorCode REQUIRED = new ErrorCode("required");
    public static final ErrorCode TYPE_ERROR = new ErrorCode("type_error");
    public static final ErrorCode MIN = new ErrorCode("min");
    public static final ErrorCode MAX = new ErrorCode("max");
    public static final ErrorCode LENGTH = new ErrorCode("length");
    public static final ErrorCode FORMAT = new ErrorCode("format");
    public static final ErrorCode ENUM = new ErrorCode("enum");
    public static final ErrorCode REFINEMENT = new ErrorCode("refinement");
    public static final ErrorCode DISCRIMINATOR_MISSING = new ErrorCode("discriminator_missing");
    public static final ErrorCode INVALID_DISCRIMINATOR = new ErrorCode("invalid_discriminator");
    public static final ErrorCode UNION_TYPE_ERROR = new ErrorCode("union_type_error");

    /** Raised by schema-level validators. */
    public static final ErrorCode CUSTOM = new ErrorCode("custom");

    public ErrorCode {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("error code must not be blank");
        }
    }

    /** Returns the code for the given symbolic name. */
    public static ErrorCode of(String value) {
        return new ErrorCode(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
