package io.validkit.core.spi;

/**
 * Identifies every message the engine can render, together with its English default template.
 * Templates interpolate {@code %{name}} placeholders from the arguments passed to {@link
 * MessageRenderer#render(MessageKey, java.util.Map)}.
 */
public enum MessageKey {
    REQUIRED("is required"),
    TYPE_COERCION("cannot coerce %{actual} to %{type}"),
    TYPE_INVALID("must be a %{type}"),
    LITERAL("must be %{expected}, got %{actual}"),
    UNION("must be one of: %{types}"),
    NOT_AN_OBJECT("must be an object"),
    DISCRIMINATOR_MISSING("discriminator field is required"),
    INVALID_DISCRIMINATOR("must be one of: %{values}"),
    MIN("must be at least %{value}"),
    MIN_LENGTH("length must be at least %{value} (got %{actual})"),
    MAX("must be at most %{value}"),
    MAX_LENGTH("length must be at most %{value} (got %{actual})"),
    LENGTH_EXACT("length must be exactly %{value} (got %{actual})"),
    LENGTH_RANGE("length must be between %{min} and %{max} (got %{actual})"),
    LENGTH_MIN("length must be at least %{min} (got %{actual})"),
    LENGTH_MAX("length must be at most %{max} (got %{actual})"),
    FORMAT("must match format %{pattern}"),
    FORMAT_NAMED("must be a valid %{name}"),
    ENUM("must be one of: %{values}"),
    REFINEMENT("failed refinement");

    private final String defaultTemplate;

    MessageKey(String defaultTemplate) {
        this.defaultTemplate = defaultTemplate;
    }

    /** English template used when no override is configured. */
    public String defaultTemplate() {
        return defaultTemplate;
    }
}
