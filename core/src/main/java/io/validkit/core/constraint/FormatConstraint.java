package io.validkit.core.constraint;

import io.validkit.core.error.InvalidFieldConfigException;
import io.validkit.core.model.ErrorCode;
import io.validkit.core.model.EvaluationScope;
import io.validkit.core.spi.MessageKey;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * String format check against a caller pattern or a {@link NamedFormat}. Caller patterns match
 * anywhere in the value unless anchored. Non-string values always fail.
 */
public final class FormatConstraint extends Constraint {

    private final Pattern pattern;
    private final NamedFormat namedFormat;

    public FormatConstraint(Pattern pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.namedFormat = null;
    }

    public FormatConstraint(NamedFormat format) {
        this.namedFormat = Objects.requireNonNull(format, "format must not be null");
        this.pattern = format.pattern();
    }

    /** Accepts a {@link Pattern}, a {@link NamedFormat} or the name of one. */
    public static FormatConstraint fromConfig(Object config) {
        if (config instanceof FormatConstraint constraint) {
            return constraint;
        }
        if (config instanceof Pattern p) {
            return new FormatConstraint(p);
        }
        if (config instanceof NamedFormat format) {
            return new FormatConstraint(format);
        }
        if (config instanceof String name) {
            return NamedFormat.lookup(name)
                    .map(FormatConstraint::new)
                    .orElseThrow(() -> new InvalidFieldConfigException("Unknown format: " + name + ". Available: "
                            + Arrays.stream(NamedFormat.values())
                                    .map(NamedFormat::formatName)
                                    .collect(Collectors.joining(", "))));
        }
        throw new InvalidFieldConfigException("format must be a Pattern or a named format, got "
                + (config == null ? "null" : config.getClass().getSimpleName()));
    }

    public Pattern pattern() {
        return pattern;
    }

    /** The named format, or {@code null} for a caller pattern. */
    public NamedFormat namedFormat() {
        return namedFormat;
    }

    @Override
    public ConstraintKind kind() {
        return ConstraintKind.FORMAT;
    }

    @Override
    public boolean isValid(Object value) {
        return value instanceof String text && pattern.matcher(text).find();
    }

    @Override
    public String errorMessage(Object value, EvaluationScope scope) {
        if (namedFormat != null) {
            return scope.messages().render(MessageKey.FORMAT_NAMED, Map.of("name", namedFormat.formatName()));
        }
        return scope.messages().render(MessageKey.FORMAT, Map.of("pattern", "/" + pattern.pattern() + "/"));
    }

    @Override
    public ErrorCode errorCode() {
        return ErrorCode.FORMAT;
    }

    @Override
    public Map<String, Object> options() {
        Map<String, Object> options = new LinkedHashMap<>();
        if (namedFormat != null) {
            options.put("name", namedFormat.formatName());
        }
        options.put("pattern", pattern.pattern());
        return options;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FormatConstraint other
                && namedFormat == other.namedFormat
                && pattern.pattern().equals(other.pattern.pattern())
                && pattern.flags() == other.pattern.flags();
    }

    @Override
    public int hashCode() {
        return Objects.hash(namedFormat, pattern.pattern(), pattern.flags());
    }
}
