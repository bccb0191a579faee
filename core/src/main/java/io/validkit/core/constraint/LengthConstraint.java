package io.validkit.core.constraint;

import io.validkit.core.error.InvalidFieldConfigException;
import io.validkit.core.model.ErrorCode;
import io.validkit.core.model.EvaluationScope;
import io.validkit.core.spi.MessageKey;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Length of sized values. Exactly one mode is active: an exact length, an inclusive range, or
 * independent min and/or max bounds. Values without a length always fail.
 */
public final class LengthConstraint extends Constraint {

    private final Integer exact;
    private final Integer min;
    private final Integer max;
    private final boolean range;

    private LengthConstraint(Integer exact, Integer min, Integer max, boolean range) {
        if (exact == null && min == null && max == null) {
            throw new InvalidFieldConfigException("length constraint requires at least one of: exact, min, max, or range");
        }
        if (exact != null && (min != null || max != null)) {
            throw new InvalidFieldConfigException("length constraint accepts either exact or min/max, not both");
        }
        checkNotNegative(exact);
        checkNotNegative(min);
        checkNotNegative(max);
        this.exact = exact;
        this.min = min;
        this.max = max;
        this.range = range;
    }

    public static LengthConstraint exactly(int length) {
        return new LengthConstraint(length, null, null, false);
    }

    /** Inclusive range {@code [min, max]}. */
    public static LengthConstraint range(int min, int max) {
        if (min > max) {
            throw new InvalidFieldConfigException("length range is empty: " + min + ".." + max);
        }
        return new LengthConstraint(null, min, max, true);
    }

    /** Independent bounds; either may be {@code null} but not both. */
    public static LengthConstraint between(Integer min, Integer max) {
        return new LengthConstraint(null, min, max, false);
    }

    /**
     * Builds the constraint from a definition value: an integer (exact), a two-element list
     * (range), or a map with {@code exact}, {@code min}, {@code max} keys.
     */
    public static LengthConstraint fromConfig(Object config) {
        if (config instanceof LengthConstraint constraint) {
            return constraint;
        }
        if (config instanceof Number) {
            return exactly(toInt(config, "length"));
        }
        if (config instanceof List<?> bounds) {
            if (bounds.size() != 2) {
                throw new InvalidFieldConfigException("length range needs exactly two bounds, got " + bounds);
            }
            return range(toInt(bounds.get(0), "length range"), toInt(bounds.get(1), "length range"));
        }
        if (config instanceof Map<?, ?> map) {
            for (Object key : map.keySet()) {
                if (!List.of("exact", "min", "max").contains(String.valueOf(key))) {
                    throw new InvalidFieldConfigException("unknown length option '" + key + "'");
                }
            }
            if (map.get("exact") != null) {
                if (map.get("min") != null || map.get("max") != null) {
                    throw new InvalidFieldConfigException("length constraint accepts either exact or min/max, not both");
                }
                return exactly(toInt(map.get("exact"), "length.exact"));
            }
            Integer min = map.get("min") != null ? toInt(map.get("min"), "length.min") : null;
            Integer max = map.get("max") != null ? toInt(map.get("max"), "length.max") : null;
            return between(min, max);
        }
        throw new InvalidFieldConfigException("length must be an integer, a [min, max] pair or a map, got "
                + (config == null ? "null" : config.getClass().getSimpleName()));
    }

    @Override
    public ConstraintKind kind() {
        return ConstraintKind.LENGTH;
    }

    @Override
    public boolean isValid(Object value) {
        OptionalInt measured = Measure.lengthOf(value);
        if (measured.isEmpty()) {
            return false;
        }
        int length = measured.getAsInt();
        if (exact != null) {
            return length == exact;
        }
        return (min == null || length >= min) && (max == null || length <= max);
    }

    @Override
    public String errorMessage(Object value, EvaluationScope scope) {
        OptionalInt measured = Measure.lengthOf(value);
        Object actual = measured.isPresent() ? measured.getAsInt() : "N/A";
        if (exact != null) {
            return scope.messages().render(MessageKey.LENGTH_EXACT, Map.of("value", exact, "actual", actual));
        }
        if (min != null && max != null) {
            return scope.messages().render(MessageKey.LENGTH_RANGE, Map.of("min", min, "max", max, "actual", actual));
        }
        if (min != null) {
            return scope.messages().render(MessageKey.LENGTH_MIN, Map.of("min", min, "actual", actual));
        }
        return scope.messages().render(MessageKey.LENGTH_MAX, Map.of("max", max, "actual", actual));
    }

    @Override
    public ErrorCode errorCode() {
        return ErrorCode.LENGTH;
    }

    @Override
    public Map<String, Object> options() {
        Map<String, Object> options = new LinkedHashMap<>();
        if (exact != null) {
            options.put("exact", exact);
        }
        if (range) {
            options.put("range", List.of(min, max));
        } else {
            if (min != null) {
                options.put("min", min);
            }
            if (max != null) {
                options.put("max", max);
            }
        }
        return options;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LengthConstraint other
                && Objects.equals(exact, other.exact)
                && Objects.equals(min, other.min)
                && Objects.equals(max, other.max)
                && range == other.range;
    }

    @Override
    public int hashCode() {
        return Objects.hash(exact, min, max, range);
    }

    private static int toInt(Object value, String what) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long bound = ((Number) value).longValue();
            if (bound <= Integer.MAX_VALUE && bound >= Integer.MIN_VALUE) {
                return (int) bound;
            }
        }
        throw new InvalidFieldConfigException(what + " must be an integer, got " + value);
    }

    private static void checkNotNegative(Integer bound) {
        if (bound != null && bound < 0) {
            throw new InvalidFieldConfigException("length bounds must not be negative, got " + bound);
        }
    }
}
