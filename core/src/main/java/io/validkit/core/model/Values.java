package io.validkit.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Helpers for describing runtime values and building error paths. Stateless. */
public final class Values {

    private Values() {}

    /**
     * Literal-style rendering used in messages: strings are double-quoted, enums render by name,
     * {@code null} renders as {@code null}.
     */
    public static String inspect(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence text) {
            return "\"" + text + "\"";
        }
        if (value instanceof Character c) {
            return "\"" + c + "\"";
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        return String.valueOf(value);
    }

    /** Comma-separated {@link #inspect(Object)} rendering of every element. */
    public static String inspectAll(Collection<?> values) {
        return values.stream().map(Values::inspect).collect(Collectors.joining(", "));
    }

    /** Simple class name of the value, or {@code "null"}. */
    public static String className(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    /** New immutable path with {@code segment} appended. */
    public static List<Object> append(List<Object> path, Object segment) {
        List<Object> extended = new ArrayList<>(path.size() + 1);
        extended.addAll(path);
        extended.add(segment);
        return List.copyOf(extended);
    }

    /**
     * Truthiness of a plain value: {@code null} and {@link Boolean#FALSE} are false, everything
     * else is true.
     */
    public static boolean isTruthy(Object value) {
        return value != null && !Boolean.FALSE.equals(value);
    }

    /** Canonical string key for a map key (enum keys by name, everything else by {@code toString}). */
    public static String keyOf(Object key) {
        if (key instanceof Enum<?> e) {
            return e.name();
        }
        return String.valueOf(key);
    }

    /**
     * Equality used by membership checks: numbers compare by numeric value regardless of their box
     * type ({@code 1L} equals {@code 1} and {@code 1.0}); everything else uses {@code equals}.
     */
    public static boolean sameValue(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            BigDecimal x = exact(a);
            BigDecimal y = exact(b);
            if (x == null || y == null) {
                return a.doubleValue() == b.doubleValue();
            }
            return x.compareTo(y) == 0;
        }
        return Objects.equals(left, right);
    }

    /** {@code true} if any element of {@code candidates} is the {@link #sameValue} as {@code value}. */
    public static boolean containsValue(Collection<?> candidates, Object value) {
        for (Object candidate : candidates) {
            if (sameValue(candidate, value)) {
                return true;
            }
        }
        return false;
    }

    private static BigDecimal exact(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            return Double.isNaN(d) || Double.isInfinite(d) ? null : BigDecimal.valueOf(d);
        }
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return BigDecimal.valueOf(number.longValue());
        }
        return null;
    }
}
