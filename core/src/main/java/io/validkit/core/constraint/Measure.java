package io.validkit.core.constraint;

import io.validkit.core.type.Numbers;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.OptionalInt;

/** Length and ordering helpers shared by the bound constraints. */
final class Measure {

    private Measure() {}

    /**
     * Length of sized values: code points of a string, size of a collection or map, length of an
     * array. Empty for anything else, numbers included.
     */
    static OptionalInt lengthOf(Object value) {
        if (value instanceof CharSequence text) {
            return OptionalInt.of(text.codePoints().toArray().length);
        }
        if (value instanceof Collection<?> collection) {
            return OptionalInt.of(collection.size());
        }
        if (value instanceof Map<?, ?> map) {
            return OptionalInt.of(map.size());
        }
        if (value != null && value.getClass().isArray()) {
            return OptionalInt.of(Array.getLength(value));
        }
        return OptionalInt.empty();
    }

    /**
     * Orders {@code value} against {@code bound}. Numbers compare numerically across box types;
     * values of the same {@link Comparable} class use their natural order. Returns empty when the
     * two cannot be ordered, including NaN and infinite floating values.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    static OptionalInt compare(Object value, Object bound) {
        if (value instanceof Number number && bound instanceof Number limit) {
            BigDecimal left = decimal(number);
            BigDecimal right = decimal(limit);
            if (left == null || right == null) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(left.compareTo(right));
        }
        if (value instanceof Comparable comparable && bound != null && value.getClass() == bound.getClass()) {
            return OptionalInt.of(comparable.compareTo(bound));
        }
        return OptionalInt.empty();
    }

    private static BigDecimal decimal(Number number) {
        if (Numbers.isFloating(number)) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
        }
        return Numbers.toBigDecimal(number);
    }
}
