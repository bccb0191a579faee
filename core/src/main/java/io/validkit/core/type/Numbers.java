package io.validkit.core.type;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/** Numeric helpers shared by the number types and the min/max constraints. */
public final class Numbers {

    static final Pattern INTEGER_NUMERAL = Pattern.compile("-?\\d+");
    static final Pattern WHOLE_DECIMAL_NUMERAL = Pattern.compile("-?(\\d+)\\.0+");
    static final Pattern DECIMAL_NUMERAL = Pattern.compile("-?\\d+(\\.\\d+)?");

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private Numbers() {}

    /** {@code true} for the fixed-width integral boxes and {@link BigInteger}. */
    public static boolean isIntegral(Object value) {
        return value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger;
    }

    /** {@code true} for {@link Double} and {@link Float}. */
    public static boolean isFloating(Object value) {
        return value instanceof Double || value instanceof Float;
    }

    /** Lossless conversion of any standard {@link Number} to {@link BigDecimal}. */
    public static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (isFloating(number)) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }

    /** {@code Long} when the value fits, {@link BigInteger} otherwise. */
    static Number narrow(BigInteger value) {
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return value.longValue();
        }
        return value;
    }

    /** Numeric equality against a small integer, across all standard number types. */
    static boolean numericallyEquals(Object value, int target) {
        if (!(value instanceof Number number)) {
            return false;
        }
        if (isFloating(number)) {
            return number.doubleValue() == target;
        }
        if (number instanceof BigDecimal || number instanceof BigInteger) {
            return toBigDecimal(number).compareTo(BigDecimal.valueOf(target)) == 0;
        }
        return number.longValue() == target;
    }
}
