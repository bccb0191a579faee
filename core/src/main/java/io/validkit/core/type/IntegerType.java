package io.validkit.core.type;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Matcher;

/**
 * Whole numbers, produced as {@link Long} ({@link BigInteger} past the {@code long} range).
 *
 * <p>Accepts integral numbers, finite floating values with no fractional part, and trimmed
 * strings of the form {@code -?\d+} or {@code -?\d+\.0+}.
 */
public final class IntegerType extends FieldType {

    public static final IntegerType INSTANCE = new IntegerType();

    private IntegerType() {}

    @Override
    public TypeKind kind() {
        return TypeKind.INTEGER;
    }

    @Override
    public String typeName() {
        return "integer";
    }

    @Override
    public Coercion coerce(Object value) {
        if (value instanceof BigInteger integer) {
            return Coercion.of(Numbers.narrow(integer));
        }
        if (Numbers.isIntegral(value)) {
            return Coercion.of(((Number) value).longValue());
        }
        if (Numbers.isFloating(value)) {
            double d = ((Number) value).doubleValue();
            if (!Double.isFinite(d) || d != Math.floor(d)) {
                return Coercion.failed();
            }
            return Coercion.of(Numbers.narrow(BigDecimal.valueOf(d).toBigInteger()));
        }
        if (value instanceof BigDecimal decimal) {
            if (decimal.stripTrailingZeros().scale() > 0) {
                return Coercion.failed();
            }
            return Coercion.of(Numbers.narrow(decimal.toBigInteger()));
        }
        if (value instanceof String text) {
            return coerceString(text);
        }
        return Coercion.failed();
    }

    private static Coercion coerceString(String text) {
        String stripped = text.strip();
        if (stripped.isEmpty()) {
            return Coercion.failed();
        }
        if (Numbers.INTEGER_NUMERAL.matcher(stripped).matches()) {
            return Coercion.of(Numbers.narrow(new BigInteger(stripped)));
        }
        Matcher whole = Numbers.WHOLE_DECIMAL_NUMERAL.matcher(stripped);
        if (whole.matches()) {
            String integral = stripped.substring(0, stripped.indexOf('.'));
            return Coercion.of(Numbers.narrow(new BigInteger(integral)));
        }
        return Coercion.failed();
    }

    @Override
    public boolean isValid(Object value) {
        return Numbers.isIntegral(value);
    }
}
