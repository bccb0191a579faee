package io.validkit.core.type;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Arbitrary-precision decimals, produced as {@link BigDecimal}.
 *
 * <p>Strings are parsed straight from the trimmed numeral, never through binary floating point.
 * Floating inputs are rounded to 15 significant digits. Other {@link Number} implementations
 * (rationals and the like) are accepted when their string form is a plain decimal numeral.
 */
public final class DecimalType extends FieldType {

    public static final DecimalType INSTANCE = new DecimalType();

    private static final MathContext FLOAT_PRECISION = new MathContext(15);

    private DecimalType() {}

    @Override
    public TypeKind kind() {
        return TypeKind.DECIMAL;
    }

    @Override
    public String typeName() {
        return "decimal";
    }

    @Override
    public Coercion coerce(Object value) {
        if (value instanceof BigDecimal) {
            return Coercion.of(value);
        }
        if (value instanceof BigInteger integer) {
            return Coercion.of(new BigDecimal(integer));
        }
        if (Numbers.isIntegral(value)) {
            return Coercion.of(BigDecimal.valueOf(((Number) value).longValue()));
        }
        if (Numbers.isFloating(value)) {
            double d = ((Number) value).doubleValue();
            if (!Double.isFinite(d)) {
                return Coercion.failed();
            }
            return Coercion.of(BigDecimal.valueOf(d).round(FLOAT_PRECISION));
        }
        if (value instanceof String text) {
            return parse(text.strip());
        }
        if (value instanceof Number other) {
            return parse(other.toString());
        }
        return Coercion.failed();
    }

    private static Coercion parse(String numeral) {
        if (numeral.isEmpty() || !Numbers.DECIMAL_NUMERAL.matcher(numeral).matches()) {
            return Coercion.failed();
        }
        return Coercion.of(new BigDecimal(numeral));
    }

    @Override
    public boolean isValid(Object value) {
        return value instanceof BigDecimal;
    }
}
