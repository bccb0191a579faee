package io.validkit.core.type;

/**
 * Finite floating point numbers, produced as {@link Double}. Integral numbers widen; strings must
 * match {@code -?\d+(\.\d+)?} after trimming. NaN and infinities are rejected on input and output.
 */
public final class FloatType extends FieldType {

    public static final FloatType INSTANCE = new FloatType();

    private FloatType() {}

    @Override
    public TypeKind kind() {
        return TypeKind.FLOAT;
    }

    @Override
    public String typeName() {
        return "float";
    }

    @Override
    public Coercion coerce(Object value) {
        if (Numbers.isFloating(value)) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? Coercion.of(d) : Coercion.failed();
        }
        if (Numbers.isIntegral(value)) {
            return Coercion.of(((Number) value).doubleValue());
        }
        if (value instanceof String text) {
            String stripped = text.strip();
            if (stripped.isEmpty() || !Numbers.DECIMAL_NUMERAL.matcher(stripped).matches()) {
                return Coercion.failed();
            }
            double d = Double.parseDouble(stripped);
            return Double.isFinite(d) ? Coercion.of(d) : Coercion.failed();
        }
        return Coercion.failed();
    }

    @Override
    public boolean isValid(Object value) {
        return Numbers.isFloating(value) && Double.isFinite(((Number) value).doubleValue());
    }
}
