package io.validkit.core.type;

import java.math.BigDecimal;

/** Strings. Enums, characters and numbers are stringified; everything else fails. */
public final class StringType extends FieldType {

    public static final StringType INSTANCE = new StringType();

    private StringType() {}

    @Override
    public TypeKind kind() {
        return TypeKind.STRING;
    }

    @Override
    public String typeName() {
        return "string";
    }

    @Override
    public Coercion coerce(Object value) {
        if (value instanceof String) {
            return Coercion.of(value);
        }
        if (value instanceof Enum<?> e) {
            return Coercion.of(e.name());
        }
        if (value instanceof Character || value instanceof CharSequence) {
            return Coercion.of(value.toString());
        }
        if (value instanceof BigDecimal decimal) {
            return Coercion.of(decimal.toPlainString());
        }
        if (value instanceof Number) {
            return Coercion.of(value.toString());
        }
        return Coercion.failed();
    }

    @Override
    public boolean isValid(Object value) {
        return value instanceof String;
    }
}
