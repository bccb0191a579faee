package io.validkit.core.type;

import java.util.Locale;
import java.util.Set;

/**
 * Booleans. Membership in a fixed truthy or falsy set decides the result; strings compare
 * case-insensitively, numbers compare numerically against 1 and 0. Anything else fails, including
 * {@code null}.
 */
public final class BooleanType extends FieldType {

    public static final BooleanType INSTANCE = new BooleanType();

    private static final Set<String> TRUTHY_STRINGS = Set.of("1", "true", "yes", "on", "t", "y");
    private static final Set<String> FALSY_STRINGS = Set.of("0", "false", "no", "off", "f", "n");

    private BooleanType() {}

    @Override
    public TypeKind kind() {
        return TypeKind.BOOLEAN;
    }

    @Override
    public String typeName() {
        return "boolean";
    }

    @Override
    public Coercion coerce(Object value) {
        if (value instanceof Boolean) {
            return Coercion.of(value);
        }
        if (value instanceof String text) {
            String normalized = text.toLowerCase(Locale.ROOT);
            if (TRUTHY_STRINGS.contains(normalized)) {
                return Coercion.of(Boolean.TRUE);
            }
            if (FALSY_STRINGS.contains(normalized)) {
                return Coercion.of(Boolean.FALSE);
            }
            return Coercion.failed();
        }
        if (Numbers.numericallyEquals(value, 1)) {
            return Coercion.of(Boolean.TRUE);
        }
        if (Numbers.numericallyEquals(value, 0)) {
            return Coercion.of(Boolean.FALSE);
        }
        return Coercion.failed();
    }

    @Override
    public boolean isValid(Object value) {
        return value instanceof Boolean;
    }
}
