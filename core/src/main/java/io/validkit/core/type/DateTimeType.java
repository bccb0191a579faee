package io.validkit.core.type;

import java.time.OffsetDateTime;

/**
 * Date-times with an offset, produced as {@link OffsetDateTime}. Dates widen to midnight UTC,
 * offset-less values are taken as UTC, and numbers are Unix-epoch seconds.
 */
public final class DateTimeType extends FieldType {

    public static final DateTimeType INSTANCE = new DateTimeType();

    private DateTimeType() {}

    @Override
    public TypeKind kind() {
        return TypeKind.DATE_TIME;
    }

    @Override
    public String typeName() {
        return "datetime";
    }

    @Override
    public Coercion coerce(Object value) {
        OffsetDateTime temporal = TemporalParsing.fromTemporal(value);
        if (temporal != null) {
            return Coercion.of(temporal);
        }
        if (value instanceof Number number) {
            OffsetDateTime instant = TemporalParsing.epochAtUtc(number);
            return instant != null ? Coercion.of(instant) : Coercion.failed();
        }
        if (value instanceof String text) {
            String stripped = text.strip();
            if (stripped.isEmpty()) {
                return Coercion.failed();
            }
            OffsetDateTime parsed = TemporalParsing.parseDateTime(stripped);
            return parsed != null ? Coercion.of(parsed) : Coercion.failed();
        }
        return Coercion.failed();
    }

    @Override
    public boolean isValid(Object value) {
        return value instanceof OffsetDateTime;
    }
}
