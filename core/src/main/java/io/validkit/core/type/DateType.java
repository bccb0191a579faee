package io.validkit.core.type;

import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Calendar dates, produced as {@link LocalDate}. Richer temporal values are narrowed (time of day
 * is dropped); numbers are Unix-epoch seconds in UTC. Only a {@code LocalDate} is valid, so date
 * and date-time values never satisfy each other's type.
 */
public final class DateType extends FieldType {

    public static final DateType INSTANCE = new DateType();

    private DateType() {}

    @Override
    public TypeKind kind() {
        return TypeKind.DATE;
    }

    @Override
    public String typeName() {
        return "date";
    }

    @Override
    public Coercion coerce(Object value) {
        if (value instanceof LocalDate) {
            return Coercion.of(value);
        }
        OffsetDateTime temporal = TemporalParsing.fromTemporal(value);
        if (temporal != null) {
            return Coercion.of(temporal.toLocalDate());
        }
        if (value instanceof Number number) {
            OffsetDateTime instant = TemporalParsing.epochAtUtc(number);
            return instant != null ? Coercion.of(instant.toLocalDate()) : Coercion.failed();
        }
        if (value instanceof String text) {
            String stripped = text.strip();
            if (stripped.isEmpty()) {
                return Coercion.failed();
            }
            LocalDate date = TemporalParsing.parseDate(stripped);
            return date != null ? Coercion.of(date) : Coercion.failed();
        }
        return Coercion.failed();
    }

    @Override
    public boolean isValid(Object value) {
        return value instanceof LocalDate;
    }
}
