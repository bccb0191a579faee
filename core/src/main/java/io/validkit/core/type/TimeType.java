package io.validkit.core.type;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Points on the time line, produced as {@link Instant}. Accepts the same sources as {@link
 * DateTimeType} and normalizes them to an instant.
 */
public final class TimeType extends FieldType {

    public static final TimeType INSTANCE = new TimeType();

    private TimeType() {}

    @Override
    public TypeKind kind() {
        return TypeKind.TIME;
    }

    @Override
    public String typeName() {
        return "time";
    }

    @Override
    public Coercion coerce(Object value) {
        if (value instanceof Instant) {
            return Coercion.of(value);
        }
        OffsetDateTime temporal = TemporalParsing.fromTemporal(value);
        if (temporal != null) {
            return Coercion.of(temporal.toInstant());
        }
        if (value instanceof Number number) {
            Instant instant = TemporalParsing.fromEpochSeconds(number);
            return instant != null ? Coercion.of(instant) : Coercion.failed();
        }
        if (value instanceof String text) {
            String stripped = text.strip();
            if (stripped.isEmpty()) {
                return Coercion.failed();
            }
            OffsetDateTime parsed = TemporalParsing.parseDateTime(stripped);
            return parsed != null ? Coercion.of(parsed.toInstant()) : Coercion.failed();
        }
        return Coercion.failed();
    }

    @Override
    public boolean isValid(Object value) {
        return value instanceof Instant;
    }
}
