package io.validkit.core.type;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQuery;
import java.util.Date;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * String and epoch conversions shared by the date, date-time and time types.
 *
 * <p>String parsing runs in three tiers: ISO-8601 first, then a fixed list of fallback formats,
 * then a permissive pass that accepts local date-times and bare dates, interpreted in UTC. All
 * formatters resolve strictly, so impossible dates such as {@code 2024-02-30} are rejected.
 */
final class TemporalParsing {

    private static final Logger LOG = LoggerFactory.getLogger(TemporalParsing.class);

    private static final DateTimeFormatter SPACE_OFFSET_DATE_TIME = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendLiteral(' ')
            .optionalEnd()
            .appendOffset("+HH:mm", "Z")
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT)
            .withChronology(IsoChronology.INSTANCE);

    private static final DateTimeFormatter SPACE_LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT)
            .withChronology(IsoChronology.INSTANCE);

    private static final DateTimeFormatter SLASH_LOCAL_DATE_TIME =
            DateTimeFormatter.ofPattern("uuuu/MM/dd HH:mm[:ss]").withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter SLASH_DATE =
            DateTimeFormatter.ofPattern("uuuu/MM/dd").withResolverStyle(ResolverStyle.STRICT);

    /** Date formats tried after ISO-8601. */
    private static final List<DateTimeFormatter> DATE_FALLBACKS = List.of(SLASH_DATE, DateTimeFormatter.BASIC_ISO_DATE);

    /** Zoned formats tried after ISO-8601. */
    private static final List<DateTimeFormatter> ZONED_FALLBACKS =
            List.of(DateTimeFormatter.RFC_1123_DATE_TIME, SPACE_OFFSET_DATE_TIME);

    /** Permissive local formats, interpreted in UTC. */
    private static final List<DateTimeFormatter> LOCAL_DATE_TIMES =
            List.of(DateTimeFormatter.ISO_LOCAL_DATE_TIME, SPACE_LOCAL_DATE_TIME, SLASH_LOCAL_DATE_TIME);

    private TemporalParsing() {}

    /** Parses a calendar date, or returns {@code null}. */
    static LocalDate parseDate(String text) {
        LocalDate date = attempt(text, DateTimeFormatter.ISO_LOCAL_DATE, LocalDate::from);
        if (date != null) {
            return date;
        }
        for (DateTimeFormatter formatter : DATE_FALLBACKS) {
            date = attempt(text, formatter, LocalDate::from);
            if (date != null) {
                return date;
            }
        }
        OffsetDateTime dateTime = parseDateTime(text);
        return dateTime != null ? dateTime.toLocalDate() : null;
    }

    /** Parses a point in time with its offset, or returns {@code null}. */
    static OffsetDateTime parseDateTime(String text) {
        ZonedDateTime zoned = attempt(text, DateTimeFormatter.ISO_ZONED_DATE_TIME, ZonedDateTime::from);
        if (zoned != null) {
            return zoned.toOffsetDateTime();
        }
        for (DateTimeFormatter formatter : ZONED_FALLBACKS) {
            zoned = attempt(text, formatter, ZonedDateTime::from);
            if (zoned != null) {
                return zoned.toOffsetDateTime();
            }
        }
        for (DateTimeFormatter formatter : LOCAL_DATE_TIMES) {
            LocalDateTime local = attempt(text, formatter, LocalDateTime::from);
            if (local != null) {
                return local.atOffset(ZoneOffset.UTC);
            }
        }
        LocalDate date = attempt(text, DateTimeFormatter.ISO_LOCAL_DATE, LocalDate::from);
        if (date == null) {
            date = attempt(text, SLASH_DATE, LocalDate::from);
        }
        return date != null ? date.atStartOfDay().atOffset(ZoneOffset.UTC) : null;
    }

    /**
     * Converts Unix-epoch seconds (fractions allowed) to an instant, or returns {@code null} for
     * non-finite numbers and values outside the instant range.
     */
    static Instant fromEpochSeconds(Number seconds) {
        try {
            if (Numbers.isIntegral(seconds) && !(seconds instanceof BigInteger)) {
                return Instant.ofEpochSecond(seconds.longValue());
            }
            if (Numbers.isFloating(seconds) && !Double.isFinite(seconds.doubleValue())) {
                return null;
            }
            BigDecimal exact = Numbers.toBigDecimal(seconds);
            BigDecimal whole = exact.setScale(0, RoundingMode.FLOOR);
            long nanos = exact.subtract(whole).movePointRight(9).longValue();
            return Instant.ofEpochSecond(whole.longValueExact(), nanos);
        } catch (ArithmeticException | DateTimeException e) {
            LOG.trace("Epoch value {} is out of range: {}", seconds, e.getMessage());
            return null;
        }
    }

    /** Epoch seconds as a UTC date-time, or {@code null} when they cannot be represented as one. */
    static OffsetDateTime epochAtUtc(Number seconds) {
        Instant instant = fromEpochSeconds(seconds);
        return instant != null ? atUtc(instant) : null;
    }

    /** The instant at offset UTC, or {@code null} past the year range of a date-time. */
    static OffsetDateTime atUtc(Instant instant) {
        try {
            return instant.atOffset(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            LOG.trace("Instant {} has no UTC date-time: {}", instant, e.getMessage());
            return null;
        }
    }

    /**
     * Converts the temporal value types the engine understands into an offset date-time in UTC
     * where no offset is carried, or returns {@code null} for anything else.
     */
    static OffsetDateTime fromTemporal(Object value) {
        if (value instanceof OffsetDateTime offset) {
            return offset;
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.toOffsetDateTime();
        }
        if (value instanceof LocalDateTime local) {
            return local.atOffset(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay().atOffset(ZoneOffset.UTC);
        }
        if (value instanceof Instant instant) {
            return atUtc(instant);
        }
        if (value instanceof Date legacy) {
            return atUtc(legacy.toInstant());
        }
        return null;
    }

    private static <T> T attempt(String text, DateTimeFormatter formatter, TemporalQuery<T> query) {
        try {
            TemporalAccessor parsed = formatter.parse(text);
            return query.queryFrom(parsed);
        } catch (DateTimeException e) {
            LOG.trace("'{}' does not match {}: {}", text, formatter, e.getMessage());
            return null;
        }
    }
}
