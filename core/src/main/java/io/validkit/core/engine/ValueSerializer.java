package io.validkit.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.validkit.core.model.Result;
import io.validkit.core.model.ValidationError;
import io.validkit.core.model.Values;
import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns validated output into JSON-safe values: strings, booleans, integral and floating numbers,
 * {@code null}, lists and string-keyed maps.
 *
 * <ul>
 *   <li>enums and characters become strings
 *   <li>{@link BigDecimal} becomes its plain (non-scientific) string
 *   <li>dates, date-times and instants become ISO-8601 strings
 *   <li>collections, arrays and maps are converted recursively
 *   <li>records become a map of their components; anything else becomes {@code toString()}
 * </ul>
 *
 * <p>Thread-safe; stateless apart from a shared {@link ObjectMapper}.
 */
public final class ValueSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ValueSerializer() {}

    /** Canonicalizes {@code value} recursively. */
    public static Object serializeValue(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger
                || value instanceof Double
                || value instanceof Float) {
            return value;
        }
        if (value instanceof Number number) {
            return number.toString();
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return value.toString();
        }
        if (value instanceof LocalDate date) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
        }
        if (value instanceof OffsetDateTime dateTime) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(dateTime);
        }
        if (value instanceof Instant instant) {
            return DateTimeFormatter.ISO_INSTANT.format(instant);
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((key, item) -> result.put(Values.keyOf(key), serializeValue(item)));
            return result;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> result = new ArrayList<>(collection.size());
            collection.forEach(item -> result.add(serializeValue(item)));
            return result;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> result = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                result.add(serializeValue(Array.get(value, i)));
            }
            return result;
        }
        if (value instanceof Result<?> result) {
            return dump(result);
        }
        if (value.getClass().isRecord()) {
            return recordComponents(value);
        }
        return value.toString();
    }

    /** Serializes {@code value} and writes it as a JSON string. */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(serializeValue(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize value to JSON", e);
        }
    }

    /** Serializes {@code value} into a Jackson tree. */
    public static JsonNode toJsonNode(Object value) {
        return MAPPER.valueToTree(serializeValue(value));
    }

    /**
     * Serializes a result: the data of a success, or {@code {"errors": [{path, message, code}, ...]}}
     * for a failure, with every path segment rendered as a string.
     */
    public static Object dump(Result<?> result) {
        if (result.isSuccess()) {
            return serializeValue(result.data());
        }
        List<Object> errors = new ArrayList<>();
        for (ValidationError error : result.errors()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("path", error.path().stream().map(String::valueOf).collect(Collectors.toList()));
            entry.put("message", error.message());
            entry.put("code", error.code().value());
            errors.add(entry);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("errors", errors);
        return body;
    }

    private static Map<String, Object> recordComponents(Object record) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            try {
                result.put(component.getName(), serializeValue(component.getAccessor().invoke(record)));
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new IllegalArgumentException(
                        "Failed to read record component '" + component.getName() + "' of "
                                + record.getClass().getSimpleName(),
                        e);
            }
        }
        return result;
    }
}
