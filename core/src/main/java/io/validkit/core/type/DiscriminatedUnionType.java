package io.validkit.core.type;

import io.validkit.core.model.ErrorCode;
import io.validkit.core.model.EvaluationScope;
import io.validkit.core.model.Result;
import io.validkit.core.model.ValidationError;
import io.validkit.core.model.Values;
import io.validkit.core.schema.Schema;
import io.validkit.core.spi.MessageKey;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Picks the schema for an object from the value of one of its own fields.
 *
 * <p>The discriminator key and value are matched in string and enum form alike, and numeric
 * values by value regardless of their box type. A missing value
 * yields {@code discriminator_missing}, an unmapped one {@code invalid_discriminator}; both are
 * reported at {@code path + [discriminator]}. Otherwise the selected schema evaluates the whole
 * object and none of the other mapped schemas is consulted.
 */
public final class DiscriminatedUnionType extends FieldType {

    private final String discriminator;
    private final Map<Object, Schema> mapping;

    public DiscriminatedUnionType(String discriminator, Map<?, Schema> mapping) {
        Objects.requireNonNull(discriminator, "discriminator must not be null");
        if (mapping == null || mapping.isEmpty()) {
            throw new IllegalArgumentException("discriminated union requires a non-empty mapping");
        }
        Map<Object, Schema> normalized = new LinkedHashMap<>();
        mapping.forEach((key, schema) -> normalized.put(normalizeKey(key), Objects.requireNonNull(schema,
                "mapping for '" + key + "' must not be null")));
        this.discriminator = discriminator;
        this.mapping = Collections.unmodifiableMap(normalized);
    }

    public String discriminator() {
        return discriminator;
    }

    /** Discriminator value to schema, keys normalized (enum keys by name). */
    public Map<Object, Schema> mapping() {
        return mapping;
    }

    @Override
    public TypeKind kind() {
        return TypeKind.DISCRIMINATED_UNION;
    }

    @Override
    public String typeName() {
        String keys = mapping.keySet().stream().map(Values::inspect).collect(Collectors.joining(" | "));
        return "discriminated_union<" + discriminator + ": " + keys + ">";
    }

    @Override
    public Coercion coerce(Object value) {
        return Coercion.of(value);
    }

    @Override
    public boolean isValid(Object value) {
        return value instanceof Map<?, ?>;
    }

    @Override
    public Evaluation evaluate(Object value, List<Object> path, EvaluationScope scope) {
        if (!(value instanceof Map<?, ?> map)) {
            return Evaluation.failed(
                    ValidationError.of(path, scope.messages().render(MessageKey.NOT_AN_OBJECT), ErrorCode.TYPE_ERROR));
        }

        Object discriminatorValue = lookupDiscriminator(map);
        List<Object> discriminatorPath = Values.append(path, discriminator);
        if (discriminatorValue == null) {
            return Evaluation.failed(ValidationError.of(
                    discriminatorPath,
                    scope.messages().render(MessageKey.DISCRIMINATOR_MISSING),
                    ErrorCode.DISCRIMINATOR_MISSING));
        }

        Schema schema = schemaFor(normalizeKey(discriminatorValue));
        if (schema == null) {
            String message = scope.messages()
                    .render(MessageKey.INVALID_DISCRIMINATOR, Map.of("values", Values.inspectAll(mapping.keySet())));
            return Evaluation.failed(ValidationError.of(discriminatorPath, message, ErrorCode.INVALID_DISCRIMINATOR));
        }

        Result<Map<String, Object>> result = schema.evaluate(map, path, scope);
        return result.isSuccess() ? Evaluation.ok(result.data()) : Evaluation.failed(result.errors().toList());
    }

    /** Exact key first, then numeric value, so a {@code 1L} read from JSON selects an {@code Integer} key. */
    private Schema schemaFor(Object key) {
        Schema exact = mapping.get(key);
        if (exact != null || !(key instanceof Number)) {
            return exact;
        }
        for (Map.Entry<Object, Schema> entry : mapping.entrySet()) {
            if (Values.sameValue(entry.getKey(), key)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private Object lookupDiscriminator(Map<?, ?> map) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (discriminator.equals(Values.keyOf(entry.getKey()))) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static Object normalizeKey(Object key) {
        return key instanceof Enum<?> e ? e.name() : key;
    }
}
