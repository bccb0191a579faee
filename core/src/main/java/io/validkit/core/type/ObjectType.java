package io.validkit.core.type;

import io.validkit.core.model.ErrorCode;
import io.validkit.core.model.EvaluationScope;
import io.validkit.core.model.Result;
import io.validkit.core.model.ValidationError;
import io.validkit.core.schema.Schema;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Key-value objects. Without a nested schema the map is passed through (as an unmodifiable copy);
 * with one, evaluation is delegated to the schema using this value's path as prefix.
 */
public final class ObjectType extends FieldType {

    private final Schema schema;

    /**
     * @param schema nested schema, or {@code null} to accept any map
     */
    public ObjectType(Schema schema) {
        this.schema = schema;
    }

    /** The nested schema, or {@code null}. */
    public Schema schema() {
        return schema;
    }

    @Override
    public TypeKind kind() {
        return TypeKind.OBJECT;
    }

    @Override
    public String typeName() {
        return "object";
    }

    @Override
    public Coercion coerce(Object value) {
        return value instanceof Map<?, ?> ? Coercion.of(value) : Coercion.failed();
    }

    @Override
    public boolean isValid(Object value) {
        return value instanceof Map<?, ?>;
    }

    @Override
    public Evaluation evaluate(Object value, List<Object> path, EvaluationScope scope) {
        if (!(value instanceof Map<?, ?> map)) {
            return Evaluation.failed(ValidationError.of(path, coercionErrorMessage(value, scope), ErrorCode.TYPE_ERROR));
        }
        if (schema == null) {
            return Evaluation.ok(Collections.unmodifiableMap(new LinkedHashMap<Object, Object>(map)));
        }
        Result<Map<String, Object>> result = schema.evaluate(map, path, scope);
        return result.isSuccess() ? Evaluation.ok(result.data()) : Evaluation.failed(result.errors().toList());
    }
}
