package io.validkit.core.type;

import io.validkit.core.model.EvaluationScope;
import io.validkit.core.model.Values;
import io.validkit.core.spi.MessageKey;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Exact values. No coercion is attempted: the input must equal one of the configured values, so
 * the integer {@code 1} does not match the string {@code "1"}.
 */
public final class LiteralType extends FieldType {

    private final List<Object> values;

    public LiteralType(List<?> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("literal requires at least one value");
        }
        this.values = Collections.unmodifiableList(new ArrayList<Object>(values));
    }

    /** Accepted values. */
    public List<Object> values() {
        return values;
    }

    @Override
    public TypeKind kind() {
        return TypeKind.LITERAL;
    }

    @Override
    public String typeName() {
        return values.stream().map(Values::inspect).collect(Collectors.joining(" | "));
    }

    @Override
    public Coercion coerce(Object value) {
        return Coercion.of(value);
    }

    @Override
    public boolean isValid(Object value) {
        return Values.containsValue(values, value);
    }

    @Override
    protected String coercionErrorMessage(Object value, EvaluationScope scope) {
        return validationErrorMessage(value, scope);
    }

    @Override
    public String validationErrorMessage(Object value, EvaluationScope scope) {
        return scope.messages()
                .render(MessageKey.LITERAL, Map.of("expected", typeName(), "actual", Values.inspect(value)));
    }
}
