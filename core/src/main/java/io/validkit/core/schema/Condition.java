package io.validkit.core.schema;

import io.validkit.core.model.ValidationContext;
import io.validkit.core.model.Values;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * Predicate gating a field ({@code when} / {@code unless}). Evaluated against the whole
 * normalized input of the enclosing schema, not only the field's own value.
 */
@FunctionalInterface
public interface Condition {

    boolean test(Map<String, Object> data, ValidationContext context);

    /** Condition over the input data only. */
    static Condition of(Predicate<Map<String, Object>> predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return (data, context) -> predicate.test(data);
    }

    /** Condition over the input data and the call context. */
    static Condition withContext(BiPredicate<Map<String, Object>, ValidationContext> predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return predicate::test;
    }

    /** True when the sibling field {@code name} is present and neither {@code null} nor {@code false}. */
    static Condition field(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return (data, context) -> Values.isTruthy(data.get(name));
    }
}
