package io.validkit.core.type;

import io.validkit.core.model.EvaluationScope;
import io.validkit.core.model.ValidationError;
import io.validkit.core.model.Values;
import io.validkit.core.model.ErrorCode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Arrays, produced as unmodifiable {@link List}s. Accepts {@code List} and {@code Object[]} input.
 *
 * <p>With an item type every element is evaluated at {@code path + [index]}; a failing element
 * does not stop the others, and all element errors are reported together.
 */
public final class ArrayType extends FieldType {

    private final FieldType itemType;

    /**
     * @param itemType type every element must satisfy, or {@code null} to accept any element
     */
    public ArrayType(FieldType itemType) {
        this.itemType = itemType;
    }

    /** The element type, or {@code null}. */
    public FieldType itemType() {
        return itemType;
    }

    @Override
    public TypeKind kind() {
        return TypeKind.ARRAY;
    }

    @Override
    public String typeName() {
        return itemType != null ? "array<" + itemType.typeName() + ">" : "array";
    }

    @Override
    public Coercion coerce(Object value) {
        if (value instanceof List<?> list) {
            return Coercion.of(Collections.unmodifiableList(new ArrayList<Object>(list)));
        }
        if (value instanceof Object[] array) {
            return Coercion.of(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(array))));
        }
        return Coercion.failed();
    }

    @Override
    public boolean isValid(Object value) {
        return value instanceof List<?>;
    }

    @Override
    public Evaluation evaluate(Object value, List<Object> path, EvaluationScope scope) {
        Coercion coercion = coerce(value);
        if (!(coercion instanceof Coercion.Coerced coerced)) {
            return Evaluation.failed(ValidationError.of(path, coercionErrorMessage(value, scope), ErrorCode.TYPE_ERROR));
        }
        List<?> items = (List<?>) coerced.value();
        if (itemType == null) {
            return Evaluation.ok(items);
        }

        List<Object> result = new ArrayList<>(items.size());
        List<ValidationError> errors = new ArrayList<>();
        for (int index = 0; index < items.size(); index++) {
            Evaluation item = itemType.evaluate(items.get(index), Values.append(path, index), scope);
            if (item.isValid()) {
                result.add(item.value());
            } else {
                errors.addAll(item.errors());
            }
        }
        return errors.isEmpty() ? Evaluation.ok(Collections.unmodifiableList(result)) : Evaluation.failed(errors);
    }
}
