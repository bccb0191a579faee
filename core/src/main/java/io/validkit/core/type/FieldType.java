package io.validkit.core.type;

import io.validkit.core.model.ErrorCode;
import io.validkit.core.model.EvaluationScope;
import io.validkit.core.model.ValidationError;
import io.validkit.core.model.Values;
import io.validkit.core.spi.MessageKey;
import java.util.List;
import java.util.Map;

/**
 * Base class of every coercion/validation unit bound to a field.
 *
 * <p>Scalar types only implement {@link #coerce(Object)} and {@link #isValid(Object)}; the
 * composite {@link #evaluate(Object, List, EvaluationScope)} turns a failed coercion or a failed
 * validity check into exactly one {@code type_error} at the given path. Structural and combinator
 * types override {@code evaluate} to recurse and emit path-prefixed sub-errors.
 *
 * <p>Instances are immutable; their only state is configuration fixed at construction. A single
 * instance is safely shared by any number of fields, schemas and threads.
 */
public abstract class FieldType {

    /** The variant discriminant. */
    public abstract TypeKind kind();

    /** Name used in messages and introspection ({@code "integer"}, {@code "array<string>"}). */
    public abstract String typeName();

    /** Attempts to convert {@code value} into this type's canonical Java representation. */
    public abstract Coercion coerce(Object value);

    /** Returns {@code true} if {@code value} already is a valid instance of this type. */
    public abstract boolean isValid(Object value);

    /**
     * Coerces then validates {@code value}.
     *
     * @param value the raw input value
     * @param path absolute path of the value, used for every emitted error
     * @param scope per-call context and message renderer
     * @return the coerced value, or the errors
     */
    public Evaluation evaluate(Object value, List<Object> path, EvaluationScope scope) {
        Coercion coercion = coerce(value);
        if (coercion instanceof Coercion.Coerced coerced) {
            if (!isValid(coerced.value())) {
                return Evaluation.failed(
                        ValidationError.of(path, validationErrorMessage(coerced.value(), scope), ErrorCode.TYPE_ERROR));
            }
            return Evaluation.ok(coerced.value());
        }
        return Evaluation.failed(ValidationError.of(path, coercionErrorMessage(value, scope), ErrorCode.TYPE_ERROR));
    }

    /** Message for a value that could not be coerced. */
    protected String coercionErrorMessage(Object value, EvaluationScope scope) {
        return scope.messages()
                .render(MessageKey.TYPE_COERCION, Map.of("actual", Values.className(value), "type", typeName()));
    }

    /** Message for a value that is not a valid instance; also used when coercion is disabled. */
    public String validationErrorMessage(Object value, EvaluationScope scope) {
        return scope.messages().render(MessageKey.TYPE_INVALID, Map.of("type", typeName()));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + typeName() + "]";
    }
}
