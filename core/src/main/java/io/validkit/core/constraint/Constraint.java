package io.validkit.core.constraint;

import io.validkit.core.model.ErrorCode;
import io.validkit.core.model.EvaluationScope;
import io.validkit.core.model.ValidationError;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A post-coercion predicate bound to a field. Constraints never transform the value; they only
 * decide whether it is acceptable and, if not, how to phrase the failure.
 *
 * <p>Subclasses hold immutable configuration only and are safe to share between threads.
 */
public abstract class Constraint {

    /** The variant discriminant. */
    public abstract ConstraintKind kind();

    /** Registry name, {@code "min"} for {@link MinConstraint} and so on. */
    public String name() {
        return kind().name().toLowerCase(Locale.ROOT);
    }

    public abstract boolean isValid(Object value);

    public abstract String errorMessage(Object value, EvaluationScope scope);

    public abstract ErrorCode errorCode();

    /** Configuration as a plain map, for introspection. */
    public abstract Map<String, Object> options();

    /**
     * Checks {@code value} and returns either no errors or exactly one error at {@code path}.
     */
    public List<ValidationError> evaluate(Object value, List<Object> path, EvaluationScope scope) {
        if (isValid(value)) {
            return List.of();
        }
        return List.of(ValidationError.of(path, errorMessage(value, scope), errorCode()));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + options();
    }
}
