package io.validkit.core.type;

import io.validkit.core.model.ValidationError;
import java.util.List;

/**
 * Result of evaluating one value against a type: the coerced value when {@code errors} is empty,
 * otherwise {@code null} plus the path-addressed errors.
 */
public record Evaluation(Object value, List<ValidationError> errors) {

    public Evaluation {
        errors = errors == null || errors.isEmpty() ? List.of() : List.copyOf(errors);
    }

    public static Evaluation ok(Object value) {
        return new Evaluation(value, List.of());
    }

    public static Evaluation failed(List<ValidationError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("a failed evaluation needs at least one error");
        }
        return new Evaluation(null, errors);
    }

    public static Evaluation failed(ValidationError error) {
        return new Evaluation(null, List.of(error));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
