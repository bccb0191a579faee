package io.validkit.core.error;

import io.validkit.core.model.ErrorCollection;
import java.util.Objects;

/**
 * Thrown by {@code Schema.parse} when the input does not validate. Carries the complete, unchanged
 * {@link ErrorCollection} of the failed pass.
 */
public final class ValidationException extends ValidkitException {

    private static final long serialVersionUID = 1L;

    private final transient ErrorCollection errors;

    public ValidationException(ErrorCollection errors) {
        super(buildMessage(errors), Phase.VALIDATION);
        this.errors = errors;
    }

    /** The errors that caused the failure. */
    public ErrorCollection errors() {
        return errors;
    }

    private static String buildMessage(ErrorCollection errors) {
        Objects.requireNonNull(errors, "errors must not be null");
        if (errors.isEmpty()) {
            return "Validation failed";
        }
        return "Validation failed: " + String.join("; ", errors.fullMessages());
    }
}
