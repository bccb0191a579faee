package io.validkit.core.schema;

import io.validkit.core.model.ErrorCode;
import io.validkit.core.model.ValidationError;
import io.validkit.core.model.Values;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Error sink handed to {@link SchemaValidator}s. Errors carry the {@code custom} code. */
public final class ValidatorErrors {

    private final List<Object> pathPrefix;
    private final List<ValidationError> errors = new ArrayList<>();

    ValidatorErrors(List<Object> pathPrefix) {
        this.pathPrefix = pathPrefix;
    }

    /** Adds an error at {@code field} below the schema's path. */
    public void error(String field, String message) {
        Objects.requireNonNull(field, "field must not be null");
        errors.add(ValidationError.of(Values.append(pathPrefix, field), message, ErrorCode.CUSTOM));
    }

    /** Adds an error at the schema's own path. */
    public void baseError(String message) {
        errors.add(ValidationError.of(pathPrefix, message, ErrorCode.CUSTOM));
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    List<ValidationError> errors() {
        return errors;
    }
}
