package io.validkit.core.schema;

import io.validkit.core.model.ValidationContext;
import java.util.Map;

/**
 * Cross-field check run once every field of a schema has validated. Report problems through the
 * {@link ValidatorErrors} sink; exceptions thrown here propagate to the caller.
 */
@FunctionalInterface
public interface SchemaValidator {

    /**
     * @param data the coerced output of the schema's fields
     * @param errors sink for field-level and schema-level errors
     * @param context the call context
     */
    void validate(Map<String, Object> data, ValidatorErrors errors, ValidationContext context);
}
