package io.validkit.core.schema;

/**
 * Schema-level options.
 *
 * @param strict marks the schema as closed for consumers such as exporters; unknown keys are
 *     dropped either way
 * @param passthrough copy keys that match no field into the output unchanged
 */
public record SchemaOptions(boolean strict, boolean passthrough) {

    public static final SchemaOptions DEFAULTS = new SchemaOptions(false, false);

    public SchemaOptions withStrict(boolean value) {
        return new SchemaOptions(value, passthrough);
    }

    public SchemaOptions withPassthrough(boolean value) {
        return new SchemaOptions(strict, value);
    }
}
