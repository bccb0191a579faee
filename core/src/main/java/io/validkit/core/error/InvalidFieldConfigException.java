package io.validkit.core.error;

/**
 * Thrown when a field, type or constraint option has an unusable value: an empty enum list, a
 * length constraint without any bound, an unknown named format, an item type that is neither a
 * type name, a type nor a schema, and so on.
 */
public final class InvalidFieldConfigException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    public InvalidFieldConfigException(String message) {
        super(message, null);
    }

    public InvalidFieldConfigException(String message, String fieldName) {
        super(message, fieldName);
    }

    public InvalidFieldConfigException(String message, Throwable cause, String fieldName) {
        super(message, cause, fieldName);
    }
}
