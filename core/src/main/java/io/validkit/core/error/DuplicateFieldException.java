package io.validkit.core.error;

/** Thrown when a schema declares the same field name twice. */
public final class DuplicateFieldException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    public DuplicateFieldException(String fieldName) {
        super("Field '" + fieldName + "' already defined", fieldName);
    }
}
