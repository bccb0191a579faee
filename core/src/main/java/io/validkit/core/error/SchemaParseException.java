package io.validkit.core.error;

/**
 * Thrown when a declarative schema definition document has invalid syntax, violates the definition
 * format, or references something that cannot be built. Carries the document source (file path or
 * {@code "<inline>"}).
 */
public final class SchemaParseException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public SchemaParseException(String message, String fieldName, String source) {
        super(message, fieldName);
        this.source = source;
    }

    public SchemaParseException(String message, Throwable cause, String fieldName, String source) {
        super(message, cause, fieldName);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
