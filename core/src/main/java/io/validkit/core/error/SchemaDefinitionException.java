package io.validkit.core.error;

/**
 * Abstract parent for programmer errors detected while a schema is being built: unknown type or
 * constraint names, unusable option values, duplicate fields, malformed definition documents.
 * Always thrown at build time, never deferred to parse time. Carries the offending field name when
 * one is known.
 */
public abstract class SchemaDefinitionException extends ValidkitException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;

    protected SchemaDefinitionException(String message, String fieldName) {
        super(message, Phase.DEFINITION);
        this.fieldName = fieldName;
    }

    protected SchemaDefinitionException(String message, Throwable cause, String fieldName) {
        super(message, cause, Phase.DEFINITION);
        this.fieldName = fieldName;
    }

    /** The field being defined, or {@code null} if not yet identified. */
    public String fieldName() {
        return fieldName;
    }
}
