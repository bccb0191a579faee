package io.validkit.core.error;

/** Thrown when a type name is not registered in the {@code TypeRegistry}. */
public final class UnknownTypeException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    private final String typeName;

    public UnknownTypeException(String typeName, String fieldName) {
        super("Unknown type: '" + typeName + "'", fieldName);
        this.typeName = typeName;
    }

    /** The name that failed to resolve. */
    public String typeName() {
        return typeName;
    }
}
