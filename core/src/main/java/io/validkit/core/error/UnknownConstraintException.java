package io.validkit.core.error;

/** Thrown when a constraint name is not registered in the {@code ConstraintRegistry}. */
public final class UnknownConstraintException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    private final String constraintName;

    public UnknownConstraintException(String constraintName, String fieldName) {
        super("Unknown constraint: '" + constraintName + "'", fieldName);
        this.constraintName = constraintName;
    }

    /** The name that failed to resolve. */
    public String constraintName() {
        return constraintName;
    }
}
