package io.validkit.core.error;

/**
 * Abstract base for all validkit exceptions. Never thrown directly; use the concrete subclasses
 * under {@link SchemaDefinitionException} or the validation-phase exceptions.
 */
public abstract class ValidkitException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        DEFINITION,
        VALIDATION
    }

    private final Phase phase;

    protected ValidkitException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected ValidkitException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
