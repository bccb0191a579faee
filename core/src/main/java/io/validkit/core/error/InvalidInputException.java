package io.validkit.core.error;

/**
 * Thrown when a schema is asked to parse something that is not key-value shaped. This is a caller
 * contract violation, not a validation failure, and is therefore never reported as a {@code
 * ValidationError}.
 */
public final class InvalidInputException extends ValidkitException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message, Phase.VALIDATION);
    }
}
