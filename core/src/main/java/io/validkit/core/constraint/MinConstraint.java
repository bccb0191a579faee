package io.validkit.core.constraint;

import io.validkit.core.model.ErrorCode;
import io.validkit.core.spi.MessageKey;

/** Minimum value for numbers and comparable values, minimum length for sized values. */
public final class MinConstraint extends BoundConstraint {

    public MinConstraint(Object bound) {
        super(bound);
    }

    @Override
    public ConstraintKind kind() {
        return ConstraintKind.MIN;
    }

    @Override
    boolean accepts(int cmp) {
        return cmp >= 0;
    }

    @Override
    MessageKey valueMessage() {
        return MessageKey.MIN;
    }

    @Override
    MessageKey lengthMessage() {
        return MessageKey.MIN_LENGTH;
    }

    @Override
    public ErrorCode errorCode() {
        return ErrorCode.MIN;
    }
}
