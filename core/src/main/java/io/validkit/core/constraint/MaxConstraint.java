package io.validkit.core.constraint;

import io.validkit.core.model.ErrorCode;
import io.validkit.core.spi.MessageKey;

/** Maximum value for numbers and comparable values, maximum length for sized values. */
public final class MaxConstraint extends BoundConstraint {

    public MaxConstraint(Object bound) {
        super(bound);
    }

    @Override
    public ConstraintKind kind() {
        return ConstraintKind.MAX;
    }

    @Override
    boolean accepts(int cmp) {
        return cmp <= 0;
    }

    @Override
    MessageKey valueMessage() {
        return MessageKey.MAX;
    }

    @Override
    MessageKey lengthMessage() {
        return MessageKey.MAX_LENGTH;
    }

    @Override
    public ErrorCode errorCode() {
        return ErrorCode.MAX;
    }
}
