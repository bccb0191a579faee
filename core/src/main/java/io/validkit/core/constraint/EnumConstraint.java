package io.validkit.core.constraint;

import io.validkit.core.error.InvalidFieldConfigException;
import io.validkit.core.model.ErrorCode;
import io.validkit.core.model.EvaluationScope;
import io.validkit.core.model.Values;
import io.validkit.core.spi.MessageKey;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Membership in a fixed, non-empty list of allowed values. Numbers compare by numeric value. */
public final class EnumConstraint extends Constraint {

    private final List<Object> allowed;

    public EnumConstraint(Collection<?> allowed) {
        if (allowed == null || allowed.isEmpty()) {
            throw new InvalidFieldConfigException("enum requires at least one allowed value");
        }
        this.allowed = Collections.unmodifiableList(new ArrayList<Object>(allowed));
    }

    /** Accepts a collection or an array of allowed values. */
    public static EnumConstraint fromConfig(Object config) {
        if (config instanceof EnumConstraint constraint) {
            return constraint;
        }
        if (config instanceof Collection<?> values) {
            return new EnumConstraint(values);
        }
        if (config instanceof Object[] values) {
            return new EnumConstraint(Arrays.asList(values));
        }
        throw new InvalidFieldConfigException("enum must be a list of allowed values, got "
                + (config == null ? "null" : config.getClass().getSimpleName()));
    }

    public List<Object> allowed() {
        return allowed;
    }

    @Override
    public ConstraintKind kind() {
        return ConstraintKind.ENUM;
    }

    @Override
    public boolean isValid(Object value) {
        return Values.containsValue(allowed, value);
    }

    @Override
    public String errorMessage(Object value, EvaluationScope scope) {
        return scope.messages().render(MessageKey.ENUM, Map.of("values", Values.inspectAll(allowed)));
    }

    @Override
    public ErrorCode errorCode() {
        return ErrorCode.ENUM;
    }

    @Override
    public Map<String, Object> options() {
        return Map.of("values", allowed);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EnumConstraint other && allowed.equals(other.allowed);
    }

    @Override
    public int hashCode() {
        return allowed.hashCode();
    }
}
