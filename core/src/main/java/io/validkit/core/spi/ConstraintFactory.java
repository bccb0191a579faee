package io.validkit.core.spi;

import io.validkit.core.constraint.Constraint;

/**
 * Creates {@link Constraint} instances for a registered constraint name from the raw option value
 * given at field definition ({@code min: 2}, {@code length: {min: 1, max: 5}}, ...).
 */
@FunctionalInterface
public interface ConstraintFactory {

    /**
     * Builds a constraint.
     *
     * @param config the option value as written in the field definition
     * @return a new immutable constraint
     * @throws io.validkit.core.error.InvalidFieldConfigException if {@code config} is unusable
     */
    Constraint create(Object config);
}
