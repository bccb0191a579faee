package io.validkit.core.engine;

import io.validkit.core.constraint.Constraint;
import io.validkit.core.constraint.EnumConstraint;
import io.validkit.core.constraint.FormatConstraint;
import io.validkit.core.constraint.LengthConstraint;
import io.validkit.core.constraint.MaxConstraint;
import io.validkit.core.constraint.MinConstraint;
import io.validkit.core.error.InvalidFieldConfigException;
import io.validkit.core.error.UnknownConstraintException;
import io.validkit.core.spi.ConstraintFactory;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name to {@link ConstraintFactory} table. Same contract as {@link TypeRegistry}: thread-safe,
 * append-only, one instance per configuration.
 */
public final class ConstraintRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ConstraintRegistry.class);

    private final Map<String, ConstraintFactory> factories = new ConcurrentHashMap<>();

    /** Returns a new registry holding {@code min}, {@code max}, {@code length}, {@code format}, {@code enum}. */
    public static ConstraintRegistry withBuiltins() {
        return new ConstraintRegistry()
                .register("min", MinConstraint::new)
                .register("max", MaxConstraint::new)
                .register("length", LengthConstraint::fromConfig)
                .register("format", FormatConstraint::fromConfig)
                .register("enum", EnumConstraint::fromConfig);
    }

    /**
     * Registers a constraint factory.
     *
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public ConstraintRegistry register(String name, ConstraintFactory factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("constraint name must not be null or blank");
        }
        if (factory == null) {
            throw new NullPointerException("factory must not be null");
        }
        if (factories.putIfAbsent(name, factory) != null) {
            throw new IllegalArgumentException("Constraint already registered: '" + name + "'");
        }
        LOG.debug("Registered constraint '{}'", name);
        return this;
    }

    public Optional<ConstraintFactory> getFactory(String name) {
        return Optional.ofNullable(name != null ? factories.get(name) : null);
    }

    public boolean has(String name) {
        return name != null && factories.containsKey(name);
    }

    /** Registered names, sorted. */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(factories.keySet()));
    }

    /**
     * Builds a constraint by name from its option value.
     *
     * @param fieldName field being defined, for error reporting; may be {@code null}
     * @throws UnknownConstraintException if the name is not registered
     * @throws InvalidFieldConfigException if the configuration is unusable
     */
    public Constraint build(String name, Object config, String fieldName) {
        ConstraintFactory factory =
                getFactory(name).orElseThrow(() -> new UnknownConstraintException(name, fieldName));
        Constraint constraint;
        try {
            constraint = factory.create(config);
        } catch (InvalidFieldConfigException e) {
            if (fieldName == null || e.fieldName() != null) {
                throw e;
            }
            throw new InvalidFieldConfigException(e.getMessage(), e, fieldName);
        }
        if (constraint == null) {
            throw new InvalidFieldConfigException("constraint factory for '" + name + "' returned null", fieldName);
        }
        return constraint;
    }

    /** As {@link #build(String, Object, String)} without a field name. */
    public Constraint build(String name, Object config) {
        return build(name, config, null);
    }
}
