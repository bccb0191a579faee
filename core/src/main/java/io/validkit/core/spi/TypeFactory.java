package io.validkit.core.spi;

import io.validkit.core.engine.TypeRegistry;
import io.validkit.core.type.FieldType;
import io.validkit.core.type.TypeOptions;

/**
 * Creates {@link FieldType} instances for a registered type name. Registered with a {@link
 * TypeRegistry}; this is the seam custom types plug into.
 *
 * <p>Implementations MUST return immutable, thread-safe types.
 */
@FunctionalInterface
public interface TypeFactory {

    /**
     * Builds a type from its configuration.
     *
     * @param options structural configuration ({@code of}, {@code schema}, union members, ...)
     * @param registry the registry the type is built from, for resolving nested type names
     * @return a new immutable type
     * @throws io.validkit.core.error.SchemaDefinitionException if the configuration is invalid
     */
    FieldType create(TypeOptions options, TypeRegistry registry);
}
