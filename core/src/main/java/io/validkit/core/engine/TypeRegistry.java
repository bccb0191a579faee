package io.validkit.core.engine;

import io.validkit.core.error.InvalidFieldConfigException;
import io.validkit.core.error.UnknownTypeException;
import io.validkit.core.schema.Schema;
import io.validkit.core.spi.TypeFactory;
import io.validkit.core.type.ArrayType;
import io.validkit.core.type.BooleanType;
import io.validkit.core.type.DateTimeType;
import io.validkit.core.type.DateType;
import io.validkit.core.type.DecimalType;
import io.validkit.core.type.DiscriminatedUnionType;
import io.validkit.core.type.FieldType;
import io.validkit.core.type.FloatType;
import io.validkit.core.type.IntegerType;
import io.validkit.core.type.LiteralType;
import io.validkit.core.type.ObjectType;
import io.validkit.core.type.StringType;
import io.validkit.core.type.TimeType;
import io.validkit.core.type.TypeOptions;
import io.validkit.core.type.UnionType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name to {@link TypeFactory} table used when fields are defined by type name. Thread-safe;
 * registration is append-only, so a name resolves to the same factory for the lifetime of the
 * registry.
 *
 * <p>Registries are explicit objects: {@link #withBuiltins()} returns a fresh registry with the
 * built-in types, and custom types are registered on an instance that is then handed to {@link
 * Schema#builder(TypeRegistry, ConstraintRegistry)}.
 */
public final class TypeRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(TypeRegistry.class);

    private final Map<String, TypeFactory> factories = new ConcurrentHashMap<>();

    /** Returns a new registry holding the built-in types and their aliases. */
    public static TypeRegistry withBuiltins() {
        TypeRegistry registry = new TypeRegistry();
        registry.register("string", (options, types) -> StringType.INSTANCE);
        registry.register("integer", (options, types) -> IntegerType.INSTANCE);
        registry.register("float", (options, types) -> FloatType.INSTANCE);
        registry.register("decimal", (options, types) -> DecimalType.INSTANCE);
        registry.register("bigdecimal", (options, types) -> DecimalType.INSTANCE);
        registry.register("boolean", (options, types) -> BooleanType.INSTANCE);
        registry.register("bool", (options, types) -> BooleanType.INSTANCE);
        registry.register("date", (options, types) -> DateType.INSTANCE);
        registry.register("datetime", (options, types) -> DateTimeType.INSTANCE);
        registry.register("date_time", (options, types) -> DateTimeType.INSTANCE);
        registry.register("time", (options, types) -> TimeType.INSTANCE);
        registry.register("array", TypeRegistry::array);
        registry.register("object", (options, types) -> new ObjectType(options.schema()));
        registry.register("hash", (options, types) -> new ObjectType(options.schema()));
        registry.register("union", TypeRegistry::union);
        registry.register("discriminated_union", TypeRegistry::discriminatedUnion);
        registry.register("literal", TypeRegistry::literal);
        return registry;
    }

    /**
     * Registers a type factory.
     *
     * @param name the type name used in field definitions
     * @param factory creates the type from its options
     * @return this registry
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public TypeRegistry register(String name, TypeFactory factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("type name must not be null or blank");
        }
        if (factory == null) {
            throw new NullPointerException("factory must not be null");
        }
        if (factories.putIfAbsent(name, factory) != null) {
            throw new IllegalArgumentException("Type already registered: '" + name + "'");
        }
        LOG.debug("Registered type '{}'", name);
        return this;
    }

    /** Looks up the factory for a type name. */
    public Optional<TypeFactory> getFactory(String name) {
        return Optional.ofNullable(name != null ? factories.get(name) : null);
    }

    /** Returns {@code true} if the name is registered. */
    public boolean has(String name) {
        return name != null && factories.containsKey(name);
    }

    /** Registered names, sorted. */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(factories.keySet()));
    }

    public int size() {
        return factories.size();
    }

    /**
     * Builds a type by name.
     *
     * @throws UnknownTypeException if the name is not registered
     */
    public FieldType build(String name, TypeOptions options) {
        return build(name, options, null);
    }

    /** As {@link #build(String, TypeOptions)}, naming {@code fieldName} in any exception. */
    public FieldType build(String name, TypeOptions options, String fieldName) {
        TypeFactory factory = getFactory(name).orElseThrow(() -> new UnknownTypeException(name, fieldName));
        FieldType type = factory.create(options != null ? options : TypeOptions.none(), this);
        if (type == null) {
            throw new InvalidFieldConfigException("type factory for '" + name + "' returned null", fieldName);
        }
        return type;
    }

    /**
     * Resolves a type reference as used by {@code of} and union members: a registered type name, a
     * {@link FieldType} instance, or a {@link Schema} (wrapped as an object type).
     *
     * @throws UnknownTypeException if a name is not registered
     * @throws InvalidFieldConfigException for any other kind of reference
     */
    public FieldType resolve(Object reference, String fieldName) {
        if (reference instanceof FieldType type) {
            return type;
        }
        if (reference instanceof Schema schema) {
            return new ObjectType(schema);
        }
        if (reference instanceof String name) {
            return build(name, TypeOptions.none(), fieldName);
        }
        throw new InvalidFieldConfigException(
                "invalid type reference: expected a type name, a FieldType or a Schema, got "
                        + (reference == null ? "null" : reference.getClass().getSimpleName()),
                fieldName);
    }

    private static FieldType array(TypeOptions options, TypeRegistry registry) {
        return new ArrayType(options.of() != null ? registry.resolve(options.of(), null) : null);
    }

    private static FieldType union(TypeOptions options, TypeRegistry registry) {
        if (options.members() == null || options.members().isEmpty()) {
            throw new InvalidFieldConfigException("union requires at least one member type");
        }
        List<FieldType> members = new ArrayList<>();
        for (Object member : options.members()) {
            members.add(registry.resolve(member, null));
        }
        return new UnionType(members);
    }

    private static FieldType discriminatedUnion(TypeOptions options, TypeRegistry registry) {
        if (options.discriminator() == null || options.mapping() == null || options.mapping().isEmpty()) {
            throw new InvalidFieldConfigException("discriminated_union requires a discriminator and a non-empty mapping");
        }
        return new DiscriminatedUnionType(options.discriminator(), options.mapping());
    }

    private static FieldType literal(TypeOptions options, TypeRegistry registry) {
        if (options.literals() == null || options.literals().isEmpty()) {
            throw new InvalidFieldConfigException("literal requires at least one value");
        }
        return new LiteralType(options.literals());
    }
}
