package io.validkit.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.validkit.core.constraint.Constraint;
import io.validkit.core.constraint.EnumConstraint;
import io.validkit.core.constraint.FormatConstraint;
import io.validkit.core.constraint.LengthConstraint;
import io.validkit.core.constraint.MaxConstraint;
import io.validkit.core.constraint.MinConstraint;
import io.validkit.core.engine.ConstraintRegistry;
import io.validkit.core.engine.JsonValues;
import io.validkit.core.engine.TypeRegistry;
import io.validkit.core.engine.ValueSerializer;
import io.validkit.core.error.DuplicateFieldException;
import io.validkit.core.error.InvalidFieldConfigException;
import io.validkit.core.error.InvalidInputException;
import io.validkit.core.error.ValidationException;
import io.validkit.core.model.ErrorCollection;
import io.validkit.core.model.EvaluationScope;
import io.validkit.core.model.Result;
import io.validkit.core.model.ValidationContext;
import io.validkit.core.model.ValidationError;
import io.validkit.core.model.Values;
import io.validkit.core.spi.DefaultMessageRenderer;
import io.validkit.core.spi.MessageRenderer;
import io.validkit.core.type.ArrayType;
import io.validkit.core.type.DiscriminatedUnionType;
import io.validkit.core.type.FieldType;
import io.validkit.core.type.ObjectType;
import io.validkit.core.type.UnionType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ordered set of {@link Field}s turning untyped key-value input into coerced output or a
 * collection of path-addressed errors.
 *
 * <p>Every field is evaluated, in declaration order, before the outcome is decided: a failure
 * reports the errors of all fields, never only the first. Input keys are normalized to strings
 * (enum keys by name), so {@code "name"} and an enum constant {@code name} address the same field.
 *
 * <p>Schemas are immutable and safe to share between threads; each parse allocates only its own
 * output map and error list.
 *
 * <pre>{@code
 * Schema user = Schema.builder()
 *         .field("name", "string", FieldOptions.options().min(2))
 *         .optional("age", "integer", FieldOptions.options().min(0))
 *         .build();
 * Result<Map<String, Object>> result = user.safeParse(Map.of("name", "Al", "age", "17"));
 * }</pre>
 */
public final class Schema {

    private static final Logger LOG = LoggerFactory.getLogger(Schema.class);

    private static final TypeRegistry BUILTIN_TYPES = TypeRegistry.withBuiltins();
    private static final ConstraintRegistry BUILTIN_CONSTRAINTS = ConstraintRegistry.withBuiltins();

    private final Map<String, Field> fields;
    private final List<SchemaValidator> validators;
    private final SchemaOptions options;
    private final MessageRenderer messages;
    private final TypeRegistry types;
    private final ConstraintRegistry constraints;

    private Schema(Builder builder) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.validators = List.copyOf(builder.validators);
        this.options = builder.options;
        this.messages = builder.messages;
        this.types = builder.types;
        this.constraints = builder.constraints;
    }

    /** Builder resolving type and constraint names against the built-in registries. */
    public static Builder builder() {
        return new Builder(BUILTIN_TYPES, BUILTIN_CONSTRAINTS);
    }

    /** Builder resolving names against the given registries, for custom types and constraints. */
    public static Builder builder(TypeRegistry types, ConstraintRegistry constraints) {
        return new Builder(
                Objects.requireNonNull(types, "types must not be null"),
                Objects.requireNonNull(constraints, "constraints must not be null"));
    }

    /** Defines a schema in one block. */
    public static Schema define(Consumer<Builder> definition) {
        Builder builder = builder();
        definition.accept(builder);
        return builder.build();
    }

    // --- parsing ---

    /** Validates {@code input} with an empty context. */
    public Result<Map<String, Object>> safeParse(Object input) {
        return safeParse(input, ValidationContext.empty());
    }

    /**
     * Validates {@code input}, a {@link Map} or {@code null} (treated as empty).
     *
     * @throws InvalidInputException if {@code input} is neither a map nor {@code null}
     */
    public Result<Map<String, Object>> safeParse(Object input, ValidationContext context) {
        if (input instanceof JsonNode node) {
            return safeParse(node, context);
        }
        Result<Map<String, Object>> result =
                evaluate(requireMap(input), List.of(), new EvaluationScope(context, messages));
        if (result.isFailure() && LOG.isDebugEnabled()) {
            LOG.debug("Validation failed with {} error(s): {}", result.errors().size(), result.errors().fullMessages());
        }
        return result;
    }

    /** Validates a JSON object node with an empty context. */
    public Result<Map<String, Object>> safeParse(JsonNode input) {
        return safeParse(input, ValidationContext.empty());
    }

    /**
     * Validates a JSON object node.
     *
     * @throws InvalidInputException if the node is not an object (or JSON null)
     */
    public Result<Map<String, Object>> safeParse(JsonNode input, ValidationContext context) {
        if (input != null && !input.isObject() && !input.isNull() && !input.isMissingNode()) {
            throw new InvalidInputException("Expected a JSON object, got " + input.getNodeType());
        }
        return safeParse(JsonValues.toJava(input), context);
    }

    /** Validates {@code input} and returns the data, throwing on failure. */
    public Map<String, Object> parse(Object input) {
        return parse(input, ValidationContext.empty());
    }

    /**
     * Validates {@code input} and returns the data.
     *
     * @throws ValidationException carrying every error if validation fails
     */
    public Map<String, Object> parse(Object input, ValidationContext context) {
        Result<Map<String, Object>> result = safeParse(input, context);
        if (result.isFailure()) {
            throw new ValidationException(result.errors());
        }
        return result.data();
    }

    /**
     * Evaluates {@code input} below {@code pathPrefix}. Used for nested schemas; every error path
     * starts with the prefix.
     */
    public Result<Map<String, Object>> evaluate(Map<?, ?> input, List<Object> pathPrefix, EvaluationScope scope) {
        Map<String, Object> data = Collections.unmodifiableMap(normalize(input));
        Map<String, Object> output = new LinkedHashMap<>();
        List<ValidationError> errors = new ArrayList<>();

        for (Field field : fields.values()) {
            RawValue raw = data.containsKey(field.name()) ? RawValue.of(data.get(field.name())) : RawValue.missing();
            Field.Outcome outcome = field.evaluate(raw, pathPrefix, data, scope);
            if (outcome instanceof Field.Outcome.Invalid invalid) {
                errors.addAll(invalid.errors());
            } else if (outcome instanceof Field.Outcome.Value value) {
                if (value.value() != null || !omitsNull(field)) {
                    output.put(field.name(), value.value());
                }
            }
        }

        if (!errors.isEmpty()) {
            return Result.failure(ErrorCollection.of(errors));
        }

        if (options.passthrough()) {
            data.forEach((key, value) -> {
                if (!fields.containsKey(key)) {
                    output.put(key, value);
                }
            });
        }

        Map<String, Object> frozen = Collections.unmodifiableMap(output);
        if (!validators.isEmpty()) {
            ValidatorErrors sink = new ValidatorErrors(pathPrefix);
            for (SchemaValidator validator : validators) {
                validator.validate(frozen, sink, scope.context());
            }
            if (!sink.isEmpty()) {
                return Result.failure(ErrorCollection.of(sink.errors()));
            }
        }
        return Result.success(frozen);
    }

    private static boolean omitsNull(Field field) {
        return field.isOptional() && !field.hasDefault() && !field.isNullable();
    }

    private static Map<?, ?> requireMap(Object input) {
        if (input == null) {
            return Map.of();
        }
        if (input instanceof Map<?, ?> map) {
            return map;
        }
        throw new InvalidInputException("Expected a key-value map, got " + input.getClass().getSimpleName());
    }

    private static Map<String, Object> normalize(Map<?, ?> input) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (input != null) {
            input.forEach((key, value) -> normalized.put(Values.keyOf(key), value));
        }
        return normalized;
    }

    // --- serialization ---

    /**
     * Validates {@code input} and serializes the data to JSON-safe values.
     *
     * @throws ValidationException if validation fails
     */
    public Map<String, Object> dump(Object input) {
        return serialized(parse(input));
    }

    /** Validates {@code input} and serializes the data of a success. */
    public Result<Map<String, Object>> safeDump(Object input) {
        return safeParse(input).map(Schema::serialized);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> serialized(Map<String, Object> data) {
        return (Map<String, Object>) ValueSerializer.serializeValue(data);
    }

    // --- composition ---

    /** New schema with this schema's fields, validators and options plus whatever {@code extension} adds. */
    public Schema extend(Consumer<Builder> extension) {
        Builder builder = toBuilder();
        extension.accept(builder);
        return builder.build();
    }

    /** New schema with only the named fields, in this schema's order. Validators are dropped. */
    public Schema pick(String... names) {
        Set<String> wanted = knownNames(names);
        return select(wanted::contains);
    }

    /** New schema without the named fields. Validators are dropped. */
    public Schema omit(String... names) {
        Set<String> unwanted = knownNames(names);
        return select(name -> !unwanted.contains(name));
    }

    /**
     * New schema with the fields of both; {@code other} wins on name clashes, keeping this
     * schema's position for the clashing field. Validators of both run; {@code other}'s options
     * apply.
     */
    public Schema merge(Schema other) {
        Objects.requireNonNull(other, "other must not be null");
        Builder builder = new Builder(types, constraints);
        builder.fields.putAll(fields);
        builder.fields.putAll(other.fields);
        builder.validators.addAll(validators);
        builder.validators.addAll(other.validators);
        builder.options = other.options;
        builder.messages = messages;
        return builder.build();
    }

    /** New schema in which every field is optional. */
    public Schema partial() {
        Builder builder = toBuilder();
        builder.fields.replaceAll((name, field) -> field.asOptional());
        return builder.build();
    }

    private Schema select(Predicate<String> keep) {
        Builder builder = new Builder(types, constraints);
        fields.forEach((name, field) -> {
            if (keep.test(name)) {
                builder.fields.put(name, field);
            }
        });
        builder.options = options;
        builder.messages = messages;
        return builder.build();
    }

    private Set<String> knownNames(String... names) {
        Set<String> result = new LinkedHashSet<>(Arrays.asList(names));
        for (String name : result) {
            if (!fields.containsKey(name)) {
                throw new InvalidFieldConfigException("Unknown field '" + name + "'", name);
            }
        }
        return result;
    }

    private Builder toBuilder() {
        Builder builder = new Builder(types, constraints);
        builder.fields.putAll(fields);
        builder.validators.addAll(validators);
        builder.options = options;
        builder.messages = messages;
        return builder;
    }

    // --- introspection ---

    /** Fields by name, in declaration order. */
    public Map<String, Field> fields() {
        return fields;
    }

    public List<String> fieldNames() {
        return List.copyOf(fields.keySet());
    }

    public Optional<Field> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    /** Fields that fail when missing: required, unconditional and without a default. */
    public List<String> requiredFields() {
        return namesWhere(f -> f.isRequired() && !f.isConditional() && !f.hasDefault());
    }

    public List<String> optionalFields() {
        return namesWhere(Field::isOptional);
    }

    public List<String> conditionalFields() {
        return namesWhere(Field::isConditional);
    }

    public List<String> fieldsWithDefaults() {
        return namesWhere(Field::hasDefault);
    }

    public SchemaOptions options() {
        return options;
    }

    public int validatorCount() {
        return validators.size();
    }

    /**
     * Structure of the schema as plain data: per field its type name, presence flags and
     * constraints, plus nested structure for arrays, objects and unions.
     */
    public Map<String, Object> describe() {
        Map<String, Object> fieldMaps = new LinkedHashMap<>();
        fields.forEach((name, field) -> fieldMaps.put(name, describeField(field)));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("fields", fieldMaps);
        result.put("options", Map.of("strict", options.strict(), "passthrough", options.passthrough()));
        result.put("validators_count", validators.size());
        return result;
    }

    private List<String> namesWhere(Predicate<Field> filter) {
        return fields.values().stream().filter(filter).map(Field::name).collect(Collectors.toList());
    }

    private static Map<String, Object> describeField(Field field) {
        Map<String, Object> map = new LinkedHashMap<>(describeType(field.type()));
        map.put("optional", field.isOptional());
        map.put("nullable", field.isNullable());
        map.put("has_default", field.hasDefault());
        map.put("conditional", field.isConditional());
        map.put("constraints", field.constraints().stream().map(Schema::describeConstraint).collect(Collectors.toList()));
        return map;
    }

    private static Map<String, Object> describeType(FieldType type) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type.typeName());
        switch (type.kind()) {
            case ARRAY -> {
                FieldType items = ((ArrayType) type).itemType();
                if (items != null) {
                    map.put("items", describeType(items));
                }
            }
            case OBJECT -> {
                Schema nested = ((ObjectType) type).schema();
                if (nested != null) {
                    map.put("schema", nested.describe());
                }
            }
            case UNION -> map.put("members", ((UnionType) type).members().stream()
                    .map(Schema::describeType)
                    .collect(Collectors.toList()));
            case DISCRIMINATED_UNION -> {
                DiscriminatedUnionType union = (DiscriminatedUnionType) type;
                Map<String, Object> mapping = new LinkedHashMap<>();
                union.mapping().forEach((key, schema) -> mapping.put(Values.keyOf(key), schema.describe()));
                map.put("discriminator", union.discriminator());
                map.put("mapping", mapping);
            }
            case STRING, INTEGER, FLOAT, DECIMAL, BOOLEAN, DATE, DATE_TIME, TIME, LITERAL, CUSTOM -> {
                // scalar: the type name says it all
            }
        }
        return map;
    }

    private static Map<String, Object> describeConstraint(Constraint constraint) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", constraint.name());
        switch (constraint.kind()) {
            case MIN -> map.put("value", ((MinConstraint) constraint).bound());
            case MAX -> map.put("value", ((MaxConstraint) constraint).bound());
            case LENGTH -> map.put("options", ((LengthConstraint) constraint).options());
            case FORMAT -> map.put("pattern", ((FormatConstraint) constraint).pattern().pattern());
            case ENUM -> map.put("values", ((EnumConstraint) constraint).allowed());
            case CUSTOM -> map.put("options", constraint.options());
        }
        return map;
    }

    @Override
    public String toString() {
        return "Schema" + fields.keySet();
    }

    /**
     * Collects field definitions. Not thread-safe; {@link #build()} produces an immutable schema
     * and the builder can be discarded.
     */
    public static final class Builder {

        private final TypeRegistry types;
        private final ConstraintRegistry constraints;
        private final Map<String, Field> fields = new LinkedHashMap<>();
        private final List<SchemaValidator> validators = new ArrayList<>();
        private SchemaOptions options = SchemaOptions.DEFAULTS;
        private MessageRenderer messages = DefaultMessageRenderer.INSTANCE;

        private Builder(TypeRegistry types, ConstraintRegistry constraints) {
            this.types = types;
            this.constraints = constraints;
        }

        public Builder field(String name, Object type) {
            return field(name, type, FieldOptions.options());
        }

        /**
         * Adds a field.
         *
         * @param type a registered type name, a {@link FieldType} or a nested {@link Schema}
         * @throws DuplicateFieldException if a field with this name exists
         * @throws io.validkit.core.error.SchemaDefinitionException if the definition is unusable
         */
        public Builder field(String name, Object type, FieldOptions fieldOptions) {
            if (name != null && fields.containsKey(name)) {
                throw new DuplicateFieldException(name);
            }
            Field field = Field.define(name, type, fieldOptions, types, constraints);
            fields.put(field.name(), field);
            LOG.debug("Defined field '{}' of type {}", name, field.type().typeName());
            return this;
        }

        public Builder optional(String name, Object type) {
            return optional(name, type, FieldOptions.options());
        }

        public Builder optional(String name, Object type, FieldOptions fieldOptions) {
            FieldOptions opts = fieldOptions != null ? fieldOptions : FieldOptions.options();
            return field(name, type, opts.optional(true));
        }

        public Builder required(String name, Object type) {
            return required(name, type, FieldOptions.options());
        }

        public Builder required(String name, Object type, FieldOptions fieldOptions) {
            FieldOptions opts = fieldOptions != null ? fieldOptions : FieldOptions.options();
            return field(name, type, opts.optional(false));
        }

        /** Adds a cross-field validator, run after all fields validated. */
        public Builder validate(SchemaValidator validator) {
            validators.add(Objects.requireNonNull(validator, "validator must not be null"));
            return this;
        }

        public Builder options(SchemaOptions schemaOptions) {
            this.options = Objects.requireNonNull(schemaOptions, "options must not be null");
            return this;
        }

        public Builder strict() {
            this.options = options.withStrict(true);
            return this;
        }

        public Builder passthrough() {
            this.options = options.withPassthrough(true);
            return this;
        }

        /** Renderer for messages of parses started on this schema. */
        public Builder messages(MessageRenderer renderer) {
            this.messages = Objects.requireNonNull(renderer, "renderer must not be null");
            return this;
        }

        public Schema build() {
            Schema schema = new Schema(this);
            LOG.debug("Built schema with fields {}", schema.fields.keySet());
            return schema;
        }
    }
}
