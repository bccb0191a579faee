package io.validkit.core.schema;

import io.validkit.core.constraint.Constraint;
import io.validkit.core.constraint.MaxConstraint;
import io.validkit.core.constraint.MinConstraint;
import io.validkit.core.engine.ConstraintRegistry;
import io.validkit.core.engine.TypeRegistry;
import io.validkit.core.error.InvalidFieldConfigException;
import io.validkit.core.model.ErrorCode;
import io.validkit.core.model.EvaluationScope;
import io.validkit.core.model.ValidationContext;
import io.validkit.core.model.ValidationError;
import io.validkit.core.model.Values;
import io.validkit.core.spi.MessageKey;
import io.validkit.core.type.Evaluation;
import io.validkit.core.type.FieldType;
import io.validkit.core.type.TypeKind;
import io.validkit.core.type.TypeOptions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * A named field of a {@link Schema}: one type, its constraints and refinements, and the presence
 * policy (optional, nullable, default, conditional).
 *
 * <p>Evaluation runs these steps in order and stops at the first one that reports errors:
 *
 * <ol>
 *   <li>conditional gate ({@code when} / {@code unless})
 *   <li>missing value: default, omission or {@code required}
 *   <li>preprocess
 *   <li>null handling: nullable fields accept it, others treat it as missing
 *   <li>coercion through the type (or a plain validity check when coercion is off)
 *   <li>constraints, all of them
 *   <li>refinements, all of them
 *   <li>transform
 * </ol>
 *
 * <p>A field-level {@code message} replaces the text of errors from steps 2, 5, 6 and 7. Fields
 * are immutable and thread-safe as long as the callbacks they hold are.
 */
public final class Field {

    private static final Set<TypeKind> NUMERIC_OR_SIZED = EnumSet.of(
            TypeKind.STRING, TypeKind.INTEGER, TypeKind.FLOAT, TypeKind.DECIMAL, TypeKind.ARRAY, TypeKind.OBJECT);

    private final String name;
    private final FieldType type;
    private final List<Constraint> constraints;
    private final List<Refinement> refinements;
    private final boolean optional;
    private final boolean nullable;
    private final boolean hasDefault;
    private final Supplier<?> defaultSupplier;
    private final BiFunction<Object, ValidationContext, Object> preprocess;
    private final BiFunction<Object, ValidationContext, Object> transform;
    private final Condition when;
    private final Condition unless;
    private final String message;
    private final boolean coerce;

    private Field(
            String name,
            FieldType type,
            List<Constraint> constraints,
            List<Refinement> refinements,
            boolean optional,
            boolean nullable,
            boolean hasDefault,
            Supplier<?> defaultSupplier,
            BiFunction<Object, ValidationContext, Object> preprocess,
            BiFunction<Object, ValidationContext, Object> transform,
            Condition when,
            Condition unless,
            String message,
            boolean coerce) {
        this.name = name;
        this.type = type;
        this.constraints = constraints;
        this.refinements = refinements;
        this.optional = optional;
        this.nullable = nullable;
        this.hasDefault = hasDefault;
        this.defaultSupplier = defaultSupplier;
        this.preprocess = preprocess;
        this.transform = transform;
        this.when = when;
        this.unless = unless;
        this.message = message;
        this.coerce = coerce;
    }

    /**
     * Builds a field from its definition.
     *
     * @param typeRef a registered type name, a {@link FieldType} or a nested {@link Schema};
     *     ignored when the options declare a {@code union} or {@code literal}
     * @throws io.validkit.core.error.SchemaDefinitionException if the definition is unusable
     */
    static Field define(
            String name, Object typeRef, FieldOptions options, TypeRegistry types, ConstraintRegistry registry) {
        if (name == null || name.isBlank()) {
            throw new InvalidFieldConfigException("field name must not be null or blank");
        }
        FieldOptions opts = options != null ? options : FieldOptions.options();
        FieldType type = resolveType(name, typeRef, opts, types);

        List<Constraint> constraints = new ArrayList<>();
        if (opts.hasMin()) {
            constraints.add(registry.build("min", opts.min, name));
        }
        if (opts.hasMax()) {
            constraints.add(registry.build("max", opts.max, name));
        }
        if (opts.length != null) {
            constraints.add(registry.build("length", opts.length, name));
        }
        if (opts.format != null) {
            constraints.add(registry.build("format", opts.format, name));
        }
        if (opts.enumValues != null) {
            constraints.add(registry.build("enum", opts.enumValuesOrNull(), name));
        }
        opts.customConstraints.forEach(
                (constraintName, config) -> constraints.add(registry.build(constraintName, config, name)));
        requireNumericBounds(name, type, constraints);

        return new Field(
                name,
                type,
                Collections.unmodifiableList(constraints),
                List.copyOf(opts.refinements),
                Boolean.TRUE.equals(opts.optional),
                opts.nullable,
                opts.hasDefault,
                opts.defaultSupplier,
                opts.preprocess,
                opts.transform,
                opts.when,
                opts.unless,
                opts.message,
                opts.coerce);
    }

    private static FieldType resolveType(String name, Object typeRef, FieldOptions opts, TypeRegistry types) {
        if (opts.literal != null) {
            return types.build("literal", TypeOptions.none().withLiterals(opts.literal), name);
        }
        if (opts.union != null) {
            return types.build("union", TypeOptions.none().withMembers(opts.union), name);
        }
        if (typeRef instanceof String typeName) {
            TypeOptions typeOptions = TypeOptions.none()
                    .withOf(opts.of)
                    .withSchema(opts.schema)
                    .withDiscriminator(opts.discriminator, opts.mapping);
            return types.build(typeName, typeOptions, name);
        }
        return types.resolve(typeRef, name);
    }

    /**
     * Numeric and sized types compare numbers (values or lengths), so a bound of any other class
     * could never be met.
     */
    private static void requireNumericBounds(String name, FieldType type, List<Constraint> constraints) {
        if (!NUMERIC_OR_SIZED.contains(type.kind())) {
            return;
        }
        for (Constraint constraint : constraints) {
            Object bound = constraint instanceof MinConstraint min
                    ? min.bound()
                    : constraint instanceof MaxConstraint max ? max.bound() : null;
            if (bound != null && !(bound instanceof Number)) {
                throw new InvalidFieldConfigException(
                        constraint.name() + " bound for type '" + type.typeName() + "' must be a number, got "
                                + Values.className(bound),
                        name);
            }
        }
    }

    /** Copy of this field that is optional. */
    Field asOptional() {
        if (optional) {
            return this;
        }
        return new Field(name, type, constraints, refinements, true, nullable, hasDefault, defaultSupplier,
                preprocess, transform, when, unless, message, coerce);
    }

    public String name() {
        return name;
    }

    public FieldType type() {
        return type;
    }

    public List<Constraint> constraints() {
        return constraints;
    }

    /** Number of refinements; the checks themselves are opaque. */
    public int refinementCount() {
        return refinements.size();
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean isRequired() {
        return !optional;
    }

    public boolean isNullable() {
        return nullable;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    /** The default, computed fresh when it comes from a supplier; {@code null} without a default. */
    public Object defaultValue() {
        return hasDefault ? defaultSupplier.get() : null;
    }

    public boolean isConditional() {
        return when != null || unless != null;
    }

    public boolean coerces() {
        return coerce;
    }

    /** The field-level message override, if any. */
    public Optional<String> message() {
        return Optional.ofNullable(message);
    }

    /** First constraint of the given class, if the field has one. */
    public <C extends Constraint> Optional<C> constraint(Class<C> constraintClass) {
        return constraints.stream().filter(constraintClass::isInstance).map(constraintClass::cast).findFirst();
    }

    /**
     * Evaluates this field's slot of the input.
     *
     * @param raw the field's value, or missing
     * @param pathPrefix path of the enclosing schema
     * @param data the enclosing schema's whole normalized input, for conditions
     * @param scope per-call context and messages
     */
    public Outcome evaluate(RawValue raw, List<Object> pathPrefix, Map<String, Object> data, EvaluationScope scope) {
        List<Object> path = Values.append(pathPrefix, name);
        ValidationContext context = scope.context();

        if (isConditional() && !shouldValidate(data, context)) {
            if (!(raw instanceof RawValue.Present present) || present.value() == null) {
                return Outcome.absent();
            }
            return Outcome.value(applyTransform(applyPreprocess(present.value(), context), context));
        }

        if (!(raw instanceof RawValue.Present present)) {
            return handleMissing(path, scope);
        }

        Object value = applyPreprocess(present.value(), context);
        if (value == null) {
            return nullable ? Outcome.value(null) : handleMissing(path, scope);
        }

        Object coerced;
        if (coerce) {
            Evaluation evaluation = type.evaluate(value, path, scope);
            if (!evaluation.isValid()) {
                return invalid(evaluation.errors());
            }
            coerced = evaluation.value();
        } else {
            if (!type.isValid(value)) {
                return invalid(List.of(
                        ValidationError.of(path, type.validationErrorMessage(value, scope), ErrorCode.TYPE_ERROR)));
            }
            coerced = value;
        }

        List<ValidationError> constraintErrors = new ArrayList<>();
        for (Constraint constraint : constraints) {
            constraintErrors.addAll(constraint.evaluate(coerced, path, scope));
        }
        if (!constraintErrors.isEmpty()) {
            return invalid(constraintErrors);
        }

        List<ValidationError> refinementErrors = new ArrayList<>();
        for (Refinement refinement : refinements) {
            refinement.evaluate(coerced, path, scope).ifPresent(refinementErrors::add);
        }
        if (!refinementErrors.isEmpty()) {
            return invalid(refinementErrors);
        }

        return Outcome.value(applyTransform(coerced, context));
    }

    private boolean shouldValidate(Map<String, Object> data, ValidationContext context) {
        if (data == null) {
            return true;
        }
        if (when != null && !when.test(data, context)) {
            return false;
        }
        return unless == null || !unless.test(data, context);
    }

    private Outcome handleMissing(List<Object> path, EvaluationScope scope) {
        if (hasDefault) {
            ValidationContext context = scope.context();
            return Outcome.value(applyTransform(applyPreprocess(defaultSupplier.get(), context), context));
        }
        if (optional) {
            return Outcome.absent();
        }
        return invalid(List.of(
                ValidationError.of(path, scope.messages().render(MessageKey.REQUIRED), ErrorCode.REQUIRED)));
    }

    private Outcome invalid(List<ValidationError> errors) {
        if (message == null) {
            return new Outcome.Invalid(errors);
        }
        List<ValidationError> rewritten = new ArrayList<>(errors.size());
        for (ValidationError error : errors) {
            rewritten.add(error.withMessage(message));
        }
        return new Outcome.Invalid(rewritten);
    }

    private Object applyPreprocess(Object value, ValidationContext context) {
        return preprocess != null ? preprocess.apply(value, context) : value;
    }

    private Object applyTransform(Object value, ValidationContext context) {
        return transform != null ? transform.apply(value, context) : value;
    }

    @Override
    public String toString() {
        return "Field[" + name + ": " + type.typeName() + (optional ? ", optional" : "")
                + (nullable ? ", nullable" : "") + "]";
    }

    /** What a field contributes to the schema output. */
    public sealed interface Outcome {

        static Outcome value(Object value) {
            return new Value(value);
        }

        static Outcome absent() {
            return Absent.INSTANCE;
        }

        /** The key is written with this value, which may be {@code null}. */
        record Value(Object value) implements Outcome {}

        /** The key is left out of the output. */
        enum Absent implements Outcome {
            INSTANCE
        }

        /** The field failed. */
        record Invalid(List<ValidationError> errors) implements Outcome {
            public Invalid {
                errors = List.copyOf(Objects.requireNonNull(errors, "errors must not be null"));
            }
        }
    }
}
