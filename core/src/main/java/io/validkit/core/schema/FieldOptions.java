package io.validkit.core.schema;

import io.validkit.core.constraint.LengthConstraint;
import io.validkit.core.model.ValidationContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Mutable definition of a field's options, consumed once by {@link Schema.Builder}. The resulting
 * {@link Field} copies everything it needs, so reusing or changing an options object after the
 * field is defined has no effect on it.
 *
 * <p>Callbacks come in two shapes selected by method name: value-only ({@link #preprocess}) and
 * value plus context ({@link #preprocessWithContext}).
 */
public final class FieldOptions {

    private static final Object NO_BOUND = new Object();

    Boolean optional;
    boolean nullable;
    boolean hasDefault;
    Supplier<?> defaultSupplier;
    Object min = NO_BOUND;
    Object max = NO_BOUND;
    Object length;
    Object format;
    List<Object> enumValues;
    final Map<String, Object> customConstraints = new LinkedHashMap<>();
    Object of;
    Schema schema;
    String discriminator;
    Map<Object, Schema> mapping;
    List<Object> union;
    List<Object> literal;
    boolean coerce = true;
    BiFunction<Object, ValidationContext, Object> preprocess;
    BiFunction<Object, ValidationContext, Object> transform;
    Condition when;
    Condition unless;
    final List<Refinement> refinements = new ArrayList<>();
    String message;

    /** Starts an empty set of options. */
    public static FieldOptions options() {
        return new FieldOptions();
    }

    // --- presence ---

    public FieldOptions optional() {
        return optional(true);
    }

    public FieldOptions optional(boolean value) {
        this.optional = value;
        return this;
    }

    public FieldOptions nullable() {
        this.nullable = true;
        return this;
    }

    /** Value used when the key is missing (or null on a non-nullable field). */
    public FieldOptions defaultValue(Object value) {
        this.hasDefault = true;
        this.defaultSupplier = () -> value;
        return this;
    }

    /** Default computed on every use. */
    public FieldOptions defaultSupplier(Supplier<?> supplier) {
        Objects.requireNonNull(supplier, "supplier must not be null");
        this.hasDefault = true;
        this.defaultSupplier = supplier;
        return this;
    }

    // --- constraints ---

    public FieldOptions min(Object bound) {
        this.min = Objects.requireNonNull(bound, "min must not be null");
        return this;
    }

    public FieldOptions max(Object bound) {
        this.max = Objects.requireNonNull(bound, "max must not be null");
        return this;
    }

    /**
     * Length option: an exact {@code Integer}, a {@code [min, max]} list, a map with {@code
     * exact}/{@code min}/{@code max}, or a {@link LengthConstraint}.
     */
    public FieldOptions length(Object config) {
        this.length = Objects.requireNonNull(config, "length must not be null");
        return this;
    }

    /** Inclusive length range. */
    public FieldOptions length(int minLength, int maxLength) {
        this.length = LengthConstraint.range(minLength, maxLength);
        return this;
    }

    /** A {@link java.util.regex.Pattern}, a {@link io.validkit.core.constraint.NamedFormat} or its name. */
    public FieldOptions format(Object config) {
        this.format = Objects.requireNonNull(config, "format must not be null");
        return this;
    }

    public FieldOptions enumValues(Collection<?> allowed) {
        this.enumValues = new ArrayList<>(Objects.requireNonNull(allowed, "allowed must not be null"));
        return this;
    }

    public FieldOptions enumOf(Object... allowed) {
        return enumValues(Arrays.asList(allowed));
    }

    /** Adds a constraint registered under {@code name}; runs after the built-in constraints. */
    public FieldOptions constraint(String name, Object config) {
        Objects.requireNonNull(name, "name must not be null");
        this.customConstraints.put(name, config);
        return this;
    }

    // --- structure ---

    /** Array item type: a type name, a {@link io.validkit.core.type.FieldType} or a {@link Schema}. */
    public FieldOptions of(Object itemType) {
        this.of = Objects.requireNonNull(itemType, "of must not be null");
        return this;
    }

    public FieldOptions schema(Schema nested) {
        this.schema = Objects.requireNonNull(nested, "schema must not be null");
        return this;
    }

    public FieldOptions discriminator(String field, Map<?, Schema> schemas) {
        this.discriminator = Objects.requireNonNull(field, "discriminator must not be null");
        this.mapping = new LinkedHashMap<>(Objects.requireNonNull(schemas, "mapping must not be null"));
        return this;
    }

    /** Turns the field into a union of the given members, replacing its declared type. */
    public FieldOptions union(Object... members) {
        this.union = new ArrayList<>(Arrays.asList(members));
        return this;
    }

    /** Turns the field into a literal of the given values, replacing its declared type. */
    public FieldOptions literal(Object... values) {
        this.literal = new ArrayList<>(Arrays.asList(values));
        return this;
    }

    /** When {@code false}, the value is only checked against the type, never converted. */
    public FieldOptions coerce(boolean value) {
        this.coerce = value;
        return this;
    }

    // --- callbacks ---

    public FieldOptions preprocess(Function<Object, Object> function) {
        Objects.requireNonNull(function, "preprocess must not be null");
        this.preprocess = (value, context) -> function.apply(value);
        return this;
    }

    public FieldOptions preprocessWithContext(BiFunction<Object, ValidationContext, Object> function) {
        this.preprocess = Objects.requireNonNull(function, "preprocess must not be null");
        return this;
    }

    public FieldOptions transform(Function<Object, Object> function) {
        Objects.requireNonNull(function, "transform must not be null");
        this.transform = (value, context) -> function.apply(value);
        return this;
    }

    public FieldOptions transformWithContext(BiFunction<Object, ValidationContext, Object> function) {
        this.transform = Objects.requireNonNull(function, "transform must not be null");
        return this;
    }

    public FieldOptions when(Predicate<Map<String, Object>> predicate) {
        this.when = Condition.of(predicate);
        return this;
    }

    public FieldOptions whenWithContext(BiPredicate<Map<String, Object>, ValidationContext> predicate) {
        this.when = Condition.withContext(predicate);
        return this;
    }

    /** Validates the field only when sibling {@code field} is truthy. */
    public FieldOptions when(String field) {
        this.when = Condition.field(field);
        return this;
    }

    public FieldOptions when(Condition condition) {
        this.when = Objects.requireNonNull(condition, "condition must not be null");
        return this;
    }

    public FieldOptions unless(Predicate<Map<String, Object>> predicate) {
        this.unless = Condition.of(predicate);
        return this;
    }

    public FieldOptions unlessWithContext(BiPredicate<Map<String, Object>, ValidationContext> predicate) {
        this.unless = Condition.withContext(predicate);
        return this;
    }

    /** Skips the field's validation when sibling {@code field} is truthy. */
    public FieldOptions unless(String field) {
        this.unless = Condition.field(field);
        return this;
    }

    public FieldOptions unless(Condition condition) {
        this.unless = Objects.requireNonNull(condition, "condition must not be null");
        return this;
    }

    public FieldOptions refine(Predicate<Object> check) {
        refinements.add(Refinement.of(check));
        return this;
    }

    public FieldOptions refine(Predicate<Object> check, String failureMessage) {
        refinements.add(Refinement.of(check, failureMessage));
        return this;
    }

    public FieldOptions refine(Predicate<Object> check, Function<Object, String> failureMessage) {
        refinements.add(Refinement.of(check, failureMessage));
        return this;
    }

    public FieldOptions refineWithContext(BiPredicate<Object, ValidationContext> check, String failureMessage) {
        refinements.add(Refinement.withContext(check, failureMessage));
        return this;
    }

    public FieldOptions refineWithContext(
            BiPredicate<Object, ValidationContext> check, Function<Object, String> failureMessage) {
        refinements.add(Refinement.withContext(check, failureMessage));
        return this;
    }

    public FieldOptions refine(Refinement refinement) {
        refinements.add(Objects.requireNonNull(refinement, "refinement must not be null"));
        return this;
    }

    /** Replaces the message of every error this field reports; codes and paths are kept. */
    public FieldOptions message(String text) {
        this.message = Objects.requireNonNull(text, "message must not be null");
        return this;
    }

    boolean hasMin() {
        return min != NO_BOUND;
    }

    boolean hasMax() {
        return max != NO_BOUND;
    }

    List<Object> enumValuesOrNull() {
        return enumValues != null ? Collections.unmodifiableList(enumValues) : null;
    }
}
