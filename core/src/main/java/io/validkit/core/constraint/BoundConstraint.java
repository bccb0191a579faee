package io.validkit.core.constraint;

import io.validkit.core.error.InvalidFieldConfigException;
import io.validkit.core.model.EvaluationScope;
import io.validkit.core.spi.MessageKey;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Shared logic of {@link MinConstraint} and {@link MaxConstraint}. The comparison mode follows the
 * runtime value: sized values (strings, collections, maps, arrays) compare their length, anything
 * else compares the value itself. A value that cannot be ordered against the bound fails.
 */
abstract class BoundConstraint extends Constraint {

    private final Object bound;

    BoundConstraint(Object bound) {
        if (bound == null) {
            throw new InvalidFieldConfigException(name() + " requires a bound");
        }
        this.bound = bound;
    }

    /** The configured threshold. */
    public Object bound() {
        return bound;
    }

    /** {@code true} when the comparison result {@code cmp} of value against bound is acceptable. */
    abstract boolean accepts(int cmp);

    abstract MessageKey valueMessage();

    abstract MessageKey lengthMessage();

    @Override
    public boolean isValid(Object value) {
        OptionalInt length = Measure.lengthOf(value);
        OptionalInt cmp = length.isPresent() ? Measure.compare((long) length.getAsInt(), bound) : Measure.compare(value, bound);
        return cmp.isPresent() && accepts(cmp.getAsInt());
    }

    @Override
    public String errorMessage(Object value, EvaluationScope scope) {
        OptionalInt length = Measure.lengthOf(value);
        if (length.isPresent()) {
            return scope.messages().render(lengthMessage(), Map.of("value", bound, "actual", length.getAsInt()));
        }
        return scope.messages().render(valueMessage(), Map.of("value", bound));
    }

    @Override
    public Map<String, Object> options() {
        return Map.of("value", bound);
    }

    @Override
    public boolean equals(Object o) {
        return o != null && o.getClass() == getClass() && Objects.equals(bound, ((BoundConstraint) o).bound);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), bound);
    }
}
