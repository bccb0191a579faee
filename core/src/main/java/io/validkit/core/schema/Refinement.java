package io.validkit.core.schema;

import io.validkit.core.model.ErrorCode;
import io.validkit.core.model.EvaluationScope;
import io.validkit.core.model.ValidationContext;
import io.validkit.core.model.ValidationError;
import io.validkit.core.spi.MessageKey;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * An extra check run after constraints pass. A failing check yields one {@code refinement} error
 * whose message is static, derived from the value, or the renderer's default.
 */
public final class Refinement {

    private final BiPredicate<Object, ValidationContext> check;
    private final Function<Object, String> message;

    private Refinement(BiPredicate<Object, ValidationContext> check, Function<Object, String> message) {
        this.check = Objects.requireNonNull(check, "check must not be null");
        this.message = message;
    }

    public static Refinement of(Predicate<Object> check) {
        Objects.requireNonNull(check, "check must not be null");
        return new Refinement((value, context) -> check.test(value), null);
    }

    public static Refinement of(Predicate<Object> check, String message) {
        Objects.requireNonNull(check, "check must not be null");
        Objects.requireNonNull(message, "message must not be null");
        return new Refinement((value, context) -> check.test(value), value -> message);
    }

    public static Refinement of(Predicate<Object> check, Function<Object, String> message) {
        Objects.requireNonNull(check, "check must not be null");
        Objects.requireNonNull(message, "message must not be null");
        return new Refinement((value, context) -> check.test(value), message);
    }

    public static Refinement withContext(BiPredicate<Object, ValidationContext> check, String message) {
        Objects.requireNonNull(message, "message must not be null");
        return new Refinement(check, value -> message);
    }

    public static Refinement withContext(BiPredicate<Object, ValidationContext> check, Function<Object, String> message) {
        Objects.requireNonNull(message, "message must not be null");
        return new Refinement(check, message);
    }

    /** Runs the check; returns the error when it fails. */
    Optional<ValidationError> evaluate(Object value, List<Object> path, EvaluationScope scope) {
        if (check.test(value, scope.context())) {
            return Optional.empty();
        }
        String text = message != null ? message.apply(value) : scope.messages().render(MessageKey.REFINEMENT);
        return Optional.of(ValidationError.of(path, text, ErrorCode.REFINEMENT));
    }
}
