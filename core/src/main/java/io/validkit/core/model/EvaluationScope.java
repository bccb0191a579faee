package io.validkit.core.model;

import io.validkit.core.spi.DefaultMessageRenderer;
import io.validkit.core.spi.MessageRenderer;
import java.util.Objects;

/**
 * Per-call state threaded through field, type and constraint evaluation: the caller's {@link
 * ValidationContext} and the {@link MessageRenderer} used to phrase errors. Allocated once per
 * top-level parse; never shared across calls.
 */
public record EvaluationScope(ValidationContext context, MessageRenderer messages) {

    public EvaluationScope {
        context = context != null ? context : ValidationContext.empty();
        Objects.requireNonNull(messages, "messages must not be null");
    }

    /** Scope with an empty context and the default English messages. */
    public static EvaluationScope defaults() {
        return new EvaluationScope(ValidationContext.empty(), DefaultMessageRenderer.INSTANCE);
    }

    /** Scope with the given context and the default English messages. */
    public static EvaluationScope of(ValidationContext context) {
        return new EvaluationScope(context, DefaultMessageRenderer.INSTANCE);
    }
}
