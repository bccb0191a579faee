package io.validkit.core.spi;

import java.util.Map;

/**
 * Hook that turns an error kind plus its arguments into a human-readable message. The engine never
 * builds message strings itself; localization layers plug in here.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
@FunctionalInterface
public interface MessageRenderer {

    /**
     * Renders the message for {@code key}.
     *
     * @param key the message being rendered
     * @param args interpolation arguments (e.g. {@code value}, {@code actual}, {@code type})
     * @return the rendered message, never {@code null}
     */
    String render(MessageKey key, Map<String, Object> args);

    /** Convenience for messages without arguments. */
    default String render(MessageKey key) {
        return render(key, Map.of());
    }
}
