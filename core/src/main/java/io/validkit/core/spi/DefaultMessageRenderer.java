package io.validkit.core.spi;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * English message catalog with optional per-key template overrides. Placeholders use the {@code
 * %{name}} syntax; unknown placeholders are left verbatim.
 *
 * <p>Immutable: {@link #withOverride(MessageKey, String)} returns a new renderer.
 */
public final class DefaultMessageRenderer implements MessageRenderer {

    /** Shared renderer with the built-in templates only. */
    public static final DefaultMessageRenderer INSTANCE = new DefaultMessageRenderer(new EnumMap<>(MessageKey.class));

    private final Map<MessageKey, String> overrides;

    private DefaultMessageRenderer(EnumMap<MessageKey, String> overrides) {
        this.overrides = Collections.unmodifiableMap(overrides);
    }

    /** Returns a renderer that uses {@code template} for {@code key} and this renderer's templates otherwise. */
    public DefaultMessageRenderer withOverride(MessageKey key, String template) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(template, "template must not be null");
        EnumMap<MessageKey, String> copy = new EnumMap<>(MessageKey.class);
        copy.putAll(overrides);
        copy.put(key, template);
        return new DefaultMessageRenderer(copy);
    }

    /** Returns a renderer with all of the given overrides applied. */
    public DefaultMessageRenderer withOverrides(Map<MessageKey, String> templates) {
        EnumMap<MessageKey, String> copy = new EnumMap<>(MessageKey.class);
        copy.putAll(overrides);
        copy.putAll(templates);
        return new DefaultMessageRenderer(copy);
    }

    @Override
    public String render(MessageKey key, Map<String, Object> args) {
        String template = overrides.getOrDefault(key, key.defaultTemplate());
        return interpolate(template, args);
    }

    static String interpolate(String template, Map<String, Object> args) {
        if (args.isEmpty() || template.indexOf("%{") < 0) {
            return template;
        }
        String result = template;
        for (Map.Entry<String, Object> entry : args.entrySet()) {
            result = result.replace("%{" + entry.getKey() + "}", String.valueOf(entry.getValue()));
        }
        return result;
    }
}
