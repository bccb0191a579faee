package io.validkit.core.constraint;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/** Built-in formats usable by name in a {@code format} option. */
public enum NamedFormat {
    EMAIL("\\A[\\w+\\-.]+@[a-z\\d\\-]+(\\.[a-z\\d\\-]+)*\\.[a-z]+\\z", Pattern.CASE_INSENSITIVE),
    URL("\\Ahttps?://[^\\s/$.?#].[^\\s]*\\z", Pattern.CASE_INSENSITIVE),
    UUID("\\A[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}\\z", Pattern.CASE_INSENSITIVE),
    PHONE("\\A\\+?[\\d\\s\\-().]{7,}\\z", 0),
    ALPHANUMERIC("\\A[a-zA-Z0-9]+\\z", 0),
    ALPHA("\\A[a-zA-Z]+\\z", 0),
    NUMERIC("\\A\\d+\\z", 0),
    HEX("\\A[0-9a-fA-F]+\\z", 0),
    SLUG("\\A[a-z0-9]+(?:-[a-z0-9]+)*\\z", 0);

    private final Pattern pattern;

    NamedFormat(String regex, int flags) {
        this.pattern = Pattern.compile(regex, flags);
    }

    public Pattern pattern() {
        return pattern;
    }

    /** Lower-case name as written in definitions ({@code "email"}). */
    public String formatName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive lookup by name. */
    public static Optional<NamedFormat> lookup(String name) {
        for (NamedFormat format : values()) {
            if (format.name().equalsIgnoreCase(name)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
