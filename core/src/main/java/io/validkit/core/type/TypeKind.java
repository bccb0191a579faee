package io.validkit.core.type;

/**
 * Discriminant of every {@link FieldType} variant. Switches over this enum are exhaustive; types
 * registered from outside the core report {@link #CUSTOM}.
 */
public enum TypeKind {
    STRING,
    INTEGER,
    FLOAT,
    DECIMAL,
    BOOLEAN,
    DATE,
    DATE_TIME,
    TIME,
    ARRAY,
    OBJECT,
    UNION,
    DISCRIMINATED_UNION,
    LITERAL,
    CUSTOM
}
