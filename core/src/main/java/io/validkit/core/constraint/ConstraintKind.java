package io.validkit.core.constraint;

/** Discriminant of every {@link Constraint} variant; constraints registered from outside report {@link #CUSTOM}. */
public enum ConstraintKind {
    MIN,
    MAX,
    LENGTH,
    FORMAT,
    ENUM,
    CUSTOM
}
