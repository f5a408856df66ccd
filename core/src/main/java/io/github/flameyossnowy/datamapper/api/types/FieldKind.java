package io.github.flameyossnowy.datamapper.api.types;

/**
 * Semantic kind of a declared field, independent of the Java class that holds the value.
 */
public enum FieldKind {
    INTEGER,
    TEXT,
    BOOLEAN,
    DECIMAL,
    FLOAT,
    TIMESTAMP,
    DATE,
    OPAQUE;

    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL || this == FLOAT;
    }

    /** Kinds that accept {@code precision}/{@code scale}. */
    public boolean isFixedPoint() {
        return this == DECIMAL || this == FLOAT;
    }
}
