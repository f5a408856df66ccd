package io.github.flameyossnowy.datamapper.sql;

import org.jetbrains.annotations.Nullable;

/**
 * The dialect details statement compilation depends on.
 */
public interface DatabaseImplementation {
    String getName();

    char quoteChar();

    /** Operator matching a column against a regular expression. */
    String regexpOperator();

    /** Whether inserts can hand back the identity through {@code RETURNING}. */
    boolean supportsReturning();

    /** Whether a column-less insert is written {@code DEFAULT VALUES} rather than {@code () VALUES ()}. */
    boolean supportsDefaultValues();

    /** Query reading the identity produced by the last insert on a connection, if the dialect has one. */
    @Nullable String lastInsertIdQuery();
}
