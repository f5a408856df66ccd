package io.github.flameyossnowy.datamapper.api.adapter;

import org.jetbrains.annotations.Nullable;

/**
 * Outcome of a statement that returns no rows.
 *
 * @param insertId the generated identity of the last inserted row, when there is one
 */
public record ExecutionResult(int affectedRows, @Nullable Long insertId) {
}
