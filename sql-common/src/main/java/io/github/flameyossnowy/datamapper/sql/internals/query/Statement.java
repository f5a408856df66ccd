package io.github.flameyossnowy.datamapper.sql.internals.query;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compiled SQL text with its positional bind values.
 */
public record Statement(@NotNull String sql, @NotNull List<Object> bindValues) {
    public Statement {
        bindValues = Collections.unmodifiableList(new ArrayList<>(bindValues));
    }
}
