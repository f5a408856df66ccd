package io.github.flameyossnowy.datamapper.api.adapter;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One multi-column row of a raw query, keyed by underscored column name in select order.
 */
public record Row(@NotNull Map<String, Object> values) {
    public Row {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * @throws IllegalArgumentException when the row has no such column
     */
    public @Nullable Object get(@NotNull String column) {
        if (!values.containsKey(column)) {
            throw new IllegalArgumentException("Row has no column '" + column + "', columns are " + values.keySet());
        }
        return values.get(column);
    }
}
