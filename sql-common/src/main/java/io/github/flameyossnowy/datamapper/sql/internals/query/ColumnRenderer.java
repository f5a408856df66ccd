package io.github.flameyossnowy.datamapper.sql.internals.query;

import io.github.flameyossnowy.datamapper.api.property.Property;
import org.jetbrains.annotations.NotNull;

/**
 * Renders the quoted column of a property, optionally qualified by its table.
 */
@FunctionalInterface
public interface ColumnRenderer {
    String column(@NotNull Property<?, ?> property, boolean qualify);
}
