package io.github.flameyossnowy.datamapper.api.query;

import io.github.flameyossnowy.datamapper.api.property.Property;
import org.jetbrains.annotations.NotNull;

/**
 * Something a condition or an ordering can refer to: a property of the queried
 * model, or a property reached through links.
 */
public interface QueryTarget {
    @NotNull Property<?, ?> property();
}
