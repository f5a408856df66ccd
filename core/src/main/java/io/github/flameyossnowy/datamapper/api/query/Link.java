package io.github.flameyossnowy.datamapper.api.query;

import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.property.Property;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * A relationship between two models, joined on pairwise equal keys.
 *
 * @param parentKey key properties on the parent side
 * @param childKey  the matching properties on the child side, same length and order
 */
public record Link(
    @NotNull Model<?> parentModel,
    @NotNull Model<?> childModel,
    @NotNull List<Property<?, ?>> parentKey,
    @NotNull List<Property<?, ?>> childKey
) {
    public Link {
        Objects.requireNonNull(parentModel, "parentModel");
        Objects.requireNonNull(childModel, "childModel");
        parentKey = List.copyOf(parentKey);
        childKey = List.copyOf(childKey);
        if (parentKey.isEmpty()) {
            throw new IllegalArgumentException("A link needs at least one key pair");
        }
        if (parentKey.size() != childKey.size()) {
            throw new IllegalArgumentException("Parent key has " + parentKey.size()
                + " properties but child key has " + childKey.size());
        }
    }

    public static Link of(@NotNull Property<?, ?> parentKey, @NotNull Property<?, ?> childKey) {
        return new Link(parentKey.model(), childKey.model(), List.of(parentKey), List.of(childKey));
    }

    /** The model on the other side of this link from {@code model}. */
    public Model<?> otherSide(@NotNull Model<?> model) {
        return model == childModel ? parentModel : childModel;
    }
}
