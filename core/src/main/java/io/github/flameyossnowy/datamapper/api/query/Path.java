package io.github.flameyossnowy.datamapper.api.query;

import io.github.flameyossnowy.datamapper.api.property.Property;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * A property of a related model, reached through {@code links} from the queried model.
 */
public record Path(@NotNull List<Link> links, @NotNull Property<?, ?> property) implements QueryTarget {
    public Path {
        links = List.copyOf(links);
        Objects.requireNonNull(property, "property");
    }

    public static Path through(@NotNull Link link, @NotNull Property<?, ?> property) {
        return new Path(List.of(link), property);
    }
}
