package io.github.flameyossnowy.datamapper.api.adapter;

import io.github.flameyossnowy.datamapper.api.CloseableIterator;
import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.query.Query;
import io.github.flameyossnowy.datamapper.api.resource.Resource;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Map;

/**
 * Storage back end serving one named repository.
 */
public interface Adapter extends AutoCloseable {
    /** The name of the repository this adapter serves. */
    String name();

    /**
     * Inserts every resource, assigning identities and marking each created one saved.
     *
     * @return the number of resources created
     */
    int create(@NotNull Collection<? extends Resource> resources);

    <R extends Resource> CloseableIterator<R> read(@NotNull Query<R> query);

    /**
     * @param attributes properties mapped to the primitives to write
     * @return the number of affected records
     */
    int update(@NotNull Map<Property<?, ?>, Object> attributes, @NotNull Query<?> query);

    int delete(@NotNull Query<?> query);

    @Override
    void close();
}
