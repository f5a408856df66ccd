package io.github.flameyossnowy.datamapper.api.repository;

import io.github.flameyossnowy.datamapper.api.CloseableIterator;
import io.github.flameyossnowy.datamapper.api.adapter.Adapter;
import io.github.flameyossnowy.datamapper.api.adapter.RawSqlAdapter;
import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.query.Query;
import io.github.flameyossnowy.datamapper.api.resource.Resource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named storage location. All persistence goes through its {@link Adapter}.
 */
public final class Repository implements AutoCloseable {
    private final String name;
    private final Adapter adapter;

    public Repository(@NotNull Adapter adapter) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.name = adapter.name();
    }

    public String name() {
        return name;
    }

    public Adapter adapter() {
        return adapter;
    }

    public int create(@NotNull Collection<? extends Resource> resources) {
        for (Resource resource : resources) resource.attach(this);
        return adapter.create(resources);
    }

    public <R extends Resource> CloseableIterator<R> read(@NotNull Query<R> query) {
        return adapter.read(query);
    }

    public int update(@NotNull Map<Property<?, ?>, Object> attributes, @NotNull Query<?> query) {
        return attributes.isEmpty() ? 0 : adapter.update(attributes, query);
    }

    public int delete(@NotNull Query<?> query) {
        return adapter.delete(query);
    }

    public <R extends Resource> List<R> all(@NotNull Query<R> query) {
        List<R> resources = new ArrayList<>();
        try (CloseableIterator<R> iterator = adapter.read(query)) {
            while (iterator.hasNext()) resources.add(iterator.next());
        }
        return resources;
    }

    public <R extends Resource> List<R> all(@NotNull Model<R> model) {
        return all(Query.builder(this, model).build());
    }

    public <R extends Resource> @Nullable R first(@NotNull Query<R> query) {
        try (CloseableIterator<R> iterator = adapter.read(query.toBuilder().limit(1).build())) {
            return iterator.hasNext() ? iterator.next() : null;
        }
    }

    /**
     * Looks a resource up by key values given in key order.
     *
     * @throws IllegalArgumentException when the number of values differs from the key size
     */
    public <R extends Resource> @Nullable R get(@NotNull Model<R> model, @NotNull Object... key) {
        List<Property<R, ?>> properties = model.key(name);
        if (properties.size() != key.length) {
            throw new IllegalArgumentException(model.name() + " has a key of " + properties.size()
                + " properties, got " + key.length + " values");
        }
        Query.Builder<R> builder = Query.builder(this, model);
        for (int i = 0; i < key.length; i++) builder.where(properties.get(i)).eql(key[i]);
        return first(builder.build());
    }

    /**
     * @throws IllegalStateException when the adapter does not accept raw SQL
     */
    public <R extends Resource> List<R> findBySql(@NotNull Model<R> model, @NotNull String sql, @Nullable Object... bindValues) {
        if (!(adapter instanceof RawSqlAdapter raw)) {
            throw new IllegalStateException("Repository '" + name + "' is served by "
                + adapter.getClass().getSimpleName() + ", which does not accept raw SQL");
        }
        return raw.findBySql(this, model, sql, bindValues);
    }

    @Override
    public void close() {
        adapter.close();
    }

    @Override
    public String toString() {
        return "Repository[" + name + ']';
    }
}
