package io.github.flameyossnowy.datamapper.api.adapter;

import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.repository.Repository;
import io.github.flameyossnowy.datamapper.api.resource.Resource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * An adapter that also accepts hand written SQL.
 */
public interface RawSqlAdapter extends Adapter {
    ExecutionResult execute(@NotNull String sql, @Nullable Object... bindValues);

    /**
     * Runs a query. A single selected column yields its values, several columns yield {@link Row}s.
     */
    List<Object> query(@NotNull String sql, @Nullable Object... bindValues);

    /**
     * Runs a query and loads resources from it, matching result columns to property fields
     * by name. The loaded resources are attached to {@code repository}.
     */
    <R extends Resource> List<R> findBySql(@NotNull Repository repository, @NotNull Model<R> model, @NotNull String sql, @Nullable Object... bindValues);
}
