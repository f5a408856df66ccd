package io.github.flameyossnowy.datamapper.sqlite;

import io.github.flameyossnowy.datamapper.sql.internals.AbstractRelationalRepositoryAdapter;
import io.github.flameyossnowy.datamapper.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.datamapper.sql.internals.SQLConnectionProvider;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

public class SQLiteRepositoryAdapter extends AbstractRelationalRepositoryAdapter {
    SQLiteRepositoryAdapter(@NotNull String name, @NotNull SQLConnectionProvider dataSource) {
        super(name, dataSource, QueryParseEngine.SQLType.SQLITE);
    }

    @Contract(" -> new")
    public static @NotNull SQLiteRepositoryAdapterBuilder builder() {
        return new SQLiteRepositoryAdapterBuilder();
    }
}
