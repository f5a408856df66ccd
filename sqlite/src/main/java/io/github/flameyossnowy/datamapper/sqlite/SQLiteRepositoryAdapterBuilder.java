package io.github.flameyossnowy.datamapper.sqlite;

import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.sql.internals.SQLConnectionProvider;
import io.github.flameyossnowy.datamapper.sqlite.connections.SQLiteSimpleConnectionProvider;
import io.github.flameyossnowy.datamapper.sqlite.credentials.SQLiteCredentials;

import java.util.Objects;
import java.util.function.Function;

public class SQLiteRepositoryAdapterBuilder {
    private String name = Model.DEFAULT_REPOSITORY;
    private SQLiteCredentials credentials;
    private Function<SQLiteCredentials, SQLConnectionProvider> connectionProvider;

    public SQLiteRepositoryAdapterBuilder withName(String name) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        return this;
    }

    public SQLiteRepositoryAdapterBuilder withCredentials(SQLiteCredentials credentials) {
        this.credentials = credentials;
        return this;
    }

    public SQLiteRepositoryAdapterBuilder withConnectionProvider(Function<SQLiteCredentials, SQLConnectionProvider> connectionProvider) {
        this.connectionProvider = connectionProvider;
        return this;
    }

    public SQLiteRepositoryAdapter build() {
        if (this.credentials == null) throw new IllegalArgumentException("Credentials cannot be null");
        if (this.name.isBlank()) throw new IllegalArgumentException("Repository name cannot be blank");

        return new SQLiteRepositoryAdapter(
            this.name,
            this.connectionProvider != null ? this.connectionProvider.apply(credentials) : new SQLiteSimpleConnectionProvider(this.credentials)
        );
    }
}
