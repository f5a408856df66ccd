package io.github.flameyossnowy.datamapper.sql.internals.query;

import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.sql.DatabaseImplementation;
import io.github.flameyossnowy.datamapper.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.StringJoiner;

public final class InsertSqlBuilder {
    private final DatabaseImplementation sqlType;
    private final QueryParseEngine engine;

    public InsertSqlBuilder(DatabaseImplementation sqlType, QueryParseEngine engine) {
        this.sqlType = sqlType;
        this.engine = engine;
    }

    public String parseInsert(@NotNull Model<?> model, @NotNull List<? extends Property<?, ?>> columns, @Nullable Property<?, ?> identity) {
        StringBuilder sql = new StringBuilder(64).append("INSERT INTO ").append(engine.table(model));
        if (columns.isEmpty()) {
            sql.append(sqlType.supportsDefaultValues() ? " DEFAULT VALUES" : " () VALUES ()");
        } else {
            StringJoiner names = new StringJoiner(", ", " (", ")");
            StringJoiner placeholders = new StringJoiner(", ", " VALUES (", ")");
            for (Property<?, ?> column : columns) {
                names.add(engine.column(column, false));
                placeholders.add("?");
            }
            sql.append(names).append(placeholders);
        }
        if (identity != null && sqlType.supportsReturning()) {
            sql.append(" RETURNING ").append(engine.column(identity, false));
        }
        return sql.toString();
    }
}
