package io.github.flameyossnowy.datamapper.sql.internals.query;

import io.github.flameyossnowy.datamapper.api.query.Query;
import io.github.flameyossnowy.datamapper.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

public final class DeleteSqlBuilder {
    private final QueryParseEngine engine;
    private final SqlConditionBuilder conditionBuilder;

    public DeleteSqlBuilder(QueryParseEngine engine, SqlConditionBuilder conditionBuilder) {
        this.engine = engine;
        this.conditionBuilder = conditionBuilder;
    }

    public Statement parseDelete(@NotNull Query<?> query) {
        List<Object> binds = new ArrayList<>(query.conditions().size());
        StringBuilder sql = new StringBuilder(48).append("DELETE FROM ").append(engine.table(query.model()));
        conditionBuilder.appendWhere(query.conditions(), false, sql, binds);
        return new Statement(sql.toString(), binds);
    }
}
