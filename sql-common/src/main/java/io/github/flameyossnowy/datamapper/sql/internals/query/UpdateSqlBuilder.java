package io.github.flameyossnowy.datamapper.sql.internals.query;

import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.query.Query;
import io.github.flameyossnowy.datamapper.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

public final class UpdateSqlBuilder {
    private final QueryParseEngine engine;
    private final SqlConditionBuilder conditionBuilder;

    public UpdateSqlBuilder(QueryParseEngine engine, SqlConditionBuilder conditionBuilder) {
        this.engine = engine;
        this.conditionBuilder = conditionBuilder;
    }

    /**
     * @throws IllegalArgumentException when there is nothing to set
     */
    public Statement parseUpdate(@NotNull Map<Property<?, ?>, Object> attributes, @NotNull Query<?> query) {
        if (attributes.isEmpty()) {
            throw new IllegalArgumentException("An update needs at least one attribute");
        }
        List<Object> binds = new ArrayList<>(attributes.size() + query.conditions().size());
        StringJoiner assignments = new StringJoiner(", ");
        for (Map.Entry<Property<?, ?>, Object> entry : attributes.entrySet()) {
            assignments.add(engine.column(entry.getKey(), false) + " = ?");
            binds.add(entry.getValue());
        }

        StringBuilder sql = new StringBuilder(64)
            .append("UPDATE ").append(engine.table(query.model()))
            .append(" SET ").append(assignments);
        conditionBuilder.appendWhere(query.conditions(), false, sql, binds);
        return new Statement(sql.toString(), binds);
    }
}
