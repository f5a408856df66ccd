package io.github.flameyossnowy.datamapper.sql.internals.query;

import io.github.flameyossnowy.datamapper.api.query.Direction;
import io.github.flameyossnowy.datamapper.api.query.Order;
import org.jetbrains.annotations.NotNull;

import java.util.StringJoiner;

public final class SqlSortBuilder {
    private final ColumnRenderer columns;

    public SqlSortBuilder(ColumnRenderer columns) {
        this.columns = columns;
    }

    public String buildSortOptions(@NotNull Iterable<Order> order, boolean qualify) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Order option : order) {
            String column = columns.column(option.target().property(), qualify);
            joiner.add(option.direction() == Direction.DESC ? column + " DESC" : column);
        }
        return joiner.toString();
    }
}
