package io.github.flameyossnowy.datamapper.sql.internals.query;

import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.query.Condition;
import io.github.flameyossnowy.datamapper.api.query.Link;
import io.github.flameyossnowy.datamapper.api.query.Operator;
import io.github.flameyossnowy.datamapper.api.query.Order;
import io.github.flameyossnowy.datamapper.api.query.Path;
import io.github.flameyossnowy.datamapper.api.query.Query;
import io.github.flameyossnowy.datamapper.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

public final class SelectSqlBuilder {
    private final QueryParseEngine engine;
    private final SqlConditionBuilder conditionBuilder;
    private final SqlSortBuilder sortBuilder;

    public SelectSqlBuilder(QueryParseEngine engine, SqlConditionBuilder conditionBuilder, SqlSortBuilder sortBuilder) {
        this.engine = engine;
        this.conditionBuilder = conditionBuilder;
        this.sortBuilder = sortBuilder;
    }

    public Statement parseSelect(@NotNull Query<?> query) {
        List<Link> links = links(query);
        boolean qualify = !links.isEmpty() || query.isUnique();
        List<Object> binds = new ArrayList<>();

        String columns = columnList(query.fields(), qualify);
        StringBuilder sql = new StringBuilder(64)
            .append("SELECT ").append(columns)
            .append(" FROM ").append(engine.table(query.model()));

        appendJoins(query.model(), links, sql);
        conditionBuilder.appendWhere(query.conditions(), qualify, sql, binds);

        if (qualify) {
            sql.append(" GROUP BY ").append(columns);
        }

        if (!returnsSingleRow(query, links)) {
            if (!query.order().isEmpty()) {
                sql.append(" ORDER BY ").append(sortBuilder.buildSortOptions(query.order(), qualify));
            }
            Integer limit = query.limit();
            if (limit != null) {
                sql.append(" LIMIT ").append(limit);
                if (query.offset() > 0) sql.append(" OFFSET ").append(query.offset());
            }
        }
        return new Statement(sql.toString(), binds);
    }

    private String columnList(List<? extends Property<?, ?>> fields, boolean qualify) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Property<?, ?> field : fields) joiner.add(engine.column(field, qualify));
        return joiner.toString();
    }

    /**
     * Joins are walked from the last link back to the first, each one bringing in the
     * model on the far side of the previously joined model.
     */
    private void appendJoins(Model<?> source, List<Link> links, StringBuilder sql) {
        Model<?> previous = source;
        for (int i = links.size() - 1; i >= 0; i--) {
            Link link = links.get(i);
            Model<?> joined = link.otherSide(previous);
            StringJoiner on = new StringJoiner(" AND ");
            for (int k = 0; k < link.parentKey().size(); k++) {
                on.add(engine.column(link.parentKey().get(k), true) + " = " + engine.column(link.childKey().get(k), true));
            }
            sql.append(" INNER JOIN ").append(engine.table(joined)).append(" ON ").append(on);
            previous = joined;
        }
    }

    private static List<Link> links(Query<?> query) {
        Set<Link> links = new LinkedHashSet<>(query.links());
        for (Condition condition : query.conditions()) {
            if (condition.subject() instanceof Path path) links.addAll(path.links());
        }
        for (Order order : query.order()) {
            if (order.target() instanceof Path path) links.addAll(path.links());
        }
        return new ArrayList<>(links);
    }

    /**
     * A sole equality on a unique property selects at most one row, so ordering and paging are dropped.
     */
    private static boolean returnsSingleRow(Query<?> query, List<Link> links) {
        if (!links.isEmpty() || query.offset() != 0) return false;
        Integer limit = query.limit();
        if (limit != null && limit > 1) return false;
        if (query.conditions().size() != 1) return false;

        Condition condition = query.conditions().get(0);
        return condition.operator() == Operator.EQL
            && condition.shape() == Condition.Shape.SCALAR
            && condition.subject() instanceof Property<?, ?> property
            && property.isUnique();
    }
}
