package io.github.flameyossnowy.datamapper.sql.internals.query;

import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.query.Condition;
import io.github.flameyossnowy.datamapper.api.query.QueryTarget;
import io.github.flameyossnowy.datamapper.api.query.Range;
import io.github.flameyossnowy.datamapper.sql.DatabaseImplementation;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.List;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Translates conditions into SQL predicates, appending operands to the bind list in
 * placeholder order. Operands are dumped through the subject property first.
 */
public final class SqlConditionBuilder {
    private final DatabaseImplementation sqlType;
    private final ColumnRenderer columns;

    public SqlConditionBuilder(DatabaseImplementation sqlType, ColumnRenderer columns) {
        this.sqlType = sqlType;
        this.columns = columns;
    }

    /**
     * Appends {@code " WHERE "} followed by the conditions joined with {@code AND}, or nothing
     * when there are none.
     */
    public void appendWhere(@NotNull List<Condition> conditions, boolean qualify, @NotNull StringBuilder sql, @NotNull List<Object> binds) {
        if (conditions.isEmpty()) return;
        StringJoiner joiner = new StringJoiner(" AND ");
        for (Condition condition : conditions) {
            joiner.add(buildCondition(condition, qualify, binds));
        }
        sql.append(" WHERE ").append(joiner);
    }

    public String buildCondition(@NotNull Condition condition, boolean qualify, @NotNull List<Object> binds) {
        if (condition.isRaw()) {
            binds.addAll(condition.bindValues());
            return condition.sql();
        }

        Property<?, ?> property = condition.property();
        String column = columns.column(property, qualify);
        return switch (condition.operator()) {
            case EQL, IN -> equality(column, property, condition, qualify, false, binds);
            case NOT -> equality(column, property, condition, qualify, true, binds);
            case LIKE -> like(column, property, condition, binds);
            case GT -> comparison(column, ">", property, condition, qualify, binds);
            case GTE -> comparison(column, ">=", property, condition, qualify, binds);
            case LT -> comparison(column, "<", property, condition, qualify, binds);
            case LTE -> comparison(column, "<=", property, condition, qualify, binds);
            case RAW -> throw new IllegalStateException("Raw condition without SQL");
        };
    }

    private String equality(String column, Property<?, ?> property, Condition condition, boolean qualify, boolean negated, List<Object> binds) {
        Object operand = condition.operand();
        return switch (condition.shape()) {
            case NULL -> column + (negated ? " IS NOT NULL" : " IS NULL");
            case LIST -> inList(column, property, (Collection<?>) operand, negated, binds);
            case INCLUSIVE_RANGE -> {
                Range<?> range = (Range<?>) operand;
                binds.add(property.dumpOperand(range.min()));
                binds.add(property.dumpOperand(range.max()));
                yield column + (negated ? " NOT BETWEEN ? AND ?" : " BETWEEN ? AND ?");
            }
            case EXCLUSIVE_RANGE -> {
                Range<?> range = (Range<?>) operand;
                binds.add(property.dumpOperand(range.min()));
                binds.add(property.dumpOperand(range.max()));
                yield negated
                    ? "(" + column + " < ? OR " + column + " >= ?)"
                    : "(" + column + " >= ? AND " + column + " < ?)";
            }
            case PATTERN -> {
                binds.add(((Pattern) operand).pattern());
                String match = column + ' ' + sqlType.regexpOperator() + " ?";
                yield negated ? "NOT (" + match + ')' : match;
            }
            case TARGET -> column + (negated ? " <> " : " = ") + columns.column(((QueryTarget) operand).property(), qualify);
            case SCALAR -> {
                binds.add(property.dumpOperand(operand));
                yield column + (negated ? " <> ?" : " = ?");
            }
        };
    }

    private static String inList(String column, Property<?, ?> property, Collection<?> values, boolean negated, List<Object> binds) {
        if (values.isEmpty()) {
            return negated ? "1 = 1" : "1 = 0";
        }
        StringJoiner placeholders = new StringJoiner(", ", "(", ")");
        for (Object value : values) {
            binds.add(property.dumpOperand(value));
            placeholders.add("?");
        }
        return column + (negated ? " NOT IN " : " IN ") + placeholders;
    }

    private String like(String column, Property<?, ?> property, Condition condition, List<Object> binds) {
        if (condition.shape() == Condition.Shape.PATTERN) {
            binds.add(((Pattern) condition.operand()).pattern());
            return column + ' ' + sqlType.regexpOperator() + " ?";
        }
        binds.add(property.dumpOperand(condition.operand()));
        return column + " LIKE ?";
    }

    private String comparison(String column, String operator, Property<?, ?> property, Condition condition, boolean qualify, List<Object> binds) {
        if (condition.shape() == Condition.Shape.TARGET) {
            return column + ' ' + operator + ' ' + columns.column(((QueryTarget) condition.operand()).property(), qualify);
        }
        binds.add(property.dumpOperand(condition.operand()));
        return column + ' ' + operator + " ?";
    }
}
