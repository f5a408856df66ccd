package io.github.flameyossnowy.datamapper.sql.internals;

import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.query.Query;
import io.github.flameyossnowy.datamapper.api.utils.Logging;
import io.github.flameyossnowy.datamapper.sql.DatabaseImplementation;
import io.github.flameyossnowy.datamapper.sql.internals.query.DeleteSqlBuilder;
import io.github.flameyossnowy.datamapper.sql.internals.query.InsertSqlBuilder;
import io.github.flameyossnowy.datamapper.sql.internals.query.QueryStringCache;
import io.github.flameyossnowy.datamapper.sql.internals.query.SelectSqlBuilder;
import io.github.flameyossnowy.datamapper.sql.internals.query.SqlConditionBuilder;
import io.github.flameyossnowy.datamapper.sql.internals.query.SqlSortBuilder;
import io.github.flameyossnowy.datamapper.sql.internals.query.Statement;
import io.github.flameyossnowy.datamapper.sql.internals.query.UpdateSqlBuilder;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiles queries into dialect specific SQL for one repository.
 */
public class QueryParseEngine {
    private final SQLType sqlType;
    private final String repositoryName;
    private final QueryStringCache<ColumnKey> columnNames;
    private final SelectSqlBuilder selectSqlBuilder;
    private final InsertSqlBuilder insertSqlBuilder;
    private final UpdateSqlBuilder updateSqlBuilder;
    private final DeleteSqlBuilder deleteSqlBuilder;

    public QueryParseEngine(@NotNull SQLType sqlType, @NotNull String repositoryName) {
        this.sqlType = Objects.requireNonNull(sqlType, "sqlType");
        this.repositoryName = Objects.requireNonNull(repositoryName, "repositoryName");
        this.columnNames = new QueryStringCache<>(16);

        SqlConditionBuilder conditionBuilder = new SqlConditionBuilder(sqlType, this::column);
        this.selectSqlBuilder = new SelectSqlBuilder(this, conditionBuilder, new SqlSortBuilder(this::column));
        this.insertSqlBuilder = new InsertSqlBuilder(sqlType, this);
        this.updateSqlBuilder = new UpdateSqlBuilder(this, conditionBuilder);
        this.deleteSqlBuilder = new DeleteSqlBuilder(this, conditionBuilder);
    }

    public SQLType sqlType() {
        return sqlType;
    }

    public String repositoryName() {
        return repositoryName;
    }

    public Statement parseSelect(@NotNull Query<?> query) {
        Statement statement = selectSqlBuilder.parseSelect(query);
        Logging.info(() -> "Parsed query for selecting: " + statement.sql());
        Logging.deepInfo(() -> "Bind values: " + statement.bindValues());
        return statement;
    }

    public String parseInsert(@NotNull Model<?> model, @NotNull List<? extends Property<?, ?>> columns, @Nullable Property<?, ?> identity) {
        String sql = insertSqlBuilder.parseInsert(model, columns, identity);
        Logging.info(() -> "Parsed query for inserting: " + sql);
        return sql;
    }

    public Statement parseUpdate(@NotNull Map<Property<?, ?>, Object> attributes, @NotNull Query<?> query) {
        Statement statement = updateSqlBuilder.parseUpdate(attributes, query);
        Logging.info(() -> "Parsed query for updating: " + statement.sql());
        Logging.deepInfo(() -> "Bind values: " + statement.bindValues());
        return statement;
    }

    public Statement parseDelete(@NotNull Query<?> query) {
        Statement statement = deleteSqlBuilder.parseDelete(query);
        Logging.info(() -> "Parsed query for deleting: " + statement.sql());
        Logging.deepInfo(() -> "Bind values: " + statement.bindValues());
        return statement;
    }

    /**
     * Quotes an identifier, doubling any embedded quote character.
     */
    public String quote(@NotNull String identifier) {
        char quote = sqlType.quoteChar();
        String escaped = identifier.replace(String.valueOf(quote), String.valueOf(quote) + quote);
        return quote + escaped + quote;
    }

    public String table(@NotNull Model<?> model) {
        return quote(model.storageName(repositoryName));
    }

    /**
     * The quoted column of {@code property}, prefixed by its quoted table when {@code qualify} is set.
     */
    public String column(@NotNull Property<?, ?> property, boolean qualify) {
        String field = property.field();
        return columnNames.computeIfAbsent(new ColumnKey(property.model().type(), field, qualify), key -> {
            String column = quote(field);
            return qualify ? table(property.model()) + '.' + column : column;
        });
    }

    /** Columns are keyed by what they render, so redeclared properties share entries. */
    private record ColumnKey(Class<?> modelType, String field, boolean qualify) {
    }

    int cachedColumns() {
        return columnNames.size();
    }

    public enum SQLType implements DatabaseImplementation {
        MYSQL("MySQL", '`', "REGEXP", false, false, "SELECT LAST_INSERT_ID()"),
        SQLITE("SQLite", '"', "REGEXP", false, true, "SELECT last_insert_rowid()"),
        POSTGRESQL("PostgreSQL", '"', "~", true, true, null);

        private final String name;
        private final char quotesChar;
        private final String regexpOperator;
        private final boolean supportsReturning;
        private final boolean supportsDefaultValues;
        private final String lastInsertIdQuery;

        SQLType(String name, char quotesChar, String regexpOperator, boolean supportsReturning,
                boolean supportsDefaultValues, String lastInsertIdQuery) {
            this.name = name;
            this.quotesChar = quotesChar;
            this.regexpOperator = regexpOperator;
            this.supportsReturning = supportsReturning;
            this.supportsDefaultValues = supportsDefaultValues;
            this.lastInsertIdQuery = lastInsertIdQuery;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public char quoteChar() {
            return quotesChar;
        }

        @Override
        public String regexpOperator() {
            return regexpOperator;
        }

        @Override
        public boolean supportsReturning() {
            return supportsReturning;
        }

        @Override
        public boolean supportsDefaultValues() {
            return supportsDefaultValues;
        }

        @Override
        public @Nullable String lastInsertIdQuery() {
            return lastInsertIdQuery;
        }
    }
}
