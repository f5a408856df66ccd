package io.github.flameyossnowy.datamapper.sql.internals;

import io.github.flameyossnowy.datamapper.api.CloseableIterator;
import io.github.flameyossnowy.datamapper.api.adapter.ExecutionResult;
import io.github.flameyossnowy.datamapper.api.adapter.RawSqlAdapter;
import io.github.flameyossnowy.datamapper.api.adapter.Row;
import io.github.flameyossnowy.datamapper.api.exceptions.RepositoryException;
import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.model.NamingConvention;
import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.query.Query;
import io.github.flameyossnowy.datamapper.api.repository.Repository;
import io.github.flameyossnowy.datamapper.api.resource.Resource;
import io.github.flameyossnowy.datamapper.api.utils.Logging;
import io.github.flameyossnowy.datamapper.sql.internals.query.Statement;
import io.github.flameyossnowy.datamapper.sql.internals.repository.SqlParameterBinder;
import io.github.flameyossnowy.datamapper.sql.internals.repository.SqlResultMapper;
import io.github.flameyossnowy.datamapper.sql.iteration.ResultSetIterator;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Executes compiled statements against a JDBC data source. Each operation borrows one
 * connection and returns it before completing, except reads, whose connection is released
 * when the returned iterator is exhausted or closed.
 *
 * <p>Driver failures surface as {@link RepositoryException} with the driver exception as
 * the cause. Programming errors propagate unchanged.</p>
 */
public abstract class AbstractRelationalRepositoryAdapter implements RawSqlAdapter {
    protected final String name;
    protected final SQLConnectionProvider dataSource;
    protected final QueryParseEngine.SQLType sqlType;
    protected final QueryParseEngine engine;
    protected final SqlParameterBinder parameterBinder = new SqlParameterBinder();
    protected final SqlResultMapper resultMapper = new SqlResultMapper();

    protected AbstractRelationalRepositoryAdapter(@NotNull String name, @NotNull SQLConnectionProvider dataSource, @NotNull QueryParseEngine.SQLType sqlType) {
        this.name = Objects.requireNonNull(name, "name");
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.sqlType = Objects.requireNonNull(sqlType, "sqlType");

        Logging.info(() -> "Creating QueryParseEngine for repository " + name + " with type: " + sqlType.getName() + '.');
        this.engine = new QueryParseEngine(sqlType, name);
    }

    @Override
    public String name() {
        return name;
    }

    public QueryParseEngine engine() {
        return engine;
    }

    public SQLConnectionProvider dataSource() {
        return dataSource;
    }

    @Override
    public int create(@NotNull Collection<? extends Resource> resources) {
        int created = 0;
        for (Resource resource : resources) {
            if (!name.equals(resource.repositoryName())) {
                throw new IllegalArgumentException("Resource " + resource.model().name() + " belongs to repository '"
                    + resource.repositoryName() + "', not '" + name + "'");
            }
            if (insert(resource.model(), resource)) created++;
        }
        return created;
    }

    private <R extends Resource> boolean insert(Model<R> model, Resource resource) {
        R typed = model.cast(resource);
        Property<R, ?> identity = model.identityField(name);
        Map<Property<?, ?>, Object> dirty = typed.dirtyAttributes();

        List<Property<R, ?>> columns = new ArrayList<>(dirty.size());
        List<Object> values = new ArrayList<>(dirty.size());
        for (Property<R, ?> property : model.properties(name)) {
            if (!dirty.containsKey(property)) continue;
            Object value = dirty.get(property);
            if (property == identity && value == null) continue;
            columns.add(property);
            values.add(value);
        }

        String sql = engine.parseInsert(model, columns, identity);
        Logging.deepInfo(() -> "Bind values: " + values);
        ExecutionResult result = withConnection(connection -> executeInsert(connection, sql, values, identity != null));
        if (result.affectedRows() != 1) return false;

        if (identity != null && result.insertId() != null && identity.getRaw(typed) == null) {
            typed.writeSlot(identity.slot(), identity.load(result.insertId()));
        }
        typed.markSaved();
        return true;
    }

    private ExecutionResult executeInsert(Connection connection, String sql, List<Object> values, boolean returnsIdentity) throws SQLException {
        try (PreparedStatement statement = dataSource.prepareStatement(sql, connection)) {
            parameterBinder.bind(statement, values);
            if (returnsIdentity && sqlType.supportsReturning()) {
                try (ResultSet resultSet = statement.executeQuery()) {
                    return resultSet.next()
                        ? new ExecutionResult(1, resultSet.getLong(1))
                        : new ExecutionResult(0, null);
                }
            }
            int affected = statement.executeUpdate();
            return new ExecutionResult(affected, returnsIdentity && affected > 0 ? lastInsertId(connection) : null);
        }
    }

    private @Nullable Long lastInsertId(Connection connection) throws SQLException {
        String query = sqlType.lastInsertIdQuery();
        if (query == null) return null;
        try (PreparedStatement statement = dataSource.prepareStatement(query, connection);
             ResultSet resultSet = statement.executeQuery()) {
            return resultSet.next() ? resultSet.getLong(1) : null;
        }
    }

    @Override
    public <R extends Resource> CloseableIterator<R> read(@NotNull Query<R> query) {
        checkRepository(query);
        Statement statement = engine.parseSelect(query);

        Connection connection = null;
        PreparedStatement prepared = null;
        try {
            connection = dataSource.getConnection();
            prepared = dataSource.prepareStatement(statement.sql(), connection);
            parameterBinder.bind(prepared, statement.bindValues());
            ResultSet resultSet = prepared.executeQuery();
            return new ResultSetIterator<>(resultSet, row -> resultMapper.map(row, query), prepared, connection);
        } catch (SQLException e) {
            RepositoryException exception = new RepositoryException("Failed to read " + query.model().name() + ": " + e.getMessage(), e);
            release(exception, prepared, connection);
            Logging.error(exception.getMessage(), e);
            throw exception;
        } catch (RuntimeException e) {
            release(e, prepared, connection);
            Logging.error("Failed to read " + query.model().name() + ": " + e.getMessage(), e);
            throw e;
        }
    }

    @Override
    public int update(@NotNull Map<Property<?, ?>, Object> attributes, @NotNull Query<?> query) {
        checkRepository(query);
        if (attributes.isEmpty()) return 0;
        Statement statement = engine.parseUpdate(attributes, query);
        return withConnection(connection -> executeUpdate(connection, statement));
    }

    @Override
    public int delete(@NotNull Query<?> query) {
        checkRepository(query);
        Statement statement = engine.parseDelete(query);
        return withConnection(connection -> executeUpdate(connection, statement));
    }

    private int executeUpdate(Connection connection, Statement statement) throws SQLException {
        try (PreparedStatement prepared = dataSource.prepareStatement(statement.sql(), connection)) {
            parameterBinder.bind(prepared, statement.bindValues());
            return prepared.executeUpdate();
        }
    }

    @Override
    public ExecutionResult execute(@NotNull String sql, @Nullable Object... bindValues) {
        Logging.info(() -> "Executing: " + sql);
        return withConnection(connection -> {
            try (PreparedStatement statement = dataSource.prepareStatement(sql, connection)) {
                parameterBinder.bind(statement, bindValues);
                boolean producedResults = statement.execute();
                int affected = producedResults ? 0 : Math.max(statement.getUpdateCount(), 0);
                Long insertId = isInsert(sql) && affected > 0 ? lastInsertId(connection) : null;
                return new ExecutionResult(affected, insertId);
            }
        });
    }

    @Override
    public List<Object> query(@NotNull String sql, @Nullable Object... bindValues) {
        Logging.info(() -> "Querying: " + sql);
        return withConnection(connection -> {
            try (PreparedStatement statement = dataSource.prepareStatement(sql, connection)) {
                parameterBinder.bind(statement, bindValues);
                try (ResultSet resultSet = statement.executeQuery()) {
                    return readRows(resultSet);
                }
            }
        });
    }

    private static List<Object> readRows(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int count = metaData.getColumnCount();
        String[] names = new String[count];
        for (int column = 1; column <= count; column++) {
            names[column - 1] = NamingConvention.underscore(metaData.getColumnLabel(column));
        }

        List<Object> rows = new ArrayList<>();
        while (resultSet.next()) {
            if (count == 1) {
                rows.add(resultSet.getObject(1));
                continue;
            }
            Map<String, Object> values = new LinkedHashMap<>(count);
            for (int column = 1; column <= count; column++) {
                values.put(names[column - 1], resultSet.getObject(column));
            }
            rows.add(new Row(values));
        }
        return rows;
    }

    @Override
    public <R extends Resource> List<R> findBySql(@NotNull Repository repository, @NotNull Model<R> model, @NotNull String sql, @Nullable Object... bindValues) {
        if (!name.equals(repository.name())) {
            throw new IllegalArgumentException("Repository '" + repository.name() + "' is not served by adapter '" + name + "'");
        }
        Logging.info(() -> "Finding " + model.name() + " by: " + sql);
        return withConnection(connection -> {
            try (PreparedStatement statement = dataSource.prepareStatement(sql, connection)) {
                parameterBinder.bind(statement, bindValues);
                try (ResultSet resultSet = statement.executeQuery()) {
                    return resultMapper.loadAll(resultSet, model, repository);
                }
            }
        });
    }

    /**
     * Runs {@code callback} on a borrowed connection, returning the connection afterwards.
     */
    protected <T> T withConnection(@NotNull SqlCallback<T> callback) {
        try (Connection connection = dataSource.getConnection()) {
            return callback.apply(connection);
        } catch (SQLException e) {
            Logging.error("Statement failed on repository " + name + ": " + e.getMessage(), e);
            throw new RepositoryException(e);
        } catch (RepositoryException e) {
            throw e;
        } catch (RuntimeException e) {
            Logging.error("Statement failed on repository " + name + ": " + e.getMessage(), e);
            throw e;
        }
    }

    protected void checkRepository(@NotNull Query<?> query) {
        if (!name.equals(query.repository().name())) {
            throw new IllegalArgumentException("Query targets repository '" + query.repository().name()
                + "' but adapter is '" + name + "'");
        }
    }

    private static boolean isInsert(String sql) {
        return sql.stripLeading().toLowerCase(Locale.ROOT).startsWith("insert");
    }

    private static void release(Throwable failure, AutoCloseable... resources) {
        for (AutoCloseable resource : resources) {
            if (resource == null) continue;
            try {
                resource.close();
            } catch (Exception e) {
                failure.addSuppressed(e);
            }
        }
    }

    @Override
    public void close() {
        dataSource.close();
    }

    @FunctionalInterface
    protected interface SqlCallback<T> {
        T apply(Connection connection) throws SQLException;
    }
}
