package io.github.flameyossnowy.datamapper.sql.iteration;

import io.github.flameyossnowy.datamapper.api.CloseableIterator;
import io.github.flameyossnowy.datamapper.api.exceptions.RepositoryException;
import io.github.flameyossnowy.datamapper.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.NoSuchElementException;

/**
 * Iterates a result set lazily, one row per {@link #next()}. Exhausting the rows or
 * closing the iterator releases the result set and then every resource it depends on,
 * in the order given.
 *
 * @param <T> the type of elements returned by this iterator
 */
public class ResultSetIterator<T> implements CloseableIterator<T> {
    private final ResultSet resultSet;
    private final RowMapper<T> mapper;
    private final AutoCloseable[] resources;
    private Boolean hasNext;
    private boolean closed = false;

    public ResultSetIterator(@NotNull ResultSet resultSet, @NotNull RowMapper<T> mapper, @NotNull AutoCloseable... resources) {
        this.resultSet = resultSet;
        this.mapper = mapper;
        this.resources = resources;
    }

    @Override
    public boolean hasNext() {
        if (closed) {
            return false;
        }

        if (hasNext == null) {
            try {
                hasNext = resultSet.next();
                if (!hasNext) {
                    close();
                }
            } catch (SQLException e) {
                close();
                throw new RepositoryException("Error checking for next result", e);
            }
        }
        return hasNext;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more elements in ResultSet");
        }

        try {
            T result = mapper.map(resultSet);
            hasNext = null;
            return result;
        } catch (SQLException e) {
            close();
            throw new RepositoryException("Error mapping ResultSet row", e);
        } catch (RuntimeException e) {
            close();
            throw e;
        }
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        hasNext = false;
        release(resultSet);
        for (AutoCloseable resource : resources) release(resource);
    }

    public boolean isClosed() {
        return closed;
    }

    private static void release(AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            Logging.warn("Error closing " + resource.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet resultSet) throws SQLException;
    }
}
