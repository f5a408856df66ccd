package io.github.flameyossnowy.datamapper.sql.internals;

import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Hands out JDBC connections. Callers release every connection they obtain.
 */
public interface SQLConnectionProvider extends AutoCloseable {
    Connection getConnection() throws SQLException;

    default PreparedStatement prepareStatement(@NotNull String sql, @NotNull Connection connection) throws SQLException {
        return connection.prepareStatement(sql);
    }

    @Override
    void close();
}
