package io.github.flameyossnowy.datamapper.sqlite.connections;

import io.github.flameyossnowy.datamapper.api.exceptions.RepositoryException;
import io.github.flameyossnowy.datamapper.api.utils.Logging;
import io.github.flameyossnowy.datamapper.sql.internals.SQLConnectionProvider;
import io.github.flameyossnowy.datamapper.sqlite.credentials.SQLiteCredentials;
import org.jetbrains.annotations.NotNull;
import org.sqlite.Function;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Opens a fresh connection per request and installs a {@code REGEXP} function on it.
 * In-memory databases are shared between those connections through an anchor connection
 * that stays open until {@link #close()}.
 */
public class SQLiteSimpleConnectionProvider implements SQLConnectionProvider {
    private static final AtomicInteger MEMORY_DATABASES = new AtomicInteger();

    private final String url;
    private final Connection anchor;
    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public SQLiteSimpleConnectionProvider(@NotNull SQLiteCredentials credentials) {
        this.url = normalizeUrl(credentials);
        Logging.info(() -> "Using SQLite database at " + url);
        try {
            this.anchor = credentials.isMemory() ? DriverManager.getConnection(url) : null;
        } catch (SQLException e) {
            throw new RepositoryException("Failed to open in-memory SQLite database: " + e.getMessage(), e);
        }
    }

    private static String normalizeUrl(SQLiteCredentials credentials) {
        if (credentials.isMemory()) {
            return "jdbc:sqlite:file:datamapper_" + MEMORY_DATABASES.incrementAndGet() + "?mode=memory&cache=shared";
        }
        return "jdbc:sqlite:" + Path.of(credentials.directory()).toAbsolutePath().normalize();
    }

    public String url() {
        return url;
    }

    @Override
    public Connection getConnection() throws SQLException {
        if (closed) {
            throw new IllegalStateException("Connection provider for " + url + " is closed");
        }
        Connection connection = DriverManager.getConnection(url);
        try {
            Function.create(connection, "REGEXP", new RegexpFunction(patterns));
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
        return connection;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (anchor == null) return;
        try {
            anchor.close();
        } catch (SQLException e) {
            Logging.warn("Failed to close in-memory SQLite database " + url + ": " + e.getMessage());
        }
    }

    /**
     * {@code value REGEXP pattern} is evaluated by SQLite as {@code regexp(pattern, value)}.
     * Matches anywhere in the value; a null on either side yields null.
     */
    private static final class RegexpFunction extends Function {
        private final Map<String, Pattern> patterns;

        RegexpFunction(Map<String, Pattern> patterns) {
            this.patterns = patterns;
        }

        @Override
        protected void xFunc() throws SQLException {
            String pattern = value_text(0);
            String value = value_text(1);
            if (pattern == null || value == null) {
                result();
                return;
            }
            try {
                result(patterns.computeIfAbsent(pattern, Pattern::compile).matcher(value).find() ? 1 : 0);
            } catch (PatternSyntaxException e) {
                error("Invalid regular expression: " + e.getDescription());
            }
        }
    }
}
