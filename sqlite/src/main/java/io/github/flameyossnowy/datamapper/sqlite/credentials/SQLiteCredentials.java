package io.github.flameyossnowy.datamapper.sqlite.credentials;

import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Location of a SQLite database: a file path, or {@code :memory:} for a private
 * in-memory database that lives as long as its connection provider.
 */
public record SQLiteCredentials(@NotNull String directory) {
    public static final String MEMORY = ":memory:";

    public SQLiteCredentials {
        Objects.requireNonNull(directory, "directory");
        if (directory.isBlank()) {
            throw new IllegalArgumentException("SQLite database path must not be blank");
        }
    }

    public static SQLiteCredentials memory() {
        return new SQLiteCredentials(MEMORY);
    }

    public static SQLiteCredentials file(@NotNull Path path) {
        return new SQLiteCredentials(path.toString());
    }

    public boolean isMemory() {
        return MEMORY.equals(directory);
    }
}
