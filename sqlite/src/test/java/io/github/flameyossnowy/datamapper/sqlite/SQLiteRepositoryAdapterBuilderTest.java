package io.github.flameyossnowy.datamapper.sqlite;

import io.github.flameyossnowy.datamapper.api.repository.Repository;
import io.github.flameyossnowy.datamapper.sqlite.connections.SQLiteSimpleConnectionProvider;
import io.github.flameyossnowy.datamapper.sqlite.credentials.SQLiteCredentials;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteRepositoryAdapterBuilderTest {
    @Test
    void build_requires_credentials() {
        assertThrows(IllegalArgumentException.class, () -> SQLiteRepositoryAdapter.builder().build());
    }

    @Test
    void blank_paths_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new SQLiteCredentials("  "));
    }

    @Test
    void name_defaults_to_the_default_repository() {
        try (SQLiteRepositoryAdapter adapter = SQLiteRepositoryAdapter.builder().withCredentials(SQLiteCredentials.memory()).build()) {
            assertEquals("default", adapter.name());
        }
    }

    @Test
    void custom_names_and_connection_providers_are_used() {
        List<SQLiteCredentials> seen = new ArrayList<>();
        SQLiteCredentials credentials = SQLiteCredentials.memory();

        try (Repository repository = new Repository(SQLiteRepositoryAdapter.builder()
            .withName("archive")
            .withCredentials(credentials)
            .withConnectionProvider(given -> {
                seen.add(given);
                return new SQLiteSimpleConnectionProvider(given);
            })
            .build())) {
            assertEquals("archive", repository.name());
        }

        assertEquals(List.of(credentials), seen);
    }
}
