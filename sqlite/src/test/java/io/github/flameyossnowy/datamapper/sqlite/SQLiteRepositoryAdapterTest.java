package io.github.flameyossnowy.datamapper.sqlite;

import io.github.flameyossnowy.datamapper.api.CloseableIterator;
import io.github.flameyossnowy.datamapper.api.adapter.ExecutionResult;
import io.github.flameyossnowy.datamapper.api.adapter.RawSqlAdapter;
import io.github.flameyossnowy.datamapper.api.adapter.Row;
import io.github.flameyossnowy.datamapper.api.exceptions.RepositoryException;
import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.query.Direction;
import io.github.flameyossnowy.datamapper.api.query.Query;
import io.github.flameyossnowy.datamapper.api.query.Range;
import io.github.flameyossnowy.datamapper.api.repository.Repository;
import io.github.flameyossnowy.datamapper.sqlite.credentials.SQLiteCredentials;
import io.github.flameyossnowy.datamapper.sqlite.fixtures.Heffalump;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteRepositoryAdapterTest {
    @TempDir
    Path directory;

    private SQLiteRepositoryAdapter adapter;
    private Repository repository;

    @BeforeEach
    void setUp() {
        adapter = SQLiteRepositoryAdapter.builder()
            .withCredentials(SQLiteCredentials.file(directory.resolve("heffalumps.db")))
            .build();
        repository = new Repository(adapter);
        adapter.execute("CREATE TABLE heffalumps (id INTEGER PRIMARY KEY AUTOINCREMENT, color VARCHAR(20),"
            + " num_spots INTEGER, striped BOOLEAN, notes TEXT)");

        heffalump("red", 3, true);
        heffalump("blue", 5, false);
        heffalump("pink", 7, false);
        heffalump("purple", 9, true);
        heffalump(null, 0, false);
    }

    @AfterEach
    void tearDown() {
        repository.close();
    }

    private Heffalump heffalump(String color, int spots, boolean striped) {
        Heffalump heffalump = new Heffalump();
        heffalump.setColor(color);
        heffalump.setNumSpots(spots);
        heffalump.setStriped(striped);
        assertTrue(heffalump.save(repository));
        return heffalump;
    }

    private Query.Builder<Heffalump> heffalumps() {
        return Query.builder(repository, Heffalump.MODEL);
    }

    private List<String> colors(Query<Heffalump> query) {
        return repository.all(query).stream().map(Heffalump::getColor).collect(Collectors.toList());
    }

    @Test
    void save_assigns_the_identity_and_marks_the_resource_saved() {
        Heffalump heffalump = heffalump("green", 2, false);

        assertEquals(6L, heffalump.getId());
        assertTrue(heffalump.isSaved());
        assertFalse(heffalump.isDirty());
    }

    @Test
    void defaults_are_written_on_create() {
        Heffalump heffalump = new Heffalump();
        heffalump.setColor("grey");
        assertTrue(heffalump.save(repository));

        Heffalump reloaded = repository.get(Heffalump.MODEL, heffalump.getId());
        assertNotNull(reloaded);
        assertEquals(Boolean.FALSE, reloaded.isStriped());
    }

    @Test
    void all_reads_every_row_ordered_by_key() {
        List<Heffalump> all = repository.all(Heffalump.MODEL);

        assertEquals(5, all.size());
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), all.stream().map(Heffalump::getId).collect(Collectors.toList()));
        assertTrue(all.stream().allMatch(Heffalump::isSaved));
    }

    @Test
    void get_finds_a_resource_by_key() {
        Heffalump pink = repository.get(Heffalump.MODEL, 3L);

        assertNotNull(pink);
        assertEquals("pink", pink.getColor());
        assertEquals(7, pink.getNumSpots());
        assertEquals(Boolean.FALSE, pink.isStriped());
        assertNull(repository.get(Heffalump.MODEL, 42L));
    }

    @Test
    void equality_and_null_conditions() {
        assertEquals(List.of("blue"), colors(heffalumps().where(Heffalump.COLOR).eql("blue").build()));
        assertEquals(1, repository.all(heffalumps().where(Heffalump.COLOR).eql(null).build()).size());
        assertEquals(List.of("red", "blue", "pink", "purple"),
            colors(heffalumps().where(Heffalump.COLOR).not(null).build()));
    }

    @Test
    void list_conditions_become_membership_tests() {
        assertEquals(List.of("red", "pink"),
            colors(heffalumps().where(Heffalump.COLOR).in(List.of("red", "pink")).build()));
        assertEquals(List.of("blue", "purple"),
            colors(heffalumps().where(Heffalump.COLOR).not(List.of("red", "pink")).where(Heffalump.COLOR).not(null).build()));
        assertTrue(repository.all(heffalumps().where(Heffalump.COLOR).in(List.of()).build()).isEmpty());
        assertEquals(5, repository.all(heffalumps().where(Heffalump.COLOR).not(List.of()).build()).size());
    }

    @Test
    void ranges_select_inclusive_and_exclusive_bounds() {
        assertEquals(List.of("red", "blue", "pink"),
            colors(heffalumps().where(Heffalump.NUM_SPOTS).eql(Range.inclusive(3, 7)).build()));
        assertEquals(List.of("red", "blue"),
            colors(heffalumps().where(Heffalump.NUM_SPOTS).eql(Range.exclusive(3, 7)).build()));
        assertEquals(List.of("pink", "purple"),
            colors(heffalumps().where(Heffalump.NUM_SPOTS).not(Range.exclusive(0, 7)).build()));
    }

    @Test
    void comparisons_filter_numerically() {
        assertEquals(List.of("pink", "purple"), colors(heffalumps().where(Heffalump.NUM_SPOTS).gt(5).build()));
        assertEquals(List.of("blue", "pink", "purple"), colors(heffalumps().where(Heffalump.NUM_SPOTS).gte(5).build()));
        assertEquals(List.of("red"), colors(heffalumps().where(Heffalump.NUM_SPOTS).lt(5).where(Heffalump.NUM_SPOTS).gt(0).build()));
        assertEquals(List.of("red", "blue"), colors(heffalumps().where(Heffalump.NUM_SPOTS).lte(5).where(Heffalump.COLOR).not(null).build()));
    }

    @Test
    void like_matches_sql_wildcards_and_regular_expressions() {
        assertEquals(List.of("pink", "purple"), colors(heffalumps().where(Heffalump.COLOR).like("p%").build()));
        assertEquals(List.of("red", "blue", "purple"), colors(heffalumps().where(Heffalump.COLOR).like(Pattern.compile("e$|ed")).build()));
        assertEquals(List.of("pink"), colors(heffalumps().where(Heffalump.COLOR).eql(Pattern.compile("^pi")).build()));
        assertEquals(List.of("red", "blue"),
            colors(heffalumps().where(Heffalump.COLOR).not(Pattern.compile("^p")).build()));
    }

    @Test
    void order_limit_and_offset_page_through_rows() {
        Query<Heffalump> page = heffalumps()
            .where(Heffalump.COLOR).not(null)
            .orderBy(Heffalump.NUM_SPOTS, Direction.DESC)
            .limit(2)
            .offset(1)
            .build();

        assertEquals(List.of("pink", "blue"), colors(page));
    }

    @Test
    void first_returns_the_first_match_or_null() {
        Heffalump first = repository.first(heffalumps().where(Heffalump.STRIPED).eql(true).build());

        assertNotNull(first);
        assertEquals("red", first.getColor());
        assertNull(repository.first(heffalumps().where(Heffalump.COLOR).eql("gold").build()));
    }

    @Test
    void read_streams_rows_lazily_and_can_be_closed_early() {
        try (CloseableIterator<Heffalump> iterator = repository.read(heffalumps().build())) {
            assertTrue(iterator.hasNext());
            assertEquals("red", iterator.next().getColor());
        }

        assertEquals(5, repository.all(Heffalump.MODEL).size());
    }

    @Test
    void selected_fields_limit_what_is_loaded() {
        Heffalump partial = repository.first(heffalumps().fields(Heffalump.ID, Heffalump.COLOR).where(Heffalump.ID).eql(2L).build());

        assertNotNull(partial);
        assertTrue(Heffalump.COLOR.isLoaded(partial));
        assertFalse(Heffalump.NUM_SPOTS.isLoaded(partial));
        assertEquals(5, partial.getNumSpots());
    }

    @Test
    void save_writes_only_dirty_attributes() {
        Heffalump blue = repository.get(Heffalump.MODEL, 2L);
        assertNotNull(blue);
        blue.setNumSpots(11);

        assertTrue(blue.isDirty());
        assertEquals(List.of(Heffalump.NUM_SPOTS), List.copyOf(blue.dirtyAttributes().keySet()));
        assertTrue(blue.save());
        assertFalse(blue.isDirty());

        Heffalump reloaded = repository.get(Heffalump.MODEL, 2L);
        assertNotNull(reloaded);
        assertEquals(11, reloaded.getNumSpots());
        assertEquals("blue", reloaded.getColor());
    }

    @Test
    void update_changes_every_matching_row() {
        Map<Property<?, ?>, Object> attributes = new LinkedHashMap<>();
        attributes.put(Heffalump.STRIPED, true);

        int updated = repository.update(attributes, heffalumps().where(Heffalump.NUM_SPOTS).gte(5).build());

        assertEquals(3, updated);
        assertEquals(4, repository.all(heffalumps().where(Heffalump.STRIPED).eql(true).build()).size());
    }

    @Test
    void delete_removes_matching_rows() {
        assertEquals(2, repository.delete(heffalumps().where(Heffalump.STRIPED).eql(true).build()));
        assertEquals(3, repository.all(Heffalump.MODEL).size());
        assertEquals(0, repository.delete(heffalumps().where(Heffalump.STRIPED).eql(true).build()));
    }

    @Test
    void destroy_deletes_the_row_of_a_saved_resource() {
        Heffalump red = repository.get(Heffalump.MODEL, 1L);
        assertNotNull(red);

        assertTrue(red.destroy());
        assertTrue(red.isDestroyed());
        assertNull(repository.get(Heffalump.MODEL, 1L));
        assertThrows(IllegalStateException.class, red::save);
    }

    @Test
    void execute_reports_affected_rows_and_insert_ids() {
        ExecutionResult insert = adapter.execute("INSERT INTO heffalumps (color, num_spots) VALUES (?, ?)", "gold", 1);
        assertEquals(1, insert.affectedRows());
        assertEquals(6L, insert.insertId());

        ExecutionResult update = adapter.execute("UPDATE heffalumps SET striped = ? WHERE num_spots < ?", true, 5);
        assertEquals(3, update.affectedRows());
        assertNull(update.insertId());
    }

    @Test
    void query_returns_values_for_one_column_and_rows_for_several() {
        List<Object> colors = adapter.query("SELECT color FROM heffalumps WHERE num_spots > ? ORDER BY id", 4);
        assertEquals(List.of("blue", "pink", "purple"), colors);

        List<Object> rows = adapter.query("SELECT color, num_spots AS numSpots FROM heffalumps WHERE id = ?", 1);
        assertEquals(1, rows.size());
        Row row = (Row) rows.get(0);
        assertEquals("red", row.get("color"));
        assertEquals(3, ((Number) row.get("num_spots")).intValue());
        assertThrows(IllegalArgumentException.class, () -> row.get("striped"));
    }

    @Test
    void find_by_sql_loads_attached_resources() {
        List<Heffalump> found = repository.findBySql(Heffalump.MODEL,
            "SELECT id, color FROM heffalumps WHERE striped = ? ORDER BY id", true);

        assertEquals(List.of("red", "purple"), found.stream().map(Heffalump::getColor).collect(Collectors.toList()));
        Heffalump red = found.get(0);
        assertTrue(red.isSaved());
        assertSame(repository, red.repository());
        assertEquals(3, red.getNumSpots());
    }

    @Test
    void find_by_sql_rejects_unknown_columns() {
        assertThrows(IllegalArgumentException.class,
            () -> repository.findBySql(Heffalump.MODEL, "SELECT id, 1 AS mystery FROM heffalumps"));
    }

    @Test
    void not_in_excludes_rows_whose_value_is_null() {
        heffalump("green", 2, false);
        Heffalump spotless = new Heffalump();
        spotless.setColor("white");
        spotless.setNumSpots(null);
        assertTrue(spotless.save(repository));

        List<String> colors = colors(heffalumps().where(Heffalump.NUM_SPOTS).not(List.of(1, 3, 5, 7)).build());

        assertEquals(Arrays.asList("purple", null, "green"), colors);
        assertFalse(colors.contains("white"));
    }

    @Test
    void named_repositories_save_and_read_through_their_own_name() {
        try (Repository archive = new Repository(SQLiteRepositoryAdapter.builder()
            .withName("archive")
            .withCredentials(SQLiteCredentials.file(directory.resolve("archive.db")))
            .build())) {
            RawSqlAdapter raw = (RawSqlAdapter) archive.adapter();
            raw.execute("CREATE TABLE heffalumps (id INTEGER PRIMARY KEY AUTOINCREMENT, color VARCHAR(20),"
                + " num_spots INTEGER, striped BOOLEAN, notes TEXT)");

            Heffalump heffalump = new Heffalump();
            heffalump.setColor("amber");
            heffalump.setNumSpots(4);
            assertTrue(heffalump.save(archive));
            assertEquals("archive", heffalump.repositoryName());

            heffalump.setNumSpots(6);
            assertTrue(heffalump.save());

            Heffalump reloaded = archive.get(Heffalump.MODEL, heffalump.getId());
            assertNotNull(reloaded);
            assertEquals("amber", reloaded.getColor());
            assertEquals(6, reloaded.getNumSpots());
            assertEquals(1, archive.findBySql(Heffalump.MODEL, "SELECT id, color FROM heffalumps").size());
        }
    }

    @Test
    void failures_are_logged_before_they_propagate() {
        PrintStream original = System.err;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setErr(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            assertThrows(IllegalArgumentException.class,
                () -> repository.findBySql(Heffalump.MODEL, "SELECT id, 1 AS mystery FROM heffalumps"));
            assertThrows(RepositoryException.class, () -> adapter.execute("SELECT ?", new Object()));
        } finally {
            System.setErr(original);
        }

        String log = captured.toString(StandardCharsets.UTF_8);
        assertTrue(log.contains("Column 'mystery' does not match any property of Heffalump"), log);
        assertEquals(2, log.split("Statement failed on repository default", -1).length - 1, log);
    }

    @Test
    void driver_errors_surface_as_repository_exceptions() {
        RepositoryException error = assertThrows(RepositoryException.class,
            () -> adapter.execute("INSERT INTO missing_table VALUES (1)"));

        assertNotNull(error.getCause());
    }
}
