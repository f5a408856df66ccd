package io.github.flameyossnowy.datamapper.api.resource;

import io.github.flameyossnowy.datamapper.api.adapter.InMemoryAdapter;
import io.github.flameyossnowy.datamapper.api.fixtures.Article;
import io.github.flameyossnowy.datamapper.api.fixtures.Heffalump;
import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.query.Query;
import io.github.flameyossnowy.datamapper.api.repository.Repository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResourceLifecycleTest {
    private Repository repository;

    @BeforeEach
    void setUp() {
        repository = new Repository(new InMemoryAdapter(Model.DEFAULT_REPOSITORY));
    }

    @Test
    void save_assigns_the_identity_and_clears_tracking() {
        Heffalump heffalump = Heffalump.of("pink", 3, null);
        assertTrue(heffalump.isNew());
        assertNull(heffalump.getId());

        assertTrue(heffalump.save(repository));

        assertTrue(heffalump.isSaved());
        assertFalse(heffalump.isNew());
        assertEquals(1L, heffalump.getId());
        assertFalse(heffalump.isDirty());
        assertEquals(List.of(1L), heffalump.key());

        Heffalump second = Heffalump.of("blue", 1, true);
        second.save(repository);
        assertEquals(2L, second.getId());
    }

    @Test
    void save_materializes_defaults() {
        Heffalump untouched = new Heffalump();
        untouched.setColor("grey");

        untouched.save(repository);

        Heffalump loaded = repository.get(Heffalump.MODEL, untouched.getId());
        assertNotNull(loaded);
        assertEquals(Boolean.FALSE, loaded.isStriped());
    }

    @Test
    void save_without_a_repository_is_a_usage_error() {
        assertThrows(IllegalStateException.class, () -> new Heffalump().save());
    }

    @Test
    void dirty_attributes_are_written_on_update() {
        Heffalump heffalump = Heffalump.of("pink", 3, false);
        heffalump.save(repository);

        heffalump.setColor("purple");
        assertEquals(1, heffalump.dirtyAttributes().size());
        assertEquals("pink", heffalump.originalValue(Heffalump.COLOR));
        assertTrue(heffalump.save());
        assertFalse(heffalump.isDirty());

        Heffalump loaded = repository.get(Heffalump.MODEL, heffalump.getId());
        assertNotNull(loaded);
        assertEquals("purple", loaded.getColor());
        assertEquals(3, loaded.getNumSpots());
    }

    @Test
    void destroy_removes_the_record() {
        Heffalump heffalump = Heffalump.of("pink", 3, false);
        heffalump.save(repository);

        assertTrue(heffalump.destroy());
        assertTrue(heffalump.isDestroyed());
        assertNull(repository.get(Heffalump.MODEL, heffalump.getId()));
        assertThrows(IllegalStateException.class, heffalump::save);
    }

    @Test
    void lazy_properties_load_on_first_access() {
        Heffalump heffalump = Heffalump.of("pink", 3, false);
        heffalump.setNotes("likes honey");
        heffalump.save(repository);

        Heffalump loaded = repository.get(Heffalump.MODEL, heffalump.getId());
        assertNotNull(loaded);
        assertFalse(Heffalump.NOTES.isLoaded(loaded));

        assertEquals("likes honey", loaded.getNotes());
        assertTrue(Heffalump.NOTES.isLoaded(loaded));
        assertFalse(loaded.isDirty());
    }

    @Test
    void a_lazy_context_loads_as_one_group() {
        Article article = Article.titled("Groups");
        Article.BODY.set(article, "body text");
        Article.SUMMARY.set(article, "summary text");
        article.save(repository);

        Article loaded = repository.first(Query.builder(repository, Article.MODEL).build());
        assertNotNull(loaded);
        assertEquals("groups", Article.SLUG.get(loaded));
        assertFalse(Article.BODY.isLoaded(loaded));
        assertFalse(Article.SUMMARY.isLoaded(loaded));

        loaded.lazyLoad("body");
        assertTrue(Article.SUMMARY.isLoaded(loaded));
        assertEquals("summary text", Article.SUMMARY.getRaw(loaded));
        assertEquals("body text", Article.BODY.get(loaded));
    }

    @Test
    void custom_typed_values_survive_a_round_trip() {
        Article article = Article.titled("Tags");
        Article.TAGS.set(article, List.of("a", "b"));
        article.save(repository);

        Article loaded = repository.get(Article.MODEL, article.key().get(0));
        assertNotNull(loaded);
        assertEquals(List.of("a", "b"), Article.TAGS.get(loaded));
        assertEquals(0, Article.VIEWS.get(loaded));
    }

    @Test
    void conditions_are_evaluated_by_the_in_memory_adapter() {
        Heffalump.of("pink", 1, true).save(repository);
        Heffalump.of("blue", 4, false).save(repository);
        Heffalump.of("pink", 7, false).save(repository);

        List<Heffalump> pink = repository.all(Query.builder(repository, Heffalump.MODEL)
            .where(Heffalump.COLOR).eql("pink")
            .where(Heffalump.NUM_SPOTS).gt(2)
            .build());

        assertEquals(1, pink.size());
        assertEquals(7, pink.get(0).getNumSpots());
        assertEquals(3, repository.all(Heffalump.MODEL).size());
    }
}
