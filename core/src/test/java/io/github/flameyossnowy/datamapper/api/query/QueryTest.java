package io.github.flameyossnowy.datamapper.api.query;

import io.github.flameyossnowy.datamapper.api.adapter.InMemoryAdapter;
import io.github.flameyossnowy.datamapper.api.fixtures.Article;
import io.github.flameyossnowy.datamapper.api.fixtures.Heffalump;
import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.repository.Repository;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryTest {
    private final Repository repository = new Repository(new InMemoryAdapter(Model.DEFAULT_REPOSITORY));

    @Test
    void defaults_to_eager_fields_ordered_by_key() {
        Query<Heffalump> query = Query.builder(repository, Heffalump.MODEL).build();

        assertEquals(Heffalump.MODEL.properties().defaults(), query.fields());
        assertEquals(List.of(Order.asc(Heffalump.ID)), query.order());
        assertNull(query.limit());
        assertEquals(0, query.offset());
        assertFalse(query.hasLinks());
        assertFalse(query.isUnique());
    }

    @Test
    void builder_collects_conditions_in_order() {
        Query<Heffalump> query = Query.builder(repository, Heffalump.MODEL)
            .where(Heffalump.COLOR).eql("pink")
            .where(Heffalump.NUM_SPOTS).gte(2)
            .raw("1 = 1")
            .orderBy(Heffalump.NUM_SPOTS, Direction.DESC)
            .limit(10)
            .offset(5)
            .build();

        assertEquals(3, query.conditions().size());
        assertEquals(Operator.EQL, query.conditions().get(0).operator());
        assertEquals(Operator.GTE, query.conditions().get(1).operator());
        assertTrue(query.conditions().get(2).isRaw());
        assertEquals(List.of(Order.desc(Heffalump.NUM_SPOTS)), query.order());
        assertEquals(10, query.limit());
        assertEquals(5, query.offset());
    }

    @Test
    void limit_and_offset_validation() {
        assertThrows(IllegalArgumentException.class, () -> Query.builder(repository, Heffalump.MODEL).offset(-1).build());
        assertThrows(IllegalArgumentException.class, () -> Query.builder(repository, Heffalump.MODEL).limit(-1).build());
        assertThrows(IllegalArgumentException.class, () -> Query.builder(repository, Heffalump.MODEL).offset(3).build());
        assertDoesNotThrow(() -> Query.builder(repository, Heffalump.MODEL).limit(0).build());
    }

    @Test
    void to_builder_keeps_everything() {
        Query<Heffalump> query = Query.builder(repository, Heffalump.MODEL)
            .fields(Heffalump.ID, Heffalump.COLOR)
            .where(Heffalump.COLOR).not(null)
            .unique(true)
            .build();

        Query<Heffalump> limited = query.toBuilder().limit(1).build();
        assertEquals(query.fields(), limited.fields());
        assertEquals(query.conditions(), limited.conditions());
        assertTrue(limited.isUnique());
        assertEquals(1, limited.limit());
    }

    @Test
    void links_need_keys_of_equal_length() {
        List<Property<?, ?>> parent = List.of(Heffalump.ID, Heffalump.COLOR);
        List<Property<?, ?>> child = List.of(Article.ID);

        assertThrows(IllegalArgumentException.class, () -> new Link(Heffalump.MODEL, Article.MODEL, parent, child));

        Link link = Link.of(Heffalump.ID, Article.ID);
        assertSame(Article.MODEL, link.otherSide(Heffalump.MODEL));
        assertSame(Heffalump.MODEL, link.otherSide(Article.MODEL));
    }
}
