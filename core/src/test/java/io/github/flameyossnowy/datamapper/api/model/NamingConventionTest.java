package io.github.flameyossnowy.datamapper.api.model;

import io.github.flameyossnowy.datamapper.api.fixtures.Heffalump;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NamingConventionTest {

    @Test
    void underscores_camel_case() {
        assertEquals("num_spots", NamingConvention.UNDERSCORED.apply("numSpots"));
        assertEquals("line_item", NamingConvention.UNDERSCORED.apply("LineItem"));
        assertEquals("html_page", NamingConvention.UNDERSCORED.apply("HTMLPage"));
        assertEquals("already_snake", NamingConvention.UNDERSCORED.apply("already_snake"));
    }

    @Test
    void pluralizes_storage_names() {
        assertEquals("heffalumps", NamingConvention.UNDERSCORED_AND_PLURALIZED.apply("Heffalump"));
        assertEquals("line_items", NamingConvention.UNDERSCORED_AND_PLURALIZED.apply("LineItem"));
        assertEquals("categories", NamingConvention.UNDERSCORED_AND_PLURALIZED.apply("Category"));
        assertEquals("boxes", NamingConvention.UNDERSCORED_AND_PLURALIZED.apply("Box"));
        assertEquals("keys", NamingConvention.UNDERSCORED_AND_PLURALIZED.apply("Key"));
    }

    @Test
    void model_storage_names_per_repository() {
        Model<Heffalump> model = Model.builder(Heffalump.class, Heffalump::new).build();
        model.storageName("legacy", "old_heffalumps");

        assertEquals("heffalumps", model.storageName());
        assertEquals("old_heffalumps", model.storageName("legacy"));

        Model<Heffalump> explicit = Model.builder(Heffalump.class, Heffalump::new).storageName("elephants").build();
        assertEquals("elephants", explicit.storageName("other"));
    }

    @Test
    void other_repositories_start_from_a_copy_of_the_default_set() {
        assertEquals(Heffalump.MODEL.properties().asList(), Heffalump.MODEL.properties("archive").asList());
        assertNotSame(Heffalump.MODEL.properties(), Heffalump.MODEL.properties("archive"));
        assertSame(Heffalump.ID, Heffalump.MODEL.identityField("archive"));
    }
}
