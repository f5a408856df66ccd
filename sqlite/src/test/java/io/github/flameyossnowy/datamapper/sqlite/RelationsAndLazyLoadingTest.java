package io.github.flameyossnowy.datamapper.sqlite;

import io.github.flameyossnowy.datamapper.api.query.Path;
import io.github.flameyossnowy.datamapper.api.query.Query;
import io.github.flameyossnowy.datamapper.api.repository.Repository;
import io.github.flameyossnowy.datamapper.sqlite.credentials.SQLiteCredentials;
import io.github.flameyossnowy.datamapper.sqlite.fixtures.Collar;
import io.github.flameyossnowy.datamapper.sqlite.fixtures.Owner;
import io.github.flameyossnowy.datamapper.sqlite.fixtures.Pet;
import io.github.flameyossnowy.datamapper.sqlite.fixtures.Relations;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RelationsAndLazyLoadingTest {
    private SQLiteRepositoryAdapter adapter;
    private Repository repository;
    private Owner ann;
    private Owner bob;

    @BeforeEach
    void setUp() {
        adapter = SQLiteRepositoryAdapter.builder()
            .withCredentials(SQLiteCredentials.memory())
            .build();
        repository = new Repository(adapter);
        adapter.execute("CREATE TABLE owners (id INTEGER PRIMARY KEY AUTOINCREMENT, name VARCHAR(50))");
        adapter.execute("CREATE TABLE pets (id INTEGER PRIMARY KEY AUTOINCREMENT, name VARCHAR(50), owner_id INTEGER,"
            + " collar TEXT, diet TEXT, allergies TEXT)");

        ann = owner("Ann");
        bob = owner("Bob");
        owner("Cid");
        pet("Rex", ann, new Collar("red", 3), "kibble", "none");
        pet("Tom", ann, null, "fish", "pollen");
        pet("Rex", bob, new Collar("blue", 2), "meat", "grass");
    }

    @AfterEach
    void tearDown() {
        repository.close();
    }

    private Owner owner(String name) {
        Owner owner = new Owner();
        owner.setName(name);
        assertTrue(owner.save(repository));
        return owner;
    }

    private void pet(String name, Owner owner, Collar collar, String diet, String allergies) {
        Pet pet = new Pet();
        pet.setName(name);
        pet.setOwnerId(owner.getId());
        pet.setCollar(collar);
        pet.setDiet(diet);
        pet.setAllergies(allergies);
        assertTrue(pet.save(repository));
    }

    @Test
    void in_memory_databases_are_shared_across_connections() {
        assertEquals(3, repository.all(Owner.MODEL).size());
        assertEquals(3, repository.all(Pet.MODEL).size());
    }

    @Test
    void paths_filter_parents_by_child_properties_without_duplicates() {
        List<String> owners = repository.all(Query.builder(repository, Owner.MODEL)
                .where(Path.through(Relations.PET_OWNER, Pet.NAME)).eql("Rex")
                .build())
            .stream().map(Owner::getName).collect(Collectors.toList());

        assertEquals(List.of("Ann", "Bob"), owners);
    }

    @Test
    void explicit_links_filter_children_by_parent_properties() {
        List<String> pets = repository.all(Query.builder(repository, Pet.MODEL)
                .link(Relations.PET_OWNER)
                .where(Owner.NAME).eql("Ann")
                .build())
            .stream().map(Pet::getName).collect(Collectors.toList());

        assertEquals(List.of("Rex", "Tom"), pets);
    }

    @Test
    void json_properties_are_stored_as_text_and_decoded_on_read() {
        Pet rex = repository.first(Query.builder(repository, Pet.MODEL).where(Pet.OWNER_ID).eql(bob.getId()).build());

        assertNotNull(rex);
        assertEquals(new Collar("blue", 2), rex.getCollar());
        assertEquals(List.of("{\"color\":\"blue\",\"size\":2}"),
            adapter.query("SELECT collar FROM pets WHERE id = ?", rex.getId()));

        Pet tom = repository.first(Query.builder(repository, Pet.MODEL).where(Pet.NAME).eql("Tom").build());
        assertNotNull(tom);
        assertNull(tom.getCollar());
    }

    @Test
    void json_conditions_compare_the_encoded_value() {
        Pet pet = repository.first(Query.builder(repository, Pet.MODEL).where(Pet.COLLAR).eql(new Collar("red", 3)).build());

        assertNotNull(pet);
        assertEquals("Rex", pet.getName());
        assertEquals(ann.getId(), pet.getOwnerId());
    }

    @Test
    void lazy_properties_load_together_with_their_context() {
        Pet tom = repository.first(Query.builder(repository, Pet.MODEL).where(Pet.NAME).eql("Tom").build());
        assertNotNull(tom);
        assertFalse(Pet.DIET.isLoaded(tom));
        assertFalse(Pet.ALLERGIES.isLoaded(tom));

        assertEquals("fish", tom.getDiet());

        assertTrue(Pet.ALLERGIES.isLoaded(tom));
        assertEquals("pollen", tom.getAllergies());
        assertFalse(tom.isDirty());
    }

    @Test
    void lazy_load_by_name_fetches_requested_properties() {
        Pet rex = repository.first(Query.builder(repository, Pet.MODEL).where(Pet.OWNER_ID).eql(bob.getId()).build());
        assertNotNull(rex);

        rex.lazyLoad("allergies");

        assertTrue(Pet.DIET.isLoaded(rex));
        assertEquals("grass", Pet.ALLERGIES.getRaw(rex));
    }

    @Test
    void changing_a_lazy_property_before_loading_it_saves_the_new_value() {
        Pet rex = repository.first(Query.builder(repository, Pet.MODEL).where(Pet.OWNER_ID).eql(ann.getId()).build());
        assertNotNull(rex);

        rex.setDiet("raw");
        assertTrue(rex.save());

        assertEquals(List.of("raw"), adapter.query("SELECT diet FROM pets WHERE id = ?", rex.getId()));
    }
}
