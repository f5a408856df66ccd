package io.github.flameyossnowy.datamapper.sqlite.fixtures;

import io.github.flameyossnowy.datamapper.api.annotations.Json;
import io.github.flameyossnowy.datamapper.api.annotations.Key;
import io.github.flameyossnowy.datamapper.api.annotations.Lazy;
import io.github.flameyossnowy.datamapper.api.annotations.Model;
import io.github.flameyossnowy.datamapper.api.annotations.Serial;

@Model
public interface PetSchema {
    @Key @Serial Long id();

    String name();

    Long ownerId();

    @Json Collar collar();

    @Lazy({"medical"}) String diet();

    @Lazy({"medical"}) String allergies();
}
