package io.github.flameyossnowy.datamapper.sqlite.fixtures;

import io.github.flameyossnowy.datamapper.api.annotations.Key;
import io.github.flameyossnowy.datamapper.api.annotations.Model;
import io.github.flameyossnowy.datamapper.api.annotations.Serial;

@Model
public interface OwnerSchema {
    @Key @Serial Long id();

    String name();
}
