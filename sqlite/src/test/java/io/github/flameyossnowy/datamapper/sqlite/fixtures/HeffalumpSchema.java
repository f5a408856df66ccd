package io.github.flameyossnowy.datamapper.sqlite.fixtures;

import io.github.flameyossnowy.datamapper.api.annotations.DefaultValue;
import io.github.flameyossnowy.datamapper.api.annotations.Key;
import io.github.flameyossnowy.datamapper.api.annotations.Lazy;
import io.github.flameyossnowy.datamapper.api.annotations.Length;
import io.github.flameyossnowy.datamapper.api.annotations.Model;
import io.github.flameyossnowy.datamapper.api.annotations.Serial;
import io.github.flameyossnowy.datamapper.api.annotations.Text;

@Model
public interface HeffalumpSchema {
    @Key @Serial Long id();

    @Length(20) String color();

    Integer numSpots();

    @DefaultValue("false") Boolean striped();

    @Lazy @Text String notes();
}
