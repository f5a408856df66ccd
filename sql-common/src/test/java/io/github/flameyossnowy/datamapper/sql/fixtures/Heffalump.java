package io.github.flameyossnowy.datamapper.sql.fixtures;

import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.property.PropertyOptions;
import io.github.flameyossnowy.datamapper.api.resource.Resource;
import io.github.flameyossnowy.datamapper.api.types.FieldType;

public final class Heffalump extends Resource {
    public static final Model<Heffalump> MODEL = Model.define(Heffalump.class, Heffalump::new);

    public static final Property<Heffalump, Long> ID = MODEL.property("id", FieldType.SERIAL,
        PropertyOptions.<Heffalump, Long>options().key());
    public static final Property<Heffalump, String> COLOR = MODEL.property("color", FieldType.STRING);
    public static final Property<Heffalump, Integer> NUM_SPOTS = MODEL.property("num_spots", FieldType.INTEGER);
    public static final Property<Heffalump, Boolean> STRIPED = MODEL.property("striped", FieldType.BOOLEAN);
    public static final Property<Heffalump, String> BIO = MODEL.property("bio", FieldType.TEXT);

    @Override
    public Model<Heffalump> model() {
        return MODEL;
    }
}
