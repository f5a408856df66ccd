package io.github.flameyossnowy.datamapper.sql.fixtures;

import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.property.PropertyOptions;
import io.github.flameyossnowy.datamapper.api.resource.Resource;
import io.github.flameyossnowy.datamapper.api.types.FieldType;

public final class Owner extends Resource {
    public static final Model<Owner> MODEL = Model.define(Owner.class, Owner::new);

    public static final Property<Owner, Long> ID = MODEL.property("id", FieldType.SERIAL,
        PropertyOptions.<Owner, Long>options().key());
    public static final Property<Owner, String> NAME = MODEL.property("name", FieldType.STRING);

    @Override
    public Model<Owner> model() {
        return MODEL;
    }
}
