package io.github.flameyossnowy.datamapper.api.annotations;

import io.github.flameyossnowy.datamapper.api.types.FieldType;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Stores the property through a custom field type.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.METHOD)
public @interface ResolveWith {
    /** A field type with a public no-argument constructor. */
    Class<? extends FieldType> value();
}
