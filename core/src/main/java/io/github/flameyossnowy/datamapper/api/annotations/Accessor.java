package io.github.flameyossnowy.datamapper.api.annotations;

import io.github.flameyossnowy.datamapper.api.property.Visibility;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Visibility of the generated getter and setter.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.METHOD)
public @interface Accessor {
    Visibility reader() default Visibility.PUBLIC;

    Visibility writer() default Visibility.PUBLIC;
}
