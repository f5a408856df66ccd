package io.github.flameyossnowy.datamapper.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.function.BiFunction;

/**
 * Computes the default value of a property from the resource being created.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.METHOD)
public @interface DefaultValueProvider {
    /**
     * A class with a no-argument constructor implementing
     * {@code BiFunction<Resource, Property<Resource, V>, V>} for the generated resource.
     */
    Class<? extends BiFunction> value();
}
