package io.github.flameyossnowy.datamapper.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a schema interface. Each abstract method declares one property, named after
 * the method, typed by its (boxed) return type.
 * <pre>{@code
 * @Model(name = "Heffalump")
 * interface HeffalumpSchema {
 *     @Key @Serial Long id();
 *     @Length(20) String color();
 * }
 * }</pre>
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface Model {
    /**
     * Name of the generated resource class. Defaults to the schema name without its {@code Schema} suffix.
     */
    String name() default "";

    /** Storage name in every repository. Empty means the underscored, pluralized model name. */
    String storageName() default "";

    String repository() default "default";
}
