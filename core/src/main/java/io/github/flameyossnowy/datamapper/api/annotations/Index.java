package io.github.flameyossnowy.datamapper.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.METHOD)
public @interface Index {
    /** Named composite indexes. Empty means an index on this property alone. */
    String[] value() default {};
}
