package io.github.flameyossnowy.datamapper.checker;

import com.squareup.javapoet.CodeBlock;

import javax.lang.model.element.ExecutableElement;
import javax.lang.model.type.TypeMirror;
import java.util.List;
import java.util.Locale;

/**
 * One property read from a schema method.
 *
 * @param name          property name, the underscored method name
 * @param accessorName  capitalized method name used for the getter and setter
 * @param typeSource    how the generated code obtains the field type
 * @param typeReference built-in constant name for {@link TypeSource#BUILT_IN}, otherwise unused
 * @param resolver      the {@code @ResolveWith} field type class
 * @param nullable      explicit nullability, {@code null} when neither annotation is present
 * @param index         named indexes, {@code null} when not indexed
 * @param lazyContexts  lazy loading contexts, {@code null} when not lazy
 * @param defaultValue  literal default rendered as code, or {@code null}
 */
public record PropertyModel(
    ExecutableElement method,
    String name,
    String accessorName,
    TypeMirror valueType,
    TypeSource typeSource,
    String typeReference,
    TypeMirror resolver,
    boolean key,
    Boolean nullable,
    boolean unique,
    List<String> index,
    List<String> uniqueIndex,
    List<String> lazyContexts,
    Integer length,
    Integer precision,
    Integer scale,
    String field,
    CodeBlock defaultValue,
    TypeMirror defaultProvider,
    String readerVisibility,
    String writerVisibility
) {
    public enum TypeSource {
        BUILT_IN,
        JSON,
        RESOLVE_WITH
    }

    public String constantName() {
        return name.toUpperCase(Locale.ROOT);
    }

    public boolean isBoolean() {
        return valueType.toString().equals("java.lang.Boolean");
    }
}
