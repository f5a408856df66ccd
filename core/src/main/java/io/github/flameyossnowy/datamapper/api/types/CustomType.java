package io.github.flameyossnowy.datamapper.api.types;

import io.github.flameyossnowy.datamapper.api.property.Property;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A field type whose values need a symmetrical conversion to and from a primitive
 * the driver understands.
 *
 * <pre>{@code
 * public final class CsvType extends CustomType<List<String>, String> { ... }
 * }</pre>
 *
 * @param <V> the Java value class
 * @param <P> the primitive stored in the repository
 */
public abstract class CustomType<V, P> extends FieldType<V> {
    private final Class<P> primitiveType;

    protected CustomType(
        @NotNull String name,
        @NotNull Class<V> valueType,
        @NotNull Class<P> primitiveType,
        @NotNull TypeOptions defaultOptions
    ) {
        super(name, FieldKind.OPAQUE, valueType, primitiveType, primitiveType == String.class, defaultOptions);
        this.primitiveType = primitiveType;
    }

    protected CustomType(@NotNull String name, @NotNull Class<V> valueType, @NotNull Class<P> primitiveType) {
        this(name, valueType, primitiveType, TypeOptions.NONE);
    }

    protected abstract P dumpValue(@NotNull V value, @NotNull Property<?, V> property);

    protected abstract V loadValue(@NotNull P primitive, @NotNull Property<?, V> property);

    @Override
    public final boolean isCustom() {
        return true;
    }

    @Override
    public final @Nullable Object dump(@Nullable V value, @NotNull Property<?, V> property) {
        return value == null ? null : dumpValue(value, property);
    }

    @Override
    public final @Nullable V load(@Nullable Object primitive, @NotNull Property<?, V> property) {
        if (primitive == null) return null;
        if (valueType().isInstance(primitive) && !primitiveType.isInstance(primitive)) {
            return valueType().cast(primitive);
        }
        if (primitiveType == String.class) {
            return loadValue(primitiveType.cast(primitive.toString()), property);
        }
        return loadValue(primitiveType.cast(primitive), property);
    }
}
