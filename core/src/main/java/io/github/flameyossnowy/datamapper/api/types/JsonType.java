package io.github.flameyossnowy.datamapper.api.types;

import io.github.flameyossnowy.datamapper.api.json.DefaultJsonCodec;
import io.github.flameyossnowy.datamapper.api.json.JsonCodec;
import io.github.flameyossnowy.datamapper.api.property.Property;
import org.jetbrains.annotations.NotNull;

/**
 * Stores any value as JSON text.
 *
 * @param <V> the value class handed to the codec
 */
public class JsonType<V> extends CustomType<V, String> {
    private final JsonCodec<V> codec;

    public JsonType(@NotNull Class<V> valueType) {
        this(valueType, new DefaultJsonCodec<>());
    }

    public JsonType(@NotNull Class<V> valueType, @NotNull JsonCodec<V> codec) {
        super("Json<" + valueType.getSimpleName() + '>', valueType, String.class,
            TypeOptions.NONE.withLength(FieldType.DEFAULT_TEXT_LENGTH));
        this.codec = codec;
    }

    @Override
    protected String dumpValue(@NotNull V value, @NotNull Property<?, V> property) {
        return codec.serialize(value, valueType());
    }

    @Override
    protected V loadValue(@NotNull String primitive, @NotNull Property<?, V> property) {
        return codec.deserialize(primitive, valueType());
    }
}
