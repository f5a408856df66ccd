package io.github.flameyossnowy.datamapper.api.json;

public interface JsonCodec<T> {

    String serialize(T value, Class<T> targetType);

    T deserialize(String json, Class<T> targetType);
}
