package io.github.flameyossnowy.datamapper.api.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.flameyossnowy.datamapper.api.exceptions.json.JsonPosition;
import io.github.flameyossnowy.datamapper.api.exceptions.json.JsonProcessException;

public class DefaultJsonCodec<T> implements JsonCodec<T> {
    private final ObjectMapper mapper;

    public DefaultJsonCodec() {
        this(new ObjectMapper().findAndRegisterModules());
    }

    public DefaultJsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String serialize(T value, Class<T> targetType) {
        try {
            return mapper.writerFor(targetType).writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JsonProcessException(e.getOriginalMessage(), e, JsonPosition.from(e.getLocation()));
        }
    }

    @Override
    public T deserialize(String json, Class<T> targetType) {
        try {
            return mapper.readValue(json, targetType);
        } catch (JsonProcessingException e) {
            throw new JsonProcessException(e.getOriginalMessage(), e, JsonPosition.from(e.getLocation()));
        }
    }
}
