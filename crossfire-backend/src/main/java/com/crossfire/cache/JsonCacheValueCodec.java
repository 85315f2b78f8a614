package com.crossfire.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;

/**
 * Stores composite values as camelCase JSON.
 *
 * @param <T> value type
 */
public class JsonCacheValueCodec<T> implements CacheValueCodec<T> {
    private final ObjectMapper objectMapper;
    private final JavaType valueType;

    public JsonCacheValueCodec(ObjectMapper objectMapper, Class<T> valueType) {
        this.objectMapper = objectMapper.copy().setPropertyNamingStrategy(PropertyNamingStrategies.LOWER_CAMEL_CASE);
        this.valueType = this.objectMapper.constructType(valueType);
    }

    @Override
    public String encode(T value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CacheValueCodecException("Failed to encode cache value of type " + valueType, e);
        }
    }

    @Override
    public T decode(String encoded) {
        try {
            return objectMapper.readValue(encoded, valueType);
        } catch (JsonProcessingException e) {
            throw new CacheValueCodecException("Failed to decode cache value of type " + valueType, e);
        }
    }
}
