package com.crossfire.cache;

/**
 * Encodes cache values to the text form held by {@link CacheStorage}.
 *
 * @param <T> value type
 */
public interface CacheValueCodec<T> {

    String encode(T value);

    /**
     * @throws CacheValueCodecException when the stored text cannot be read as a value
     */
    T decode(String encoded);
}
