package com.crossfire.cache;

/**
 * Stores string values verbatim.
 */
public class StringCacheValueCodec implements CacheValueCodec<String> {

    @Override
    public String encode(String value) {
        return value;
    }

    @Override
    public String decode(String encoded) {
        return encoded;
    }
}
