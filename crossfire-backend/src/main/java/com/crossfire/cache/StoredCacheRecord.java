package com.crossfire.cache;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Physical form of a cache entry: the value is already encoded to text.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StoredCacheRecord {
    private String groupKey;
    private String sessionId;
    private Instant createdAt;
    private int ttlSeconds;
    private String cachedValue;
}
