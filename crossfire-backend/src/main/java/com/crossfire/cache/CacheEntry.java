package com.crossfire.cache;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * A record in the fingerprint cache.
 *
 * <p>Several entries may share a group key; each is identified by its session id. Expiry is computed
 * at read time and expired entries are never removed from storage.
 *
 * @param <T> type of the cached value
 */
@Value
@Builder
public class CacheEntry<T> {
    public static final int DEFAULT_TTL_SECONDS = 3300;

    String groupKey;
    String sessionId;
    Instant createdAt;
    int ttlSeconds;
    T value;

    /**
     * An entry is expired once strictly more than {@code ttlSeconds} have passed since creation.
     *
     * @param now current time
     * @return true when expired
     */
    public boolean isExpired(Instant now) {
        return isExpired(createdAt, ttlSeconds, now);
    }

    static boolean isExpired(Instant createdAt, int ttlSeconds, Instant now) {
        return Duration.between(createdAt, now).compareTo(Duration.ofSeconds(ttlSeconds)) > 0;
    }
}
