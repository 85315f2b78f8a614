package com.crossfire.cache;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Distributed TTL cache keyed by group key and session id.
 *
 * <p>Conflict resolution is left to the storage: concurrent writers for one group key use distinct
 * session ids, so their records never overwrite each other. Nothing here prevents two callers from
 * computing the same value at the same time.
 *
 * @param <T> cached value type
 */
public class FingerprintCache<T> {
    private final CacheStorage storage;
    private final CacheValueCodec<T> codec;
    private final Clock clock;

    public FingerprintCache(CacheStorage storage, CacheValueCodec<T> codec, Clock clock) {
        this.storage = storage;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * Retrieves a non-expired entry for the key. Which entry is returned when several are valid is
     * unspecified.
     *
     * @param groupKey cache key
     * @return first non-expired entry found
     */
    public Optional<CacheEntry<T>> get(String groupKey) {
        Instant now = clock.instant();
        return storage.findAll(groupKey).stream()
                .filter(r -> !isExpired(r, now))
                .findFirst()
                .map(this::toEntry);
    }

    /**
     * Retrieves all non-expired entries for the key.
     *
     * @param groupKey cache key
     * @return non-expired entries
     */
    public List<CacheEntry<T>> getAll(String groupKey) {
        Instant now = clock.instant();
        return storage.findAll(groupKey).stream()
                .filter(r -> !isExpired(r, now))
                .map(this::toEntry)
                .collect(Collectors.toList());
    }

    public void set(String groupKey, String sessionId, T value) {
        set(groupKey, sessionId, value, CacheEntry.DEFAULT_TTL_SECONDS);
    }

    /**
     * Saves a value. A later call with the same group key and session id overwrites this record.
     *
     * @param groupKey cache key
     * @param sessionId writer identifier, unique per writer
     * @param value value to cache
     * @param ttlSeconds time to live in seconds
     */
    public void set(String groupKey, String sessionId, T value, int ttlSeconds) {
        storage.insertOrMerge(new StoredCacheRecord(groupKey, sessionId, clock.instant(), ttlSeconds, codec.encode(value)));
    }

    private boolean isExpired(StoredCacheRecord record, Instant now) {
        return CacheEntry.isExpired(record.getCreatedAt(), record.getTtlSeconds(), now);
    }

    private CacheEntry<T> toEntry(StoredCacheRecord record) {
        return CacheEntry.<T>builder()
                .groupKey(record.getGroupKey())
                .sessionId(record.getSessionId())
                .createdAt(record.getCreatedAt())
                .ttlSeconds(record.getTtlSeconds())
                .value(codec.decode(record.getCachedValue()))
                .build();
    }
}
