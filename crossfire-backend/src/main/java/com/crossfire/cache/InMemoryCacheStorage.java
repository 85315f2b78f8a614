package com.crossfire.cache;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link CacheStorage}. Records are never evicted.
 */
public class InMemoryCacheStorage implements CacheStorage {
    private final Map<String, Map<String, StoredCacheRecord>> partitions = new ConcurrentHashMap<>();

    @Override
    public void insertOrMerge(StoredCacheRecord record) {
        partitions.computeIfAbsent(record.getGroupKey(), k -> new ConcurrentHashMap<>())
                .put(record.getSessionId(), copyOf(record));
    }

    @Override
    public List<StoredCacheRecord> findAll(String groupKey) {
        List<StoredCacheRecord> out = new ArrayList<>();
        if (groupKey == null || groupKey.isEmpty()) {
            partitions.values().forEach(p -> p.values().forEach(r -> out.add(copyOf(r))));
            return out;
        }

        Map<String, StoredCacheRecord> partition = partitions.get(groupKey);
        if (partition != null) {
            partition.values().forEach(r -> out.add(copyOf(r)));
        }
        return out;
    }

    private static StoredCacheRecord copyOf(StoredCacheRecord r) {
        return new StoredCacheRecord(r.getGroupKey(), r.getSessionId(), r.getCreatedAt(), r.getTtlSeconds(), r.getCachedValue());
    }
}
