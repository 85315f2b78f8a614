package com.crossfire.cache;

import java.util.List;

/**
 * Partition-scoped record store backing the fingerprint cache.
 *
 * <p>Implementations propagate storage failures as {@link CacheStorageException}.
 */
public interface CacheStorage {

    /**
     * Inserts a record, or overwrites the record with the same group key and session id.
     *
     * @param record record to write
     */
    void insertOrMerge(StoredCacheRecord record);

    /**
     * Returns every record of a group, expired ones included.
     *
     * @param groupKey group key; an empty key returns all records
     * @return records in storage order
     */
    List<StoredCacheRecord> findAll(String groupKey);
}
