package com.affiliation.linkage.cache;

import com.affiliation.linkage.core.model.StoreRecord;
import com.affiliation.linkage.store.StoreColumn;

import java.util.List;
import java.util.Optional;

/**
 * Cache of equality lookups against an indexed store, keyed by column + value.
 */
public interface StoreLookupCache {

    /**
     * Gets the cached rows for a lookup.
     *
     * @return the cached rows, or empty if the lookup is not cached
     */
    Optional<List<StoreRecord>> get(StoreColumn column, String value);

    void put(StoreColumn column, String value, List<StoreRecord> rows);

    /**
     * Invalidates all cache entries. Called whenever the underlying store is written.
     */
    void invalidateAll();

    CacheStats getStats();
}
