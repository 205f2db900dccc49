package com.affiliation.linkage.cache;

import com.affiliation.linkage.core.model.StoreRecord;
import com.affiliation.linkage.store.StoreColumn;

import java.util.List;
import java.util.Optional;

/**
 * No-op cache implementation. Used when caching is disabled.
 */
public class NoOpStoreLookupCache implements StoreLookupCache {

    @Override
    public Optional<List<StoreRecord>> get(StoreColumn column, String value) {
        return Optional.empty();
    }

    @Override
    public void put(StoreColumn column, String value, List<StoreRecord> rows) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
