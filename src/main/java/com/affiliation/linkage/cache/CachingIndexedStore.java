package com.affiliation.linkage.cache;

import com.affiliation.linkage.core.model.StoreRecord;
import com.affiliation.linkage.metrics.MetricsService;
import com.affiliation.linkage.metrics.NoOpMetricsService;
import com.affiliation.linkage.store.BatchInsertResult;
import com.affiliation.linkage.store.IndexedStore;
import com.affiliation.linkage.store.StoreColumn;
import com.affiliation.linkage.store.StoreSchema;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decorates an {@link IndexedStore} so that repeated {@code queryBy} lookups are served from a
 * {@link StoreLookupCache}. Any write to the store clears the cache.
 */
public class CachingIndexedStore implements IndexedStore {

    private final IndexedStore delegate;
    private final StoreLookupCache cache;
    private final MetricsService metrics;

    public CachingIndexedStore(IndexedStore delegate, StoreLookupCache cache) {
        this(delegate, cache, new NoOpMetricsService());
    }

    public CachingIndexedStore(IndexedStore delegate, StoreLookupCache cache, MetricsService metrics) {
        this.delegate = delegate;
        this.cache = cache;
        this.metrics = metrics;
    }

    @Override
    public void createTable(StoreSchema schema) {
        delegate.createTable(schema);
    }

    @Override
    public BatchInsertResult batchInsert(List<StoreRecord> rows) {
        try {
            return delegate.batchInsert(rows);
        } finally {
            cache.invalidateAll();
        }
    }

    @Override
    public void createIndex(Set<StoreColumn> columns) {
        delegate.createIndex(columns);
    }

    @Override
    public List<StoreRecord> queryBy(StoreColumn column, String value) {
        Optional<List<StoreRecord>> cached = cache.get(column, value);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached.get();
        }
        metrics.recordCacheMiss();
        List<StoreRecord> rows = delegate.queryBy(column, value);
        cache.put(column, value, rows);
        return rows;
    }

    @Override
    public long count() {
        return delegate.count();
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    @Override
    public void close() {
        delegate.close();
    }
}
