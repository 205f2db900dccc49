package com.affiliation.linkage.cache;

import com.affiliation.linkage.core.model.StoreRecord;
import com.affiliation.linkage.store.StoreColumn;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Caffeine-backed store lookup cache.
 */
public class CaffeineStoreLookupCache implements StoreLookupCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineStoreLookupCache.class);

    private final Cache<LookupKey, List<StoreRecord>> cache;

    public CaffeineStoreLookupCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("cache.initialized maxSize={} ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<List<StoreRecord>> get(StoreColumn column, String value) {
        return Optional.ofNullable(cache.getIfPresent(new LookupKey(column, value)));
    }

    @Override
    public void put(StoreColumn column, String value, List<StoreRecord> rows) {
        cache.put(new LookupKey(column, value), List.copyOf(rows));
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("cache.invalidated");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    record LookupKey(StoreColumn column, String value) {}
}
