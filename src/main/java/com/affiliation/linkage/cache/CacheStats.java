package com.affiliation.linkage.cache;

/**
 * Snapshot of a store lookup cache.
 *
 * @param hitCount      lookups answered from the cache
 * @param missCount     lookups that went to the store
 * @param evictionCount result lists dropped for size or age
 * @param size          result lists currently held
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public long lookups() {
        return hitCount + missCount;
    }

    /**
     * Share of lookups answered from the cache, 0.0 before the first lookup.
     */
    public double hitRate() {
        return lookups() == 0 ? 0.0 : (double) hitCount / lookups();
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
