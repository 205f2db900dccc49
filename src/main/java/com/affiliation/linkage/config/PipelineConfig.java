package com.affiliation.linkage.config;

import com.affiliation.linkage.cache.CacheConfig;

/**
 * Root of the pipeline configuration. Missing sections take their defaults.
 */
public record PipelineConfig(
        ExtractionConfig extraction,
        SortConfig sort,
        JoinConfig join,
        StoreConfig store,
        LinkageConfig linkage,
        DiscoveryConfig discovery,
        CacheConfig cache
) {
    public PipelineConfig {
        extraction = extraction != null ? extraction : ExtractionConfig.defaults();
        sort = sort != null ? sort : SortConfig.defaults();
        join = join != null ? join : JoinConfig.defaults();
        store = store != null ? store : StoreConfig.defaults();
        linkage = linkage != null ? linkage : LinkageConfig.defaults();
        discovery = discovery != null ? discovery : DiscoveryConfig.defaults();
        cache = cache != null ? cache : CacheConfig.defaults();
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(null, null, null, null, null, null, null);
    }
}
