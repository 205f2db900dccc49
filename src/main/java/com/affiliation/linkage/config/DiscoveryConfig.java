package com.affiliation.linkage.config;

/**
 * Discovery section of the pipeline configuration.
 *
 * @param useEntities        also seed discovery with organizations extracted from linked affiliations
 * @param restrictToVariants in document-id mode, only use affiliations containing an organization variant
 * @param outputPrefix       prefix of the discovery output files
 */
public record DiscoveryConfig(boolean useEntities, boolean restrictToVariants, String outputPrefix) {

    public DiscoveryConfig {
        outputPrefix = outputPrefix != null && !outputPrefix.isBlank() ? outputPrefix : "results";
    }

    public static DiscoveryConfig defaults() {
        return new DiscoveryConfig(false, false, "results");
    }
}
