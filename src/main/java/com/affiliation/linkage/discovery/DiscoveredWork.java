package com.affiliation.linkage.discovery;

import java.util.Objects;

/**
 * A document found to share an affiliation key with a seed.
 * {@code seedSource}, {@code originDocumentId} and {@code originAuthorSequence} describe the first
 * seed that led to it; the origin fields are empty/null for seeds that did not come from a document.
 */
public record DiscoveredWork(
        String discoveredDocumentId,
        String sharedAffiliationKey,
        SeedSource seedSource,
        String originDocumentId,
        Integer originAuthorSequence
) {
    public DiscoveredWork {
        Objects.requireNonNull(discoveredDocumentId, "discoveredDocumentId is required");
        Objects.requireNonNull(seedSource, "seedSource is required");
        sharedAffiliationKey = Objects.requireNonNullElse(sharedAffiliationKey, "");
        originDocumentId = Objects.requireNonNullElse(originDocumentId, "");
    }
}
