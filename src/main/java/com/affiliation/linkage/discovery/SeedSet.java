package com.affiliation.linkage.discovery;

import java.util.List;
import java.util.Set;

/**
 * Seeds for one discovery run, the documents that must not be reported as discoveries,
 * and the inputs that did not even produce a seed.
 */
public record SeedSet(List<DiscoverySeed> seeds, Set<String> excludedDocuments, List<UnmatchedInput> unmatched) {

    public SeedSet {
        seeds = List.copyOf(seeds);
        excludedDocuments = Set.copyOf(excludedDocuments);
        unmatched = List.copyOf(unmatched);
    }
}
