package com.affiliation.linkage.discovery;


import java.util.List;

/**
 * Outcome of a discovery run.
 *
 * @param seedsSearched  seeds processed
 * @param keysSearched   distinct affiliation keys looked up
 * @param log            every contributing link, in seed order
 * @param discovered     discovered documents, deduplicated, first contributor kept
 * @param unmatched      inputs and seeds that led to no discovery
 * @param selfMatches    rows skipped because their document was part of the input
 */
public record DiscoveryReport(long seedsSearched, long keysSearched, List<DiscoveryLogEntry> log,
                              List<DiscoveredWork> discovered, List<UnmatchedInput> unmatched, long selfMatches) {

    public DiscoveryReport {
        log = List.copyOf(log);
        discovered = List.copyOf(discovered);
        unmatched = List.copyOf(unmatched);
    }

    public boolean isSuccessful() {
        return true;
    }

    @Override
    public String toString() {
        return "DiscoveryReport{seeds=" + seedsSearched +
                ", keys=" + keysSearched +
                ", links=" + log.size() +
                ", discovered=" + discovered.size() +
                ", unmatched=" + unmatched.size() +
                ", selfMatches=" + selfMatches + '}';
    }
}
