package com.affiliation.linkage.discovery;

/**
 * One contributing link: a seed whose affiliation key is shared by a stored row of another document.
 *
 * @param seed                        the seed that led here
 * @param discoveredDocumentId        the other document
 * @param discoveredAuthorName        the author of the matching row
 * @param discoveredAffiliation       the affiliation text of the matching row
 * @param discoveredAffiliationRef    the external affiliation reference of the matching row
 */
public record DiscoveryLogEntry(DiscoverySeed seed, String discoveredDocumentId, String discoveredAuthorName,
                                String discoveredAffiliation, String discoveredAffiliationRef) {
}
