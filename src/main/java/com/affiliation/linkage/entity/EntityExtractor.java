package com.affiliation.linkage.entity;

import java.util.List;

/**
 * Optional collaborator that finds organization names in free affiliation text.
 * Results only ever add confidence to a linkage; they never override a direct text match.
 */
public interface EntityExtractor {

    /**
     * Extracts organization candidates from the text.
     *
     * @param text affiliation text, may be empty
     * @return the candidates, empty when none were found or the extractor failed
     */
    List<OrganizationCandidate> extractOrganizations(String text);

    /**
     * Returns the name/identifier of this extractor.
     */
    String getProviderName();

    /**
     * Checks if the extractor is available and configured.
     */
    boolean isAvailable();
}
