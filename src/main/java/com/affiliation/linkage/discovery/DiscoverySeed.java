package com.affiliation.linkage.discovery;

import java.util.Objects;

/**
 * One affiliation key to search for, with the input it came from.
 *
 * @param affiliationKey       the key to look up
 * @param source               how the seed was produced
 * @param input                the caller input behind the seed (affiliation text or document id)
 * @param originDocumentId     the document the key was taken from, empty when not from a document
 * @param originAuthorSequence author sequence within that document, or null
 */
public record DiscoverySeed(String affiliationKey, SeedSource source, String input,
                            String originDocumentId, Integer originAuthorSequence) {

    public DiscoverySeed {
        Objects.requireNonNull(affiliationKey, "affiliationKey is required");
        Objects.requireNonNull(source, "source is required");
        input = Objects.requireNonNullElse(input, "");
        originDocumentId = Objects.requireNonNullElse(originDocumentId, "");
    }
}
