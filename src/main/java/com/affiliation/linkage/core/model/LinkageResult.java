package com.affiliation.linkage.core.model;

import java.util.Objects;

/**
 * Result of linking one external (document, author) reference to a stored affiliation.
 * Unmatched inputs are represented explicitly with an unmatched status and empty match fields.
 */
public record LinkageResult(
        String externalDocumentRef,
        String externalAuthorRef,
        LinkageStatus status,
        MatchBasis matchBasis,
        String matchedDocumentId,
        Integer matchedAuthorSequence,
        String matchedAuthorName,
        String matchedAffiliationKey,
        String matchedAffiliationOriginal,
        String matchedAffiliationRef,
        double confidence,
        boolean entityCorroborated
) {
    public LinkageResult {
        externalDocumentRef = Objects.requireNonNullElse(externalDocumentRef, "");
        externalAuthorRef = Objects.requireNonNullElse(externalAuthorRef, "");
        Objects.requireNonNull(status, "status is required");
        matchedDocumentId = Objects.requireNonNullElse(matchedDocumentId, "");
        matchedAuthorName = Objects.requireNonNullElse(matchedAuthorName, "");
        matchedAffiliationKey = Objects.requireNonNullElse(matchedAffiliationKey, "");
        matchedAffiliationOriginal = Objects.requireNonNullElse(matchedAffiliationOriginal, "");
        matchedAffiliationRef = Objects.requireNonNullElse(matchedAffiliationRef, "");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
    }

    public boolean isMatched() {
        return status.isMatched();
    }

    /**
     * Creates an explicit unmatched result.
     */
    public static LinkageResult unmatched(String documentRef, String authorRef, LinkageStatus status) {
        if (status.isMatched()) {
            throw new IllegalArgumentException("Not an unmatched status: " + status);
        }
        return new LinkageResult(documentRef, authorRef, status, null, null, null, null,
                null, null, null, 0.0, false);
    }
}
