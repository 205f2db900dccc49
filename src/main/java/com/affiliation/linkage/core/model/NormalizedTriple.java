package com.affiliation.linkage.core.model;

import java.util.Objects;

/**
 * One (document, author, affiliation) combination reconstructed from flat rows.
 * An author with no affiliation yields a triple with empty affiliation fields.
 * Sequences are null when the source path carried no usable coordinate.
 */
public record NormalizedTriple(
        String documentId,
        Integer authorSequence,
        String authorNameOriginal,
        String authorNameNormalized,
        String givenNameOriginal,
        String givenNameNormalized,
        String familyNameOriginal,
        String familyNameNormalized,
        Integer affiliationSequence,
        String affiliationNameOriginal,
        String affiliationNameNormalized,
        String affiliationExternalRef,
        boolean coordinatesResolved,
        String originShard
) {
    public NormalizedTriple {
        documentId = Objects.requireNonNullElse(documentId, "");
        authorNameOriginal = Objects.requireNonNullElse(authorNameOriginal, "");
        authorNameNormalized = Objects.requireNonNullElse(authorNameNormalized, "");
        givenNameOriginal = Objects.requireNonNullElse(givenNameOriginal, "");
        givenNameNormalized = Objects.requireNonNullElse(givenNameNormalized, "");
        familyNameOriginal = Objects.requireNonNullElse(familyNameOriginal, "");
        familyNameNormalized = Objects.requireNonNullElse(familyNameNormalized, "");
        affiliationNameOriginal = Objects.requireNonNullElse(affiliationNameOriginal, "");
        affiliationNameNormalized = Objects.requireNonNullElse(affiliationNameNormalized, "");
        affiliationExternalRef = Objects.requireNonNullElse(affiliationExternalRef, "");
        originShard = Objects.requireNonNullElse(originShard, "");
    }

    public boolean hasAffiliation() {
        return !affiliationNameOriginal.isEmpty() || !affiliationExternalRef.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String documentId;
        private Integer authorSequence;
        private String authorNameOriginal;
        private String authorNameNormalized;
        private String givenNameOriginal;
        private String givenNameNormalized;
        private String familyNameOriginal;
        private String familyNameNormalized;
        private Integer affiliationSequence;
        private String affiliationNameOriginal;
        private String affiliationNameNormalized;
        private String affiliationExternalRef;
        private boolean coordinatesResolved = true;
        private String originShard;

        public Builder documentId(String documentId) {
            this.documentId = documentId;
            return this;
        }

        public Builder authorSequence(Integer authorSequence) {
            this.authorSequence = authorSequence;
            return this;
        }

        public Builder authorName(String original, String normalized) {
            this.authorNameOriginal = original;
            this.authorNameNormalized = normalized;
            return this;
        }

        public Builder givenName(String original, String normalized) {
            this.givenNameOriginal = original;
            this.givenNameNormalized = normalized;
            return this;
        }

        public Builder familyName(String original, String normalized) {
            this.familyNameOriginal = original;
            this.familyNameNormalized = normalized;
            return this;
        }

        public Builder affiliationSequence(Integer affiliationSequence) {
            this.affiliationSequence = affiliationSequence;
            return this;
        }

        public Builder affiliationName(String original, String normalized) {
            this.affiliationNameOriginal = original;
            this.affiliationNameNormalized = normalized;
            return this;
        }

        public Builder affiliationExternalRef(String affiliationExternalRef) {
            this.affiliationExternalRef = affiliationExternalRef;
            return this;
        }

        public Builder coordinatesResolved(boolean coordinatesResolved) {
            this.coordinatesResolved = coordinatesResolved;
            return this;
        }

        public Builder originShard(String originShard) {
            this.originShard = originShard;
            return this;
        }

        public NormalizedTriple build() {
            return new NormalizedTriple(documentId, authorSequence, authorNameOriginal, authorNameNormalized,
                    givenNameOriginal, givenNameNormalized, familyNameOriginal, familyNameNormalized,
                    affiliationSequence, affiliationNameOriginal, affiliationNameNormalized,
                    affiliationExternalRef, coordinatesResolved, originShard);
        }
    }
}
