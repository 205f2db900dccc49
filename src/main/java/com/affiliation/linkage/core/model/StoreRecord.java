package com.affiliation.linkage.core.model;

import com.affiliation.linkage.store.StoreColumn;

import java.util.Objects;

/**
 * A normalized triple as held by the indexed store, with its derived lookup keys.
 * {@code affiliationKey} and {@code authorKey} are always recomputed from the triple at load time.
 *
 * @param triple         the source triple
 * @param authorKey      "family initial" author lookup key
 * @param affiliationKey canonical affiliation key, empty when the author has no affiliation
 * @param sourceFile     the triples file the row was loaded from
 */
public record StoreRecord(
        NormalizedTriple triple,
        String authorKey,
        String affiliationKey,
        String sourceFile
) {
    public StoreRecord {
        Objects.requireNonNull(triple, "triple is required");
        authorKey = Objects.requireNonNullElse(authorKey, "");
        affiliationKey = Objects.requireNonNullElse(affiliationKey, "");
        sourceFile = Objects.requireNonNullElse(sourceFile, "");
    }

    public String documentId() {
        return triple.documentId();
    }

    public Integer authorSequence() {
        return triple.authorSequence();
    }

    public Integer affiliationSequence() {
        return triple.affiliationSequence();
    }

    /**
     * Returns the value of the given column as stored text.
     */
    public String value(StoreColumn column) {
        return switch (column) {
            case DOCUMENT_ID -> triple.documentId();
            case AUTHOR_SEQUENCE -> sequenceText(triple.authorSequence());
            case AUTHOR_NAME -> triple.authorNameOriginal();
            case AUTHOR_NAME_NORMALIZED -> triple.authorNameNormalized();
            case AUTHOR_KEY -> authorKey;
            case AFFILIATION_SEQUENCE -> sequenceText(triple.affiliationSequence());
            case AFFILIATION_NAME -> triple.affiliationNameOriginal();
            case AFFILIATION_NAME_NORMALIZED -> triple.affiliationNameNormalized();
            case AFFILIATION_KEY -> affiliationKey;
            case AFFILIATION_EXTERNAL_REF -> triple.affiliationExternalRef();
            case ORIGIN_SHARD -> triple.originShard();
            case SOURCE_FILE -> sourceFile;
        };
    }

    private static String sequenceText(Integer sequence) {
        return sequence == null ? "" : sequence.toString();
    }
}
