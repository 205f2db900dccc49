package com.affiliation.linkage.core.model;

/**
 * Outcome of linking one external author reference.
 */
public enum LinkageStatus {
    /** An affiliation containing a configured organization variant was found. */
    ORG_MATCH(true, true),
    /** An affiliation was selected because an extracted organization resembled a variant. */
    ENTITY_MATCH(true, true),
    /** No variants were configured; the first affiliation by sequence was taken. */
    FIRST_AVAILABLE(true, true),
    /** Variants were configured but none matched; the first affiliation by sequence was taken. */
    NO_ORG_MATCH(true, false),
    /** The document is not in the store. */
    UNMATCHED_NO_DOCUMENT(false, false),
    /** The document exists but no author matched the name. */
    UNMATCHED_NO_AUTHOR(false, false),
    /** The author matched but has no stored affiliation. */
    UNMATCHED_NO_AFFILIATION(false, false);

    private final boolean matched;
    private final boolean discoverySeed;

    LinkageStatus(boolean matched, boolean discoverySeed) {
        this.matched = matched;
        this.discoverySeed = discoverySeed;
    }

    public boolean isMatched() {
        return matched;
    }

    /**
     * Returns true if results with this status seed affiliation discovery.
     */
    public boolean isDiscoverySeed() {
        return discoverySeed;
    }
}
