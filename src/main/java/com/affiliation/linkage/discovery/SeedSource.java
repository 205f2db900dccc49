package com.affiliation.linkage.discovery;

/**
 * Where a discovery seed came from.
 */
public enum SeedSource {
    /** A matched affiliation from a linkage run. */
    LINKAGE,
    /** A caller-supplied affiliation name. */
    AFFILIATION_NAME,
    /** A stored affiliation of a caller-supplied document. */
    DOCUMENT_ID,
    /** An organization extracted from a linked affiliation that resembles a configured variant. */
    ENTITY
}
