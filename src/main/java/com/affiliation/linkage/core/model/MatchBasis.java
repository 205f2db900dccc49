package com.affiliation.linkage.core.model;

/**
 * How a linkage result was obtained.
 */
public enum MatchBasis {
    /** The author key matched a stored author of the document exactly. */
    EXACT_NAME,
    /** The author matched by name similarity. */
    FUZZY_NAME,
    /** The affiliation was selected on entity-extraction evidence. */
    ENTITY_EXTRACTION
}
