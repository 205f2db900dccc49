package com.affiliation.linkage.join;

/**
 * What an extracted field contributes to the author/affiliation structure.
 */
public enum FieldRole {
    AUTHOR_FULL_NAME(false),
    AUTHOR_GIVEN_NAME(false),
    AUTHOR_FAMILY_NAME(false),
    AFFILIATION_NAME(true),
    AFFILIATION_EXTERNAL_REF(true);

    private final boolean affiliationLevel;

    FieldRole(boolean affiliationLevel) {
        this.affiliationLevel = affiliationLevel;
    }

    /**
     * Returns true if the field needs an affiliation coordinate in addition to the author coordinate.
     */
    public boolean isAffiliationLevel() {
        return affiliationLevel;
    }
}
