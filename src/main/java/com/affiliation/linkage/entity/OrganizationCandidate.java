package com.affiliation.linkage.entity;

import java.util.Objects;

/**
 * An organization name found in free text.
 *
 * @param text  the candidate organization name as it appears in the text
 * @param score extractor confidence (0.0 to 1.0)
 */
public record OrganizationCandidate(String text, double score) {

    public OrganizationCandidate {
        Objects.requireNonNull(text, "text is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0");
        }
    }

    /**
     * True for short all-caps tokens such as "MIT" or "E.M.B.L" that are too ambiguous to search by.
     */
    public boolean isLikelyAcronym() {
        String stripped = text.strip().replace(".", "").replace("-", "");
        return stripped.length() <= 5 && !stripped.isEmpty() && stripped.equals(stripped.toUpperCase())
                && stripped.chars().anyMatch(Character::isLetter);
    }
}
