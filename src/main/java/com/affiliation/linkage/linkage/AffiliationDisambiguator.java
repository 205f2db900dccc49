package com.affiliation.linkage.linkage;

import com.affiliation.linkage.core.model.LinkageStatus;
import com.affiliation.linkage.core.model.StoreRecord;

import java.util.Comparator;
import java.util.List;

/**
 * Picks one affiliation for an author that has several.
 *
 * <p>Affiliations are visited in the author's stored sequence order and the first whose normalized
 * text contains an organization variant wins. Without a match the first affiliation is taken.
 * Variants are tried in the given order for each affiliation, so the result depends only on the
 * two orderings.</p>
 */
public class AffiliationDisambiguator {

    /** Affiliation sequence order; rows without a sequence sort last and keep their relative order. */
    public static final Comparator<StoreRecord> BY_AFFILIATION_SEQUENCE = Comparator.comparing(
            StoreRecord::affiliationSequence, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * Selects an affiliation.
     *
     * @param affiliations       the author's affiliations, already in sequence order, not empty
     * @param normalizedVariants normalized organization variants, possibly empty
     */
    public Selection select(List<StoreRecord> affiliations, List<String> normalizedVariants) {
        if (affiliations.isEmpty()) {
            throw new IllegalArgumentException("affiliations must not be empty");
        }
        if (normalizedVariants.isEmpty()) {
            return new Selection(affiliations.get(0), LinkageStatus.FIRST_AVAILABLE, null);
        }
        for (StoreRecord affiliation : affiliations) {
            String text = affiliation.triple().affiliationNameNormalized();
            for (String variant : normalizedVariants) {
                if (!text.isEmpty() && text.contains(variant)) {
                    return new Selection(affiliation, LinkageStatus.ORG_MATCH, variant);
                }
            }
        }
        return new Selection(affiliations.get(0), LinkageStatus.NO_ORG_MATCH, null);
    }

    /**
     * The chosen affiliation.
     *
     * @param affiliation    the selected row
     * @param status         why it was selected
     * @param matchedVariant the variant found in its text, or null
     */
    public record Selection(StoreRecord affiliation, LinkageStatus status, String matchedVariant) {}
}
