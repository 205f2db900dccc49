package com.affiliation.linkage.linkage;

import com.affiliation.linkage.core.model.LinkageStatus;
import com.affiliation.linkage.core.model.NormalizedTriple;
import com.affiliation.linkage.core.model.StoreRecord;
import com.affiliation.linkage.rules.TextNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AffiliationDisambiguator Tests")
class AffiliationDisambiguatorTest {

    private final AffiliationDisambiguator disambiguator = new AffiliationDisambiguator();

    private static StoreRecord affiliation(Integer sequence, String text) {
        NormalizedTriple triple = NormalizedTriple.builder()
                .documentId("W1")
                .authorSequence(0)
                .authorName("Jane Doe", "jane doe")
                .affiliationSequence(sequence)
                .affiliationName(text, TextNormalizer.normalize(text))
                .build();
        return new StoreRecord(triple, "doe j", "", "triples.csv");
    }

    private final List<StoreRecord> affiliations = List.of(
            affiliation(0, "Sorbonne Université"),
            affiliation(1, "Department of Physics, University of Oxford"),
            affiliation(2, "University of Oxford Hospital"));

    @Test
    @DisplayName("Should pick the first affiliation containing a variant")
    void shouldPickFirstContainingVariant() {
        AffiliationDisambiguator.Selection selection =
                disambiguator.select(affiliations, List.of("university of oxford"));

        assertSame(affiliations.get(1), selection.affiliation());
        assertEquals(LinkageStatus.ORG_MATCH, selection.status());
        assertEquals("university of oxford", selection.matchedVariant());
    }

    @Test
    @DisplayName("Affiliation order wins over variant order")
    void shouldVisitAffiliationsBeforeVariants() {
        AffiliationDisambiguator.Selection selection =
                disambiguator.select(affiliations, List.of("oxford hospital", "sorbonne"));

        assertSame(affiliations.get(0), selection.affiliation());
        assertEquals("sorbonne", selection.matchedVariant());
    }

    @Test
    @DisplayName("Without variants the first affiliation is available")
    void shouldTakeFirstWithoutVariants() {
        AffiliationDisambiguator.Selection selection = disambiguator.select(affiliations, List.of());

        assertSame(affiliations.get(0), selection.affiliation());
        assertEquals(LinkageStatus.FIRST_AVAILABLE, selection.status());
        assertNull(selection.matchedVariant());
    }

    @Test
    @DisplayName("Unmatched variants fall back to the first affiliation")
    void shouldReportNoOrgMatch() {
        AffiliationDisambiguator.Selection selection = disambiguator.select(affiliations, List.of("eth zurich"));

        assertSame(affiliations.get(0), selection.affiliation());
        assertEquals(LinkageStatus.NO_ORG_MATCH, selection.status());
    }

    @Test
    @DisplayName("Should reject an empty affiliation list")
    void shouldRejectEmptyList() {
        assertThrows(IllegalArgumentException.class, () -> disambiguator.select(List.of(), List.of("x")));
    }

    @Test
    @DisplayName("Rows without a sequence sort last and keep their order")
    void shouldSortNullSequencesLast() {
        StoreRecord unknownA = affiliation(null, "A");
        StoreRecord second = affiliation(1, "B");
        StoreRecord unknownC = affiliation(null, "C");
        StoreRecord first = affiliation(0, "D");

        List<StoreRecord> rows = new ArrayList<>(List.of(unknownA, second, unknownC, first));
        rows.sort(AffiliationDisambiguator.BY_AFFILIATION_SEQUENCE);

        assertEquals(List.of(first, second, unknownA, unknownC), rows);
    }
}
