package com.affiliation.linkage.linkage;

import com.affiliation.linkage.core.model.LinkageResult;
import com.affiliation.linkage.core.model.LinkageStatus;
import com.affiliation.linkage.core.model.MatchBasis;
import com.affiliation.linkage.core.model.NormalizedTriple;
import com.affiliation.linkage.core.model.StoreRecord;
import com.affiliation.linkage.entity.EntityExtractor;
import com.affiliation.linkage.entity.OrganizationCandidate;
import com.affiliation.linkage.io.LinkageResultCodec;
import com.affiliation.linkage.metrics.NoOpMetricsService;
import com.affiliation.linkage.name.NameConvention;
import com.affiliation.linkage.rules.AffiliationKeyDeriver;
import com.affiliation.linkage.rules.TextNormalizer;
import com.affiliation.linkage.store.AuthorKeyDeriver;
import com.affiliation.linkage.store.InMemoryIndexedStore;
import com.affiliation.linkage.store.StoreSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("LinkageEngine Tests")
class LinkageEngineTest {

    private static final AuthorKeyDeriver AUTHOR_KEYS = new AuthorKeyDeriver(NameConvention.GIVEN_FAMILY);
    private static final AffiliationKeyDeriver AFFILIATION_KEYS = new AffiliationKeyDeriver();

    private InMemoryIndexedStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryIndexedStore();
        store.createTable(StoreSchema.authorAffiliations());
        List<StoreRecord> rows = new ArrayList<>();
        rows.add(row("W1", 0, "Jane Doe", 1, "University of Oxford, UK"));
        rows.add(row("W1", 0, "Jane Doe", 0, "Department of Physics, Sorbonne Université"));
        rows.add(row("W1", 1, "John Roe", 0, "Cambridge University"));
        rows.add(row("W2", 0, "Marie Curie", null, null));
        rows.add(row("10.1234/abc", 0, "Ann Lee", 0, "MIT"));
        store.batchInsert(rows);
    }

    private static StoreRecord row(String document, int authorSequence, String author,
                                   Integer affiliationSequence, String affiliation) {
        NormalizedTriple triple = NormalizedTriple.builder()
                .documentId(document)
                .authorSequence(authorSequence)
                .authorName(author, TextNormalizer.normalize(author))
                .affiliationSequence(affiliationSequence)
                .affiliationName(affiliation, TextNormalizer.normalize(affiliation))
                .originShard("shard-0.gz")
                .build();
        String affiliationKey = affiliation == null ? "" : AFFILIATION_KEYS.deriveKey(affiliation);
        return new StoreRecord(triple, AUTHOR_KEYS.deriveKey(triple), affiliationKey, "triples.csv");
    }

    private LinkageEngine engine(List<String> variants) {
        return new LinkageEngine(store, LinkageOptions.builder().organizationVariants(variants).build());
    }

    @Nested
    @DisplayName("Author matching")
    class AuthorMatching {

        @Test
        @DisplayName("Should match an author by exact key")
        void shouldMatchExactKey() {
            LinkageResult result = engine(List.of("University of Oxford")).link(new LinkageInput("W1", "Jane Doe"));

            assertEquals(LinkageStatus.ORG_MATCH, result.status());
            assertEquals(MatchBasis.EXACT_NAME, result.matchBasis());
            assertEquals("W1", result.matchedDocumentId());
            assertEquals(Integer.valueOf(0), result.matchedAuthorSequence());
            assertEquals("Jane Doe", result.matchedAuthorName());
            assertEquals("University of Oxford, UK", result.matchedAffiliationOriginal());
            assertEquals(AFFILIATION_KEYS.deriveKey("University of Oxford, UK"), result.matchedAffiliationKey());
            assertEquals(1.0, result.confidence(), 1e-9);
            assertFalse(result.entityCorroborated());
        }

        @Test
        @DisplayName("Family-comma references should reach the same key")
        void shouldMatchFamilyCommaReference() {
            LinkageResult result = engine(List.of()).link(new LinkageInput("W1", "Doe, Jane"));

            assertEquals(MatchBasis.EXACT_NAME, result.matchBasis());
            assertEquals("Jane Doe", result.matchedAuthorName());
        }

        @Test
        @DisplayName("Should fall back to fuzzy comparison within the document")
        void shouldMatchFuzzy() {
            LinkageResult result = engine(List.of("University of Oxford")).link(new LinkageInput("W1", "Jane Doee"));

            assertEquals(LinkageStatus.ORG_MATCH, result.status());
            assertEquals(MatchBasis.FUZZY_NAME, result.matchBasis());
            assertEquals("Jane Doe", result.matchedAuthorName());
            assertTrue(result.confidence() > 0.85 && result.confidence() < 1.0);
        }

        @Test
        @DisplayName("Authors of other documents are never matched")
        void shouldNotMatchAcrossDocuments() {
            LinkageResult result = engine(List.of()).link(new LinkageInput("W2", "Jane Doe"));

            assertEquals(LinkageStatus.UNMATCHED_NO_AUTHOR, result.status());
        }
    }

    @Nested
    @DisplayName("Unmatched results")
    class Unmatched {

        @Test
        @DisplayName("Unknown documents are reported")
        void shouldReportUnknownDocument() {
            LinkageResult result = engine(List.of()).link(new LinkageInput("W9", "Jane Doe"));

            assertEquals(LinkageStatus.UNMATCHED_NO_DOCUMENT, result.status());
            assertEquals("W9", result.externalDocumentRef());
            assertEquals("Jane Doe", result.externalAuthorRef());
            assertEquals("", result.matchedDocumentId());
            assertNull(result.matchBasis());
            assertEquals(0.0, result.confidence());
        }

        @Test
        @DisplayName("Unknown authors are reported")
        void shouldReportUnknownAuthor() {
            assertEquals(LinkageStatus.UNMATCHED_NO_AUTHOR,
                    engine(List.of()).link(new LinkageInput("W1", "Zed Zulu")).status());
        }

        @Test
        @DisplayName("Authors without affiliations are reported")
        void shouldReportMissingAffiliation() {
            assertEquals(LinkageStatus.UNMATCHED_NO_AFFILIATION,
                    engine(List.of()).link(new LinkageInput("W2", "Marie Curie")).status());
        }

        @Test
        @DisplayName("Every input yields one result in input order")
        void shouldKeepOneResultPerInput() {
            List<LinkageInput> inputs = List.of(
                    new LinkageInput("W9", "Nobody"),
                    new LinkageInput("W1", "John Roe"),
                    new LinkageInput("W2", "Marie Curie"));

            LinkageReport report = engine(List.of()).link(inputs);

            assertEquals(3, report.results().size());
            assertEquals("Nobody", report.results().get(0).externalAuthorRef());
            assertEquals("John Roe", report.results().get(1).externalAuthorRef());
            assertEquals(1, report.matched());
            assertEquals(2, report.unmatched());
            assertNull(report.output());
        }
    }

    @Nested
    @DisplayName("Affiliation selection")
    class AffiliationSelection {

        @Test
        @DisplayName("Without variants the first affiliation in sequence is taken")
        void shouldTakeFirstAvailable() {
            LinkageResult result = engine(List.of()).link(new LinkageInput("W1", "Jane Doe"));

            assertEquals(LinkageStatus.FIRST_AVAILABLE, result.status());
            assertEquals("Department of Physics, Sorbonne Université", result.matchedAffiliationOriginal());
            assertEquals(0.8, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("A single affiliation is taken with full confidence")
        void shouldTrustSingleAffiliation() {
            LinkageResult result = engine(List.of()).link(new LinkageInput("W1", "John Roe"));

            assertEquals(LinkageStatus.FIRST_AVAILABLE, result.status());
            assertEquals("Cambridge University", result.matchedAffiliationOriginal());
            assertEquals(1.0, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Variants found nowhere give a matched result that is not a seed")
        void shouldReportNoOrgMatch() {
            LinkageResult result = engine(List.of("ETH Zurich")).link(new LinkageInput("W1", "Jane Doe"));

            assertEquals(LinkageStatus.NO_ORG_MATCH, result.status());
            assertTrue(result.isMatched());
            assertFalse(result.status().isDiscoverySeed());
            assertEquals(0.5, result.confidence(), 1e-9);
        }
    }

    @Test
    @DisplayName("DOI mode should resolve resolver URLs to stored ids")
    void shouldResolveDoiReferences() {
        LinkageInput input = new LinkageInput("https://doi.org/10.1234/ABC", "Ann Lee");

        LinkageResult asIs = engine(List.of()).link(input);
        LinkageResult doi = new LinkageEngine(store,
                LinkageOptions.builder().documentRefMode(DocumentRefMode.DOI).build()).link(input);

        assertEquals(LinkageStatus.UNMATCHED_NO_DOCUMENT, asIs.status());
        assertEquals(LinkageStatus.FIRST_AVAILABLE, doi.status());
        assertEquals("10.1234/abc", doi.matchedDocumentId());
        assertEquals("https://doi.org/10.1234/ABC", doi.externalDocumentRef());
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Entity extraction")
    class EntityExtraction {

        @Mock
        private EntityExtractor extractor;

        private LinkageEngine engine(List<String> variants, boolean enabled) {
            LinkageOptions options = LinkageOptions.builder()
                    .organizationVariants(variants)
                    .entityExtractionEnabled(enabled)
                    .build();
            return new LinkageEngine(store, options, extractor, new NoOpMetricsService());
        }

        @Test
        @DisplayName("Should fall back to an extracted organization")
        void shouldMatchByEntity() {
            when(extractor.extractOrganizations("MIT"))
                    .thenReturn(List.of(new OrganizationCandidate("Massachusetts Institute of Technology", 0.9)));

            LinkageResult result = engine(List.of("Massachusetts Institute of Technology"), true)
                    .link(new LinkageInput("10.1234/abc", "Ann Lee"));

            assertEquals(LinkageStatus.ENTITY_MATCH, result.status());
            assertEquals(MatchBasis.ENTITY_EXTRACTION, result.matchBasis());
            assertEquals("MIT", result.matchedAffiliationOriginal());
            assertTrue(result.entityCorroborated());
            assertEquals(1.0, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Should corroborate a direct match")
        void shouldCorroborateDirectMatch() {
            when(extractor.extractOrganizations("University of Oxford, UK"))
                    .thenReturn(List.of(new OrganizationCandidate("University of Oxford", 0.95)));

            LinkageResult exact = engine(List.of("University of Oxford"), true)
                    .link(new LinkageInput("W1", "Jane Doe"));
            LinkageResult fuzzy = engine(List.of("University of Oxford"), true)
                    .link(new LinkageInput("W1", "Jane Doee"));

            assertEquals(LinkageStatus.ORG_MATCH, exact.status());
            assertTrue(exact.entityCorroborated());
            assertEquals(1.0, exact.confidence(), 1e-9);

            LinkageResult uncorroborated = new LinkageEngine(store,
                    LinkageOptions.builder().organizationVariants(List.of("University of Oxford")).build())
                    .link(new LinkageInput("W1", "Jane Doee"));
            assertTrue(fuzzy.entityCorroborated());
            assertTrue(fuzzy.confidence() > uncorroborated.confidence());
        }

        @Test
        @DisplayName("Extraction never overrides the direct selection")
        void shouldKeepDirectSelection() {
            when(extractor.extractOrganizations("University of Oxford, UK")).thenReturn(List.of());

            LinkageResult result = engine(List.of("University of Oxford"), true)
                    .link(new LinkageInput("W1", "Jane Doe"));

            assertEquals(LinkageStatus.ORG_MATCH, result.status());
            assertEquals("University of Oxford, UK", result.matchedAffiliationOriginal());
            assertFalse(result.entityCorroborated());
        }

        @Test
        @DisplayName("Disabled extraction is never consulted")
        void shouldSkipWhenDisabled() {
            LinkageResult result = engine(List.of("Massachusetts Institute of Technology"), false)
                    .link(new LinkageInput("10.1234/abc", "Ann Lee"));

            assertEquals(LinkageStatus.NO_ORG_MATCH, result.status());
            verifyNoInteractions(extractor);
        }
    }

    @Test
    @DisplayName("Should read the input file and write one row per author")
    void shouldRunFromFile(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("input.csv");
        Files.writeString(input, "doi,authors\nW1,\"Jane Doe; John Roe\"\nW9,Nobody\n", StandardCharsets.UTF_8);
        Path output = dir.resolve("linkage.csv");
        LinkageOptions options = LinkageOptions.builder()
                .organizationVariants(List.of("University of Oxford"))
                .authorSeparator(";")
                .build();

        LinkageReport report = new LinkageEngine(store, options).run(input, output);

        assertEquals(3, report.results().size());
        assertEquals(output, report.output());
        assertEquals(2, report.inputDocumentRefs().size());
        assertEquals(1, report.count(LinkageStatus.ORG_MATCH));
        assertEquals(1, report.count(LinkageStatus.NO_ORG_MATCH));
        assertEquals(1, report.count(LinkageStatus.UNMATCHED_NO_DOCUMENT));

        List<LinkageResult> written = LinkageResultCodec.read(output);
        assertEquals(report.results().size(), written.size());
        assertEquals("John Roe", written.get(1).externalAuthorRef());
        assertEquals(LinkageStatus.UNMATCHED_NO_DOCUMENT, written.get(2).status());
    }

    @Test
    @DisplayName("A repeated document and author pair yields one result per occurrence")
    void shouldKeepRepeatedPairs(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("input.csv");
        Files.writeString(input, "doi,authors\nW1,Jane Doe\nW1,\"Jane Doe; Jane Doe\"\n", StandardCharsets.UTF_8);
        LinkageOptions options = LinkageOptions.builder()
                .organizationVariants(List.of("University of Oxford"))
                .authorSeparator(";")
                .build();

        LinkageReport report = new LinkageEngine(store, options).run(input, dir.resolve("linkage.csv"));

        assertEquals(3, report.results().size());
        assertEquals(3, report.count(LinkageStatus.ORG_MATCH));
        assertEquals(report.results().get(0), report.results().get(2));
    }
}
