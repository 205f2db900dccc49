package com.affiliation.linkage.discovery;

import com.affiliation.linkage.core.model.LinkageResult;
import com.affiliation.linkage.core.model.LinkageStatus;
import com.affiliation.linkage.core.model.MatchBasis;
import com.affiliation.linkage.core.model.NormalizedTriple;
import com.affiliation.linkage.core.model.StoreRecord;
import com.affiliation.linkage.linkage.DocumentRefMode;
import com.affiliation.linkage.linkage.LinkageEngine;
import com.affiliation.linkage.linkage.LinkageInput;
import com.affiliation.linkage.linkage.LinkageOptions;
import com.affiliation.linkage.linkage.LinkageReport;
import com.affiliation.linkage.metrics.MicrometerMetricsService;
import com.affiliation.linkage.name.NameConvention;
import com.affiliation.linkage.pipeline.CancellationToken;
import com.affiliation.linkage.pipeline.Stage;
import com.affiliation.linkage.pipeline.StageCancelledException;
import com.affiliation.linkage.rules.AffiliationKeyDeriver;
import com.affiliation.linkage.rules.TextNormalizer;
import com.affiliation.linkage.store.AuthorKeyDeriver;
import com.affiliation.linkage.store.InMemoryIndexedStore;
import com.affiliation.linkage.store.StoreSchema;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DiscoveryEngine Tests")
class DiscoveryEngineTest {

    private static final AffiliationKeyDeriver KEYS = new AffiliationKeyDeriver();
    private static final String OXFORD = "Department of Physics, University of Oxford";

    private InMemoryIndexedStore store;
    private DiscoveryEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryIndexedStore();
        store.createTable(StoreSchema.authorAffiliations());
        store.batchInsert(List.of(
                row("D1", "Jane Doe", OXFORD),
                row("D2", "Ann Lee", "Dept. of Physics, Univ. Oxford"),
                row("D3", "Bob Ray", OXFORD),
                row("D4", "Carl Fox", "Cambridge University"),
                row("D5", "Dan Poe", OXFORD),
                row("D5", "Eve Kay", OXFORD)));
        engine = new DiscoveryEngine(store);
    }

    private static StoreRecord row(String document, String author, String affiliation) {
        NormalizedTriple triple = NormalizedTriple.builder()
                .documentId(document)
                .authorSequence(0)
                .authorName(author, TextNormalizer.normalize(author))
                .affiliationSequence(0)
                .affiliationName(affiliation, TextNormalizer.normalize(affiliation))
                .build();
        return new StoreRecord(triple, "", KEYS.deriveKey(affiliation), "triples.csv");
    }

    private static DiscoverySeed seed(String affiliation, String origin) {
        return new DiscoverySeed(KEYS.deriveKey(affiliation), SeedSource.LINKAGE, affiliation, origin, 0);
    }

    @Test
    @DisplayName("Excluded and origin documents are never discovered")
    void shouldSkipExcludedDocuments() {
        SeedSet seeds = new SeedSet(List.of(seed(OXFORD, "D1")), Set.of("D1", "D2", "D3"), List.of());

        DiscoveryReport report = engine.discover(seeds);

        assertEquals(List.of(new DiscoveredWork("D5", KEYS.deriveKey(OXFORD), SeedSource.LINKAGE, "D1", 0)), report.discovered());
        assertEquals(2, report.log().size());
        assertEquals(3, report.selfMatches());
        assertTrue(report.unmatched().isEmpty());
    }

    @Test
    @DisplayName("Discovery from a linked document never reports that document")
    void shouldNeverDiscoverTheLinkedDocument() {
        InMemoryIndexedStore three = new InMemoryIndexedStore();
        three.createTable(StoreSchema.authorAffiliations());
        three.batchInsert(List.of(row("D1", "Jane Doe", OXFORD), row("D2", "Ann Lee", OXFORD),
                row("D3", "Bob Ray", OXFORD)));
        LinkageResult linked = new LinkageResult("D1", "Jane Doe", LinkageStatus.ORG_MATCH, MatchBasis.EXACT_NAME,
                "D1", 0, "Jane Doe", KEYS.deriveKey(OXFORD), OXFORD, "", 1.0, false);

        DiscoveryReport report = new DiscoveryEngine(three).discover(DiscoverySeeds.fromLinkage(List.of(linked)));

        assertEquals(List.of("D2", "D3"),
                report.discovered().stream().map(DiscoveredWork::discoveredDocumentId).toList());
        assertTrue(report.log().stream().noneMatch(e -> e.discoveredDocumentId().equals("D1")));
    }

    @Test
    @DisplayName("DOI references never come back as discoveries, even when their authors went unmatched")
    void shouldExcludeDoiInputsWithUnmatchedAuthors() {
        AuthorKeyDeriver authorKeys = new AuthorKeyDeriver(NameConvention.GIVEN_FAMILY);
        InMemoryIndexedStore dois = new InMemoryIndexedStore();
        dois.createTable(StoreSchema.authorAffiliations());
        List<StoreRecord> rows = new ArrayList<>();
        for (String[] entry : new String[][]{{"10.1/a", "Jane Doe"}, {"10.1/b", "Ann Lee"}, {"10.1/c", "Bob Ray"}}) {
            StoreRecord plain = row(entry[0], entry[1], OXFORD);
            rows.add(new StoreRecord(plain.triple(), authorKeys.deriveKey(plain.triple()), plain.affiliationKey(),
                    plain.sourceFile()));
        }
        dois.batchInsert(rows);
        LinkageOptions options = LinkageOptions.builder().documentRefMode(DocumentRefMode.DOI).build();
        LinkageReport linkage = new LinkageEngine(dois, options).link(List.of(
                new LinkageInput("https://doi.org/10.1/A", "Jane Doe"),
                new LinkageInput("https://doi.org/10.1/B", "Nobody Here")));
        assertEquals(LinkageStatus.UNMATCHED_NO_AUTHOR, linkage.results().get(1).status());

        SeedSet seeds = DiscoverySeeds.fromLinkage(linkage.results(), linkage.inputDocumentRefs(), DocumentRefMode.DOI);
        DiscoveryReport report = new DiscoveryEngine(dois).discover(seeds);

        assertEquals(List.of("10.1/c"),
                report.discovered().stream().map(DiscoveredWork::discoveredDocumentId).toList());
    }

    @Test
    @DisplayName("Every contributing link is logged but each document is listed once")
    void shouldLogAllLinksAndDeduplicateWorks() {
        SeedSet seeds = new SeedSet(List.of(
                new DiscoverySeed(KEYS.deriveKey(OXFORD), SeedSource.AFFILIATION_NAME, OXFORD, "", null),
                new DiscoverySeed(KEYS.deriveKey("Dept of Physics Univ Oxford"), SeedSource.AFFILIATION_NAME,
                        "Dept of Physics Univ Oxford", "", null)),
                Set.of(), List.of());

        DiscoveryReport report = engine.discover(seeds);

        assertEquals(2, report.seedsSearched());
        assertEquals(1, report.keysSearched());
        assertEquals(10, report.log().size());
        assertEquals(List.of("D1", "D2", "D3", "D5"),
                report.discovered().stream().map(DiscoveredWork::discoveredDocumentId).toList());
        assertEquals(OXFORD, report.log().get(0).seed().input());
        assertEquals("Dept of Physics Univ Oxford", report.log().get(5).seed().input());
    }

    @Test
    @DisplayName("Seeds that reach nothing are reported as unmatched")
    void shouldReportUnmatchedSeeds() {
        SeedSet seeds = new SeedSet(List.of(
                seed("Institut Pasteur", ""),
                seed("Cambridge University", "D4")),
                Set.of("D4"),
                List.of(new UnmatchedInput("D9", SeedSource.DOCUMENT_ID, "document not found in store")));

        DiscoveryReport report = engine.discover(seeds);

        assertTrue(report.discovered().isEmpty());
        assertEquals(3, report.unmatched().size());
        assertEquals("D9", report.unmatched().get(0).input());
        assertEquals("affiliation key not found in store", report.unmatched().get(1).reason());
        assertEquals("no other document shares this affiliation key", report.unmatched().get(2).reason());
    }

    @Test
    @DisplayName("Results should be deterministic for the same seeds")
    void shouldBeDeterministic() {
        SeedSet seeds = new SeedSet(List.of(seed(OXFORD, "D3"), seed("Cambridge University", "")), Set.of(), List.of());

        assertEquals(engine.discover(seeds), engine.discover(seeds));
    }

    @Test
    @DisplayName("Should count discovered documents")
    void shouldRecordMetrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        DiscoveryEngine measured = new DiscoveryEngine(store, new MicrometerMetricsService(registry));

        measured.discover(new SeedSet(List.of(seed(OXFORD, "D1")), Set.of(), List.of()));

        assertEquals(3.0, registry.get("discovery.documents").counter().count());
    }

    @Test
    @DisplayName("A cancelled run stops before searching")
    void shouldStopWhenCancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        StageCancelledException e = assertThrows(StageCancelledException.class,
                () -> engine.discover(new SeedSet(List.of(seed(OXFORD, "")), Set.of(), List.of()), token));
        assertEquals(Stage.DISCOVERY, e.getStage());
    }
}
