package com.affiliation.linkage.discovery;

import com.affiliation.linkage.core.model.StoreRecord;
import com.affiliation.linkage.logging.LogContext;
import com.affiliation.linkage.metrics.MetricsService;
import com.affiliation.linkage.metrics.NoOpMetricsService;
import com.affiliation.linkage.pipeline.CancellationToken;
import com.affiliation.linkage.pipeline.Stage;
import com.affiliation.linkage.store.IndexedStore;
import com.affiliation.linkage.store.StoreColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds stored documents that share an affiliation key with a seed.
 *
 * <p>Documents in the seed set's exclusion list are never reported. Every contributing
 * (seed, discovered document) link is logged, while the discovered list keeps each document
 * once with the first seed that reached it. For a fixed seed order and store snapshot the
 * output is deterministic.</p>
 */
public class DiscoveryEngine {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryEngine.class);

    private final IndexedStore store;
    private final MetricsService metrics;

    public DiscoveryEngine(IndexedStore store) {
        this(store, new NoOpMetricsService());
    }

    public DiscoveryEngine(IndexedStore store, MetricsService metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    public DiscoveryReport discover(SeedSet seeds) {
        return discover(seeds, CancellationToken.NONE);
    }

    public DiscoveryReport discover(SeedSet seeds, CancellationToken token) {
        Instant start = Instant.now();
        Map<String, List<StoreRecord>> rowsByKey = new HashMap<>();
        List<DiscoveryLogEntry> entries = new ArrayList<>();
        Map<String, DiscoveredWork> discovered = new LinkedHashMap<>();
        List<UnmatchedInput> unmatched = new ArrayList<>(seeds.unmatched());
        long selfMatches = 0;
        long processed = 0;

        try (LogContext ctx = LogContext.forStage(LogContext.generateRunId(), Stage.DISCOVERY.label())) {
            for (DiscoverySeed seed : seeds.seeds()) {
                token.throwIfCancelled(Stage.DISCOVERY, processed);
                processed++;
                List<StoreRecord> rows = rowsByKey.computeIfAbsent(seed.affiliationKey(),
                        key -> store.queryBy(StoreColumn.AFFILIATION_KEY, key));

                int linksBefore = entries.size();
                for (StoreRecord row : rows) {
                    String documentId = row.documentId();
                    if (seeds.excludedDocuments().contains(documentId) || documentId.equals(seed.originDocumentId())) {
                        selfMatches++;
                        continue;
                    }
                    entries.add(new DiscoveryLogEntry(seed, documentId, row.triple().authorNameOriginal(),
                            row.triple().affiliationNameOriginal(), row.triple().affiliationExternalRef()));
                    discovered.putIfAbsent(documentId, new DiscoveredWork(documentId, seed.affiliationKey(),
                            seed.source(), seed.originDocumentId(), seed.originAuthorSequence()));
                }
                if (entries.size() == linksBefore) {
                    unmatched.add(new UnmatchedInput(seed.affiliationKey(), seed.source(),
                            rows.isEmpty() ? "affiliation key not found in store"
                                    : "no other document shares this affiliation key"));
                }
            }
        }

        metrics.incrementDiscovered(discovered.size());
        metrics.recordStageDuration(Stage.DISCOVERY, Duration.between(start, Instant.now()));
        DiscoveryReport report = new DiscoveryReport(processed, rowsByKey.size(), entries,
                new ArrayList<>(discovered.values()), unmatched, selfMatches);
        log.info("discovery.completed report={}", report);
        return report;
    }
}
