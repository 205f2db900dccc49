package com.affiliation.linkage.discovery;

import com.affiliation.linkage.io.CsvTables;
import com.affiliation.linkage.io.PartialFile;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Writes the discovery outputs next to each other under a common prefix:
 * {@code <prefix>_full_discovery_log.csv}, {@code <prefix>_discovered_works.csv}
 * and {@code <prefix>_unmatched.csv}.
 */
public class DiscoveryWriter {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryWriter.class);

    public static final String FULL_LOG_SUFFIX = "_full_discovery_log.csv";
    public static final String DISCOVERED_WORKS_SUFFIX = "_discovered_works.csv";
    public static final String UNMATCHED_SUFFIX = "_unmatched.csv";

    static final List<String> LOG_COLUMNS = List.of(
            "seed_source", "seed_input", "origin_document_id", "origin_author_sequence",
            "shared_affiliation_key", "discovered_document_id", "discovered_author_name",
            "discovered_affiliation", "discovered_affiliation_ref");
    static final List<String> WORK_COLUMNS = List.of(
            "discovered_document_id", "shared_affiliation_key", "seed_source", "origin_document_id",
            "origin_author_sequence");
    static final List<String> UNMATCHED_COLUMNS = List.of("input", "kind", "reason");

    private final Path directory;
    private final String prefix;

    public DiscoveryWriter(Path directory, String prefix) {
        this.directory = directory;
        this.prefix = prefix;
    }

    public Path fullLogPath() {
        return directory.resolve(prefix + FULL_LOG_SUFFIX);
    }

    public Path discoveredWorksPath() {
        return directory.resolve(prefix + DISCOVERED_WORKS_SUFFIX);
    }

    public Path unmatchedPath() {
        return directory.resolve(prefix + UNMATCHED_SUFFIX);
    }

    public void write(DiscoveryReport report) throws IOException {
        Path logPartial = PartialFile.partialOf(fullLogPath());
        try (CSVPrinter printer = CsvTables.create(logPartial, LOG_COLUMNS)) {
            for (DiscoveryLogEntry entry : report.log()) {
                DiscoverySeed seed = entry.seed();
                printer.printRecord(label(seed.source()), seed.input(), seed.originDocumentId(),
                        sequence(seed.originAuthorSequence()), seed.affiliationKey(), entry.discoveredDocumentId(),
                        entry.discoveredAuthorName(), entry.discoveredAffiliation(), entry.discoveredAffiliationRef());
            }
        }

        Path worksPartial = PartialFile.partialOf(discoveredWorksPath());
        try (CSVPrinter printer = CsvTables.create(worksPartial, WORK_COLUMNS)) {
            for (DiscoveredWork work : report.discovered()) {
                printer.printRecord(work.discoveredDocumentId(), work.sharedAffiliationKey(),
                        label(work.seedSource()), work.originDocumentId(), sequence(work.originAuthorSequence()));
            }
        }

        Path unmatchedPartial = PartialFile.partialOf(unmatchedPath());
        try (CSVPrinter printer = CsvTables.create(unmatchedPartial, UNMATCHED_COLUMNS)) {
            for (UnmatchedInput input : report.unmatched()) {
                printer.printRecord(input.input(), label(input.kind()), input.reason());
            }
        }

        PartialFile.commit(logPartial, fullLogPath());
        PartialFile.commit(worksPartial, discoveredWorksPath());
        PartialFile.commit(unmatchedPartial, unmatchedPath());
        log.info("discovery.written directory={} prefix={} links={} works={} unmatched={}",
                directory, prefix, report.log().size(), report.discovered().size(), report.unmatched().size());
    }

    private static String label(SeedSource source) {
        return source.name().toLowerCase(Locale.ROOT);
    }

    private static String sequence(Integer sequence) {
        return sequence == null ? "" : sequence.toString();
    }
}
