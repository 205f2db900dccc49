package com.affiliation.linkage.join;

import com.affiliation.linkage.core.model.FlatFieldRow;
import com.affiliation.linkage.core.model.NormalizedTriple;
import com.affiliation.linkage.io.CsvRowReader;
import com.affiliation.linkage.io.CsvTables;
import com.affiliation.linkage.io.FlatRowCodec;
import com.affiliation.linkage.io.MalformedRowException;
import com.affiliation.linkage.io.PartialFile;
import com.affiliation.linkage.io.TripleCodec;
import com.affiliation.linkage.logging.LogContext;
import com.affiliation.linkage.metrics.MetricsService;
import com.affiliation.linkage.metrics.NoOpMetricsService;
import com.affiliation.linkage.pipeline.CancellationToken;
import com.affiliation.linkage.pipeline.PipelineException;
import com.affiliation.linkage.pipeline.Stage;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Streams sorted flat rows, regroups them by document and writes normalized triples.
 * Only one document is held in memory at a time.
 */
public class JoinNormalizer {
    private static final Logger log = LoggerFactory.getLogger(JoinNormalizer.class);

    private final FieldRoles roles;
    private final MetricsService metrics;

    public JoinNormalizer(FieldRoles roles) {
        this(roles, new NoOpMetricsService());
    }

    public JoinNormalizer(FieldRoles roles, MetricsService metrics) {
        this.roles = roles;
        this.metrics = metrics;
    }

    public JoinResult join(Path sortedInput, Path output) {
        return join(sortedInput, output, CancellationToken.NONE);
    }

    /**
     * Runs the pass. Fails if the input turns out not to be sorted by document id,
     * since grouping contiguous rows would then split documents.
     */
    public JoinResult join(Path sortedInput, Path output, CancellationToken token) {
        Instant start = Instant.now();
        long rowsRead = 0, ignored = 0, malformed = 0, flagged = 0, documents = 0, triples = 0;

        try (LogContext ctx = LogContext.forStage(LogContext.generateRunId(), Stage.JOIN.label())) {
            Path partial = PartialFile.partialOf(output);
            try (CsvRowReader<FlatFieldRow> reader = FlatRowCodec.reader(sortedInput);
                 CSVPrinter printer = CsvTables.create(partial, TripleCodec.COLUMNS)) {
                DocumentAssembler current = null;
                while (reader.hasNext()) {
                    token.throwIfCancelled(Stage.JOIN, rowsRead);
                    FlatFieldRow row;
                    try {
                        row = reader.next();
                    } catch (MalformedRowException e) {
                        malformed++;
                        log.warn("join.malformedRow record={} error={}", e.getRecordNumber(), e.getMessage());
                        continue;
                    }
                    rowsRead++;

                    if (current == null || !current.documentId().equals(row.documentId())) {
                        if (current != null) {
                            if (row.documentId().compareTo(current.documentId()) < 0) {
                                throw new PipelineException(Stage.JOIN, String.valueOf(reader.lastRecordNumber()),
                                        "input is not sorted: '" + row.documentId() + "' after '"
                                                + current.documentId() + "'");
                            }
                            triples += write(printer, current);
                            flagged += current.flaggedRows();
                        }
                        current = new DocumentAssembler(row.documentId(), roles);
                        documents++;
                    }
                    if (!current.accept(row)) {
                        ignored++;
                    }
                }
                if (current != null) {
                    triples += write(printer, current);
                    flagged += current.flaggedRows();
                }
            }
            PartialFile.commit(partial, output);
        } catch (IOException | UncheckedIOException e) {
            throw new PipelineException(Stage.JOIN, String.valueOf(rowsRead), "I/O failure: " + e.getMessage(), e);
        } catch (MalformedRowException e) {
            throw new PipelineException(Stage.JOIN, null, e.getMessage(), e);
        }

        JoinResult result = new JoinResult(rowsRead, ignored, malformed, flagged, documents, triples);
        metrics.recordStageDuration(Stage.JOIN, Duration.between(start, Instant.now()));
        log.info("join.completed output={} result={}", output, result);
        return result;
    }

    private static long write(CSVPrinter printer, DocumentAssembler assembler) throws IOException {
        long count = 0;
        for (NormalizedTriple triple : assembler.finish()) {
            TripleCodec.write(printer, triple);
            count++;
        }
        return count;
    }
}
