package com.affiliation.linkage.store;

import com.affiliation.linkage.core.model.ErrorRecord;
import com.affiliation.linkage.core.model.NormalizedTriple;
import com.affiliation.linkage.core.model.RejectionReason;
import com.affiliation.linkage.core.model.StoreRecord;
import com.affiliation.linkage.graph.InputSanitizer;
import com.affiliation.linkage.io.CsvTables;
import com.affiliation.linkage.io.TripleCodec;
import com.affiliation.linkage.logging.LogContext;
import com.affiliation.linkage.metrics.MetricsService;
import com.affiliation.linkage.metrics.NoOpMetricsService;
import com.affiliation.linkage.pipeline.CancellationToken;
import com.affiliation.linkage.pipeline.PipelineException;
import com.affiliation.linkage.pipeline.ProgressCallback;
import com.affiliation.linkage.pipeline.Stage;
import com.affiliation.linkage.rules.AffiliationKeyDeriver;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a normalized triples file into an {@link IndexedStore}.
 *
 * <p>Each row is validated, keyed and appended in batches. Rows that fail validation or that the
 * store refuses are written to the error log with a reason code and loading continues. The
 * affiliation and author keys are always recomputed here from the row's own text.</p>
 */
public class StoreLoader {
    private static final Logger log = LoggerFactory.getLogger(StoreLoader.class);
    private static final int PROGRESS_INTERVAL = 10_000;

    private final IndexedStore store;
    private final LoadOptions options;
    private final AffiliationKeyDeriver affiliationKeys;
    private final AuthorKeyDeriver authorKeys;
    private final MetricsService metrics;

    public StoreLoader(IndexedStore store) {
        this(store, LoadOptions.defaults());
    }

    public StoreLoader(IndexedStore store, LoadOptions options) {
        this(store, options, new AffiliationKeyDeriver(), new NoOpMetricsService());
    }

    public StoreLoader(IndexedStore store, LoadOptions options, AffiliationKeyDeriver affiliationKeys,
                       MetricsService metrics) {
        this.store = store;
        this.options = options;
        this.affiliationKeys = affiliationKeys;
        this.authorKeys = new AuthorKeyDeriver(options.getReferenceNameConvention());
        this.metrics = metrics;
    }

    public LoadResult load(Path triplesFile, Path errorLog) {
        return load(triplesFile, errorLog, CancellationToken.NONE, ProgressCallback.NOOP);
    }

    /**
     * Loads every row of the triples file. The table is created first and the configured
     * indexes are built once all rows are in.
     *
     * @throws PipelineException if the input or the error log cannot be read or written
     */
    public LoadResult load(Path triplesFile, Path errorLog, CancellationToken token, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        Instant start = Instant.now();
        String sourceFile = triplesFile.getFileName().toString();
        Batch batch = new Batch();
        Map<RejectionReason, Long> byReason = new EnumMap<>(RejectionReason.class);
        long rowsRead = 0;
        long accepted = 0;

        try (LogContext ctx = LogContext.forStage(LogContext.generateRunId(), Stage.LOAD.label());
             ErrorLogWriter errors = new ErrorLogWriter(errorLog);
             CSVParser parser = CsvTables.open(triplesFile)) {

            if (!parser.getHeaderNames().equals(TripleCodec.COLUMNS)) {
                throw new PipelineException(Stage.LOAD, "0", "unexpected header " + parser.getHeaderNames()
                        + " in " + triplesFile);
            }
            store.createTable(StoreSchema.authorAffiliations());

            for (CSVRecord record : parser) {
                token.throwIfCancelled(Stage.LOAD, rowsRead);
                rowsRead++;
                List<String> raw = record.toList();
                long line = record.getRecordNumber();

                ErrorRecord error = validate(line, raw);
                if (error == null) {
                    NormalizedTriple triple = TripleCodec.decode(raw);
                    StoreRecord storeRecord = new StoreRecord(triple, authorKeys.deriveKey(triple),
                            affiliationKeys.deriveKey(triple.affiliationNameNormalized()), sourceFile);
                    batch.add(storeRecord, line, raw);
                } else {
                    reject(errors, byReason, error);
                }

                if (batch.size() >= options.getBatchSize()) {
                    accepted += flush(batch, errors, byReason);
                }
                if (rowsRead % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(rowsRead, -1, "Loaded " + rowsRead + " rows");
                }
            }
            accepted += flush(batch, errors, byReason);
            store.createIndex(options.getIndexColumns());
            errors.commit();
        } catch (IOException | UncheckedIOException e) {
            throw new PipelineException(Stage.LOAD, String.valueOf(rowsRead), "I/O failure: " + e.getMessage(), e);
        }

        long rejected = byReason.values().stream().mapToLong(Long::longValue).sum();
        LoadResult result = new LoadResult(rowsRead, accepted, rejected, byReason, errorLog);
        metrics.recordStageDuration(Stage.LOAD, Duration.between(start, Instant.now()));
        cb.onProgress(rowsRead, rowsRead, "Load completed");
        log.info("load.completed input={} storeRows={} result={}", triplesFile, store.count(), result);
        return result;
    }

    /**
     * Returns the reason a row cannot be loaded, or null if it is valid.
     */
    ErrorRecord validate(long line, List<String> raw) {
        if (raw.size() != TripleCodec.COLUMNS.size()) {
            return new ErrorRecord(line, RejectionReason.MALFORMED_ROW,
                    "expected " + TripleCodec.COLUMNS.size() + " columns but found " + raw.size(), raw);
        }
        NormalizedTriple triple;
        try {
            triple = TripleCodec.decode(raw);
        } catch (NumberFormatException e) {
            return new ErrorRecord(line, RejectionReason.TYPE_MISMATCH,
                    "sequence is not an integer: " + e.getMessage(), raw);
        }
        if (triple.documentId().isBlank()) {
            return new ErrorRecord(line, RejectionReason.MISSING_DOCUMENT_ID, "document_id is empty", raw);
        }
        if (triple.authorNameOriginal().isBlank()) {
            return new ErrorRecord(line, RejectionReason.MISSING_AUTHOR_NAME, "author_name_original is empty", raw);
        }
        for (int i = 0; i < raw.size(); i++) {
            try {
                InputSanitizer.validateValue(TripleCodec.COLUMNS.get(i), raw.get(i), options.getMaxValueLength());
            } catch (IllegalArgumentException e) {
                return new ErrorRecord(line, RejectionReason.INVALID_VALUE, e.getMessage(), raw);
            }
        }
        return null;
    }

    private long flush(Batch batch, ErrorLogWriter errors, Map<RejectionReason, Long> byReason) throws IOException {
        if (batch.size() == 0) {
            return 0;
        }
        BatchInsertResult result = store.batchInsert(batch.records);
        for (BatchInsertResult.RejectedRow rejectedRow : result.rejected()) {
            Batch.Source source = batch.sources.get(rejectedRow.record());
            long line = source != null ? source.line() : 0;
            List<String> raw = source != null ? source.raw() : List.of();
            reject(errors, byReason, new ErrorRecord(line, RejectionReason.STORE_REJECTED, rejectedRow.reason(), raw));
        }
        metrics.incrementRowsAccepted(result.accepted());
        log.debug("load.batchFlushed size={} accepted={} rejected={}",
                batch.size(), result.accepted(), result.rejected().size());
        batch.clear();
        return result.accepted();
    }

    private void reject(ErrorLogWriter errors, Map<RejectionReason, Long> byReason, ErrorRecord error)
            throws IOException {
        errors.write(error);
        byReason.merge(error.reason(), 1L, Long::sum);
        metrics.incrementRowRejected(error.reason());
        log.debug("load.rowRejected line={} reason={} message={}", error.lineNumber(), error.reason(), error.message());
    }

    /**
     * Pending rows plus the input line each came from, looked up by identity when the store refuses one.
     */
    private static final class Batch {
        private final List<StoreRecord> records = new ArrayList<>();
        private final Map<StoreRecord, Source> sources = new IdentityHashMap<>();

        private record Source(long line, List<String> raw) {}

        void add(StoreRecord record, long line, List<String> raw) {
            records.add(record);
            sources.put(record, new Source(line, raw));
        }

        int size() {
            return records.size();
        }

        void clear() {
            records.clear();
            sources.clear();
        }
    }
}
