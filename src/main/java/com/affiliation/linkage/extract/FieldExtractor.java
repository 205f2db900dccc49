package com.affiliation.linkage.extract;

import com.affiliation.linkage.core.model.FlatFieldRow;
import com.affiliation.linkage.logging.LogContext;
import com.affiliation.linkage.metrics.MetricsService;
import com.affiliation.linkage.metrics.NoOpMetricsService;
import com.affiliation.linkage.pipeline.CancellationToken;
import com.affiliation.linkage.pipeline.PipelineException;
import com.affiliation.linkage.pipeline.ProgressCallback;
import com.affiliation.linkage.pipeline.ResourceExhaustedException;
import com.affiliation.linkage.pipeline.Stage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;

/**
 * Extracts flat field rows from a directory of gzip-compressed JSON Lines shards.
 *
 * <p>Shards are distributed over a fixed pool of workers. Each worker decompresses,
 * parses and extracts its own shard and hands finished batches to the shared
 * {@link RowSink}, which is the only state shared between workers.</p>
 */
public class FieldExtractor {
    private static final Logger log = LoggerFactory.getLogger(FieldExtractor.class);
    private static final long PROGRESS_INTERVAL = 100_000;

    private final ExtractionOptions options;
    private final RecordExtractor recordExtractor;
    private final MetricsService metrics;

    public FieldExtractor(ExtractionOptions options) {
        this(options, new ObjectMapper(), new NoOpMetricsService());
    }

    public FieldExtractor(ExtractionOptions options, ObjectMapper objectMapper, MetricsService metrics) {
        this.options = options;
        this.recordExtractor = new RecordExtractor(options, objectMapper);
        this.metrics = metrics;
    }

    public ExtractionResult extract(Path inputDir, RowSink sink) {
        return extract(inputDir, sink, CancellationToken.NONE, ProgressCallback.NOOP);
    }

    /**
     * Runs extraction over every shard under {@code inputDir}.
     * On success the sink is completed; on a fatal error or cancellation it is aborted
     * and the exception is rethrown.
     */
    public ExtractionResult extract(Path inputDir, RowSink sink, CancellationToken token, ProgressCallback callback) {
        String runId = LogContext.generateRunId();
        Instant start = Instant.now();
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;

        try (LogContext ctx = LogContext.forStage(runId, Stage.EXTRACT.label())) {
            List<Path> shards = findShards(inputDir);
            int threads = Math.max(1, Math.min(options.effectiveThreads(), Math.max(1, shards.size())));
            log.info("extract.started shards={} threads={} paths={}", shards.size(), threads, options.getFieldPaths());

            AtomicBoolean failed = new AtomicBoolean(false);
            AtomicLong recordsSeen = new AtomicLong();
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            ExtractionResult total = ExtractionResult.empty();
            try {
                List<Future<ExtractionResult>> futures = new ArrayList<>();
                for (Path shard : shards) {
                    futures.add(executor.submit(() ->
                            processShard(runId, inputDir, shard, sink, token, failed, recordsSeen, cb)));
                }
                for (Future<ExtractionResult> future : futures) {
                    total = total.plus(await(future, failed));
                }
                executor.shutdown();
                synchronized (sink) {
                    sink.complete();
                }
            } catch (IOException e) {
                abort(executor, sink, failed);
                throw new ResourceExhaustedException(Stage.EXTRACT, "cannot finalize output", e);
            } catch (RuntimeException e) {
                abort(executor, sink, failed);
                throw e;
            } finally {
                executor.shutdownNow();
            }

            metrics.recordStageDuration(Stage.EXTRACT, Duration.between(start, Instant.now()));
            cb.onProgress(total.recordsRead(), total.recordsRead(), "Extraction completed");
            log.info("extract.completed result={}", total);
            return total;
        }
    }

    private void abort(ExecutorService executor, RowSink sink, AtomicBoolean failed) {
        failed.set(true);
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("extract.abort.workersStillRunning");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        synchronized (sink) {
            sink.abort();
        }
    }

    private ExtractionResult await(Future<ExtractionResult> future, AtomicBoolean failed) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            failed.set(true);
            Thread.currentThread().interrupt();
            throw new PipelineException(Stage.EXTRACT, null, "interrupted", e);
        } catch (ExecutionException e) {
            failed.set(true);
            Throwable cause = e.getCause();
            if (cause instanceof PipelineException pe) {
                throw pe;
            }
            throw new PipelineException(Stage.EXTRACT, null, "worker failed: " + cause.getMessage(), cause);
        }
    }

    private ExtractionResult processShard(String runId, Path inputDir, Path shard, RowSink sink,
                                          CancellationToken token, AtomicBoolean failed,
                                          AtomicLong recordsSeen, ProgressCallback cb) {
        String shardName = inputDir.relativize(shard).toString();
        try (LogContext ctx = LogContext.forShard(runId, shardName)) {
            long read = 0, emitted = 0, filtered = 0, missingId = 0, parseErrors = 0, rows = 0;
            List<FlatFieldRow> batch = new ArrayList<>(Math.min(options.getBatchSize(), 10_000));

            try (BufferedReader reader = openShard(shard)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (failed.get()) {
                        return ExtractionResult.empty();
                    }
                    token.throwIfCancelled(Stage.EXTRACT, recordsSeen.get());
                    if (line.isBlank()) {
                        continue;
                    }
                    read++;
                    long seen = recordsSeen.incrementAndGet();
                    if (seen % PROGRESS_INTERVAL == 0) {
                        cb.onProgress(seen, -1, "Processed " + seen + " records");
                    }

                    RecordExtractor.Extraction extraction = recordExtractor.extract(line, shardName);
                    switch (extraction.outcome()) {
                        case PARSE_ERROR -> {
                            parseErrors++;
                            log.debug("extract.parseError shard={} line={}", shardName, read);
                        }
                        case FILTERED -> filtered++;
                        case MISSING_ID -> missingId++;
                        case EMITTED -> {
                            emitted++;
                            batch.addAll(extraction.rows());
                            if (batch.size() >= options.getBatchSize()) {
                                rows += flush(sink, batch);
                            }
                        }
                    }
                }
            } catch (IOException e) {
                log.warn("extract.shardFailed shard={} afterRecords={} error={}", shardName, read, e.getMessage());
                rows += flush(sink, batch);
                record(read, parseErrors, rows);
                return new ExtractionResult(0, 1, read, emitted, filtered, missingId, parseErrors, rows);
            }
            rows += flush(sink, batch);
            record(read, parseErrors, rows);
            log.info("extract.shardCompleted shard={} records={} rows={} parseErrors={}",
                    shardName, read, rows, parseErrors);
            return new ExtractionResult(1, 0, read, emitted, filtered, missingId, parseErrors, rows);
        }
    }

    private long flush(RowSink sink, List<FlatFieldRow> batch) {
        if (batch.isEmpty()) {
            return 0;
        }
        int size = batch.size();
        synchronized (sink) {
            try {
                sink.write(batch);
            } catch (IOException e) {
                throw new ResourceExhaustedException(Stage.EXTRACT, "cannot write extracted rows", e);
            }
        }
        batch.clear();
        return size;
    }

    private void record(long read, long parseErrors, long rows) {
        metrics.incrementRecordsParsed(read - parseErrors);
        metrics.incrementParseErrors(parseErrors);
        metrics.incrementRowsEmitted(rows);
    }

    private BufferedReader openShard(Path shard) throws IOException {
        InputStream in = Files.newInputStream(shard);
        try {
            return new BufferedReader(new InputStreamReader(new GZIPInputStream(in, 64 * 1024), StandardCharsets.UTF_8));
        } catch (IOException e) {
            in.close();
            throw e;
        }
    }

    private List<Path> findShards(Path inputDir) {
        try (Stream<Path> files = Files.walk(inputDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(options.getShardSuffix()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PipelineException(Stage.EXTRACT, null, "cannot list input directory " + inputDir, e);
        }
    }
}
