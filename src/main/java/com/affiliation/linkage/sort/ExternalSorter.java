package com.affiliation.linkage.sort;

import com.affiliation.linkage.core.model.FlatFieldRow;
import com.affiliation.linkage.io.CsvRowReader;
import com.affiliation.linkage.io.CsvTables;
import com.affiliation.linkage.io.FlatRowCodec;
import com.affiliation.linkage.io.MalformedRowException;
import com.affiliation.linkage.io.PartialFile;
import com.affiliation.linkage.logging.LogContext;
import com.affiliation.linkage.metrics.MetricsService;
import com.affiliation.linkage.metrics.NoOpMetricsService;
import com.affiliation.linkage.pipeline.CancellationToken;
import com.affiliation.linkage.pipeline.PipelineException;
import com.affiliation.linkage.pipeline.ResourceExhaustedException;
import com.affiliation.linkage.pipeline.SortIntegrityException;
import com.affiliation.linkage.pipeline.Stage;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Sorts a flat-row file by document id with bounded memory.
 *
 * <p>The input is cut into chunks that fit the memory budget. Chunks are stable-sorted in
 * parallel and spilled to temporary files, then merged by a single thread through a min-heap
 * of spill cursors ordered by (document id, spill index). Taking the lower spill index on
 * equal keys keeps the sort stable across chunks.</p>
 */
public class ExternalSorter {
    private static final Logger log = LoggerFactory.getLogger(ExternalSorter.class);
    private static final Comparator<FlatFieldRow> BY_DOCUMENT_ID = Comparator.comparing(FlatFieldRow::documentId);
    private static final int CANCEL_CHECK_INTERVAL = 1_000;

    private final SortOptions options;
    private final MetricsService metrics;

    public ExternalSorter(SortOptions options) {
        this(options, new NoOpMetricsService());
    }

    public ExternalSorter(SortOptions options, MetricsService metrics) {
        this.options = options;
        this.metrics = metrics;
    }

    public SortResult sort(Path input, Path output) {
        return sort(input, output, CancellationToken.NONE);
    }

    /**
     * Sorts {@code input} into {@code output}. The output only appears under its final name
     * once the merge has completed; spill files are removed in every case.
     */
    public SortResult sort(Path input, Path output, CancellationToken token) {
        Instant start = Instant.now();
        try (LogContext ctx = LogContext.forStage(LogContext.generateRunId(), Stage.SORT.label())) {
            Path spillDir = createSpillDir();
            int threads = options.effectiveThreads();
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                log.info("sort.started input={} chunkBytes={} threads={}", input, options.chunkBytes(), threads);
                List<Future<Path>> pending = new ArrayList<>();
                long rowsRead = split(input, spillDir, executor, new Semaphore(threads), pending, token);
                List<Path> spills = awaitSpills(pending);
                metrics.incrementSpillFiles(spills.size());

                Path partial = PartialFile.partialOf(output);
                long rowsWritten = merge(spills, partial, token);
                if (rowsWritten != rowsRead) {
                    throw new SortIntegrityException("0-" + rowsRead,
                            "merged " + rowsWritten + " rows but read " + rowsRead);
                }
                commit(partial, output);

                SortResult result = new SortResult(rowsRead, rowsWritten, spills.size());
                metrics.recordStageDuration(Stage.SORT, Duration.between(start, Instant.now()));
                log.info("sort.completed output={} result={}", output, result);
                return result;
            } finally {
                stop(executor);
                deleteRecursively(spillDir);
            }
        }
    }

    private long split(Path input, Path spillDir, ExecutorService executor, Semaphore inFlight,
                       List<Future<Path>> pending, CancellationToken token) {
        long rowsRead = 0;
        long chunkStart = 1;
        long bytes = 0;
        List<FlatFieldRow> chunk = new ArrayList<>();
        try (CsvRowReader<FlatFieldRow> reader = FlatRowCodec.reader(input)) {
            while (reader.hasNext()) {
                if (rowsRead % CANCEL_CHECK_INTERVAL == 0) {
                    token.throwIfCancelled(Stage.SORT, rowsRead);
                }
                FlatFieldRow row = reader.next();
                rowsRead++;
                chunk.add(row);
                bytes += row.estimatedBytes();
                if (bytes >= options.chunkBytes()) {
                    submit(chunk, pending.size(), chunkStart, rowsRead, spillDir, executor, inFlight, pending);
                    chunk = new ArrayList<>();
                    bytes = 0;
                    chunkStart = rowsRead + 1;
                }
            }
            if (!chunk.isEmpty()) {
                submit(chunk, pending.size(), chunkStart, rowsRead, spillDir, executor, inFlight, pending);
            }
            return rowsRead;
        } catch (MalformedRowException e) {
            throw new SortIntegrityException(chunkStart + "-" + (rowsRead + 1), "malformed input row", e);
        } catch (UncheckedIOException e) {
            throw new SortIntegrityException(chunkStart + "-" + (rowsRead + 1), "unreadable input", e);
        } catch (IOException e) {
            throw new PipelineException(Stage.SORT, null, "cannot read " + input, e);
        }
    }

    private void submit(List<FlatFieldRow> chunk, int index, long firstRow, long lastRow, Path spillDir,
                        ExecutorService executor, Semaphore inFlight, List<Future<Path>> pending) {
        try {
            inFlight.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException(Stage.SORT, firstRow + "-" + lastRow, "interrupted", e);
        }
        Path spill = spillDir.resolve(String.format("chunk-%06d.csv", index));
        pending.add(executor.submit(() -> {
            try {
                chunk.sort(BY_DOCUMENT_ID);
                writeSpill(chunk, spill);
                log.debug("sort.spilled chunk={} rows={}-{}", index, firstRow, lastRow);
                return spill;
            } catch (IOException e) {
                throw new ResourceExhaustedException(Stage.SORT,
                        "cannot spill rows " + firstRow + "-" + lastRow + " to " + spill, e);
            } finally {
                inFlight.release();
            }
        }));
    }

    private static void writeSpill(List<FlatFieldRow> chunk, Path spill) throws IOException {
        try (CSVPrinter printer = CsvTables.create(spill, FlatFieldRow.COLUMNS)) {
            for (FlatFieldRow row : chunk) {
                FlatRowCodec.write(printer, row);
            }
        }
    }

    private List<Path> awaitSpills(List<Future<Path>> pending) {
        List<Path> spills = new ArrayList<>(pending.size());
        for (Future<Path> future : pending) {
            try {
                spills.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PipelineException(Stage.SORT, null, "interrupted", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof PipelineException pe) {
                    throw pe;
                }
                throw new PipelineException(Stage.SORT, null, "chunk sort failed", e.getCause());
            }
        }
        return spills;
    }

    private long merge(List<Path> spills, Path partial, CancellationToken token) {
        PriorityQueue<SpillCursor> heap = new PriorityQueue<>(Math.max(1, spills.size()),
                Comparator.comparing((SpillCursor c) -> c.current().documentId()).thenComparingInt(SpillCursor::index));
        List<SpillCursor> cursors = new ArrayList<>();
        long written = 0;
        try {
            for (int i = 0; i < spills.size(); i++) {
                SpillCursor cursor = new SpillCursor(spills.get(i), i);
                cursors.add(cursor);
                if (cursor.advance()) {
                    heap.add(cursor);
                }
            }
            try (CSVPrinter printer = CsvTables.create(partial, FlatFieldRow.COLUMNS)) {
                while (!heap.isEmpty()) {
                    if (written % CANCEL_CHECK_INTERVAL == 0) {
                        token.throwIfCancelled(Stage.SORT, written);
                    }
                    SpillCursor cursor = heap.poll();
                    FlatRowCodec.write(printer, cursor.current());
                    written++;
                    if (cursor.advance()) {
                        heap.add(cursor);
                    }
                }
            }
            return written;
        } catch (IOException e) {
            throw new ResourceExhaustedException(Stage.SORT, "cannot write merged output " + partial, e);
        } finally {
            for (SpillCursor cursor : cursors) {
                cursor.close();
            }
        }
    }

    private static void commit(Path partial, Path output) {
        try {
            PartialFile.commit(partial, output);
        } catch (IOException e) {
            throw new ResourceExhaustedException(Stage.SORT, "cannot rename " + partial + " to " + output, e);
        }
    }

    private static void stop(ExecutorService executor) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("sort.workersStillRunning");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Path createSpillDir() {
        Path base = options.tempDir() != null ? options.tempDir() : Paths.get(System.getProperty("java.io.tmpdir"));
        try {
            Files.createDirectories(base);
            return Files.createTempDirectory(base, "sort-spill-");
        } catch (IOException e) {
            throw new ResourceExhaustedException(Stage.SORT, "cannot create spill directory under " + base, e);
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("sort.cleanupFailed path={} error={}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("sort.cleanupFailed dir={} error={}", dir, e.getMessage());
        }
    }

    /**
     * Reads one spill file and checks that its keys never decrease.
     */
    private static final class SpillCursor implements AutoCloseable {
        private final Path path;
        private final int index;
        private CsvRowReader<FlatFieldRow> reader;
        private FlatFieldRow current;

        SpillCursor(Path path, int index) {
            this.path = path;
            this.index = index;
        }

        int index() {
            return index;
        }

        FlatFieldRow current() {
            return current;
        }

        boolean advance() {
            try {
                if (reader == null) {
                    reader = FlatRowCodec.reader(path);
                }
                if (!reader.hasNext()) {
                    current = null;
                    return false;
                }
                FlatFieldRow next = reader.next();
                if (current != null && next.documentId().compareTo(current.documentId()) < 0) {
                    throw new SortIntegrityException(range(), "spill " + path.getFileName() + " is out of order");
                }
                current = next;
                return true;
            } catch (MalformedRowException | UncheckedIOException e) {
                throw new SortIntegrityException(range(), "corrupt spill " + path.getFileName(), e);
            } catch (IOException e) {
                throw new SortIntegrityException(range(), "cannot read spill " + path.getFileName(), e);
            }
        }

        private String range() {
            long at = reader == null ? 0 : reader.lastRecordNumber();
            return "chunk " + index + " row " + at;
        }

        @Override
        public void close() {
            if (reader != null) {
                try {
                    reader.close();
                } catch (IOException e) {
                    log.debug("sort.spillCloseFailed path={} error={}", path, e.getMessage());
                }
            }
        }
    }
}
