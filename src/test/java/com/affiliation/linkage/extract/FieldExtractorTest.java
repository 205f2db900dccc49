package com.affiliation.linkage.extract;

import com.affiliation.linkage.core.model.FlatFieldRow;
import com.affiliation.linkage.io.CsvRowReader;
import com.affiliation.linkage.io.FlatRowCodec;
import com.affiliation.linkage.io.PartialFile;
import com.affiliation.linkage.pipeline.CancellationToken;
import com.affiliation.linkage.pipeline.ProgressCallback;
import com.affiliation.linkage.pipeline.StageCancelledException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FieldExtractor Tests")
class FieldExtractorTest {

    @TempDir
    Path tempDir;

    private static String work(String id, String source, String author, String affiliation) {
        return "{\"id\":\"" + id + "\",\"doi\":\"https://doi.org/10.1000/" + id + "\","
                + "\"primary_location\":{\"source\":{\"id\":\"" + source + "\"}},"
                + "\"authorships\":[{\"author\":{\"display_name\":\"" + author + "\"},"
                + "\"raw_affiliation_strings\":[\"" + affiliation + "\"]}]}";
    }

    static void writeShard(Path file, List<String> lines) throws IOException {
        Files.createDirectories(file.getParent());
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file));
             Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
            for (String line : lines) {
                writer.write(line);
                writer.write('\n');
            }
        }
    }

    static List<FlatFieldRow> readRows(Path file) throws IOException {
        List<FlatFieldRow> rows = new ArrayList<>();
        try (CsvRowReader<FlatFieldRow> reader = FlatRowCodec.reader(file)) {
            reader.forEachRemaining(rows::add);
        }
        return rows;
    }

    private Path corpus() throws IOException {
        Path input = tempDir.resolve("corpus");
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            String line = work("W" + i, "S" + (i % 5), "Author " + i, "Affiliation " + i);
            (i % 2 == 0 ? first : second).add(line);
        }
        first.add("{broken json");
        first.add("");
        second.add("{\"authorships\":[]}");
        writeShard(input.resolve("updated_date=2024-01-01/part_000.gz"), first);
        writeShard(input.resolve("updated_date=2024-01-02/part_000.gz"), second);
        return input;
    }

    private ExtractionOptions.Builder options() {
        return ExtractionOptions.builder()
                .fieldPaths("authorships.author.display_name", "authorships.raw_affiliation_strings")
                .groupingKey1Path("primary_location.source.id")
                .groupingKey2Path("doi")
                .threads(2)
                .batchSize(4);
    }

    @Nested
    @DisplayName("Single-file mode")
    class SingleFile {

        @Test
        @DisplayName("Extracts every shard and counts recoverable errors")
        void extractsAllShards() throws IOException {
            Path output = tempDir.resolve("flat_rows.csv");
            ExtractionResult result = new FieldExtractor(options().build())
                    .extract(corpus(), new SingleFileRowSink(output));

            assertEquals(2, result.shardsProcessed());
            assertEquals(0, result.shardsFailed());
            assertEquals(32, result.recordsRead());
            assertEquals(30, result.recordsEmitted());
            assertEquals(1, result.parseErrors());
            assertEquals(1, result.recordsMissingId());
            assertEquals(60, result.rowsEmitted());
            assertTrue(result.isSuccessful());

            List<FlatFieldRow> rows = readRows(output);
            assertEquals(60, rows.size());
            assertFalse(Files.exists(PartialFile.partialOf(output)));
            assertTrue(rows.stream().allMatch(r -> r.originShard().endsWith("part_000.gz")));
        }

        @Test
        @DisplayName("Rows of one record stay together in document order")
        void recordRowsStayTogether() throws IOException {
            Path output = tempDir.resolve("flat_rows.csv");
            new FieldExtractor(options().build()).extract(corpus(), new SingleFileRowSink(output));

            List<FlatFieldRow> rows = readRows(output);
            for (int i = 0; i < rows.size(); i += 2) {
                assertEquals(rows.get(i).documentId(), rows.get(i + 1).documentId());
                assertEquals("authorships.author.display_name", rows.get(i).fieldName());
                assertEquals("authorships.raw_affiliation_strings", rows.get(i + 1).fieldName());
            }
        }

        @Test
        @DisplayName("A shard that cannot be decompressed is counted as failed")
        void corruptShard() throws IOException {
            Path input = corpus();
            Files.writeString(input.resolve("broken.gz"), "this is not gzip");

            ExtractionResult result = new FieldExtractor(options().build())
                    .extract(input, new SingleFileRowSink(tempDir.resolve("out.csv")));

            assertEquals(1, result.shardsFailed());
            assertEquals(60, result.rowsEmitted());
        }

        @Test
        @DisplayName("Cancellation aborts the sink and leaves no final output")
        void cancellation() throws IOException {
            Path input = corpus();
            Path output = tempDir.resolve("cancelled.csv");
            CancellationToken token = new CancellationToken();
            token.cancel();

            assertThrows(StageCancelledException.class, () -> new FieldExtractor(options().build())
                    .extract(input, new SingleFileRowSink(output), token, ProgressCallback.NOOP));
            assertFalse(Files.exists(output));
        }
    }

    @Nested
    @DisplayName("Organize mode")
    class Organize {

        @Test
        @DisplayName("Writes one file per grouping key 1 with a bounded number of open files")
        void boundedOpenFiles() throws IOException {
            Path input = corpus();
            Path outputDir = tempDir.resolve("organized");
            OrganizedRowSink sink = new OrganizedRowSink(outputDir, 2);

            ExtractionResult organized = new FieldExtractor(options().build()).extract(input, sink);
            ExtractionResult single = new FieldExtractor(options().build())
                    .extract(input, new SingleFileRowSink(tempDir.resolve("single.csv")));

            assertTrue(sink.getPeakOpenFiles() <= 2, "peak was " + sink.getPeakOpenFiles());
            assertEquals(0, sink.getOpenFiles());
            assertEquals(5, sink.getFileKeys().size());
            assertEquals(single.rowsEmitted(), organized.rowsEmitted());

            List<Path> files;
            try (Stream<Path> listing = Files.list(outputDir)) {
                files = listing.sorted().collect(Collectors.toList());
            }
            assertEquals(5, files.size());
            assertTrue(files.stream().noneMatch(PartialFile::isPartial));

            long total = 0;
            for (Path file : files) {
                List<FlatFieldRow> rows = readRows(file);
                String key = file.getFileName().toString().replace(".csv", "");
                assertTrue(rows.stream().allMatch(r -> r.groupingKey1().equals(key)));
                total += rows.size();
            }
            assertEquals(single.rowsEmitted(), total);
        }

        @Test
        @DisplayName("A run after an aborted one does not keep the aborted rows")
        void rerunAfterAbort() throws IOException {
            Path outputDir = tempDir.resolve("rerun");
            FlatFieldRow row = new FlatFieldRow("D1", "title", "title", "T", "A", "", "s.gz");

            OrganizedRowSink aborted = new OrganizedRowSink(outputDir, 2);
            aborted.write(List.of(row));
            aborted.abort();

            OrganizedRowSink rerun = new OrganizedRowSink(outputDir, 2);
            rerun.write(List.of(row));
            rerun.complete();

            assertEquals(List.of(row), readRows(outputDir.resolve("A.csv")));
        }

        @Test
        @DisplayName("Rows reopened after eviction are appended without a second header")
        void appendAfterEviction() throws IOException {
            Path outputDir = tempDir.resolve("evicted");
            OrganizedRowSink sink = new OrganizedRowSink(outputDir, 1);
            FlatFieldRow a1 = new FlatFieldRow("D1", "title", "title", "T1", "A", "", "s.gz");
            FlatFieldRow b1 = new FlatFieldRow("D2", "title", "title", "T2", "B", "", "s.gz");
            FlatFieldRow a2 = new FlatFieldRow("D3", "title", "title", "T3", "A", "", "s.gz");

            sink.write(List.of(a1));
            sink.write(List.of(b1));
            sink.write(List.of(a2));
            sink.complete();

            assertEquals(List.of(a1, a2), readRows(outputDir.resolve("A.csv")));
            assertEquals(2, sink.getEvictions());
        }

        @Test
        @DisplayName("Distinct keys with the same safe name get separate files")
        void collidingKeys() throws IOException {
            Path outputDir = tempDir.resolve("colliding");
            OrganizedRowSink sink = new OrganizedRowSink(outputDir, 4);
            List<String> keys = List.of("https://x.org/a_b", "a/b", "a_b", "");
            for (int i = 0; i < keys.size(); i++) {
                sink.write(List.of(new FlatFieldRow("D" + i, "title", "title", "T", keys.get(i), "", "s.gz")));
            }
            sink.complete();

            assertEquals(4, sink.getFileKeys().size());
            assertTrue(sink.getFileKeys().contains("a_b"));
            assertTrue(sink.getFileKeys().contains(OrganizedRowSink.UNKNOWN_KEY));
            assertEquals("a_b", readRows(outputDir.resolve("a_b.csv")).get(0).groupingKey1());

            List<String> seen = new ArrayList<>();
            for (String stem : sink.getFileKeys()) {
                List<FlatFieldRow> rows = readRows(outputDir.resolve(stem + ".csv"));
                assertEquals(1, rows.size());
                seen.add(rows.get(0).groupingKey1());
            }
            assertEquals(Set.copyOf(keys), Set.copyOf(seen));
        }

        @Test
        @DisplayName("File names depend only on the key set")
        void stemsIgnoreArrivalOrder() {
            Set<String> forward = new LinkedHashSet<>(List.of("a/b", "a_b", "c"));
            Set<String> backward = new LinkedHashSet<>(List.of("c", "a_b", "a/b"));

            assertEquals(OrganizedRowSink.assignStems(forward), OrganizedRowSink.assignStems(backward));
            assertEquals("a_b", OrganizedRowSink.assignStems(forward).get("a_b"));
            assertNotEquals("a_b", OrganizedRowSink.assignStems(forward).get("a/b"));
        }

        @Test
        @DisplayName("Grouping keys are turned into safe file names")
        void fileKeys() {
            assertEquals("S123", OrganizedRowSink.fileKey("https://openalex.org/S123"));
            assertEquals("a_b", OrganizedRowSink.fileKey("a/b"));
            assertEquals(OrganizedRowSink.UNKNOWN_KEY, OrganizedRowSink.fileKey(""));
            assertEquals(OrganizedRowSink.UNKNOWN_KEY, OrganizedRowSink.fileKey(".."));
        }
    }
}
