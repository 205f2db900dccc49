package com.affiliation.linkage.sort;

import com.affiliation.linkage.core.model.FlatFieldRow;
import com.affiliation.linkage.io.CsvRowReader;
import com.affiliation.linkage.io.CsvTables;
import com.affiliation.linkage.io.FlatRowCodec;
import com.affiliation.linkage.pipeline.SortIntegrityException;
import org.apache.commons.csv.CSVPrinter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExternalSorter Tests")
class ExternalSorterTest {

    @TempDir
    Path tempDir;

    private static FlatFieldRow row(String documentId, int sequence) {
        return new FlatFieldRow(documentId, "authorships.author.display_name",
                "authorships[" + sequence + "].author.display_name", "Author " + sequence,
                "S1", "10.1000", "part_000.gz");
    }

    private Path write(String name, List<FlatFieldRow> rows) throws IOException {
        Path file = tempDir.resolve(name);
        try (CSVPrinter printer = CsvTables.create(file, FlatFieldRow.COLUMNS)) {
            for (FlatFieldRow row : rows) {
                FlatRowCodec.write(printer, row);
            }
        }
        return file;
    }

    private static List<FlatFieldRow> read(Path file) throws IOException {
        List<FlatFieldRow> rows = new ArrayList<>();
        try (CsvRowReader<FlatFieldRow> reader = FlatRowCodec.reader(file)) {
            reader.forEachRemaining(rows::add);
        }
        return rows;
    }

    private static List<FlatFieldRow> shuffledRows(int documents, int rowsPerDocument) {
        Random random = new Random(42);
        List<String> ids = new ArrayList<>();
        for (int d = 0; d < documents; d++) {
            ids.add("https://openalex.org/W" + random.nextInt(1_000_000));
        }
        List<FlatFieldRow> rows = new ArrayList<>();
        Map<String, Integer> next = new HashMap<>();
        for (int i = 0; i < documents * rowsPerDocument; i++) {
            String id = ids.get(random.nextInt(ids.size()));
            int sequence = next.merge(id, 1, Integer::sum) - 1;
            rows.add(row(id, sequence));
        }
        return rows;
    }

    private SortOptions smallMemory() {
        return new SortOptions(SortOptions.MIN_CHUNK_BYTES, 2, tempDir.resolve("spill"));
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("Output is ordered by document id and keeps every row")
        void sortsAndPreservesRows() throws IOException {
            List<FlatFieldRow> input = shuffledRows(200, 10);
            Path in = write("flat_rows.csv", input);
            Path out = tempDir.resolve("sorted_rows.csv");

            SortResult result = new ExternalSorter(smallMemory()).sort(in, out);

            List<FlatFieldRow> sorted = read(out);
            assertEquals(input.size(), result.rowsRead());
            assertEquals(input.size(), result.rowsWritten());
            assertTrue(result.isSuccessful());
            assertTrue(result.spillFiles() > 1, "expected several spills, got " + result.spillFiles());

            for (int i = 1; i < sorted.size(); i++) {
                assertTrue(sorted.get(i - 1).documentId().compareTo(sorted.get(i).documentId()) <= 0);
            }
            Comparator<FlatFieldRow> total = Comparator.comparing(FlatFieldRow::documentId)
                    .thenComparing(FlatFieldRow::indexedPath);
            assertEquals(input.stream().sorted(total).collect(Collectors.toList()),
                    sorted.stream().sorted(total).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Rows with the same document id keep their input order across spills")
        void stable() throws IOException {
            List<FlatFieldRow> input = shuffledRows(50, 40);
            Path out = tempDir.resolve("sorted_rows.csv");

            new ExternalSorter(smallMemory()).sort(write("flat_rows.csv", input), out);

            Map<String, List<String>> expected = new HashMap<>();
            for (FlatFieldRow row : input) {
                expected.computeIfAbsent(row.documentId(), k -> new ArrayList<>()).add(row.indexedPath());
            }
            Map<String, List<String>> actual = new HashMap<>();
            for (FlatFieldRow row : read(out)) {
                actual.computeIfAbsent(row.documentId(), k -> new ArrayList<>()).add(row.indexedPath());
            }
            assertEquals(expected, actual);
        }

        @Test
        @DisplayName("An empty input produces an empty output with a header")
        void emptyInput() throws IOException {
            Path out = tempDir.resolve("sorted_rows.csv");

            SortResult result = new ExternalSorter(smallMemory()).sort(write("flat_rows.csv", List.of()), out);

            assertEquals(0, result.rowsWritten());
            assertEquals(0, result.spillFiles());
            assertTrue(read(out).isEmpty());
        }

        @Test
        @DisplayName("Spill files are removed after the merge")
        void cleansUpSpills() throws IOException {
            Path spillRoot = tempDir.resolve("spill");
            new ExternalSorter(smallMemory()).sort(write("flat_rows.csv", shuffledRows(100, 10)),
                    tempDir.resolve("sorted_rows.csv"));

            try (Stream<Path> leftovers = Files.list(spillRoot)) {
                assertEquals(0, leftovers.count());
            }
        }
    }

    @Nested
    @DisplayName("Integrity")
    class Integrity {

        @Test
        @DisplayName("A row with the wrong number of columns aborts the sort")
        void malformedRow() throws IOException {
            Path in = write("flat_rows.csv", List.of(row("W1", 0)));
            Files.writeString(in, Files.readString(in) + "W2,only-two\n");
            Path out = tempDir.resolve("sorted_rows.csv");

            SortIntegrityException e = assertThrows(SortIntegrityException.class,
                    () -> new ExternalSorter(smallMemory()).sort(in, out));

            assertNotNull(e.getRecordRange());
            assertFalse(Files.exists(out));
        }

        @Test
        @DisplayName("An input with an unexpected header aborts the sort")
        void wrongHeader() throws IOException {
            Path in = tempDir.resolve("flat_rows.csv");
            Files.writeString(in, "a,b,c\n1,2,3\n");

            assertThrows(SortIntegrityException.class,
                    () -> new ExternalSorter(smallMemory()).sort(in, tempDir.resolve("sorted_rows.csv")));
        }

        @Test
        @DisplayName("A memory limit below one chunk is rejected")
        void memoryLimit() {
            assertThrows(IllegalArgumentException.class, () -> new SortOptions(1024, 1, null));
            assertThrows(IllegalArgumentException.class, () -> new SortOptions(1 << 20, -1, null));
        }
    }
}
