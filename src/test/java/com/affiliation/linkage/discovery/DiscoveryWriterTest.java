package com.affiliation.linkage.discovery;

import com.affiliation.linkage.io.PartialFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DiscoveryWriter Tests")
class DiscoveryWriterTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should write the three discovery files under the prefix")
    void shouldWriteAllFiles() throws Exception {
        DiscoverySeed seed = new DiscoverySeed("university oxford", SeedSource.LINKAGE,
                "University of Oxford", "D1", 0);
        DiscoverySeed nameSeed = new DiscoverySeed("university oxford", SeedSource.AFFILIATION_NAME,
                "Univ. Oxford", "", null);
        DiscoveryReport report = new DiscoveryReport(2, 1,
                List.of(new DiscoveryLogEntry(seed, "D5", "Dan Poe", "University of Oxford, UK", "I42"),
                        new DiscoveryLogEntry(nameSeed, "D5", "Dan Poe", "University of Oxford, UK", "I42")),
                List.of(new DiscoveredWork("D5", "university oxford", SeedSource.LINKAGE, "D1", 0)),
                List.of(new UnmatchedInput("D9", SeedSource.DOCUMENT_ID, "document not found in store")),
                1);
        DiscoveryWriter writer = new DiscoveryWriter(dir, "run1");

        writer.write(report);

        assertEquals(dir.resolve("run1_full_discovery_log.csv"), writer.fullLogPath());
        List<String> logLines = Files.readAllLines(writer.fullLogPath(), StandardCharsets.UTF_8);
        assertEquals(String.join(",", DiscoveryWriter.LOG_COLUMNS), logLines.get(0));
        assertEquals("linkage,University of Oxford,D1,0,university oxford,D5,Dan Poe,\"University of Oxford, UK\",I42",
                logLines.get(1));
        assertEquals("affiliation_name,Univ. Oxford,,,university oxford,D5,Dan Poe,\"University of Oxford, UK\",I42",
                logLines.get(2));

        List<String> workLines = Files.readAllLines(writer.discoveredWorksPath(), StandardCharsets.UTF_8);
        assertEquals(List.of(String.join(",", DiscoveryWriter.WORK_COLUMNS), "D5,university oxford,linkage,D1,0"), workLines);

        List<String> unmatchedLines = Files.readAllLines(writer.unmatchedPath(), StandardCharsets.UTF_8);
        assertEquals("D9,document_id,document not found in store", unmatchedLines.get(1));

        try (Stream<Path> files = Files.list(dir)) {
            assertTrue(files.noneMatch(PartialFile::isPartial));
        }
    }

    @Test
    @DisplayName("An empty report still writes headers")
    void shouldWriteHeadersForEmptyReport() throws Exception {
        DiscoveryWriter writer = new DiscoveryWriter(dir, "empty");

        writer.write(new DiscoveryReport(0, 0, List.of(), List.of(), List.of(), 0));

        assertEquals(1, Files.readAllLines(writer.fullLogPath()).size());
        assertEquals(1, Files.readAllLines(writer.discoveredWorksPath()).size());
        assertEquals(1, Files.readAllLines(writer.unmatchedPath()).size());
    }
}
