package com.affiliation.linkage.extract;

import com.affiliation.linkage.core.model.FlatFieldRow;
import com.affiliation.linkage.io.CsvTables;
import com.affiliation.linkage.io.FlatRowCodec;
import com.affiliation.linkage.io.PartialFile;
import com.affiliation.linkage.pipeline.ResourceExhaustedException;
import com.affiliation.linkage.pipeline.Stage;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Writes one CSV file per grouping key 1 value into an output directory.
 *
 * <p>At most {@code maxOpenFiles} files are open at once. Open files are kept in
 * access order; when the pool is full the least recently used one is flushed and closed
 * before the next is opened. The first open of a key in a run truncates any leftover partial
 * file; a file reopened after eviction is appended to and its header is not repeated.
 * Rows with an empty key go to {@code unknown.csv}.</p>
 *
 * <p>Each distinct key gets its own file. When several keys sanitize to the same name, the key
 * spelled exactly like that name (or the empty key, for {@code unknown}) keeps it and the others
 * get a suffix derived from the key, so names depend only on the set of keys seen.</p>
 */
public class OrganizedRowSink implements RowSink {
    private static final Logger log = LoggerFactory.getLogger(OrganizedRowSink.class);

    static final String UNKNOWN_KEY = "unknown";
    private static final String EXTENSION = ".csv";

    private final Path outputDir;
    private final int maxOpenFiles;
    private final LinkedHashMap<String, CSVPrinter> open = new LinkedHashMap<>(16, 0.75f, true);
    private final Set<String> created = new LinkedHashSet<>();
    private final Set<String> fileStems = new LinkedHashSet<>();
    private int peakOpenFiles;
    private long evictions;
    private long rowsWritten;

    public OrganizedRowSink(Path outputDir, int maxOpenFiles) throws IOException {
        if (maxOpenFiles <= 0) {
            throw new IllegalArgumentException("maxOpenFiles must be > 0");
        }
        this.outputDir = outputDir;
        this.maxOpenFiles = maxOpenFiles;
        Files.createDirectories(outputDir);
    }

    @Override
    public void write(List<FlatFieldRow> batch) throws IOException {
        Map<String, List<FlatFieldRow>> byKey = new LinkedHashMap<>();
        for (FlatFieldRow row : batch) {
            byKey.computeIfAbsent(canonicalKey(row.groupingKey1()), k -> new ArrayList<>()).add(row);
        }
        for (Map.Entry<String, List<FlatFieldRow>> entry : byKey.entrySet()) {
            CSVPrinter printer = printerFor(entry.getKey());
            for (FlatFieldRow row : entry.getValue()) {
                FlatRowCodec.write(printer, row);
            }
            rowsWritten += entry.getValue().size();
        }
    }

    @Override
    public void complete() throws IOException {
        closeAll();
        for (Map.Entry<String, String> entry : assignStems(created).entrySet()) {
            Path target = outputDir.resolve(entry.getValue() + EXTENSION);
            PartialFile.commit(partialPath(entry.getKey()), target);
            fileStems.add(entry.getValue());
        }
        log.info("sink.completed dir={} files={} rows={} peakOpen={} evictions={}",
                outputDir, created.size(), rowsWritten, peakOpenFiles, evictions);
    }

    @Override
    public void abort() {
        try {
            closeAll();
        } catch (IOException e) {
            log.warn("sink.abort.closeFailed dir={} error={}", outputDir, e.getMessage());
        }
        log.warn("sink.aborted dir={} files={} rows={}", outputDir, created.size(), rowsWritten);
    }

    public int getOpenFiles() {
        return open.size();
    }

    /**
     * The largest number of files that were open at the same time.
     */
    public int getPeakOpenFiles() {
        return peakOpenFiles;
    }

    public long getEvictions() {
        return evictions;
    }

    /**
     * File name stems written by {@link #complete()}.
     */
    public Set<String> getFileKeys() {
        return Set.copyOf(fileStems);
    }

    private CSVPrinter printerFor(String key) throws IOException {
        CSVPrinter printer = open.get(key);
        if (printer != null) {
            return printer;
        }
        if (open.size() >= maxOpenFiles) {
            evictEldest();
        }
        Path partial = partialPath(key);
        try {
            printer = created.contains(key)
                    ? CsvTables.append(partial, FlatFieldRow.COLUMNS)
                    : CsvTables.create(partial, FlatFieldRow.COLUMNS);
        } catch (IOException e) {
            throw new ResourceExhaustedException(Stage.EXTRACT,
                    "cannot open output file " + partial + " with " + open.size() + " files open", e);
        }
        open.put(key, printer);
        created.add(key);
        peakOpenFiles = Math.max(peakOpenFiles, open.size());
        return printer;
    }

    private void evictEldest() throws IOException {
        Iterator<Map.Entry<String, CSVPrinter>> it = open.entrySet().iterator();
        Map.Entry<String, CSVPrinter> eldest = it.next();
        it.remove();
        eldest.getValue().close(true);
        evictions++;
        log.debug("sink.evicted key={}", eldest.getKey());
    }

    private void closeAll() throws IOException {
        IOException first = null;
        for (CSVPrinter printer : open.values()) {
            try {
                printer.close(true);
            } catch (IOException e) {
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        open.clear();
        if (first != null) {
            throw first;
        }
    }

    private Path partialPath(String key) {
        return PartialFile.partialOf(outputDir.resolve(fileKey(key) + "_" + keyHash(key) + EXTENSION));
    }

    /**
     * Assigns each key its final file stem. Keys whose sanitized names collide are told apart by
     * a hash suffix; the result depends only on the key set, not on arrival order.
     */
    static Map<String, String> assignStems(Set<String> keys) {
        Map<String, List<String>> byStem = new TreeMap<>();
        for (String key : keys) {
            byStem.computeIfAbsent(fileKey(key), k -> new ArrayList<>()).add(key);
        }
        Map<String, String> stems = new LinkedHashMap<>();
        Set<String> taken = new HashSet<>(byStem.keySet());
        for (Map.Entry<String, List<String>> group : byStem.entrySet()) {
            String stem = group.getKey();
            List<String> members = group.getValue();
            if (members.size() == 1) {
                stems.put(members.get(0), stem);
                continue;
            }
            String owner = members.contains("") ? "" : members.contains(stem) ? stem : null;
            for (String key : members) {
                if (key.equals(owner)) {
                    stems.put(key, stem);
                    continue;
                }
                String suffixed = stem + "_" + keyHash(key);
                while (!taken.add(suffixed)) {
                    suffixed = suffixed + "_";
                }
                stems.put(key, suffixed);
            }
        }
        return stems;
    }

    static String canonicalKey(String groupingKey) {
        return groupingKey == null ? "" : groupingKey.trim();
    }

    private static String keyHash(String key) {
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString().substring(0, 8);
    }

    /**
     * Maps a grouping key to a safe file name stem. Distinct keys may share a stem.
     */
    static String fileKey(String groupingKey) {
        if (groupingKey == null || groupingKey.isBlank()) {
            return UNKNOWN_KEY;
        }
        String key = groupingKey.trim();
        int slash = key.lastIndexOf('/');
        if (key.contains("://") && slash < key.length() - 1) {
            key = key.substring(slash + 1);
        }
        String safe = key.replaceAll("[^A-Za-z0-9._-]", "_");
        return safe.isEmpty() || safe.chars().allMatch(c -> c == '.') ? UNKNOWN_KEY : safe;
    }
}
