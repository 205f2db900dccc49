package com.affiliation.linkage.io;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * CSV conventions shared by every tabular intermediate file: RFC 4180 quoting,
 * UTF-8, a header row, and {@code \n} record separators.
 */
public final class CsvTables {

    private static final CSVFormat BASE = CSVFormat.DEFAULT.builder()
            .setRecordSeparator("\n")
            .build();

    private static final CSVFormat READ = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .build();

    private CsvTables() {
        // Utility class
    }

    /**
     * Opens a new file for writing and prints the header row.
     */
    public static CSVPrinter create(Path path, List<String> header) throws IOException {
        BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        return new CSVPrinter(writer, BASE.builder().setHeader(header.toArray(String[]::new)).build());
    }

    /**
     * Opens a file for appending. The header is written only if the file is new or empty.
     */
    public static CSVPrinter append(Path path, List<String> header) throws IOException {
        boolean needsHeader = !Files.exists(path) || Files.size(path) == 0;
        OpenOption[] options = {StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE};
        BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8, options);
        CSVFormat format = needsHeader
                ? BASE.builder().setHeader(header.toArray(String[]::new)).build()
                : BASE;
        return new CSVPrinter(writer, format);
    }

    /**
     * Opens a file for reading; the first row is taken as the header.
     */
    public static CSVParser open(Path path) throws IOException {
        BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        try {
            return CSVParser.parse(reader, READ);
        } catch (IOException | RuntimeException e) {
            reader.close();
            throw e;
        }
    }
}
