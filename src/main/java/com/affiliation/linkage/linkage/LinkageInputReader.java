package com.affiliation.linkage.linkage;

import com.affiliation.linkage.io.CsvTables;
import com.affiliation.linkage.pipeline.PipelineException;
import com.affiliation.linkage.pipeline.Stage;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads external linkage input from a CSV file using the configured column mapping.
 * A cell holding several authors is split on the author separator. Blank authors are
 * skipped; every other occurrence is kept in file order, repeats included, and repeats
 * are counted.
 */
public class LinkageInputReader {
    private static final Logger log = LoggerFactory.getLogger(LinkageInputReader.class);

    private final LinkageOptions options;

    public LinkageInputReader(LinkageOptions options) {
        this.options = options;
    }

    public Inputs read(Path csv) {
        List<LinkageInput> inputs = new ArrayList<>();
        Set<List<String>> seen = new LinkedHashSet<>();
        Set<String> documentRefs = new LinkedHashSet<>();
        long blankAuthors = 0;
        long duplicates = 0;

        try (CSVParser parser = CsvTables.open(csv)) {
            List<String> header = parser.getHeaderNames();
            requireColumn(header, options.getDocumentRefColumn(), csv);
            requireColumn(header, options.getAuthorColumn(), csv);

            for (CSVRecord record : parser) {
                String documentRef = value(record, options.getDocumentRefColumn()).trim();
                if (!documentRef.isEmpty()) {
                    documentRefs.add(documentRef);
                }
                for (String author : splitAuthors(value(record, options.getAuthorColumn()))) {
                    if (author.isBlank()) {
                        blankAuthors++;
                        continue;
                    }
                    if (!seen.add(List.of(documentRef, author.trim()))) {
                        duplicates++;
                    }
                    inputs.add(new LinkageInput(documentRef, author, record.getRecordNumber()));
                }
            }
        } catch (IOException | UncheckedIOException e) {
            throw new PipelineException(Stage.LINKAGE, null, "cannot read linkage input " + csv + ": " + e.getMessage(), e);
        }

        log.info("linkage.inputRead file={} authors={} documents={} blankAuthors={} duplicates={}",
                csv, inputs.size(), documentRefs.size(), blankAuthors, duplicates);
        return new Inputs(inputs, documentRefs, blankAuthors, duplicates);
    }

    List<String> splitAuthors(String cell) {
        String separator = options.getAuthorSeparator();
        if (separator.isEmpty()) {
            return List.of(cell);
        }
        return List.of(cell.split(Pattern.quote(separator), -1));
    }

    private static String value(CSVRecord record, String column) {
        return record.isSet(column) ? record.get(column) : "";
    }

    private static void requireColumn(List<String> header, String column, Path csv) {
        if (!header.contains(column)) {
            throw new PipelineException(Stage.LINKAGE, "0",
                    "column '" + column + "' not found in " + csv + " (columns: " + header + ")");
        }
    }

    /**
     * Parsed linkage input.
     *
     * @param inputs       every (document, author) reference, in file order
     * @param documentRefs every non-empty document reference in the file
     * @param blankAuthors author cells (or split parts) that were blank
     * @param duplicates   occurrences repeating an earlier (document, author) pair
     */
    public record Inputs(List<LinkageInput> inputs, Set<String> documentRefs, long blankAuthors, long duplicates) {
        public Inputs {
            inputs = List.copyOf(inputs);
            documentRefs = Set.copyOf(documentRefs);
        }
    }
}
