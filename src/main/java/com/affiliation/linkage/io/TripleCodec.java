package com.affiliation.linkage.io;

import com.affiliation.linkage.core.model.NormalizedTriple;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Reads and writes {@link NormalizedTriple} tables.
 */
public final class TripleCodec {

    public static final List<String> COLUMNS = List.of(
            "document_id", "author_sequence", "author_name_original", "author_name_normalized",
            "given_name_original", "given_name_normalized", "family_name_original", "family_name_normalized",
            "affiliation_sequence", "affiliation_name_original", "affiliation_name_normalized",
            "affiliation_external_ref", "coordinates_resolved", "origin_shard");

    private TripleCodec() {
        // Utility class
    }

    /**
     * Decodes a row.
     *
     * @throws NumberFormatException if a sequence column is not an integer
     */
    public static NormalizedTriple decode(List<String> v) {
        return new NormalizedTriple(v.get(0), parseSequence(v.get(1)), v.get(2), v.get(3),
                v.get(4), v.get(5), v.get(6), v.get(7), parseSequence(v.get(8)), v.get(9), v.get(10),
                v.get(11), Boolean.parseBoolean(v.get(12)), v.get(13));
    }

    public static List<String> encode(NormalizedTriple t) {
        return Arrays.asList(t.documentId(), sequenceText(t.authorSequence()), t.authorNameOriginal(),
                t.authorNameNormalized(), t.givenNameOriginal(), t.givenNameNormalized(),
                t.familyNameOriginal(), t.familyNameNormalized(), sequenceText(t.affiliationSequence()),
                t.affiliationNameOriginal(), t.affiliationNameNormalized(), t.affiliationExternalRef(),
                Boolean.toString(t.coordinatesResolved()), t.originShard());
    }

    public static void write(CSVPrinter printer, NormalizedTriple triple) throws IOException {
        printer.printRecord(encode(triple));
    }

    public static CsvRowReader<NormalizedTriple> reader(Path path) throws IOException {
        return new CsvRowReader<>(path, COLUMNS, TripleCodec::decode);
    }

    public static Integer parseSequence(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return Integer.valueOf(text.trim());
    }

    private static String sequenceText(Integer sequence) {
        return sequence == null ? "" : sequence.toString();
    }
}
