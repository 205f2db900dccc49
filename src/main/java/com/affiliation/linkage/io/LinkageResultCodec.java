package com.affiliation.linkage.io;

import com.affiliation.linkage.core.model.LinkageResult;
import com.affiliation.linkage.core.model.LinkageStatus;
import com.affiliation.linkage.core.model.MatchBasis;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Reads and writes linkage result tables, so discovery can be re-run from a previous linkage file.
 */
public final class LinkageResultCodec {

    public static final List<String> COLUMNS = List.of(
            "input_document_ref", "input_author", "linkage_status", "match_basis",
            "matched_document_id", "matched_author_sequence", "matched_author_name",
            "matched_affiliation_key", "matched_affiliation", "matched_affiliation_ref",
            "confidence", "entity_corroborated");

    private LinkageResultCodec() {
        // Utility class
    }

    public static List<String> encode(LinkageResult r) {
        return Arrays.asList(r.externalDocumentRef(), r.externalAuthorRef(),
                r.status().name().toLowerCase(Locale.ROOT),
                r.matchBasis() == null ? "" : r.matchBasis().name().toLowerCase(Locale.ROOT),
                r.matchedDocumentId(),
                r.matchedAuthorSequence() == null ? "" : r.matchedAuthorSequence().toString(),
                r.matchedAuthorName(), r.matchedAffiliationKey(), r.matchedAffiliationOriginal(),
                r.matchedAffiliationRef(), String.format(Locale.ROOT, "%.4f", r.confidence()),
                Boolean.toString(r.entityCorroborated()));
    }

    public static LinkageResult decode(List<String> v) {
        return new LinkageResult(v.get(0), v.get(1),
                LinkageStatus.valueOf(v.get(2).toUpperCase(Locale.ROOT)),
                v.get(3).isEmpty() ? null : MatchBasis.valueOf(v.get(3).toUpperCase(Locale.ROOT)),
                v.get(4), TripleCodec.parseSequence(v.get(5)), v.get(6), v.get(7), v.get(8), v.get(9),
                Double.parseDouble(v.get(10)), Boolean.parseBoolean(v.get(11)));
    }

    /**
     * Writes the results to {@code target} through a partial file.
     */
    public static void write(Path target, List<LinkageResult> results) throws IOException {
        Path partial = PartialFile.partialOf(target);
        try (CSVPrinter printer = CsvTables.create(partial, COLUMNS)) {
            for (LinkageResult result : results) {
                printer.printRecord(encode(result));
            }
        }
        PartialFile.commit(partial, target);
    }

    public static List<LinkageResult> read(Path path) throws IOException {
        List<LinkageResult> results = new ArrayList<>();
        try (CsvRowReader<LinkageResult> reader = new CsvRowReader<>(path, COLUMNS, LinkageResultCodec::decode)) {
            while (reader.hasNext()) {
                results.add(reader.next());
            }
        }
        return results;
    }
}
