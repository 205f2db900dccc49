package com.affiliation.linkage.config;

import com.affiliation.linkage.extract.ExtractionOptions;
import com.affiliation.linkage.extract.GroupingKeyMode;
import com.affiliation.linkage.extract.ObjectLeafMode;

import java.util.List;
import java.util.Locale;

/**
 * Extraction section of the pipeline configuration. Missing values take the defaults of
 * {@link ExtractionOptions}.
 *
 * @param fieldPaths         dot-notation paths to extract
 * @param documentIdPath     path of the document identifier
 * @param groupingKey1Path   path of grouping key 1 (e.g. source or member id)
 * @param groupingKey2Path   path of grouping key 2 (e.g. DOI)
 * @param groupingKey2Mode   {@code value} or {@code doi_prefix}
 * @param groupingKey1Filter keep only records whose grouping key 1 equals this
 * @param groupingKey2Filter keep only records whose derived grouping key 2 equals this
 * @param threads            worker threads, 0 for one per processor
 * @param batchSize          rows buffered per flush
 * @param maxOpenFiles       open file bound in organize mode
 * @param objectLeafMode     {@code skip} or {@code serialize}
 * @param organize           one output file per grouping key 1
 */
public record ExtractionConfig(
        List<String> fieldPaths,
        String documentIdPath,
        String groupingKey1Path,
        String groupingKey2Path,
        String groupingKey2Mode,
        String groupingKey1Filter,
        String groupingKey2Filter,
        Integer threads,
        Integer batchSize,
        Integer maxOpenFiles,
        String objectLeafMode,
        boolean organize
) {
    public ExtractionConfig {
        fieldPaths = fieldPaths != null ? List.copyOf(fieldPaths) : List.of();
    }

    /**
     * Defaults for OpenAlex works: display names, raw affiliation strings and ROR ids of all authorships.
     */
    public static ExtractionConfig defaults() {
        return new ExtractionConfig(List.of(
                "authorships.author.display_name",
                "authorships.raw_affiliation_strings",
                "authorships.institutions.ror"),
                "id", null, "doi", null, null, null, null, null, null, null, false);
    }

    public ExtractionOptions toOptions() {
        ExtractionOptions.Builder builder = ExtractionOptions.builder().fieldPaths(fieldPaths);
        if (documentIdPath != null) {
            builder.documentIdPath(documentIdPath);
        }
        builder.groupingKey1Path(groupingKey1Path)
                .groupingKey2Path(groupingKey2Path)
                .groupingKey1Filter(groupingKey1Filter)
                .groupingKey2Filter(groupingKey2Filter);
        if (groupingKey2Mode != null) {
            builder.groupingKey2Mode(GroupingKeyMode.valueOf(constant(groupingKey2Mode)));
        }
        if (threads != null) {
            builder.threads(threads);
        }
        if (batchSize != null) {
            builder.batchSize(batchSize);
        }
        if (maxOpenFiles != null) {
            builder.maxOpenFiles(maxOpenFiles);
        }
        if (objectLeafMode != null) {
            builder.objectLeafMode(ObjectLeafMode.valueOf(constant(objectLeafMode)));
        }
        return builder.build();
    }

    static String constant(String text) {
        return text.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    }
}
