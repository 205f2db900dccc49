package com.affiliation.linkage.config;

import com.affiliation.linkage.linkage.DocumentRefMode;
import com.affiliation.linkage.linkage.LinkageOptions;
import com.affiliation.linkage.name.NameConvention;

import java.util.List;

/**
 * Linkage section of the pipeline configuration.
 *
 * @param nameConvention       how input author names are written
 * @param organizationVariants organization names used to pick among several affiliations
 * @param nameThreshold        fuzzy name threshold (0..1)
 * @param entityThreshold      extracted organization similarity threshold (0..1)
 * @param entityExtraction     whether to consult the entity extractor
 * @param ollamaUrl            Ollama base URL; no URL means no extractor
 * @param ollamaModel          Ollama model name
 * @param documentRefColumn    input column holding the document reference
 * @param authorColumn         input column holding author names
 * @param authorSeparator      separator between several authors in one cell
 * @param documentRefMode      {@code as_is} or {@code doi}
 */
public record LinkageConfig(
        String nameConvention,
        List<String> organizationVariants,
        Double nameThreshold,
        Double entityThreshold,
        Boolean entityExtraction,
        String ollamaUrl,
        String ollamaModel,
        String documentRefColumn,
        String authorColumn,
        String authorSeparator,
        String documentRefMode
) {
    public LinkageConfig {
        organizationVariants = organizationVariants != null ? List.copyOf(organizationVariants) : List.of();
    }

    public static LinkageConfig defaults() {
        return new LinkageConfig(null, List.of(), null, null, null, null, null, null, null, null, null);
    }

    public boolean isEntityExtractionEnabled() {
        return entityExtraction == null || entityExtraction;
    }

    public LinkageOptions toOptions(NameConvention referenceConvention) {
        LinkageOptions.Builder builder = LinkageOptions.builder()
                .nameConvention(NameConvention.fromString(nameConvention))
                .referenceNameConvention(referenceConvention)
                .organizationVariants(organizationVariants)
                .entityExtractionEnabled(isEntityExtractionEnabled());
        if (nameThreshold != null) {
            builder.nameThreshold(nameThreshold);
        }
        if (entityThreshold != null) {
            builder.entityThreshold(entityThreshold);
        }
        if (documentRefColumn != null) {
            builder.documentRefColumn(documentRefColumn);
        }
        if (authorColumn != null) {
            builder.authorColumn(authorColumn);
        }
        builder.authorSeparator(authorSeparator);
        if (documentRefMode != null) {
            builder.documentRefMode(DocumentRefMode.valueOf(ExtractionConfig.constant(documentRefMode)));
        }
        return builder.build();
    }
}
