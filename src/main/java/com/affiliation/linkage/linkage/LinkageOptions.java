package com.affiliation.linkage.linkage;

import com.affiliation.linkage.name.NameConvention;
import com.affiliation.linkage.rules.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Options for linking external author references.
 */
public class LinkageOptions {

    private static final double DEFAULT_NAME_THRESHOLD = 0.85;
    private static final double DEFAULT_ENTITY_THRESHOLD = 0.85;

    private final NameConvention nameConvention;
    private final NameConvention referenceNameConvention;
    private final List<String> organizationVariants;
    private final List<String> normalizedVariants;
    private final double nameThreshold;
    private final double entityThreshold;
    private final boolean entityExtractionEnabled;
    private final String documentRefColumn;
    private final String authorColumn;
    private final String authorSeparator;
    private final DocumentRefMode documentRefMode;

    private LinkageOptions(Builder builder) {
        this.nameConvention = builder.nameConvention;
        this.referenceNameConvention = builder.referenceNameConvention;
        this.organizationVariants = List.copyOf(builder.organizationVariants);
        this.normalizedVariants = organizationVariants.stream()
                .map(TextNormalizer::normalize)
                .filter(v -> !v.isEmpty())
                .distinct()
                .toList();
        this.nameThreshold = builder.nameThreshold;
        this.entityThreshold = builder.entityThreshold;
        this.entityExtractionEnabled = builder.entityExtractionEnabled;
        this.documentRefColumn = builder.documentRefColumn;
        this.authorColumn = builder.authorColumn;
        this.authorSeparator = builder.authorSeparator;
        this.documentRefMode = builder.documentRefMode;
    }

    public static LinkageOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public NameConvention getNameConvention() {
        return nameConvention;
    }

    public NameConvention getReferenceNameConvention() {
        return referenceNameConvention;
    }

    public List<String> getOrganizationVariants() {
        return organizationVariants;
    }

    /**
     * The organization variants after text normalization, blanks and duplicates removed, in order.
     */
    public List<String> getNormalizedVariants() {
        return normalizedVariants;
    }

    public double getNameThreshold() {
        return nameThreshold;
    }

    public double getEntityThreshold() {
        return entityThreshold;
    }

    public boolean isEntityExtractionEnabled() {
        return entityExtractionEnabled;
    }

    public String getDocumentRefColumn() {
        return documentRefColumn;
    }

    public String getAuthorColumn() {
        return authorColumn;
    }

    /**
     * Separator between several authors in one cell; empty means one author per cell.
     */
    public String getAuthorSeparator() {
        return authorSeparator;
    }

    public DocumentRefMode getDocumentRefMode() {
        return documentRefMode;
    }

    public static class Builder {
        private NameConvention nameConvention = NameConvention.AUTO;
        private NameConvention referenceNameConvention = NameConvention.GIVEN_FAMILY;
        private List<String> organizationVariants = new ArrayList<>();
        private double nameThreshold = DEFAULT_NAME_THRESHOLD;
        private double entityThreshold = DEFAULT_ENTITY_THRESHOLD;
        private boolean entityExtractionEnabled = true;
        private String documentRefColumn = "doi";
        private String authorColumn = "authors";
        private String authorSeparator = "";
        private DocumentRefMode documentRefMode = DocumentRefMode.AS_IS;

        public Builder nameConvention(NameConvention nameConvention) {
            this.nameConvention = Objects.requireNonNull(nameConvention, "nameConvention");
            return this;
        }

        public Builder referenceNameConvention(NameConvention referenceNameConvention) {
            this.referenceNameConvention = Objects.requireNonNull(referenceNameConvention, "referenceNameConvention");
            return this;
        }

        public Builder organizationVariants(List<String> organizationVariants) {
            this.organizationVariants = new ArrayList<>(organizationVariants);
            return this;
        }

        public Builder nameThreshold(double nameThreshold) {
            this.nameThreshold = checkThreshold("nameThreshold", nameThreshold);
            return this;
        }

        public Builder entityThreshold(double entityThreshold) {
            this.entityThreshold = checkThreshold("entityThreshold", entityThreshold);
            return this;
        }

        public Builder entityExtractionEnabled(boolean entityExtractionEnabled) {
            this.entityExtractionEnabled = entityExtractionEnabled;
            return this;
        }

        public Builder documentRefColumn(String documentRefColumn) {
            this.documentRefColumn = Objects.requireNonNull(documentRefColumn, "documentRefColumn");
            return this;
        }

        public Builder authorColumn(String authorColumn) {
            this.authorColumn = Objects.requireNonNull(authorColumn, "authorColumn");
            return this;
        }

        public Builder authorSeparator(String authorSeparator) {
            this.authorSeparator = Objects.requireNonNullElse(authorSeparator, "");
            return this;
        }

        public Builder documentRefMode(DocumentRefMode documentRefMode) {
            this.documentRefMode = Objects.requireNonNull(documentRefMode, "documentRefMode");
            return this;
        }

        public LinkageOptions build() {
            return new LinkageOptions(this);
        }

        private static double checkThreshold(String name, double value) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
            return value;
        }
    }
}
