package com.affiliation.linkage.store;

/**
 * Columns of the author/affiliation reference table.
 */
public enum StoreColumn {
    DOCUMENT_ID("document_id", "documentId"),
    AUTHOR_SEQUENCE("author_sequence", "authorSequence"),
    AUTHOR_NAME("author_name", "authorName"),
    AUTHOR_NAME_NORMALIZED("author_name_normalized", "authorNameNormalized"),
    AUTHOR_KEY("author_key", "authorKey"),
    AFFILIATION_SEQUENCE("affiliation_sequence", "affiliationSequence"),
    AFFILIATION_NAME("affiliation_name", "affiliationName"),
    AFFILIATION_NAME_NORMALIZED("affiliation_name_normalized", "affiliationNameNormalized"),
    AFFILIATION_KEY("affiliation_key", "affiliationKey"),
    AFFILIATION_EXTERNAL_REF("affiliation_external_ref", "affiliationExternalRef"),
    ORIGIN_SHARD("origin_shard", "originShard"),
    SOURCE_FILE("source_file", "sourceFile");

    private final String columnName;
    private final String propertyName;

    StoreColumn(String columnName, String propertyName) {
        this.columnName = columnName;
        this.propertyName = propertyName;
    }

    public String columnName() {
        return columnName;
    }

    /**
     * Property name used by graph-backed stores.
     */
    public String propertyName() {
        return propertyName;
    }
}
