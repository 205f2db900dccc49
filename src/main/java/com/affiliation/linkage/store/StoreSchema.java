package com.affiliation.linkage.store;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Table definition handed to {@link IndexedStore#createTable(StoreSchema)}.
 *
 * @param tableName       table (or node label) name
 * @param columns         all columns, in order
 * @param requiredColumns columns that must be non-empty for a row to be accepted
 */
public record StoreSchema(String tableName, List<StoreColumn> columns, Set<StoreColumn> requiredColumns) {

    public StoreSchema {
        Objects.requireNonNull(tableName, "tableName is required");
        if (!tableName.matches("^[A-Za-z][A-Za-z0-9_]*$")) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        columns = List.copyOf(columns);
        requiredColumns = Set.copyOf(requiredColumns);
        if (!columns.containsAll(requiredColumns)) {
            throw new IllegalArgumentException("Required columns must be part of the schema");
        }
    }

    /**
     * The author/affiliation reference table.
     */
    public static StoreSchema authorAffiliations() {
        return new StoreSchema("AuthorAffiliation", List.of(StoreColumn.values()),
                EnumSet.of(StoreColumn.DOCUMENT_ID, StoreColumn.AUTHOR_NAME));
    }

    /**
     * Columns indexed after loading: the three lookup columns plus the normalized name and external reference.
     */
    public static Set<StoreColumn> defaultIndexColumns() {
        return EnumSet.of(StoreColumn.DOCUMENT_ID, StoreColumn.AUTHOR_KEY, StoreColumn.AFFILIATION_KEY,
                StoreColumn.AUTHOR_NAME_NORMALIZED, StoreColumn.AFFILIATION_EXTERNAL_REF);
    }
}
