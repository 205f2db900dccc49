package com.affiliation.linkage.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One concrete field occurrence extracted from a record.
 * Identity is (documentId, indexedPath).
 *
 * @param documentId   opaque document identifier
 * @param fieldName    the requested field path, e.g. {@code authorships.author.display_name}
 * @param indexedPath  the resolved path with array positions, e.g. {@code authorships[2].author.display_name}
 * @param value        the leaf value as text (empty for JSON null)
 * @param groupingKey1 first grouping key, e.g. source or member id
 * @param groupingKey2 second grouping key, e.g. DOI prefix
 * @param originShard  the shard file the record was read from
 */
public record FlatFieldRow(
        String documentId,
        String fieldName,
        String indexedPath,
        String value,
        String groupingKey1,
        String groupingKey2,
        String originShard
) {
    public static final List<String> COLUMNS = List.of(
            "document_id", "field_name", "indexed_path", "value",
            "grouping_key_1", "grouping_key_2", "origin_shard");

    private static final int ROW_OVERHEAD_BYTES = 96;

    public FlatFieldRow {
        documentId = Objects.requireNonNullElse(documentId, "");
        fieldName = Objects.requireNonNullElse(fieldName, "");
        indexedPath = Objects.requireNonNullElse(indexedPath, "");
        value = Objects.requireNonNullElse(value, "");
        groupingKey1 = Objects.requireNonNullElse(groupingKey1, "");
        groupingKey2 = Objects.requireNonNullElse(groupingKey2, "");
        originShard = Objects.requireNonNullElse(originShard, "");
    }

    /**
     * Approximate heap footprint of this row, used to size sort chunks.
     */
    public long estimatedBytes() {
        long chars = (long) documentId.length() + fieldName.length() + indexedPath.length()
                + value.length() + groupingKey1.length() + groupingKey2.length() + originShard.length();
        return ROW_OVERHEAD_BYTES + chars * 2;
    }

    public List<String> toValues() {
        return List.of(documentId, fieldName, indexedPath, value, groupingKey1, groupingKey2, originShard);
    }
}
