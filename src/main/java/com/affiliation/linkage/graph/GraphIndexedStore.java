package com.affiliation.linkage.graph;

import com.affiliation.linkage.core.model.NormalizedTriple;
import com.affiliation.linkage.core.model.StoreRecord;
import com.affiliation.linkage.io.TripleCodec;
import com.affiliation.linkage.store.BatchInsertResult;
import com.affiliation.linkage.store.IndexedStore;
import com.affiliation.linkage.store.StoreColumn;
import com.affiliation.linkage.store.StoreSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link IndexedStore} backed by a graph database. Each stored row is one node carrying
 * every column as a property plus a {@code rowId} that preserves insertion order.
 */
public class GraphIndexedStore implements IndexedStore {
    private static final Logger log = LoggerFactory.getLogger(GraphIndexedStore.class);
    private static final String ROW_ID = "rowId";

    private final GraphConnection connection;
    private StoreSchema schema;
    private String label;
    private String returnClause;
    private long nextRowId;

    public GraphIndexedStore(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public void createTable(StoreSchema schema) {
        InputSanitizer.validateIdentifier(schema.tableName());
        this.schema = schema;
        this.label = schema.tableName();
        this.returnClause = schema.columns().stream()
                .map(c -> "r." + c.propertyName() + " AS " + c.propertyName())
                .collect(Collectors.joining(", "));
        connection.createIndex(label, ROW_ID);
        this.nextRowId = count();
        log.info("store.tableCreated label={} graph={} existingRows={}", label, connection.getGraphName(), nextRowId);
    }

    @Override
    public BatchInsertResult batchInsert(List<StoreRecord> rows) {
        requireTable();
        long accepted = 0;
        List<BatchInsertResult.RejectedRow> rejected = new ArrayList<>();
        for (StoreRecord record : rows) {
            for (StoreColumn column : schema.requiredColumns()) {
                if (record.value(column).isBlank()) {
                    rejected.add(new BatchInsertResult.RejectedRow(record, "missing required column " + column.columnName()));
                    record = null;
                    break;
                }
            }
            if (record == null) {
                continue;
            }
            Map<String, Object> params = new LinkedHashMap<>();
            params.put(ROW_ID, nextRowId);
            for (StoreColumn column : schema.columns()) {
                params.put(column.propertyName(), record.value(column));
            }
            try {
                connection.execute(createQuery(), params);
                nextRowId++;
                accepted++;
            } catch (RuntimeException e) {
                log.debug("store.insertFailed documentId={} error={}", record.documentId(), e.getMessage());
                rejected.add(new BatchInsertResult.RejectedRow(record, e.getMessage()));
            }
        }
        return new BatchInsertResult(accepted, rejected);
    }

    @Override
    public void createIndex(Set<StoreColumn> columns) {
        requireTable();
        for (StoreColumn column : columns) {
            connection.createIndex(label, column.propertyName());
        }
    }

    @Override
    public List<StoreRecord> queryBy(StoreColumn column, String value) {
        requireTable();
        String query = "MATCH (r:" + label + ") WHERE r." + column.propertyName() + " = $value RETURN "
                + returnClause + " ORDER BY r." + ROW_ID;
        List<StoreRecord> records = new ArrayList<>();
        for (Map<String, Object> row : connection.query(query, Map.of("value", value))) {
            records.add(toRecord(row));
        }
        return records;
    }

    @Override
    public long count() {
        List<Map<String, Object>> result = connection.query("MATCH (r:" + label + ") RETURN count(r) AS c");
        if (result.isEmpty() || result.get(0).get("c") == null) {
            return 0;
        }
        return ((Number) result.get(0).get("c")).longValue();
    }

    @Override
    public void close() {
        connection.close();
    }

    private String createQuery() {
        StringBuilder sb = new StringBuilder("CREATE (:").append(label).append(" {").append(ROW_ID).append(": $").append(ROW_ID);
        for (StoreColumn column : schema.columns()) {
            sb.append(", ").append(column.propertyName()).append(": $").append(column.propertyName());
        }
        return sb.append("})").toString();
    }

    private StoreRecord toRecord(Map<String, Object> row) {
        NormalizedTriple triple = NormalizedTriple.builder()
                .documentId(text(row, StoreColumn.DOCUMENT_ID))
                .authorSequence(TripleCodec.parseSequence(text(row, StoreColumn.AUTHOR_SEQUENCE)))
                .authorName(text(row, StoreColumn.AUTHOR_NAME), text(row, StoreColumn.AUTHOR_NAME_NORMALIZED))
                .affiliationSequence(TripleCodec.parseSequence(text(row, StoreColumn.AFFILIATION_SEQUENCE)))
                .affiliationName(text(row, StoreColumn.AFFILIATION_NAME), text(row, StoreColumn.AFFILIATION_NAME_NORMALIZED))
                .affiliationExternalRef(text(row, StoreColumn.AFFILIATION_EXTERNAL_REF))
                .originShard(text(row, StoreColumn.ORIGIN_SHARD))
                .build();
        return new StoreRecord(triple, text(row, StoreColumn.AUTHOR_KEY), text(row, StoreColumn.AFFILIATION_KEY),
                text(row, StoreColumn.SOURCE_FILE));
    }

    private static String text(Map<String, Object> row, StoreColumn column) {
        Object value = row.get(column.propertyName());
        return value == null ? "" : value.toString();
    }

    private void requireTable() {
        if (schema == null) {
            throw new IllegalStateException("createTable must be called first");
        }
    }
}
