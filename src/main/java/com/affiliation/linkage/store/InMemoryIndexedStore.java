package com.affiliation.linkage.store;

import com.affiliation.linkage.core.model.StoreRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-backed {@link IndexedStore} with hash indexes. Suitable for tests and for
 * reference sets that fit in memory.
 */
public class InMemoryIndexedStore implements IndexedStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryIndexedStore.class);

    private final List<StoreRecord> rows = new ArrayList<>();
    private final Map<StoreColumn, Map<String, List<Integer>>> indexes = new EnumMap<>(StoreColumn.class);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private StoreSchema schema;

    @Override
    public void createTable(StoreSchema schema) {
        lock.writeLock().lock();
        try {
            if (this.schema == null) {
                this.schema = schema;
                log.info("store.tableCreated table={}", schema.tableName());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public BatchInsertResult batchInsert(List<StoreRecord> batch) {
        lock.writeLock().lock();
        try {
            if (schema == null) {
                throw new IllegalStateException("createTable must be called before batchInsert");
            }
            long accepted = 0;
            List<BatchInsertResult.RejectedRow> rejected = new ArrayList<>();
            for (StoreRecord record : batch) {
                String missing = firstMissingRequired(record);
                if (missing != null) {
                    rejected.add(new BatchInsertResult.RejectedRow(record, "missing required column " + missing));
                    continue;
                }
                int position = rows.size();
                rows.add(record);
                indexes.forEach((column, index) ->
                        index.computeIfAbsent(record.value(column), k -> new ArrayList<>()).add(position));
                accepted++;
            }
            return new BatchInsertResult(accepted, rejected);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void createIndex(Set<StoreColumn> columns) {
        lock.writeLock().lock();
        try {
            for (StoreColumn column : columns) {
                if (indexes.containsKey(column)) {
                    continue;
                }
                Map<String, List<Integer>> index = new HashMap<>();
                for (int i = 0; i < rows.size(); i++) {
                    index.computeIfAbsent(rows.get(i).value(column), k -> new ArrayList<>()).add(i);
                }
                indexes.put(column, index);
                log.info("store.indexCreated column={} distinctValues={}", column.columnName(), index.size());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<StoreRecord> queryBy(StoreColumn column, String value) {
        lock.readLock().lock();
        try {
            Map<String, List<Integer>> index = indexes.get(column);
            List<StoreRecord> result = new ArrayList<>();
            if (index != null) {
                for (int position : index.getOrDefault(value, List.of())) {
                    result.add(rows.get(position));
                }
                return result;
            }
            log.debug("store.scan column={}", column.columnName());
            for (StoreRecord record : rows) {
                if (record.value(column).equals(value)) {
                    result.add(record);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long count() {
        lock.readLock().lock();
        try {
            return rows.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasIndex(StoreColumn column) {
        lock.readLock().lock();
        try {
            return indexes.containsKey(column);
        } finally {
            lock.readLock().unlock();
        }
    }

    private String firstMissingRequired(StoreRecord record) {
        for (StoreColumn column : schema.requiredColumns()) {
            if (record.value(column).isBlank()) {
                return column.columnName();
            }
        }
        return null;
    }
}
