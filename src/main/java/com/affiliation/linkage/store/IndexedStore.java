package com.affiliation.linkage.store;

import com.affiliation.linkage.core.model.StoreRecord;

import java.util.List;
import java.util.Set;

/**
 * Append-only indexed table of {@link StoreRecord}s.
 *
 * <p>Loading is single-writer. Once loaded, a store may be queried from several threads.</p>
 */
public interface IndexedStore extends AutoCloseable {

    /**
     * Creates the table if it does not exist yet.
     */
    void createTable(StoreSchema schema);

    /**
     * Appends rows. Rows the store cannot accept are returned rather than thrown.
     */
    BatchInsertResult batchInsert(List<StoreRecord> rows);

    /**
     * Creates an equality index on each of the given columns.
     */
    void createIndex(Set<StoreColumn> columns);

    /**
     * Returns all rows whose column equals the value, in insertion order.
     */
    List<StoreRecord> queryBy(StoreColumn column, String value);

    /**
     * Returns the number of stored rows.
     */
    long count();

    @Override
    default void close() {
    }
}
