package com.affiliation.linkage.store;

import com.affiliation.linkage.core.model.StoreRecord;

import java.util.List;

/**
 * Outcome of {@link IndexedStore#batchInsert(List)}.
 *
 * @param accepted number of rows stored
 * @param rejected rows the store refused, with the reason
 */
public record BatchInsertResult(long accepted, List<RejectedRow> rejected) {

    public BatchInsertResult {
        rejected = rejected != null ? List.copyOf(rejected) : List.of();
    }

    /**
     * A row refused by the store.
     */
    public record RejectedRow(StoreRecord record, String reason) {}
}
