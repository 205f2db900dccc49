package com.affiliation.linkage.sort;

/**
 * Summary of an external sort.
 *
 * @param rowsRead    rows read from the input
 * @param rowsWritten rows written to the sorted output
 * @param spillFiles  number of sorted chunks spilled to disk
 */
public record SortResult(long rowsRead, long rowsWritten, int spillFiles) {

    public boolean isSuccessful() {
        return rowsRead == rowsWritten;
    }
}
