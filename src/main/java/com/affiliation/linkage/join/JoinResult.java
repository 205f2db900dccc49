package com.affiliation.linkage.join;

/**
 * Summary of a join/normalize pass.
 *
 * @param rowsRead      sorted rows read
 * @param rowsIgnored   rows whose field has no configured role
 * @param malformedRows rows with the wrong shape, skipped
 * @param flaggedRows   rows whose indexed path lacked a usable coordinate
 * @param documents     document groups processed
 * @param triples       normalized triples written
 */
public record JoinResult(long rowsRead, long rowsIgnored, long malformedRows, long flaggedRows,
                         long documents, long triples) {

    public boolean isSuccessful() {
        return true;
    }
}
