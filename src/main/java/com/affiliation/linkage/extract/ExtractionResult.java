package com.affiliation.linkage.extract;

/**
 * Summary of an extraction run.
 *
 * @param shardsProcessed  shards read to the end
 * @param shardsFailed     shards that could not be opened or decompressed
 * @param recordsRead      non-blank input lines
 * @param recordsEmitted   records that produced output
 * @param recordsFiltered  records rejected by a grouping-key filter
 * @param recordsMissingId records without a document identifier
 * @param parseErrors      lines that were not valid JSON objects
 * @param rowsEmitted      flat rows written
 */
public record ExtractionResult(
        long shardsProcessed,
        long shardsFailed,
        long recordsRead,
        long recordsEmitted,
        long recordsFiltered,
        long recordsMissingId,
        long parseErrors,
        long rowsEmitted
) {
    public static ExtractionResult empty() {
        return new ExtractionResult(0, 0, 0, 0, 0, 0, 0, 0);
    }

    ExtractionResult plus(ExtractionResult other) {
        return new ExtractionResult(
                shardsProcessed + other.shardsProcessed,
                shardsFailed + other.shardsFailed,
                recordsRead + other.recordsRead,
                recordsEmitted + other.recordsEmitted,
                recordsFiltered + other.recordsFiltered,
                recordsMissingId + other.recordsMissingId,
                parseErrors + other.parseErrors,
                rowsEmitted + other.rowsEmitted);
    }

    /**
     * Parse errors and failed shards are recoverable, so a completed extraction is always successful.
     */
    public boolean isSuccessful() {
        return true;
    }
}
