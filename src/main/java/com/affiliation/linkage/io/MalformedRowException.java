package com.affiliation.linkage.io;

/**
 * Thrown when a tabular row does not have the shape its codec expects.
 */
public class MalformedRowException extends RuntimeException {

    private final long recordNumber;

    public MalformedRowException(long recordNumber, String message) {
        super("record " + recordNumber + ": " + message);
        this.recordNumber = recordNumber;
    }

    public long getRecordNumber() {
        return recordNumber;
    }
}
