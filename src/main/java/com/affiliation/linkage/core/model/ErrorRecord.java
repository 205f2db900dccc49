package com.affiliation.linkage.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A rejected input row together with the reason it was rejected.
 *
 * @param lineNumber the record number in the input file (1-based, header excluded)
 * @param reason     the reason code
 * @param message    human-readable detail
 * @param rawRow     the original row values
 */
public record ErrorRecord(long lineNumber, RejectionReason reason, String message, List<String> rawRow) {

    public ErrorRecord {
        Objects.requireNonNull(reason, "reason is required");
        message = Objects.requireNonNullElse(message, "");
        rawRow = rawRow != null ? List.copyOf(rawRow) : List.of();
    }
}
