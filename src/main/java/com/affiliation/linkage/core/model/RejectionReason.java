package com.affiliation.linkage.core.model;

/**
 * Reason codes for rows diverted to the load error log.
 */
public enum RejectionReason {
    MALFORMED_ROW,
    MISSING_DOCUMENT_ID,
    MISSING_AUTHOR_NAME,
    TYPE_MISMATCH,
    INVALID_VALUE,
    STORE_REJECTED
}
