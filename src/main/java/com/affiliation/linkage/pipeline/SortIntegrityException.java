package com.affiliation.linkage.pipeline;

/**
 * Thrown when a sort chunk or spill file cannot be read back in key order.
 * Downstream stages rely on a total order, so this always aborts the run.
 */
public class SortIntegrityException extends PipelineException {

    public SortIntegrityException(String recordRange, String message) {
        super(Stage.SORT, recordRange, message);
    }

    public SortIntegrityException(String recordRange, String message, Throwable cause) {
        super(Stage.SORT, recordRange, message, cause);
    }
}
