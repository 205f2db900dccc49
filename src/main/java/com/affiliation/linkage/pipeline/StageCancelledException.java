package com.affiliation.linkage.pipeline;

/**
 * Thrown when a stage observes cancellation between records.
 * Output written so far keeps its {@code .partial} suffix.
 */
public class StageCancelledException extends PipelineException {

    public StageCancelledException(Stage stage, long recordsProcessed) {
        super(stage, "0-" + recordsProcessed, "cancelled");
    }
}
