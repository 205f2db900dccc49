package com.affiliation.linkage.pipeline;

/**
 * Fatal pipeline error. Carries the stage that failed and, when known,
 * the range of records it was working on.
 */
public class PipelineException extends RuntimeException {

    private final Stage stage;
    private final String recordRange;

    public PipelineException(Stage stage, String recordRange, String message) {
        super(format(stage, recordRange, message));
        this.stage = stage;
        this.recordRange = recordRange;
    }

    public PipelineException(Stage stage, String recordRange, String message, Throwable cause) {
        super(format(stage, recordRange, message), cause);
        this.stage = stage;
        this.recordRange = recordRange;
    }

    public Stage getStage() {
        return stage;
    }

    /**
     * Returns the record range being processed when the failure happened, or null if unknown.
     */
    public String getRecordRange() {
        return recordRange;
    }

    private static String format(Stage stage, String recordRange, String message) {
        StringBuilder sb = new StringBuilder("[").append(stage.label()).append("] ");
        if (recordRange != null) {
            sb.append("records ").append(recordRange).append(": ");
        }
        return sb.append(message).toString();
    }
}
