package com.affiliation.linkage.pipeline;

/**
 * Thrown when disk space, temp storage or file handles run out.
 */
public class ResourceExhaustedException extends PipelineException {

    public ResourceExhaustedException(Stage stage, String message, Throwable cause) {
        super(stage, null, message, cause);
    }
}
