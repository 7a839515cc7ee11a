package com.salary.disclosure.pipeline;

/**
 * Thrown when a stage fails. The whole run is aborted and nothing is published.
 */
public class PipelineException extends RuntimeException {

    private final PipelineStage stage;

    public PipelineException(PipelineStage stage, String message, Throwable cause) {
        super("Stage '" + stage.getId() + "' failed: " + message, cause);
        this.stage = stage;
    }

    public PipelineException(PipelineStage stage, String message) {
        this(stage, message, null);
    }

    public PipelineStage getStage() {
        return stage;
    }
}
