package com.di.starnova.runner;

import com.di.starnova.exception.StarNovaException;

/**
 * A run failed while working towards {@link #getStage()}. The cause is the underlying error,
 * already unwrapped from Beam's {@code PipelineExecutionException}.
 */
public class PipelineStageException extends StarNovaException {

    private final PipelineState stage;

    public PipelineStageException(PipelineState stage, Throwable cause) {
        super("Stage " + stage + " failed: " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public PipelineState getStage() {
        return stage;
    }
}
