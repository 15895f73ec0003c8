package com.di.starnova.exception;

/**
 * Thrown when the pipeline configuration document is missing, unreadable or invalid.
 */
public class PipelineConfigurationException extends StarNovaException {

    public PipelineConfigurationException(String message) {
        super(message);
    }

    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
