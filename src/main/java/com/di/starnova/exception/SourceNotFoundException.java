package com.di.starnova.exception;

/**
 * Thrown when a raw source file is absent from the configured source path.
 */
public class SourceNotFoundException extends StarNovaException {

    public SourceNotFoundException(String message) {
        super(message);
    }

    public SourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
