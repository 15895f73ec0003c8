package com.di.starnova.exception;

/**
 * Thrown when a source value cannot be parsed to its declared column type.
 */
public class MalformedRecordException extends StarNovaException {

    public MalformedRecordException(String message) {
        super(message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
