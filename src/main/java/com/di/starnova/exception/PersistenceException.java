package com.di.starnova.exception;

/**
 * Thrown when staged tables or reports cannot be written, published or rolled back.
 */
public class PersistenceException extends StarNovaException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
