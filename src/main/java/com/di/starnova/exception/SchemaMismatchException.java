package com.di.starnova.exception;

/**
 * Thrown when a table's column declarations differ from the registered schema. Always fatal.
 */
public class SchemaMismatchException extends StarNovaException {

    public SchemaMismatchException(String message) {
        super(message);
    }
}
