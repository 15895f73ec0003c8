package com.di.starnova.exception;

/**
 * Thrown when a table name is not registered in {@link com.di.starnova.schema.SchemaRegistry}.
 */
public class UnknownTableException extends StarNovaException {

    public UnknownTableException(String message) {
        super(message);
    }
}
