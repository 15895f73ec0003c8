package com.di.starnova.exception;

/**
 * Base of all pipeline failures. The category is derived from the concrete type.
 */
public abstract class StarNovaException extends RuntimeException {

    protected StarNovaException(String message) {
        super(message);
    }

    protected StarNovaException(String message, Throwable cause) {
        super(message, cause);
    }

    public ErrorCategory getCategory() {
        return ErrorCategory.categorize(this);
    }
}
