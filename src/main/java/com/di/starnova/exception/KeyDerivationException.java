package com.di.starnova.exception;

/**
 * Thrown when a surrogate key cannot be derived, e.g. a required natural-key attribute is null.
 */
public class KeyDerivationException extends StarNovaException {

    public KeyDerivationException(String message) {
        super(message);
    }

    public KeyDerivationException(String message, Throwable cause) {
        super(message, cause);
    }
}
