package com.fontlint.exception;

/**
 * Thrown when an integer set literal is malformed or contains duplicate values.
 */
public class IntegerSetException extends ConfigurationException {

    public IntegerSetException(String message) {
        super(message);
    }

    public IntegerSetException(String message, Throwable cause) {
        super(message, cause);
    }
}
