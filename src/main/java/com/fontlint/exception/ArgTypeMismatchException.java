package com.fontlint.exception;

/**
 * Thrown when a filter argument type is not allowed by the tag it is attached to.
 */
public class ArgTypeMismatchException extends ConfigurationException {

    public ArgTypeMismatchException(String message) {
        super(message);
    }

    public ArgTypeMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
