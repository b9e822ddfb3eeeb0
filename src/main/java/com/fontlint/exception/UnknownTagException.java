package com.fontlint.exception;

/**
 * Thrown when a tag is not in the catalog and cannot be resolved as a partial tag.
 */
public class UnknownTagException extends ConfigurationException {

    public UnknownTagException(String message) {
        super(message);
    }

    public UnknownTagException(String message, Throwable cause) {
        super(message, cause);
    }
}
