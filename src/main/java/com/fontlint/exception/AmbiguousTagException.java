package com.fontlint.exception;

/**
 * Thrown when a partial tag matches more than one catalog tag.
 */
public class AmbiguousTagException extends ConfigurationException {

    public AmbiguousTagException(String message) {
        super(message);
    }

    public AmbiguousTagException(String message, Throwable cause) {
        super(message, cause);
    }
}
