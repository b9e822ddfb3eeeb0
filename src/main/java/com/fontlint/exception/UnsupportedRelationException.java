package com.fontlint.exception;

/**
 * Thrown when a relation word is unknown, or not allowed for a field or tag.
 */
public class UnsupportedRelationException extends ConfigurationException {

    public UnsupportedRelationException(String message) {
        super(message);
    }

    public UnsupportedRelationException(String message, Throwable cause) {
        super(message, cause);
    }
}
