package com.fontlint.exception;

/**
 * Thrown when a filter clause is applied to a tag scope holding more than one tag.
 */
public class MultiTagFilterException extends ConfigurationException {

    public MultiTagFilterException(String message) {
        super(message);
    }

    public MultiTagFilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
