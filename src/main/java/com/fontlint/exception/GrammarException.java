package com.fontlint.exception;

/**
 * Thrown when a rule or catalog line does not match any recognized shape.
 */
public class GrammarException extends ConfigurationException {

    public GrammarException(String message) {
        super(message);
    }

    public GrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
