package com.fontlint.exception;

/**
 * Base exception for the font lint configuration engine.
 */
public class FontLintException extends RuntimeException {

    public FontLintException(String message) {
        super(message);
    }

    public FontLintException(String message, Throwable cause) {
        super(message, cause);
    }
}
