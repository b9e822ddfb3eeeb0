package com.fontlint.exception;

/**
 * Exception thrown when a rule text or tag catalog is invalid.
 * Results in fail-fast at load time, before any font is checked.
 */
public class ConfigurationException extends FontLintException {

    private String location;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Attach where in the source the error occurred (e.g., "line 12").
     *
     * @return this exception, for rethrowing
     */
    public ConfigurationException withLocation(String location) {
        this.location = location;
        return this;
    }

    public String getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        return location == null ? super.getMessage() : location + ": " + super.getMessage();
    }
}
