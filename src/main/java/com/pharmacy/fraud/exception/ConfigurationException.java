package com.pharmacy.fraud.exception;

/**
 * Invalid run configuration. Raised before any detector is dispatched.
 */
public class ConfigurationException extends RuntimeException {

    private final String field;

    public ConfigurationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
