package com.formula.exception;

/**
 * Exception thrown when a template configuration is invalid or incomplete.
 * Raised when a render case has no template, or when a template set cannot be loaded.
 */
public class ConfigurationException extends FormulaException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
