package com.formula.exception;

/**
 * Exception thrown for invalid location mappings or unresolvable
 * Smartsheet column references.
 */
public class MappingException extends FormulaException {

    public MappingException(String message) {
        super(message);
    }

    public MappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
