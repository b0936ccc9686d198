package com.formula.exception;

/**
 * Exception thrown when a closing parenthesis, brace or array row separator
 * has no open scope to close.
 */
public class UnbalancedStructureException extends FormulaException {

    private final int position;

    public UnbalancedStructureException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Offset of the offending character in the formula, or -1 when unknown.
     */
    public int getPosition() {
        return position;
    }
}
