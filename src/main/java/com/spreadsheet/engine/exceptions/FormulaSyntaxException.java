package com.spreadsheet.engine.exceptions;

/**
 * Raised inside the lexer and parser on malformed formula text.
 * The parser catches it at its public boundary and returns an ErrorNode instead.
 */
public class FormulaSyntaxException extends RuntimeException {

    private final int position;

    public FormulaSyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Offset into the formula body (after the leading '='), or -1 if unknown.
     */
    public int getPosition() {
        return position;
    }
}
