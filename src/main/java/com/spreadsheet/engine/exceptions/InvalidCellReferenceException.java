package com.spreadsheet.engine.exceptions;

/**
 * Thrown when a caller addresses a cell with an id that is not
 * column letters followed by a row number (e.g. "1A", "A0", "A-3").
 */
public class InvalidCellReferenceException extends RuntimeException {
    public InvalidCellReferenceException(String message) {
        super(message);
    }
}
