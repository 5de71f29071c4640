package com.spreadsheet.engine.exceptions;

/**
 * Thrown when a request names a sheet id the service has never created.
 */
public class SheetNotFoundException extends RuntimeException {
    public SheetNotFoundException(long sheetId) {
        super("Sheet not found: " + sheetId);
    }
}
