package com.spreadsheet.engine.exceptions;

/**
 * Thrown by the dependency graph when a new edge would close a loop
 * (a cell reading itself, or reading a cell that already reads it).
 * The evaluator turns it into a #REF! value; it never reaches a caller of the engine.
 */
public class CircularReferenceException extends RuntimeException {

    private final String fromCell;
    private final String toCell;

    public CircularReferenceException(String fromCell, String toCell) {
        super("Circular reference detected between " + fromCell + " and " + toCell);
        this.fromCell = fromCell;
        this.toCell = toCell;
    }

    public String getFromCell() {
        return fromCell;
    }

    public String getToCell() {
        return toCell;
    }
}
