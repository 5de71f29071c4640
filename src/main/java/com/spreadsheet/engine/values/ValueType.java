package com.spreadsheet.engine.values;

/**
 * The closed set of runtime value kinds a formula can produce.
 * BLANK only appears inside a range, for a cell that was never written
 * (or holds empty text and no formula).
 */
public enum ValueType {
    NUMBER,
    TEXT,
    BOOLEAN,
    ARRAY,
    ERROR,
    BLANK
}
