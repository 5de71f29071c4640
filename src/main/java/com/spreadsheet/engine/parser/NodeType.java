package com.spreadsheet.engine.parser;

public enum NodeType {
    NUMBER,
    STRING,
    CELL_REFERENCE,
    RANGE,
    UNARY_OPERATION,
    BINARY_OPERATION,
    FUNCTION_CALL,
    ERROR
}
