package com.spreadsheet.engine.parser;

/**
 * Kinds of tokens in formula text.
 */
public enum TokenType {
    NUMBER,
    STRING,
    IDENTIFIER,
    CELL_REFERENCE,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN,
    COLON,
    COMMA,
    EOF
}
