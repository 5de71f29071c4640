package com.spreadsheet.engine.parser;

/**
 * Result of parsing malformed formula text. Evaluates to #ERROR! with this message.
 */
public final class ErrorNode extends Node {
    private final String message;

    public ErrorNode(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public NodeType getType() {
        return NodeType.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ErrorNode && message.equals(((ErrorNode) o).message);
    }

    @Override
    public int hashCode() {
        return message.hashCode();
    }

    @Override
    public String toString() {
        return "Error(" + message + ")";
    }
}
