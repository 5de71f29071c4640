package com.spreadsheet.engine.parser;

public final class StringNode extends Node {
    private final String value;

    public StringNode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public NodeType getType() {
        return NodeType.STRING;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StringNode && value.equals(((StringNode) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }
}
