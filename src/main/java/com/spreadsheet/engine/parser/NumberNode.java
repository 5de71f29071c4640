package com.spreadsheet.engine.parser;

public final class NumberNode extends Node {
    private final double value;

    public NumberNode(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public NodeType getType() {
        return NodeType.NUMBER;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NumberNode && Double.compare(value, ((NumberNode) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
