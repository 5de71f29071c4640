package com.spreadsheet.engine.parser;

/**
 * A node of a parsed formula. Nodes are immutable; the evaluator dispatches on
 * {@link #getType()}.
 */
public abstract class Node {

    public abstract NodeType getType();

    public boolean isError() {
        return getType() == NodeType.ERROR;
    }
}
