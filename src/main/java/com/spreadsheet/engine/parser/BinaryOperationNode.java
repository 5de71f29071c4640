package com.spreadsheet.engine.parser;

import java.util.Objects;

/**
 * One of {@code + - * / ^ %} applied to two operands.
 */
public final class BinaryOperationNode extends Node {
    private final String operator;
    private final Node left;
    private final Node right;

    public BinaryOperationNode(String operator, Node left, Node right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public String getOperator() {
        return operator;
    }

    public Node getLeft() {
        return left;
    }

    public Node getRight() {
        return right;
    }

    @Override
    public NodeType getType() {
        return NodeType.BINARY_OPERATION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryOperationNode)) return false;
        BinaryOperationNode that = (BinaryOperationNode) o;
        return operator.equals(that.operator) && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
