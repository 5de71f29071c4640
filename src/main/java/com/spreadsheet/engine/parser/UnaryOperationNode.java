package com.spreadsheet.engine.parser;

import java.util.Objects;

/**
 * Prefix '-' or '+'.
 */
public final class UnaryOperationNode extends Node {
    private final String operator;
    private final Node operand;

    public UnaryOperationNode(String operator, Node operand) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public String getOperator() {
        return operator;
    }

    public Node getOperand() {
        return operand;
    }

    @Override
    public NodeType getType() {
        return NodeType.UNARY_OPERATION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnaryOperationNode)) return false;
        UnaryOperationNode that = (UnaryOperationNode) o;
        return operator.equals(that.operator) && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return operator + operand;
    }
}
