package com.spreadsheet.engine.parser;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class FunctionCallNode extends Node {
    private final String name;
    private final List<Node> arguments;

    /**
     * @param name upper-cased function name
     */
    public FunctionCallNode(String name, List<Node> arguments) {
        this.name = Objects.requireNonNull(name, "name");
        this.arguments = List.copyOf(arguments);
    }

    public String getName() {
        return name;
    }

    public List<Node> getArguments() {
        return arguments;
    }

    @Override
    public NodeType getType() {
        return NodeType.FUNCTION_CALL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionCallNode)) return false;
        FunctionCallNode that = (FunctionCallNode) o;
        return name.equals(that.name) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments);
    }

    @Override
    public String toString() {
        return name + arguments.stream().map(Node::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
