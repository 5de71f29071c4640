package com.spreadsheet.engine.parser;

import java.util.Objects;

/**
 * A rectangular block such as A1:B5. The corners are kept as written;
 * the evaluator normalizes them, so B5:A1 covers the same cells.
 */
public final class RangeNode extends Node {
    private final CellReferenceNode start;
    private final CellReferenceNode end;

    public RangeNode(CellReferenceNode start, CellReferenceNode end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
    }

    public CellReferenceNode getStart() {
        return start;
    }

    public CellReferenceNode getEnd() {
        return end;
    }

    public int getMinColumn() {
        return Math.min(start.getColumnIndex(), end.getColumnIndex());
    }

    public int getMaxColumn() {
        return Math.max(start.getColumnIndex(), end.getColumnIndex());
    }

    public int getMinRow() {
        return Math.min(start.getRow(), end.getRow());
    }

    public int getMaxRow() {
        return Math.max(start.getRow(), end.getRow());
    }

    public long getCellCount() {
        return (long) (getMaxColumn() - getMinColumn() + 1) * (getMaxRow() - getMinRow() + 1);
    }

    @Override
    public NodeType getType() {
        return NodeType.RANGE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RangeNode)) return false;
        RangeNode that = (RangeNode) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + ":" + end;
    }
}
