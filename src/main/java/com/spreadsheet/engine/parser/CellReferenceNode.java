package com.spreadsheet.engine.parser;

import com.spreadsheet.engine.models.CellAddress;

import java.util.Objects;

/**
 * A reference like A1 or $B$2. The '$' markers are kept for display only;
 * evaluation treats absolute and relative references the same.
 */
public final class CellReferenceNode extends Node {
    private final CellAddress address;
    private final boolean absoluteColumn;
    private final boolean absoluteRow;

    public CellReferenceNode(CellAddress address, boolean absoluteColumn, boolean absoluteRow) {
        this.address = Objects.requireNonNull(address, "address");
        this.absoluteColumn = absoluteColumn;
        this.absoluteRow = absoluteRow;
    }

    public CellAddress getAddress() {
        return address;
    }

    /**
     * Column letters, e.g. "B".
     */
    public String getColumn() {
        return address.getColumnLetters();
    }

    public int getColumnIndex() {
        return address.getColumn();
    }

    public int getRow() {
        return address.getRow();
    }

    public String getCellId() {
        return address.toId();
    }

    public boolean isAbsoluteColumn() {
        return absoluteColumn;
    }

    public boolean isAbsoluteRow() {
        return absoluteRow;
    }

    @Override
    public NodeType getType() {
        return NodeType.CELL_REFERENCE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellReferenceNode)) return false;
        CellReferenceNode that = (CellReferenceNode) o;
        return absoluteColumn == that.absoluteColumn && absoluteRow == that.absoluteRow
                && address.equals(that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, absoluteColumn, absoluteRow);
    }

    @Override
    public String toString() {
        return (absoluteColumn ? "$" : "") + getColumn() + (absoluteRow ? "$" : "") + getRow();
    }
}
