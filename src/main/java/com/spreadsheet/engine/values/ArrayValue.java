package com.spreadsheet.engine.values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rectangular block of scalars in row-major order, produced by expanding a range.
 * Elements are never arrays themselves.
 */
public final class ArrayValue extends FormulaValue {

    private final List<List<FormulaValue>> rows;

    private ArrayValue(List<List<FormulaValue>> rows) {
        this.rows = rows;
    }

    /**
     * Copies the given rows. Every row must have the same length.
     */
    public static ArrayValue of(List<List<FormulaValue>> rows) {
        List<List<FormulaValue>> copy = new ArrayList<>(rows.size());
        int width = -1;
        for (List<FormulaValue> row : rows) {
            if (width >= 0 && row.size() != width) {
                throw new IllegalArgumentException("Array rows must have equal length");
            }
            width = row.size();
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        return new ArrayValue(Collections.unmodifiableList(copy));
    }

    public List<List<FormulaValue>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getColumnCount() {
        return rows.isEmpty() ? 0 : rows.get(0).size();
    }

    public FormulaValue get(int row, int column) {
        return rows.get(row).get(column);
    }

    /**
     * All elements in row-major order.
     */
    public List<FormulaValue> flatten() {
        List<FormulaValue> flat = new ArrayList<>();
        for (List<FormulaValue> row : rows) {
            flat.addAll(row);
        }
        return flat;
    }

    /**
     * The top-left element, or blank for an empty array.
     */
    public FormulaValue first() {
        if (rows.isEmpty() || rows.get(0).isEmpty()) {
            return BlankValue.INSTANCE;
        }
        return rows.get(0).get(0);
    }

    @Override
    public ValueType getType() {
        return ValueType.ARRAY;
    }

    @Override
    public boolean isNumeric() {
        return false;
    }

    @Override
    public double toNumber() {
        return first().toNumber();
    }

    @Override
    public String toText() {
        return first().toText();
    }

    @Override
    public boolean toBoolean() {
        return first().toBoolean();
    }

    @Override
    public Object toJavaObject() {
        List<List<Object>> out = new ArrayList<>(rows.size());
        for (List<FormulaValue> row : rows) {
            List<Object> converted = new ArrayList<>(row.size());
            for (FormulaValue value : row) {
                converted.add(value.toJavaObject());
            }
            out.add(converted);
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayValue)) return false;
        return rows.equals(((ArrayValue) o).rows);
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public String toString() {
        return "Array" + rows;
    }
}
