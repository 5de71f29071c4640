package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Immutable copy of a cell's state, handed to callers after each update.
 * calculatedValue is a plain Java value (Double, String, Boolean, nested lists)
 * or an error code.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CellSnapshot {
    private final String value;
    private final String formula;
    private final Object calculatedValue;
    private final String error;

    public CellSnapshot(String value, String formula, Object calculatedValue, String error) {
        this.value = value;
        this.formula = formula;
        this.calculatedValue = calculatedValue;
        this.error = error;
    }

    public static CellSnapshot of(Cell cell) {
        Object calculated = cell.getCalculatedValue() == null ? null : cell.getCalculatedValue().toJavaObject();
        return new CellSnapshot(cell.getRawValue(), cell.getFormula(), calculated, cell.getError());
    }

    public String getValue() {
        return value;
    }

    public String getFormula() {
        return formula;
    }

    public Object getCalculatedValue() {
        return calculatedValue;
    }

    public String getError() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellSnapshot)) return false;
        CellSnapshot that = (CellSnapshot) o;
        return Objects.equals(value, that.value)
                && Objects.equals(formula, that.formula)
                && Objects.equals(calculatedValue, that.calculatedValue)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, formula, calculatedValue, error);
    }

    @Override
    public String toString() {
        return "CellSnapshot{value='" + value + "', formula=" + formula
                + ", calculatedValue=" + calculatedValue + ", error=" + error + "}";
    }
}
