package com.spreadsheet.engine.models;

import com.spreadsheet.engine.values.ErrorValue;
import com.spreadsheet.engine.values.FormulaValue;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - the cell id ("A1")
 * - rawValue: the text as the user typed it (a formula keeps its leading "=")
 * - formula: the formula text, or null for a plain value
 * - calculatedValue: the last evaluation result of the formula
 * - error: the error code of the last evaluation, if it failed
 * - dirty flag to signal the calculatedValue is stale
 */
public class Cell {
    private final String cellId;
    private String rawValue = "";
    private String formula;
    private FormulaValue calculatedValue;
    private String error;
    private boolean dirty = true;

    public Cell(String cellId) {
        this.cellId = cellId;
    }

    public String getCellId() {
        return cellId;
    }

    public String getRawValue() {
        return rawValue;
    }

    public void setRawValue(String rawValue) {
        this.rawValue = rawValue == null ? "" : rawValue;
    }

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
    }

    public boolean hasFormula() {
        return formula != null;
    }

    public FormulaValue getCalculatedValue() {
        return calculatedValue;
    }

    /**
     * Stores an evaluation result; an error value also sets the error code.
     */
    public void setCalculatedValue(FormulaValue calculatedValue) {
        this.calculatedValue = calculatedValue;
        this.error = calculatedValue != null && calculatedValue.isError()
                ? ((ErrorValue) calculatedValue).getCode()
                : null;
        this.dirty = false;
    }

    public String getError() {
        return error;
    }

    public boolean hasError() {
        return error != null;
    }

    /**
     * Drops the last result so the next read evaluates the formula again.
     */
    public void clearCalculation() {
        this.calculatedValue = null;
        this.error = null;
        this.dirty = true;
    }

    /**
     * True for a formula cell whose result is stale or was never computed.
     */
    public boolean isDirty() {
        return formula != null && dirty;
    }

    /**
     * An empty plain cell behaves exactly like a cell that was never written.
     */
    public boolean isEmpty() {
        return formula == null && rawValue.isEmpty();
    }
}
