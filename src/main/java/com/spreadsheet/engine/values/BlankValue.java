package com.spreadsheet.engine.values;

/**
 * An empty cell inside a range: 0 in numeric contexts, "" in text contexts.
 */
public final class BlankValue extends FormulaValue {

    public static final BlankValue INSTANCE = new BlankValue();

    private BlankValue() {
    }

    @Override
    public ValueType getType() {
        return ValueType.BLANK;
    }

    @Override
    public boolean isNumeric() {
        return false;
    }

    @Override
    public double toNumber() {
        return 0;
    }

    @Override
    public String toText() {
        return "";
    }

    @Override
    public boolean toBoolean() {
        return false;
    }

    @Override
    public Object toJavaObject() {
        return null;
    }

    @Override
    public String toString() {
        return "Blank";
    }
}
