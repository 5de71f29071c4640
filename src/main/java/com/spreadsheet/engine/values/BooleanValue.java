package com.spreadsheet.engine.values;

public final class BooleanValue extends FormulaValue {

    public static final BooleanValue TRUE = new BooleanValue(true);
    public static final BooleanValue FALSE = new BooleanValue(false);

    private final boolean value;

    private BooleanValue(boolean value) {
        this.value = value;
    }

    public static BooleanValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public ValueType getType() {
        return ValueType.BOOLEAN;
    }

    @Override
    public boolean isNumeric() {
        return false;
    }

    @Override
    public double toNumber() {
        return value ? 1 : 0;
    }

    @Override
    public String toText() {
        return value ? "TRUE" : "FALSE";
    }

    @Override
    public boolean toBoolean() {
        return value;
    }

    @Override
    public Object toJavaObject() {
        return value;
    }

    @Override
    public String toString() {
        return "Boolean(" + toText() + ")";
    }
}
