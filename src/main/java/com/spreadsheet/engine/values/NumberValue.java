package com.spreadsheet.engine.values;

import java.math.BigDecimal;
import java.util.regex.Pattern;

public final class NumberValue extends FormulaValue {

    public static final NumberValue ZERO = new NumberValue(0);

    private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final double value;

    private NumberValue(double value) {
        this.value = value;
    }

    public static NumberValue of(double value) {
        return value == 0 ? ZERO : new NumberValue(value);
    }

    /**
     * Parses decimal text (surrounding whitespace allowed).
     * Returns null when the text is not a plain decimal number;
     * "NaN", "Infinity" and hex forms are rejected.
     */
    public static Double parse(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (!NUMERIC.matcher(trimmed).matches()) {
            return null;
        }
        return Double.parseDouble(trimmed);
    }

    /**
     * Formats a double the way a cell displays it: integral values without a
     * fraction ("20", not "20.0"), everything else in plain notation.
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public double getValue() {
        return value;
    }

    @Override
    public ValueType getType() {
        return ValueType.NUMBER;
    }

    @Override
    public boolean isNumeric() {
        return true;
    }

    @Override
    public double toNumber() {
        return value;
    }

    @Override
    public String toText() {
        return format(value);
    }

    @Override
    public boolean toBoolean() {
        return value != 0;
    }

    @Override
    public Object toJavaObject() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumberValue)) return false;
        return Double.compare(value, ((NumberValue) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return "Number(" + format(value) + ")";
    }
}
