package com.spreadsheet.engine.values;

import java.util.Objects;

public final class TextValue extends FormulaValue {

    public static final TextValue EMPTY = new TextValue("");

    private final String value;

    private TextValue(String value) {
        this.value = value;
    }

    public static TextValue of(String value) {
        Objects.requireNonNull(value, "value");
        return value.isEmpty() ? EMPTY : new TextValue(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public ValueType getType() {
        return ValueType.TEXT;
    }

    @Override
    public boolean isNumeric() {
        return NumberValue.parse(value) != null;
    }

    @Override
    public double toNumber() {
        Double parsed = NumberValue.parse(value);
        return parsed == null ? 0 : parsed;
    }

    @Override
    public String toText() {
        return value;
    }

    /**
     * "TRUE"/"FALSE" (any case) and numeric text convert; anything else is false.
     */
    @Override
    public boolean toBoolean() {
        String trimmed = value.trim();
        if ("TRUE".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("FALSE".equalsIgnoreCase(trimmed)) {
            return false;
        }
        Double parsed = NumberValue.parse(trimmed);
        return parsed != null && parsed != 0;
    }

    @Override
    public Object toJavaObject() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextValue)) return false;
        return value.equals(((TextValue) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Text(\"" + value + "\")";
    }
}
