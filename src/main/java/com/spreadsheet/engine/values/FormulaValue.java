package com.spreadsheet.engine.values;

/**
 * Base type of every value flowing through the evaluator and the function library.
 * <p>
 * The coercion methods here are lenient: they never fail, and fall back to 0, ""
 * or false when a value has no sensible conversion. Callers that need strictness
 * (binary operators, for example) check {@link #getType()} or {@link #isNumeric()} first.
 */
public abstract class FormulaValue {

    public abstract ValueType getType();

    /**
     * True for numbers and for text that reads as a number ("42", " 3.5 ").
     */
    public abstract boolean isNumeric();

    public abstract double toNumber();

    public abstract String toText();

    public abstract boolean toBoolean();

    /**
     * Plain Java form used for JSON snapshots:
     * Double, String, Boolean, nested lists, or the error code.
     */
    public abstract Object toJavaObject();

    public boolean isError() {
        return getType() == ValueType.ERROR;
    }

    public boolean isBlank() {
        return getType() == ValueType.BLANK;
    }

    /**
     * Text shown in a cell holding this value.
     */
    public String toDisplayString() {
        return toText();
    }

    /**
     * Converts the raw text of a plain (non-formula) cell:
     * empty text is blank, numeric-looking text is a number, anything else stays text.
     */
    public static FormulaValue fromCellText(String raw) {
        if (raw == null || raw.isEmpty()) {
            return BlankValue.INSTANCE;
        }
        Double parsed = NumberValue.parse(raw);
        if (parsed != null) {
            return NumberValue.of(parsed);
        }
        return TextValue.of(raw);
    }
}
