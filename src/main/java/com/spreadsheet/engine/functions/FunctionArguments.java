package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.values.ArrayValue;
import com.spreadsheet.engine.values.FormulaValue;
import com.spreadsheet.engine.values.ValueType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Coerced arguments of one function call, with typed accessors.
 */
public final class FunctionArguments {

    private final List<FormulaValue> values;

    FunctionArguments(List<FormulaValue> values) {
        this.values = Collections.unmodifiableList(values);
    }

    public int size() {
        return values.size();
    }

    public boolean has(int index) {
        return index < values.size();
    }

    public FormulaValue get(int index) {
        return values.get(index);
    }

    public double number(int index) {
        return values.get(index).toNumber();
    }

    public double number(int index, double defaultValue) {
        return has(index) ? number(index) : defaultValue;
    }

    public String text(int index) {
        return values.get(index).toText();
    }

    public boolean bool(int index) {
        return values.get(index).toBoolean();
    }

    public boolean bool(int index, boolean defaultValue) {
        return has(index) ? bool(index) : defaultValue;
    }

    public ArrayValue array(int index) {
        return (ArrayValue) values.get(index);
    }

    /**
     * Every argument flattened to numbers. Blank cells are skipped;
     * non-numeric text counts as 0; TRUE/FALSE count as 1/0.
     */
    public List<Double> numbers() {
        List<Double> numbers = new ArrayList<>();
        for (FormulaValue value : values()) {
            if (value.isBlank()) {
                continue;
            }
            numbers.add(value.toNumber());
        }
        return numbers;
    }

    /**
     * Every argument flattened, arrays expanded in row-major order.
     */
    public List<FormulaValue> values() {
        List<FormulaValue> flat = new ArrayList<>();
        for (FormulaValue value : values) {
            if (value.getType() == ValueType.ARRAY) {
                flat.addAll(((ArrayValue) value).flatten());
            } else {
                flat.add(value);
            }
        }
        return flat;
    }
}
