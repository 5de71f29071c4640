package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.values.ArrayValue;
import com.spreadsheet.engine.values.BooleanValue;
import com.spreadsheet.engine.values.FormulaValue;
import com.spreadsheet.engine.values.NumberValue;
import com.spreadsheet.engine.values.TextValue;
import com.spreadsheet.engine.values.ValueType;

import java.util.List;

/**
 * How a function wants one of its parameters coerced before it runs.
 * Coercion is lenient: a value with no sensible conversion becomes 0, "" or FALSE.
 * Errors never reach coercion; the evaluator short-circuits on them first.
 */
public enum ParameterType {

    /** A scalar number; numeric text is parsed, other text is 0, TRUE/FALSE are 1/0. */
    NUMBER {
        @Override
        FormulaValue coerce(FormulaValue value) {
            FormulaValue scalar = scalarOf(value);
            if (scalar.getType() == ValueType.NUMBER) {
                return scalar;
            }
            return NumberValue.of(scalar.toNumber());
        }
    },

    /** A scalar string, numbers formatted as a cell would show them. */
    TEXT {
        @Override
        FormulaValue coerce(FormulaValue value) {
            return TextValue.of(scalarOf(value).toText());
        }
    },

    /** A scalar truth value; non-zero numbers and "TRUE" are true. */
    BOOLEAN {
        @Override
        FormulaValue coerce(FormulaValue value) {
            return BooleanValue.of(scalarOf(value).toBoolean());
        }
    },

    /** Passed through untouched, arrays included. */
    ANY {
        @Override
        FormulaValue coerce(FormulaValue value) {
            return value;
        }
    },

    /** A 2-D block; a scalar becomes a 1x1 array. */
    ARRAY {
        @Override
        FormulaValue coerce(FormulaValue value) {
            if (value.getType() == ValueType.ARRAY) {
                return value;
            }
            return ArrayValue.of(List.of(List.of(value)));
        }
    },

    /** Repeating numeric argument; read through {@link FunctionArguments#numbers()}. */
    NUMBERS {
        @Override
        FormulaValue coerce(FormulaValue value) {
            return value;
        }
    },

    /** Repeating argument of any kind; read through {@link FunctionArguments#values()}. */
    VALUES {
        @Override
        FormulaValue coerce(FormulaValue value) {
            return value;
        }
    };

    abstract FormulaValue coerce(FormulaValue value);

    private static FormulaValue scalarOf(FormulaValue value) {
        return value.getType() == ValueType.ARRAY ? ((ArrayValue) value).first() : value;
    }
}
