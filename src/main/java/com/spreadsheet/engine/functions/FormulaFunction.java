package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.values.FormulaValue;

/**
 * Body of a built-in function. Receives arguments already coerced per the
 * declared parameter types; may return an error value but should not throw.
 */
@FunctionalInterface
public interface FormulaFunction {
    FormulaValue apply(FunctionArguments args);
}
