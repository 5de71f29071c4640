package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.values.BooleanValue;
import com.spreadsheet.engine.values.FormulaValue;

import static com.spreadsheet.engine.functions.ParameterType.ANY;
import static com.spreadsheet.engine.functions.ParameterType.BOOLEAN;
import static com.spreadsheet.engine.functions.ParameterType.VALUES;

/**
 * IF, AND, OR, NOT, TRUE, FALSE.
 * All arguments are evaluated before the call, so IF does not shield its
 * unused branch from errors.
 */
final class LogicalFunctions {

    private LogicalFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register(FunctionDefinition.fixed("IF", 2, LogicalFunctions::ifFunction, BOOLEAN, ANY, ANY));
        library.register(FunctionDefinition.variadic("AND", 1, VALUES, LogicalFunctions::and));
        library.register(FunctionDefinition.variadic("OR", 1, VALUES, LogicalFunctions::or));
        library.register(FunctionDefinition.fixed("NOT", 1, args -> BooleanValue.of(!args.bool(0)), BOOLEAN));
        library.register(FunctionDefinition.fixed("TRUE", 0, args -> BooleanValue.TRUE));
        library.register(FunctionDefinition.fixed("FALSE", 0, args -> BooleanValue.FALSE));
    }

    static FormulaValue ifFunction(FunctionArguments args) {
        if (args.bool(0)) {
            return args.get(1);
        }
        return args.has(2) ? args.get(2) : BooleanValue.FALSE;
    }

    static FormulaValue and(FunctionArguments args) {
        for (FormulaValue value : args.values()) {
            if (!value.isBlank() && !value.toBoolean()) {
                return BooleanValue.FALSE;
            }
        }
        return BooleanValue.TRUE;
    }

    static FormulaValue or(FunctionArguments args) {
        for (FormulaValue value : args.values()) {
            if (!value.isBlank() && value.toBoolean()) {
                return BooleanValue.TRUE;
            }
        }
        return BooleanValue.FALSE;
    }
}
