package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.values.ErrorKind;
import com.spreadsheet.engine.values.ErrorValue;
import com.spreadsheet.engine.values.FormulaValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A named built-in: its parameter types, arity and body.
 * For a variadic function the last parameter type repeats.
 */
public final class FunctionDefinition {

    private final String name;
    private final List<ParameterType> parameters;
    private final int minArguments;
    private final boolean variadic;
    private final FormulaFunction body;

    private FunctionDefinition(String name, List<ParameterType> parameters, int minArguments,
                               boolean variadic, FormulaFunction body) {
        this.name = name.toUpperCase(Locale.ROOT);
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.minArguments = minArguments;
        this.variadic = variadic;
        this.body = body;
    }

    /**
     * A function taking between minArguments and parameters.length arguments.
     */
    public static FunctionDefinition fixed(String name, int minArguments, FormulaFunction body,
                                           ParameterType... parameters) {
        return new FunctionDefinition(name, Arrays.asList(parameters), minArguments, false, body);
    }

    /**
     * A function taking at least minArguments arguments, all of the same type.
     */
    public static FunctionDefinition variadic(String name, int minArguments, ParameterType repeated,
                                              FormulaFunction body) {
        return new FunctionDefinition(name, List.of(repeated), minArguments, true, body);
    }

    public String getName() {
        return name;
    }

    public List<ParameterType> getParameters() {
        return parameters;
    }

    public int getMinArguments() {
        return minArguments;
    }

    /**
     * Upper bound on argument count, or -1 for variadic functions.
     */
    public int getMaxArguments() {
        return variadic ? -1 : parameters.size();
    }

    public boolean isVariadic() {
        return variadic;
    }

    /**
     * Checks arity, coerces each argument per its declared type, and runs the body.
     * Arguments must already be free of errors.
     */
    public FormulaValue invoke(List<FormulaValue> arguments) {
        int count = arguments.size();
        if (count < minArguments || (!variadic && count > parameters.size())) {
            return ErrorValue.of(ErrorKind.VALUE, "Wrong number of arguments to " + name + ": " + count);
        }
        List<FormulaValue> coerced = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            coerced.add(parameterType(i).coerce(arguments.get(i)));
        }
        return body.apply(new FunctionArguments(coerced));
    }

    private ParameterType parameterType(int index) {
        return index < parameters.size() ? parameters.get(index) : parameters.get(parameters.size() - 1);
    }
}
