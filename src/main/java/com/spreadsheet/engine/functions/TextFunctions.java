package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.values.ErrorKind;
import com.spreadsheet.engine.values.ErrorValue;
import com.spreadsheet.engine.values.FormulaValue;
import com.spreadsheet.engine.values.NumberValue;
import com.spreadsheet.engine.values.TextValue;

import java.util.Locale;

import static com.spreadsheet.engine.functions.ParameterType.NUMBER;
import static com.spreadsheet.engine.functions.ParameterType.TEXT;
import static com.spreadsheet.engine.functions.ParameterType.VALUES;

/**
 * CONCATENATE, LEFT, RIGHT, MID, LEN, UPPER, LOWER, TRIM.
 * Positions are 1-based; counts past the end of the text are clamped.
 */
final class TextFunctions {

    private TextFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register(FunctionDefinition.variadic("CONCATENATE", 1, VALUES, TextFunctions::concatenate));
        library.register(FunctionDefinition.fixed("LEFT", 1, TextFunctions::left, TEXT, NUMBER));
        library.register(FunctionDefinition.fixed("RIGHT", 1, TextFunctions::right, TEXT, NUMBER));
        library.register(FunctionDefinition.fixed("MID", 3, TextFunctions::mid, TEXT, NUMBER, NUMBER));
        library.register(FunctionDefinition.fixed("LEN", 1, args -> NumberValue.of(args.text(0).length()), TEXT));
        library.register(FunctionDefinition.fixed("UPPER", 1,
                args -> TextValue.of(args.text(0).toUpperCase(Locale.ROOT)), TEXT));
        library.register(FunctionDefinition.fixed("LOWER", 1,
                args -> TextValue.of(args.text(0).toLowerCase(Locale.ROOT)), TEXT));
        library.register(FunctionDefinition.fixed("TRIM", 1, args -> TextValue.of(args.text(0).trim()), TEXT));
    }

    static FormulaValue concatenate(FunctionArguments args) {
        StringBuilder joined = new StringBuilder();
        for (FormulaValue value : args.values()) {
            joined.append(value.toText());
        }
        return TextValue.of(joined.toString());
    }

    static FormulaValue left(FunctionArguments args) {
        String text = args.text(0);
        int count = (int) args.number(1, 1);
        if (count < 0) {
            return ErrorValue.of(ErrorKind.VALUE, "LEFT count must not be negative");
        }
        return TextValue.of(text.substring(0, Math.min(count, text.length())));
    }

    static FormulaValue right(FunctionArguments args) {
        String text = args.text(0);
        int count = (int) args.number(1, 1);
        if (count < 0) {
            return ErrorValue.of(ErrorKind.VALUE, "RIGHT count must not be negative");
        }
        return TextValue.of(text.substring(text.length() - Math.min(count, text.length())));
    }

    static FormulaValue mid(FunctionArguments args) {
        String text = args.text(0);
        int start = (int) args.number(1);
        int count = (int) args.number(2);
        if (start < 1) {
            return ErrorValue.of(ErrorKind.VALUE, "MID start must be at least 1");
        }
        if (count < 0) {
            return ErrorValue.of(ErrorKind.VALUE, "MID count must not be negative");
        }
        if (start > text.length()) {
            return TextValue.EMPTY;
        }
        int from = start - 1;
        int to = (int) Math.min((long) from + count, text.length());
        return TextValue.of(text.substring(from, to));
    }
}
