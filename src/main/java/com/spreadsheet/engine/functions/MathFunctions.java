package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.values.ErrorKind;
import com.spreadsheet.engine.values.ErrorValue;
import com.spreadsheet.engine.values.FormulaValue;
import com.spreadsheet.engine.values.NumberValue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import static com.spreadsheet.engine.functions.ParameterType.NUMBER;
import static com.spreadsheet.engine.functions.ParameterType.NUMBERS;
import static com.spreadsheet.engine.functions.ParameterType.VALUES;

/**
 * SUM, AVERAGE, COUNT, COUNTA, MAX, MIN, PRODUCT, ABS, ROUND, FLOOR, CEILING.
 */
final class MathFunctions {

    // Doubles carry about 15 significant digits; rounding past that is meaningless
    private static final int MAX_ROUND_DIGITS = 15;

    private MathFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register(FunctionDefinition.variadic("SUM", 1, NUMBERS, MathFunctions::sum));
        library.register(FunctionDefinition.variadic("AVERAGE", 1, NUMBERS, MathFunctions::average));
        library.register(FunctionDefinition.variadic("COUNT", 1, VALUES, MathFunctions::count));
        library.register(FunctionDefinition.variadic("COUNTA", 1, VALUES, MathFunctions::countA));
        library.register(FunctionDefinition.variadic("MAX", 1, NUMBERS, MathFunctions::max));
        library.register(FunctionDefinition.variadic("MIN", 1, NUMBERS, MathFunctions::min));
        library.register(FunctionDefinition.variadic("PRODUCT", 1, NUMBERS, MathFunctions::product));
        library.register(FunctionDefinition.fixed("ABS", 1, args -> NumberValue.of(Math.abs(args.number(0))), NUMBER));
        library.register(FunctionDefinition.fixed("ROUND", 1, MathFunctions::round, NUMBER, NUMBER));
        library.register(FunctionDefinition.fixed("FLOOR", 1, MathFunctions::floor, NUMBER, NUMBER));
        library.register(FunctionDefinition.fixed("CEILING", 1, MathFunctions::ceiling, NUMBER, NUMBER));
    }

    static FormulaValue sum(FunctionArguments args) {
        double total = 0;
        for (double value : args.numbers()) {
            total += value;
        }
        return NumberValue.of(total);
    }

    // An empty set averages to 0 rather than failing
    static FormulaValue average(FunctionArguments args) {
        List<Double> numbers = args.numbers();
        if (numbers.isEmpty()) {
            return NumberValue.ZERO;
        }
        double total = 0;
        for (double value : numbers) {
            total += value;
        }
        return NumberValue.of(total / numbers.size());
    }

    static FormulaValue count(FunctionArguments args) {
        long count = args.values().stream().filter(FormulaValue::isNumeric).count();
        return NumberValue.of(count);
    }

    static FormulaValue countA(FunctionArguments args) {
        long count = args.values().stream()
                .filter(value -> !value.isBlank() && !value.toText().isEmpty())
                .count();
        return NumberValue.of(count);
    }

    static FormulaValue max(FunctionArguments args) {
        List<Double> numbers = args.numbers();
        if (numbers.isEmpty()) {
            return NumberValue.ZERO;
        }
        double max = Double.NEGATIVE_INFINITY;
        for (double value : numbers) {
            max = Math.max(max, value);
        }
        return NumberValue.of(max);
    }

    static FormulaValue min(FunctionArguments args) {
        List<Double> numbers = args.numbers();
        if (numbers.isEmpty()) {
            return NumberValue.ZERO;
        }
        double min = Double.POSITIVE_INFINITY;
        for (double value : numbers) {
            min = Math.min(min, value);
        }
        return NumberValue.of(min);
    }

    static FormulaValue product(FunctionArguments args) {
        List<Double> numbers = args.numbers();
        if (numbers.isEmpty()) {
            return NumberValue.ZERO;
        }
        double product = 1;
        for (double value : numbers) {
            product *= value;
        }
        return NumberValue.of(product);
    }

    /**
     * Half away from zero, like ROUND in desktop spreadsheets. Negative digits
     * round to tens, hundreds, ...; fractional digits are truncated.
     */
    static FormulaValue round(FunctionArguments args) {
        double number = args.number(0);
        double digits = args.number(1, 0);
        if (Math.abs(digits) > MAX_ROUND_DIGITS) {
            return ErrorValue.of(ErrorKind.NUM, "ROUND digits out of range: " + NumberValue.format(digits));
        }
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return ErrorValue.of(ErrorKind.NUM, "ROUND of a non-finite number");
        }
        BigDecimal rounded = BigDecimal.valueOf(number).setScale((int) digits, RoundingMode.HALF_UP);
        return NumberValue.of(rounded.doubleValue());
    }

    // A multiple of 0 follows the desktop spreadsheet convention: FLOOR divides by it
    // and fails with #DIV/0!, CEILING treats it as "no multiple" and returns 0.
    static FormulaValue floor(FunctionArguments args) {
        double number = args.number(0);
        double multiple = args.number(1, 1);
        if (multiple == 0) {
            return ErrorValue.of(ErrorKind.DIV_ZERO, "FLOOR with a multiple of 0");
        }
        return NumberValue.of(Math.floor(number / multiple) * multiple);
    }

    static FormulaValue ceiling(FunctionArguments args) {
        double number = args.number(0);
        double multiple = args.number(1, 1);
        if (multiple == 0) {
            return NumberValue.ZERO;
        }
        return NumberValue.of(Math.ceil(number / multiple) * multiple);
    }
}
