package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.values.ArrayValue;
import com.spreadsheet.engine.values.ErrorKind;
import com.spreadsheet.engine.values.ErrorValue;
import com.spreadsheet.engine.values.FormulaValue;
import com.spreadsheet.engine.values.NumberValue;
import com.spreadsheet.engine.values.ValueType;

import java.util.List;

import static com.spreadsheet.engine.functions.ParameterType.ANY;
import static com.spreadsheet.engine.functions.ParameterType.ARRAY;
import static com.spreadsheet.engine.functions.ParameterType.BOOLEAN;
import static com.spreadsheet.engine.functions.ParameterType.NUMBER;

/**
 * VLOOKUP, HLOOKUP, MATCH, INDEX.
 * <p>
 * All lookups are linear scans. Exact mode compares with strict equality (same kind,
 * same value; text is case-sensitive). Approximate mode assumes the keys are sorted
 * ascending (descending for MATCH type -1) and returns the last key not past the
 * lookup value, stopping at the first key that is. Unsorted keys give whatever that
 * scan finds; no attempt is made to detect them.
 */
final class LookupFunctions {

    private LookupFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register(FunctionDefinition.fixed("VLOOKUP", 3, LookupFunctions::vlookup, ANY, ARRAY, NUMBER, BOOLEAN));
        library.register(FunctionDefinition.fixed("HLOOKUP", 3, LookupFunctions::hlookup, ANY, ARRAY, NUMBER, BOOLEAN));
        library.register(FunctionDefinition.fixed("MATCH", 2, LookupFunctions::match, ANY, ARRAY, NUMBER));
        library.register(FunctionDefinition.fixed("INDEX", 2, LookupFunctions::index, ARRAY, NUMBER, NUMBER));
    }

    /**
     * VLOOKUP(value, table, column, [approximate = TRUE]).
     * The last argument is the desktop spreadsheet range_lookup flag: TRUE asks for the
     * sorted approximate scan, FALSE for an exact match.
     */
    static FormulaValue vlookup(FunctionArguments args) {
        FormulaValue lookup = scalar(args.get(0));
        ArrayValue table = args.array(1);
        int column = (int) args.number(2);
        boolean approximate = args.bool(3, true);

        if (column < 1 || column > table.getColumnCount()) {
            return ErrorValue.of(ErrorKind.VALUE, "VLOOKUP column index out of range: " + column);
        }
        int found = -1;
        for (int row = 0; row < table.getRowCount(); row++) {
            FormulaValue key = table.get(row, 0);
            if (!approximate) {
                if (strictEquals(key, lookup)) {
                    found = row;
                    break;
                }
                continue;
            }
            Integer order = compare(key, lookup);
            if (order == null) {
                continue;
            }
            if (order > 0) {
                break;
            }
            found = row;
        }
        if (found < 0) {
            return ErrorValue.of(ErrorKind.NA, "VLOOKUP found no match for " + lookup.toText());
        }
        return table.get(found, column - 1);
    }

    /**
     * HLOOKUP(value, table, row, [approximate = TRUE]), with the same flag as VLOOKUP.
     */
    static FormulaValue hlookup(FunctionArguments args) {
        FormulaValue lookup = scalar(args.get(0));
        ArrayValue table = args.array(1);
        int row = (int) args.number(2);
        boolean approximate = args.bool(3, true);

        if (row < 1 || row > table.getRowCount()) {
            return ErrorValue.of(ErrorKind.VALUE, "HLOOKUP row index out of range: " + row);
        }
        int found = -1;
        for (int column = 0; column < table.getColumnCount(); column++) {
            FormulaValue key = table.get(0, column);
            if (!approximate) {
                if (strictEquals(key, lookup)) {
                    found = column;
                    break;
                }
                continue;
            }
            Integer order = compare(key, lookup);
            if (order == null) {
                continue;
            }
            if (order > 0) {
                break;
            }
            found = column;
        }
        if (found < 0) {
            return ErrorValue.of(ErrorKind.NA, "HLOOKUP found no match for " + lookup.toText());
        }
        return table.get(row - 1, found);
    }

    /**
     * MATCH(value, range, [type = 1]): 1-based position. Type 0 is exact,
     * a positive type is ascending approximate, a negative type descending approximate.
     */
    static FormulaValue match(FunctionArguments args) {
        FormulaValue lookup = scalar(args.get(0));
        List<FormulaValue> candidates = args.array(1).flatten();
        double type = args.number(2, 1);

        if (type == 0) {
            for (int i = 0; i < candidates.size(); i++) {
                if (strictEquals(candidates.get(i), lookup)) {
                    return NumberValue.of(i + 1);
                }
            }
            return ErrorValue.of(ErrorKind.NA, "MATCH found no match for " + lookup.toText());
        }

        int direction = type > 0 ? 1 : -1;
        int lastIndex = -1;
        for (int i = 0; i < candidates.size(); i++) {
            Integer order = compare(candidates.get(i), lookup);
            if (order == null) {
                continue;
            }
            if (order * direction > 0) {
                break;
            }
            lastIndex = i;
        }
        if (lastIndex < 0) {
            return ErrorValue.of(ErrorKind.NA, "MATCH found no match for " + lookup.toText());
        }
        return NumberValue.of(lastIndex + 1);
    }

    /**
     * INDEX(range, row, [column]). With a single-row range and no column,
     * the second argument picks the column.
     */
    static FormulaValue index(FunctionArguments args) {
        ArrayValue range = args.array(0);
        int row = (int) args.number(1);
        int column;
        if (args.has(2)) {
            column = (int) args.number(2);
        } else if (range.getRowCount() == 1) {
            column = row;
            row = 1;
        } else {
            column = 1;
        }
        if (row < 1 || row > range.getRowCount() || column < 1 || column > range.getColumnCount()) {
            return ErrorValue.of(ErrorKind.VALUE, "INDEX position out of range: " + row + "," + column);
        }
        return range.get(row - 1, column - 1);
    }

    static boolean strictEquals(FormulaValue a, FormulaValue b) {
        if (a.getType() != b.getType()) {
            return false;
        }
        switch (a.getType()) {
            case NUMBER:
                return a.toNumber() == b.toNumber();
            case TEXT:
            case BOOLEAN:
                return a.toText().equals(b.toText());
            default:
                return false;
        }
    }

    /**
     * Orders two values of the same kind; text compares case-insensitively.
     * Returns null when they cannot be ordered against each other.
     */
    static Integer compare(FormulaValue a, FormulaValue b) {
        if (a.getType() != b.getType()) {
            return null;
        }
        switch (a.getType()) {
            case NUMBER:
                return Double.compare(a.toNumber(), b.toNumber());
            case TEXT:
                return Integer.signum(a.toText().compareToIgnoreCase(b.toText()));
            case BOOLEAN:
                return Boolean.compare(a.toBoolean(), b.toBoolean());
            default:
                return null;
        }
    }

    private static FormulaValue scalar(FormulaValue value) {
        return value.getType() == ValueType.ARRAY ? ((ArrayValue) value).first() : value;
    }
}
