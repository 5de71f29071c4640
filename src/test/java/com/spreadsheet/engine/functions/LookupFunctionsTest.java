package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.values.ErrorKind;
import com.spreadsheet.engine.values.ErrorValue;
import com.spreadsheet.engine.values.FormulaValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.spreadsheet.engine.functions.FunctionTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class LookupFunctionsTest {

    private static final FormulaValue PRICES = table(List.of(
            List.of(num(1), text("apple"), num(0.5)),
            List.of(num(5), text("banana"), num(0.25)),
            List.of(num(10), text("cherry"), num(3))));

    private static ErrorKind errorOf(FormulaValue value) {
        return ((ErrorValue) value).getKind();
    }

    @Test
    void testVlookupExact() {
        assertEquals(text("banana"), call("VLOOKUP", num(5), PRICES, num(2), bool(false)));
        assertEquals(ErrorKind.NA, errorOf(call("VLOOKUP", num(6), PRICES, num(2), bool(false))));
    }

    @Test
    void testVlookupApproximateIsDefault() {
        assertEquals(text("banana"), call("VLOOKUP", num(7), PRICES, num(2)));
        assertEquals(num(3), call("VLOOKUP", num(100), PRICES, num(3), bool(true)));
        assertEquals(ErrorKind.NA, errorOf(call("VLOOKUP", num(0), PRICES, num(2))));
    }

    @Test
    void testTrueFourthArgumentMeansApproximate() {
        assertEquals(text("banana"), call("VLOOKUP", num(7), PRICES, num(2), bool(true)));
        assertEquals(ErrorKind.NA, errorOf(call("VLOOKUP", num(7), PRICES, num(2), bool(false))));

        FormulaValue grid = table(List.of(
                List.of(num(10), num(20), num(30)),
                List.of(text("x"), text("y"), text("z"))));
        assertEquals(text("y"), call("HLOOKUP", num(25), grid, num(2), bool(true)));
        assertEquals(ErrorKind.NA, errorOf(call("HLOOKUP", num(25), grid, num(2), bool(false))));
    }

    @Test
    void testVlookupColumnOutOfRange() {
        assertEquals(ErrorKind.VALUE, errorOf(call("VLOOKUP", num(5), PRICES, num(4), bool(false))));
        assertEquals(ErrorKind.VALUE, errorOf(call("VLOOKUP", num(5), PRICES, num(0), bool(false))));
    }

    @Test
    void testExactTextMatchIsCaseSensitive() {
        FormulaValue names = table(List.of(
                List.of(text("Apple"), num(1)),
                List.of(text("apple"), num(2))));
        assertEquals(num(2), call("VLOOKUP", text("apple"), names, num(2), bool(false)));
        assertEquals(num(1), call("VLOOKUP", text("Apple"), names, num(2), bool(false)));
    }

    @Test
    void testHlookup() {
        FormulaValue grid = table(List.of(
                List.of(text("a"), text("b"), text("c")),
                List.of(num(1), num(2), num(3))));
        assertEquals(num(2), call("HLOOKUP", text("b"), grid, num(2), bool(false)));
        assertEquals(ErrorKind.NA, errorOf(call("HLOOKUP", text("z"), grid, num(2), bool(false))));
        assertEquals(ErrorKind.VALUE, errorOf(call("HLOOKUP", text("b"), grid, num(3), bool(false))));
    }

    @Test
    void testMatch() {
        FormulaValue ascending = column(num(10), num(20), num(30));
        assertEquals(num(2), call("MATCH", num(20), ascending, num(0)));
        assertEquals(num(2), call("MATCH", num(25), ascending));
        assertEquals(ErrorKind.NA, errorOf(call("MATCH", num(5), ascending, num(1))));
        assertEquals(ErrorKind.NA, errorOf(call("MATCH", num(25), ascending, num(0))));

        FormulaValue descending = column(num(30), num(20), num(10));
        assertEquals(num(2), call("MATCH", num(15), descending, num(-1)));
    }

    @Test
    void testIndex() {
        assertEquals(text("cherry"), call("INDEX", PRICES, num(3), num(2)));
        assertEquals(num(5), call("INDEX", PRICES, num(2)));
        assertEquals(num(30), call("INDEX", row(num(10), num(20), num(30)), num(3)));
        assertEquals(ErrorKind.VALUE, errorOf(call("INDEX", PRICES, num(4), num(1))));
    }
}
