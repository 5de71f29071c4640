package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.values.ErrorKind;
import com.spreadsheet.engine.values.ErrorValue;
import org.junit.jupiter.api.Test;

import static com.spreadsheet.engine.functions.FunctionTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class MathFunctionsTest {

    @Test
    void testSum() {
        assertEquals(num(6), call("SUM", num(1), num(2), num(3)));
        assertEquals(num(10), call("SUM", column(num(1), num(2), blank()), num(7)));
        // text that is not a number counts as 0
        assertEquals(num(1), call("SUM", column(num(1), text("abc"))));
    }

    @Test
    void testAverageSkipsBlanks() {
        assertEquals(num(2), call("AVERAGE", column(num(1), blank(), num(3))));
        assertEquals(num(0), call("AVERAGE", column(blank(), blank())));
    }

    @Test
    void testCountAndCountA() {
        assertEquals(num(2), call("COUNT", column(num(1), text("x"), blank(), num(4))));
        assertEquals(num(3), call("COUNTA", column(num(1), text("x"), blank(), num(4))));
        assertEquals(num(0), call("COUNTA", column(blank(), text(""))));
    }

    @Test
    void testMaxMinProduct() {
        assertEquals(num(9), call("MAX", num(3), column(num(9), num(-1))));
        assertEquals(num(-1), call("MIN", num(3), column(num(9), num(-1))));
        assertEquals(num(24), call("PRODUCT", num(2), num(3), num(4)));
        assertEquals(num(0), call("MAX", column(blank())));
        assertEquals(num(0), call("PRODUCT", column(blank())));
    }

    @Test
    void testAbs() {
        assertEquals(num(3.5), call("ABS", num(-3.5)));
    }

    @Test
    void testRoundHalfAwayFromZero() {
        assertEquals(num(3), call("ROUND", num(2.5)));
        assertEquals(num(-3), call("ROUND", num(-2.5)));
        assertEquals(num(3.14), call("ROUND", num(3.14159), num(2)));
        assertEquals(num(1200), call("ROUND", num(1234), num(-2)));
        assertEquals(ErrorKind.NUM, ((ErrorValue) call("ROUND", num(1), num(16))).getKind());
    }

    @Test
    void testFloorAndCeiling() {
        assertEquals(num(2), call("FLOOR", num(2.7)));
        assertEquals(num(10), call("FLOOR", num(12), num(5)));
        assertEquals(num(3), call("CEILING", num(2.1)));
        assertEquals(num(15), call("CEILING", num(12), num(5)));
    }

    @Test
    void testZeroMultiple() {
        assertEquals(ErrorKind.DIV_ZERO, ((ErrorValue) call("FLOOR", num(12), num(0))).getKind());
        assertEquals(ErrorKind.DIV_ZERO, ((ErrorValue) call("FLOOR", num(-3.5), num(0))).getKind());
        assertEquals(num(0), call("CEILING", num(12), num(0)));
        assertEquals(num(0), call("CEILING", num(-3.5), num(0)));
    }

    @Test
    void testNumericTextArgumentIsCoerced() {
        assertEquals(num(4), call("ABS", text("-4")));
    }

    @Test
    void testArity() {
        assertEquals(ErrorKind.VALUE, ((ErrorValue) call("SUM")).getKind());
        assertEquals(ErrorKind.VALUE, ((ErrorValue) call("ABS", num(1), num(2))).getKind());
    }
}
