package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.values.ErrorKind;
import com.spreadsheet.engine.values.ErrorValue;
import org.junit.jupiter.api.Test;

import static com.spreadsheet.engine.functions.FunctionTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class TextFunctionsTest {

    @Test
    void testConcatenate() {
        assertEquals(text("a1.5TRUE"), call("CONCATENATE", text("a"), num(1.5), bool(true)));
        assertEquals(text("xy"), call("CONCATENATE", row(text("x"), blank(), text("y"))));
    }

    @Test
    void testLeftRightMid() {
        assertEquals(text("he"), call("LEFT", text("hello"), num(2)));
        assertEquals(text("h"), call("LEFT", text("hello")));
        assertEquals(text("hello"), call("LEFT", text("hello"), num(99)));
        assertEquals(text("lo"), call("RIGHT", text("hello"), num(2)));
        assertEquals(text("ell"), call("MID", text("hello"), num(2), num(3)));
        assertEquals(text(""), call("MID", text("hello"), num(9), num(3)));
        assertEquals(ErrorKind.VALUE, ((ErrorValue) call("MID", text("hello"), num(0), num(3))).getKind());
        assertEquals(ErrorKind.VALUE, ((ErrorValue) call("LEFT", text("hello"), num(-1))).getKind());
    }

    @Test
    void testLenUpperLowerTrim() {
        assertEquals(num(5), call("LEN", text("hello")));
        assertEquals(num(1), call("LEN", num(7)));
        assertEquals(text("ABC"), call("UPPER", text("aBc")));
        assertEquals(text("abc"), call("LOWER", text("aBc")));
        assertEquals(text("a b"), call("TRIM", text("  a b  ")));
    }
}
