package com.spreadsheet.engine.values;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NumberValueTest {

    @Test
    void testFormat() {
        assertEquals("20", NumberValue.format(20.0));
        assertEquals("-3", NumberValue.format(-3.0));
        assertEquals("2.5", NumberValue.format(2.5));
        assertEquals("0.1", NumberValue.format(0.1));
        assertEquals("0.30000000000000004", NumberValue.format(0.1 + 0.2));
    }

    @Test
    void testParse() {
        assertEquals(Double.valueOf(42), NumberValue.parse("42"));
        assertEquals(Double.valueOf(-0.5), NumberValue.parse(" -.5 "));
        assertEquals(Double.valueOf(1500), NumberValue.parse("1.5e3"));
        assertNull(NumberValue.parse("abc"));
        assertNull(NumberValue.parse("NaN"));
        assertNull(NumberValue.parse("0x1F"));
        assertNull(NumberValue.parse(""));
    }

    @Test
    void testFromCellText() {
        assertEquals(NumberValue.of(7), FormulaValue.fromCellText("7"));
        assertEquals(TextValue.of("seven"), FormulaValue.fromCellText("seven"));
        assertTrue(FormulaValue.fromCellText("").isBlank());
    }

    @Test
    void testConversions() {
        assertEquals("3", NumberValue.of(3).toDisplayString());
        assertEquals(3.0, NumberValue.of(3).toJavaObject());
        assertTrue(NumberValue.of(2).toBoolean());
        assertFalse(NumberValue.ZERO.toBoolean());
        assertEquals(1.0, BooleanValue.TRUE.toNumber());
        assertEquals(0.0, TextValue.of("abc").toNumber());
        assertEquals("#DIV/0!", ErrorValue.of(ErrorKind.DIV_ZERO, "x").getCode());
        assertEquals(ErrorKind.NA, ErrorKind.fromCode("#N/A"));
    }
}
