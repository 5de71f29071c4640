package com.spreadsheet.engine.functions;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static com.spreadsheet.engine.functions.FunctionTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class DateFunctionsTest {

    @Test
    void testSerialNumbers() {
        assertEquals(0, DateFunctions.serial(LocalDate.of(1899, 12, 30)));
        assertEquals(45292, DateFunctions.serial(LocalDate.of(2024, 1, 1)));
    }

    @Test
    void testTodayAndNowUseTheClock() {
        // 2024-03-15 is serial 45366
        assertEquals(num(45366), call("TODAY"));
        assertEquals(num(45366.75), call("NOW"));
    }
}
