package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.values.NumberValue;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * NOW and TODAY, as spreadsheet serial numbers: whole days since 1899-12-30,
 * with the time of day as the fraction.
 */
final class DateFunctions {

    static final LocalDate SERIAL_EPOCH = LocalDate.of(1899, 12, 30);

    private static final double SECONDS_PER_DAY = 86_400d;

    private DateFunctions() {
    }

    static void registerAll(FunctionLibrary library, Clock clock) {
        library.register(FunctionDefinition.fixed("NOW", 0, args -> NumberValue.of(serial(LocalDateTime.now(clock)))));
        library.register(FunctionDefinition.fixed("TODAY", 0, args -> NumberValue.of(serial(LocalDate.now(clock)))));
    }

    static double serial(LocalDate date) {
        return ChronoUnit.DAYS.between(SERIAL_EPOCH, date);
    }

    static double serial(LocalDateTime dateTime) {
        return serial(dateTime.toLocalDate()) + dateTime.toLocalTime().toSecondOfDay() / SECONDS_PER_DAY;
    }
}
