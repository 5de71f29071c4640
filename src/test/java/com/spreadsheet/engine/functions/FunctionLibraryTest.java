package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.values.NumberValue;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FunctionLibraryTest {

    @Test
    void testLookupIsCaseInsensitive() {
        FunctionLibrary library = FunctionLibrary.standard(Clock.systemUTC());
        assertSame(library.get("SUM"), library.get("sum"));
        assertTrue(library.contains("Vlookup"));
        assertNull(library.get("NOPE"));
        assertFalse(library.contains("NOPE"));
    }

    @Test
    void testDeclaredArity() {
        FunctionLibrary library = FunctionLibrary.standard(Clock.systemUTC());
        FunctionDefinition mid = library.get("MID");
        assertFalse(mid.isVariadic());
        assertEquals(3, mid.getMinArguments());
        assertEquals(3, mid.getMaxArguments());
        assertEquals(List.of(ParameterType.TEXT, ParameterType.NUMBER, ParameterType.NUMBER), mid.getParameters());
        assertTrue(library.get("SUM").isVariadic());
    }

    @Test
    void testStandardFunctionNames() {
        List<String> names = FunctionLibrary.standard(Clock.systemUTC()).getAllFunctionNames();
        assertTrue(names.containsAll(List.of("SUM", "AVERAGE", "COUNT", "COUNTA", "MAX", "MIN", "PRODUCT",
                "ABS", "ROUND", "FLOOR", "CEILING", "IF", "AND", "OR", "NOT", "TRUE", "FALSE",
                "CONCATENATE", "LEFT", "RIGHT", "MID", "LEN", "UPPER", "LOWER", "TRIM",
                "NOW", "TODAY", "VLOOKUP", "HLOOKUP", "MATCH", "INDEX")));
        List<String> sorted = names.stream().sorted().collect(Collectors.toList());
        assertEquals(sorted, names);
    }

    @Test
    void testRegisterCustomFunction() {
        FunctionLibrary library = FunctionLibrary.standard(Clock.systemUTC());
        library.register(FunctionDefinition.fixed("DOUBLE", 1,
                args -> NumberValue.of(args.number(0) * 2), ParameterType.NUMBER));

        assertEquals(NumberValue.of(8), library.get("double").invoke(List.of(NumberValue.of(4))));
        assertTrue(library.getAllFunctionNames().contains("DOUBLE"));
    }
}
