package com.spreadsheet.engine.functions;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name -> function registry. Lookups are case-insensitive.
 */
public class FunctionLibrary {

    private final Map<String, FunctionDefinition> functions = new ConcurrentHashMap<>();

    /**
     * A library holding every built-in function. NOW and TODAY read the given clock.
     */
    public static FunctionLibrary standard(Clock clock) {
        FunctionLibrary library = new FunctionLibrary();
        MathFunctions.registerAll(library);
        LogicalFunctions.registerAll(library);
        TextFunctions.registerAll(library);
        DateFunctions.registerAll(library, clock);
        LookupFunctions.registerAll(library);
        return library;
    }

    public void register(FunctionDefinition definition) {
        functions.put(definition.getName(), definition);
    }

    /**
     * Returns the function, or null if no function has that name.
     */
    public FunctionDefinition get(String name) {
        if (name == null) {
            return null;
        }
        return functions.get(name.toUpperCase(Locale.ROOT));
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    /**
     * Registered names in alphabetical order.
     */
    public List<String> getAllFunctionNames() {
        List<String> names = new ArrayList<>(functions.keySet());
        names.sort(null);
        return names;
    }
}
