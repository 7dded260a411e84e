package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.models.FunctionInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The functions {@link FormulaEvaluator} understands, with a description and
 * syntax for each, and name completion for formula editors.
 */
public final class FunctionCatalog {

    public static final int DEFAULT_MAX_SUGGESTIONS = 10;

    // Same order as the evaluator's dispatch
    private static final List<FunctionInfo> FUNCTIONS = List.of(
            new FunctionInfo("SUM", "Adds all numbers in a range", "SUM(range)"),
            new FunctionInfo("AVERAGE", "Calculates the average of numbers", "AVERAGE(range)"),
            new FunctionInfo("MIN", "Finds the minimum value", "MIN(range)"),
            new FunctionInfo("MAX", "Finds the maximum value", "MAX(range)"),
            new FunctionInfo("COUNT", "Counts the number of cells with numbers", "COUNT(range)"),
            new FunctionInfo("IF", "Returns one value if true, another if false",
                    "IF(condition, true_value, false_value)"),
            new FunctionInfo("CONCATENATE", "Joins text strings", "CONCATENATE(text1, text2, ...)"),
            new FunctionInfo("ROUND", "Rounds a number to specified digits", "ROUND(number, digits)"),
            new FunctionInfo("ABS", "Returns absolute value", "ABS(number)"),
            new FunctionInfo("SQRT", "Returns square root", "SQRT(number)"),
            new FunctionInfo("POWER", "Raises a number to a power", "POWER(base, exponent)"),
            new FunctionInfo("VLOOKUP", "Looks up a value in a table",
                    "VLOOKUP(lookup_value, table_array, col_index, exact_match)")
    );

    private FunctionCatalog() {
    }

    public static List<FunctionInfo> all() {
        return FUNCTIONS;
    }

    public static Optional<FunctionInfo> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim().toUpperCase(Locale.ROOT);
        return FUNCTIONS.stream().filter(f -> f.getName().equals(wanted)).findFirst();
    }

    /**
     * Functions whose name starts with what the user typed so far, case-insensitive.
     * A leading "=" is ignored, so "=su" and "SU" both suggest SUM.
     * A blank prefix suggests everything, up to maxSuggestions.
     */
    public static List<FunctionInfo> suggest(String typed, int maxSuggestions) {
        String prefix = typed == null ? "" : typed.trim();
        if (prefix.startsWith("=")) {
            prefix = prefix.substring(1).trim();
        }
        prefix = prefix.toUpperCase(Locale.ROOT);

        List<FunctionInfo> matches = new ArrayList<>();
        for (FunctionInfo function : FUNCTIONS) {
            if (matches.size() >= maxSuggestions) {
                break;
            }
            if (function.getName().startsWith(prefix)) {
                matches.add(function);
            }
        }
        return matches;
    }
}
