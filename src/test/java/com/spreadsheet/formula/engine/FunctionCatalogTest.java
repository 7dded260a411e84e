package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.models.FunctionInfo;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FunctionCatalogTest {

    private static List<String> names(List<FunctionInfo> functions) {
        return functions.stream().map(FunctionInfo::getName).collect(Collectors.toList());
    }

    @Test
    void testSuggestByPrefix() {
        assertEquals(List.of("SUM"), names(FunctionCatalog.suggest("=su", 10)));
        assertEquals(List.of("AVERAGE", "ABS"), names(FunctionCatalog.suggest("a", 10)));
        assertEquals(List.of("AVERAGE"), names(FunctionCatalog.suggest("A", 1)));
        assertTrue(FunctionCatalog.suggest("XYZ", 10).isEmpty());
    }

    @Test
    void testBlankPrefixSuggestsUpToTheLimit() {
        List<FunctionInfo> suggestions = FunctionCatalog.suggest("", FunctionCatalog.DEFAULT_MAX_SUGGESTIONS);
        assertEquals(10, suggestions.size());
        assertEquals("SUM", suggestions.get(0).getName());
        assertEquals(12, FunctionCatalog.suggest("=", 50).size());
    }

    @Test
    void testFind() {
        FunctionInfo round = FunctionCatalog.find("round").orElseThrow();
        assertEquals("ROUND(number, digits)", round.getSyntax());
        assertFalse(FunctionCatalog.find("FOO").isPresent());
        assertFalse(FunctionCatalog.find(null).isPresent());
    }

    /**
     * Every listed function is one the evaluator dispatches on.
     */
    @Test
    void testEveryListedFunctionIsKnownToTheEvaluator() {
        FormulaEngine engine = new FormulaEngine();
        int row = 0;
        for (FunctionInfo function : FunctionCatalog.all()) {
            engine.updateCell(0, row, "=" + function.getName() + "()");
            Object value = engine.getCellValue(0, row);
            assertFalse(String.valueOf(value).startsWith("#ERROR: Unknown function"),
                    function.getName() + " gave " + value);
            row++;
        }
    }
}
