package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.exceptions.InvalidReferenceException;
import com.spreadsheet.formula.models.ComputedResult;
import com.spreadsheet.formula.models.GraphSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for one document's FormulaEngine: edits, evaluation,
 * caching, cycle rejection and recalculation.
 */
class FormulaEngineTest {

    private FormulaEngine engine;

    @BeforeEach
    void setUp() {
        engine = new FormulaEngine();
    }

    private Object value(String address) {
        return engine.evaluate(address).getDisplayValue();
    }

    private String error(String address) {
        ComputedResult result = engine.evaluate(address);
        assertTrue(result.isError(), address + " should have failed but was " + result.getValue());
        return result.getError();
    }

    // ----------------------------------------------------------------
    // Literals and simple formulas
    // ----------------------------------------------------------------

    @Test
    void testLiteralIsReturnedAsIs() {
        engine.updateCell(0, 0, "hello");
        assertEquals("hello", engine.getCellValue(0, 0));
        assertEquals("Sheet1!A2", engine.updateCell(0, 1, "42"));
        assertEquals("42", value("A2"));
    }

    @Test
    void testEmptyCellIsEmptyString() {
        assertEquals("", engine.getCellValue(3, 3));
    }

    @Test
    void testBareReference() {
        engine.setContent("A1", "hello");
        engine.setContent("B1", "=A1");

        ComputedResult result = engine.evaluate("B1");
        assertEquals("hello", result.getValue());
        assertEquals(Set.of("Sheet1!A1"), result.getDependencies());
    }

    @Test
    void testArithmetic() {
        engine.setContent("A1", "4");
        engine.setContent("B1", "2.5");
        engine.setContent("C1", "=(A1 + B1) * 2 - -1");
        assertEquals(14.0, value("C1"));

        engine.setContent("D1", "=0.1+0.2");
        assertEquals(0.30000000000000004, value("D1"));
    }

    @Test
    void testArithmeticFailuresAreTaggedWithExpression() {
        engine.setContent("A1", "=1/0");
        assertTrue(error("A1").startsWith("#ERROR: Invalid arithmetic expression: 1/0"));

        engine.setContent("B1", "=hello");
        assertTrue(error("B1").startsWith("#ERROR: Invalid arithmetic expression: hello"));
    }

    // ----------------------------------------------------------------
    // Caching and invalidation
    // ----------------------------------------------------------------

    /**
     * A1=1, B1=A1, C1=B1+1 gives 2; after A1=5, C1 gives 6 without reading B1 first.
     */
    @Test
    void testInvalidationReachesTransitiveDependents() {
        engine.setContent("A1", "1");
        engine.setContent("B1", "=A1");
        engine.setContent("C1", "=B1+1");
        assertEquals(2.0, value("C1"));
        assertTrue(engine.isCached("B1"));

        engine.setContent("A1", "5");
        assertFalse(engine.isCached("A1"));
        assertFalse(engine.isCached("B1"));
        assertFalse(engine.isCached("C1"));
        assertEquals(6.0, value("C1"));
    }

    @Test
    void testEvaluatingTwiceIsIdempotent() {
        engine.setContent("A1", "3");
        engine.setContent("B1", "=SUM(A1, 4)");

        GraphSnapshot before = engine.exportDependencyGraph();
        ComputedResult first = engine.evaluate("B1");
        ComputedResult second = engine.evaluate("B1");
        GraphSnapshot after = engine.exportDependencyGraph();

        assertSame(first, second);
        assertEquals(7.0, second.getValue());
        assertEquals(before.getNodes(), after.getNodes());
        assertEquals(before.getEdges().size(), after.getEdges().size());
    }

    @Test
    void testErrorIsTerminalUntilInputChanges() {
        engine.setContent("A1", "-4");
        engine.setContent("B1", "=SQRT(A1)");
        assertEquals("#ERROR: Invalid argument for SQRT", error("B1"));
        assertSame(engine.evaluate("B1"), engine.evaluate("B1"));

        engine.setContent("A1", "16");
        assertEquals(4.0, value("B1"));
    }

    @Test
    void testErrorsPropagateToReaders() {
        engine.setContent("A1", "=FOO(1)");
        engine.setContent("B1", "=A1");
        engine.setContent("C1", "=A1+1");

        assertEquals("#ERROR: Unknown function: FOO", error("A1"));
        assertEquals("#ERROR: Unknown function: FOO", error("B1"));
        assertEquals("#ERROR: Unknown function: FOO", error("C1"));
    }

    @Test
    void testChangingFormulaRebuildsDependencies() {
        engine.setContent("A1", "1");
        engine.setContent("B1", "2");
        engine.setContent("C1", "=A1*10");
        assertEquals(10.0, value("C1"));

        engine.setContent("C1", "=B1*10");
        assertEquals(20.0, value("C1"));
        assertEquals(Set.of("Sheet1!B1"), engine.getDependencies("C1"));
        assertTrue(engine.getDependents("A1").isEmpty());

        // A1 no longer feeds C1
        engine.setContent("B1", "3");
        engine.setContent("A1", "100");
        assertEquals(30.0, value("C1"));
    }

    @Test
    void testClearCellKeepsReadersWorking() {
        engine.setContent("A1", "5");
        engine.setContent("B1", "=A1*2");
        assertEquals(10.0, value("B1"));

        engine.clearCell(0, 0, "Sheet1");
        assertTrue(engine.getRawContent("A1").isEmpty());
        assertEquals(0.0, value("B1"));
        assertEquals(Set.of("Sheet1!B1"), engine.getDependents(0, 0, "Sheet1"));
    }

    // ----------------------------------------------------------------
    // Circular references
    // ----------------------------------------------------------------

    @Test
    void testSelfReferenceIsRejected() {
        engine.setContent("A1", "hello");
        assertThrows(CircularReferenceException.class, () -> engine.setContent("A1", "=A1+1"));
        assertEquals("hello", value("A1"));
    }

    /**
     * A1=B1 then B1=A1 fails, and B1 is left exactly as before the edit.
     */
    @Test
    void testCycleRejectionRestoresCell() {
        engine.setContent("A1", "=B1");
        CircularReferenceException ex = assertThrows(CircularReferenceException.class,
                () -> engine.setContent("B1", "=A1"));

        assertEquals(List.of("Sheet1!B1", "Sheet1!A1", "Sheet1!B1"), ex.getCycle());
        assertTrue(engine.getDependencies("B1").isEmpty());
        assertFalse(engine.getDependents("A1").contains("Sheet1!B1"));
        assertTrue(engine.getRawContent("B1").isEmpty());
        assertEquals("", value("A1"));
    }

    @Test
    void testCycleRejectionKeepsPreviousFormula() {
        engine.setContent("C1", "7");
        engine.setContent("B1", "=C1");
        engine.setContent("A1", "=B1+1");
        assertEquals(8.0, value("A1"));

        assertThrows(CircularReferenceException.class, () -> engine.setContent("B1", "=SUM(A1:A2)"));

        assertEquals("=C1", engine.getRawContent("B1").orElseThrow());
        assertEquals(Set.of("Sheet1!C1"), engine.getDependencies("B1"));
        assertEquals(8.0, value("A1"));
    }

    // ----------------------------------------------------------------
    // Ranges and sheets
    // ----------------------------------------------------------------

    @Test
    void testRangeSumWithEitherCornerOrder() {
        engine.setContent("A1", "1");
        engine.setContent("A2", "2");
        engine.setContent("A3", "3");
        engine.setContent("B1", "=SUM(A1:A3)");
        engine.setContent("B2", "=SUM(A3:A1)");

        assertEquals(6.0, value("B1"));
        assertEquals(6.0, value("B2"));
        assertEquals(Set.of("Sheet1!A1", "Sheet1!A2", "Sheet1!A3"), engine.getDependencies("B2"));
    }

    @Test
    void testOtherSheets() {
        engine.updateCell(0, 0, "7", "Data");
        engine.updateCell(1, 0, "=A1+1", "Data");
        engine.setContent("A1", "=Data!A1*2");
        engine.setContent("A2", "=SUM(Data!A1:B1)");

        assertEquals(8.0, value("Data!B1"));
        assertEquals(14.0, value("A1"));
        assertEquals(15.0, value("A2"));
        assertEquals(Set.of("Data!A1"), engine.getDependencies(1, 0, "Data"));
        assertEquals(Set.of("Data!B1", "Sheet1!A1", "Sheet1!A2"), engine.getDependents("Data!A1"));
    }

    @Test
    void testOversizedRangeIsACellError() {
        FormulaEngine small = new FormulaEngine("Sheet1", 10);
        small.setContent("B1", "=SUM(A1:A100)");
        ComputedResult result = small.evaluate("B1");
        assertTrue(result.isError());
        assertTrue(result.getError().startsWith("#ERROR: Range"));
    }

    // ----------------------------------------------------------------
    // Functions
    // ----------------------------------------------------------------

    @Test
    void testAggregates() {
        engine.setContent("A1", "1");
        engine.setContent("A2", "2");
        engine.setContent("A3", "3");
        engine.setContent("A4", "text");

        engine.setContent("B1", "=AVERAGE(A1:A4)");
        engine.setContent("B2", "=MIN(A1:A4)");
        engine.setContent("B3", "=MAX(A1:A4)");
        engine.setContent("B4", "=COUNT(A1:A4)");
        engine.setContent("B5", "=SUM(1, 2.5, A3)");
        engine.setContent("B6", "=sum(A1:A2)");

        assertEquals(2.0, value("B1"));
        assertEquals(1.0, value("B2"));
        assertEquals(3.0, value("B3"));
        assertEquals(3.0, value("B4"));
        assertEquals(6.5, value("B5"));
        assertEquals(3.0, value("B6"));
    }

    @Test
    void testAggregatesWithoutNumbers() {
        engine.setContent("A1", "x");
        engine.setContent("B1", "=SUM(A1:A3)");
        engine.setContent("B2", "=COUNT(A1:A3)");
        engine.setContent("B3", "=AVERAGE(A1:A3)");
        engine.setContent("B4", "=MIN(A1)");
        engine.setContent("B5", "=MAX(A1)");

        assertEquals(0.0, value("B1"));
        assertEquals(0.0, value("B2"));
        assertEquals("#ERROR: No valid numbers for AVERAGE", error("B3"));
        assertEquals("#ERROR: No valid numbers for MIN", error("B4"));
        assertEquals("#ERROR: No valid numbers for MAX", error("B5"));
    }

    @Test
    void testRoundArity() {
        engine.setContent("A1", "=ROUND(3.14159)");
        engine.setContent("A2", "=ROUND(3.14159,2)");
        engine.setContent("A3", "=ROUND(2.5, 0)");
        engine.setContent("A4", "=ROUND(1234.5678, -2)");
        engine.setContent("A5", "=ROUND(\"abc\", 2)");

        assertEquals("#ERROR: ROUND function requires exactly 2 arguments", error("A1"));
        assertEquals(3.14, value("A2"));
        assertEquals(3.0, value("A3"));
        assertEquals(1200.0, value("A4"));
        assertEquals("#ERROR: Invalid arguments for ROUND", error("A5"));
    }

    @Test
    void testMathFunctions() {
        engine.setContent("A1", "-4");
        engine.setContent("B1", "=ABS(A1)");
        engine.setContent("B2", "=SQRT(16)");
        engine.setContent("B3", "=POWER(2, 10)");
        engine.setContent("B4", "=POWER(\"a\", 2)");
        engine.setContent("B5", "=ABS(1, 2)");
        engine.setContent("B6", "=SQRT(-1)");
        engine.setContent("B7", "=SQRT(ABS(A1)) * 3");

        assertEquals(4.0, value("B1"));
        assertEquals(4.0, value("B2"));
        assertEquals(1024.0, value("B3"));
        assertEquals("#ERROR: Invalid argument for POWER", error("B4"));
        assertEquals("#ERROR: ABS function requires exactly 1 argument", error("B5"));
        assertEquals("#ERROR: Invalid argument for SQRT", error("B6"));
        assertEquals(6.0, value("B7"));
    }

    @Test
    void testConcatenate() {
        engine.setContent("A1", "x");
        engine.setContent("B1", "2");
        engine.setContent("C1", "=CONCATENATE(A1, \"-\", B1, \", \", 1+1)");
        assertEquals("x-2, 2", value("C1"));
    }

    /**
     * Only the selected branch of IF is evaluated.
     */
    @Test
    void testIfEvaluatesOnlyTakenBranch() {
        engine.setContent("A1", "=IF(0,SQRT(-1),\"ok\")");
        engine.setContent("A2", "=IF(1,SQRT(-1),\"ok\")");
        engine.setContent("A3", "=IF(1,\"=SQRT(-1)\",\"ok\")");

        assertEquals("ok", value("A1"));
        assertEquals("#ERROR: Invalid argument for SQRT", error("A2"));
        assertEquals("=SQRT(-1)", value("A3"));
    }

    @Test
    void testIfConditions() {
        engine.setContent("A1", "false");
        engine.setContent("A2", "yes");
        engine.setContent("B1", "=IF(A1, \"t\", \"f\")");
        engine.setContent("B2", "=IF(A2, \"t\", \"f\")");
        engine.setContent("B3", "=IF(A9, \"t\", \"f\")");
        engine.setContent("B4", "=IF(2-2, \"t\", A2)");
        engine.setContent("B5", "=IF(1, 2)");

        assertEquals("f", value("B1"));
        assertEquals("t", value("B2"));
        assertEquals("f", value("B3"));
        assertEquals("yes", value("B4"));
        assertEquals("#ERROR: IF function requires exactly 3 arguments", error("B5"));
    }

    @Test
    void testVlookupIsPlaceholder() {
        engine.setContent("A1", "=VLOOKUP(1, B1:C5, 2)");
        engine.setContent("A2", "=VLOOKUP(1, B1:C5)");

        ComputedResult result = engine.evaluate("A1");
        assertFalse(result.isError());
        assertEquals(FormulaEvaluator.NOT_AVAILABLE, result.getValue());
        assertEquals("#ERROR: VLOOKUP requires at least 3 arguments", error("A2"));
    }

    @Test
    void testUnknownFunction() {
        engine.setContent("A1", "=MEDIAN(1,2)");
        assertEquals("#ERROR: Unknown function: MEDIAN", error("A1"));
    }

    // ----------------------------------------------------------------
    // Recalculation
    // ----------------------------------------------------------------

    /**
     * Chain A1 -> B1 -> C1 -> D1, authored back to front: recalculating after
     * an edit to A1 recomputes B1, C1, D1 in that order with fresh inputs.
     */
    @Test
    void testRecalculationFollowsDependencyOrder() {
        engine.setContent("D1", "=C1+1");
        engine.setContent("C1", "=B1+1");
        engine.setContent("B1", "=A1+1");
        engine.setContent("A1", "1");
        assertEquals(4.0, value("D1"));

        engine.setContent("A1", "10");
        List<String> order = engine.recalculate(List.of("Sheet1!A1"));

        assertEquals(List.of("Sheet1!B1", "Sheet1!C1", "Sheet1!D1"), order);
        assertEquals(11.0, value("B1"));
        assertEquals(12.0, value("C1"));
        assertEquals(13.0, value("D1"));
    }

    @Test
    void testRecalculationOfSeveralEditedCells() {
        engine.setContent("A1", "1");
        engine.setContent("B1", "=A1*2");
        engine.setContent("C1", "=B1+A2");
        engine.setContent("A2", "5");

        List<String> order = engine.recalculate(List.of("A1", "B1", "a2"));
        assertEquals(List.of("Sheet1!B1", "Sheet1!C1"), order);
        assertEquals(7.0, value("C1"));
    }

    @Test
    void testRecalculationOfUnknownCellDoesNothing() {
        assertTrue(engine.recalculate(List.of("Z99")).isEmpty());
    }

    // ----------------------------------------------------------------
    // Long chains
    // ----------------------------------------------------------------

    /**
     * A running total A1..A10000 read cold from its last cell.
     */
    @Test
    void testLongChainIsEvaluatedOnColdRead() {
        engine.setContent("A1", "1");
        for (int row = 2; row <= 10_000; row++) {
            engine.setContent("A" + row, "=A" + (row - 1) + "+1");
        }

        ComputedResult result = assertDoesNotThrow(() -> engine.evaluate("A10000"));
        assertFalse(result.isError(), String.valueOf(result.getError()));
        assertEquals(10_000.0, result.getValue());
        assertTrue(engine.isCached("A5000"));
    }

    @Test
    void testLongChainAuthoredBackToFront() {
        for (int row = 3_000; row >= 2; row--) {
            engine.setContent("B" + row, "=B" + (row - 1) + "*1");
        }
        engine.setContent("B1", "7");

        assertEquals(7.0, value("B3000"));

        engine.setContent("B1", "8");
        assertEquals(8.0, value("B3000"));
    }

    /**
     * An error at the head of a long chain reaches the end with its own message.
     */
    @Test
    void testErrorTravelsDownLongChainUnchanged() {
        engine.setContent("A1", "=SQRT(-1)");
        for (int row = 2; row <= 10_000; row++) {
            engine.setContent("A" + row, "=A" + (row - 1) + "+1");
        }
        assertEquals("#ERROR: Invalid argument for SQRT", error("A10000"));
    }

    // ----------------------------------------------------------------
    // Sheet names
    // ----------------------------------------------------------------

    /**
     * Non-ASCII sheet names are tracked like any other: editing the source evicts its readers.
     */
    @Test
    void testSheetNamesInAnyScript() {
        engine.setContent("Données!A1", "1");
        engine.setContent("Données!A2", "2");
        engine.setContent("B1", "=Données!A1+1");
        engine.setContent("B2", "=SUM(Données!A1:A2)");
        engine.setContent("B3", "=Ünïcødé_2!C3");

        assertEquals(2.0, value("B1"));
        assertEquals(3.0, value("B2"));
        assertEquals(Set.of("Données!A1"), engine.getDependencies("B1"));
        assertEquals(Set.of("Données!A1", "Données!A2"), engine.getDependencies("B2"));
        assertEquals(Set.of("Ünïcødé_2!C3"), engine.getDependencies("B3"));

        engine.setContent("Données!A1", "10");
        assertEquals(11.0, value("B1"));
        assertEquals(12.0, value("B2"));

        engine.setContent("Ünïcødé_2!C3", "x");
        assertEquals("x", value("B3"));
    }

    // ----------------------------------------------------------------
    // Lifecycle
    // ----------------------------------------------------------------

    @Test
    void testResetCacheAndClear() {
        engine.setContent("A1", "2");
        engine.setContent("B1", "=A1*A1");
        assertEquals(4.0, value("B1"));

        engine.resetCache();
        assertEquals(4.0, value("B1"));

        engine.clear();
        assertTrue(engine.rawContents().isEmpty());
        assertTrue(engine.exportDependencyGraph().getNodes().isEmpty());
        assertEquals("", value("B1"));
    }

    @Test
    void testExportDependencyGraph() {
        engine.setContent("B1", "=A1");
        GraphSnapshot snapshot = engine.exportDependencyGraph();

        assertEquals(List.of("Sheet1!B1", "Sheet1!A1"), snapshot.getNodes());
        assertEquals(1, snapshot.getEdges().size());
        assertEquals("Sheet1!A1", snapshot.getEdges().get(0).getFrom());
        assertEquals("Sheet1!B1", snapshot.getEdges().get(0).getTo());
    }

    @Test
    void testEnginesAreIndependent() {
        FormulaEngine other = new FormulaEngine();
        engine.setContent("A1", "1");
        other.setContent("A1", "2");
        assertEquals("1", value("A1"));
        assertEquals("2", other.evaluate("A1").getValue());
    }

    @Test
    void testInvalidAddresses() {
        assertThrows(InvalidReferenceException.class, () -> engine.updateCell(-1, 0, "x"));
        assertThrows(InvalidReferenceException.class, () -> engine.setContent("hello", "x"));
        assertThrows(InvalidReferenceException.class, () -> engine.evaluate("A0"));
    }
}
