package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.exceptions.InvalidReferenceException;
import com.spreadsheet.formula.models.ComputedResult;
import com.spreadsheet.formula.models.GraphSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Formula engine for one document: raw contents, dependency graph and
 * result cache, plus the operations hosts call on them.
 *
 * One instance per document; instances share nothing. Not thread-safe:
 * a concurrent host must serialize every call on the same instance.
 */
public class FormulaEngine {

    private static final Logger logger = LoggerFactory.getLogger(FormulaEngine.class);

    public static final int DEFAULT_MAX_RANGE_CELLS = 100_000;

    private final String defaultSheet;
    private final DependencyGraph graph = new DependencyGraph();
    private final CellStore store = new CellStore();
    private final ReferenceExtractor extractor;
    private final FormulaEvaluator evaluator;
    private final Recalculator recalculator;

    public FormulaEngine() {
        this(ReferenceCodec.DEFAULT_SHEET, DEFAULT_MAX_RANGE_CELLS);
    }

    public FormulaEngine(String defaultSheet, int maxRangeCells) {
        this.defaultSheet = defaultSheet;
        this.extractor = new ReferenceExtractor(maxRangeCells);
        this.evaluator = new FormulaEvaluator(store, extractor);
        this.recalculator = new Recalculator(graph, store, evaluator);
    }

    // ----------------------------------------------------------------
    // Edits
    // ----------------------------------------------------------------

    public String updateCell(int column, int row, String rawValue) {
        return updateCell(column, row, rawValue, defaultSheet);
    }

    /**
     * Sets a cell's raw content (literal or "=formula") and rebuilds its
     * incoming dependency edges. Returns the cell's canonical address.
     *
     * @throws CircularReferenceException if the formula would close a loop;
     *         the cell keeps its previous content and edges
     */
    public String updateCell(int column, int row, String rawValue, String sheet) {
        return setContent(toAddress(column, row, sheet), rawValue);
    }

    /**
     * Same as {@link #updateCell(int, int, String, String)} for a textual address.
     */
    public String setContent(String address, String rawValue) {
        String cell = canonical(address);
        if (rawValue == null) {
            clearContent(cell);
            return cell;
        }
        Optional<String> previous = store.getRawContent(cell);

        // Nothing computed from the old content may survive the edit
        invalidate(cell);
        store.setContent(cell, rawValue);
        try {
            if (FormulaEvaluator.isFormula(rawValue)) {
                graph.setCellFormula(cell, extractor.extract(rawValue, ReferenceCodec.sheetOf(cell)));
            } else {
                graph.setCellLiteral(cell);
            }
        } catch (CircularReferenceException e) {
            if (previous.isPresent()) {
                store.setContent(cell, previous.get());
            } else {
                store.clearContent(cell);
            }
            logger.warn("Rejected edit of {}: {}", cell, e.getMessage());
            throw e;
        }
        logger.debug("Set {} to {}", cell, rawValue);
        return cell;
    }

    public String clearCell(int column, int row, String sheet) {
        return clearContent(toAddress(column, row, sheet));
    }

    /**
     * Deletes a cell's content. The node stays in the graph, since other
     * formulas may still read the now-empty cell.
     */
    public String clearContent(String address) {
        String cell = canonical(address);
        invalidate(cell);
        store.clearContent(cell);
        graph.setCellLiteral(cell);
        return cell;
    }

    /**
     * Evicts the cached results of address and everything downstream of it.
     * Returns the evicted closure.
     */
    public Set<String> invalidate(String address) {
        Set<String> closure = graph.dependentClosure(address);
        store.evictAll(closure);
        logger.debug("Invalidated {} cell(s) from {}", closure.size(), address);
        return closure;
    }

    // ----------------------------------------------------------------
    // Reads
    // ----------------------------------------------------------------

    public Object getCellValue(int column, int row) {
        return getCellValue(column, row, defaultSheet);
    }

    /**
     * Display value of a cell: a String or Double, or an error marker
     * such as "#ERROR: Unknown function: FOO".
     */
    public Object getCellValue(int column, int row, String sheet) {
        return evaluate(toAddress(column, row, sheet)).getDisplayValue();
    }

    /**
     * Computed result of a cell. Uncached cells it reads are computed first,
     * sources before readers, so each nested read is a cache hit and a long
     * chain never turns into a deep call stack.
     */
    public ComputedResult evaluate(String address) {
        String cell = canonical(address);
        if (!store.isCached(cell)) {
            for (String source : uncachedSources(cell)) {
                evaluator.evaluate(source);
            }
        }
        return evaluator.evaluate(cell);
    }

    /**
     * Whether a computed result for address is currently held in the cache.
     */
    public boolean isCached(String address) {
        return store.isCached(canonical(address));
    }

    public Optional<String> getRawContent(String address) {
        return store.getRawContent(canonical(address));
    }

    public Map<String, String> rawContents() {
        return store.rawContents();
    }

    /**
     * Cells whose formulas read this cell.
     */
    public Set<String> getDependents(int column, int row, String sheet) {
        return graph.successors(toAddress(column, row, sheet));
    }

    public Set<String> getDependents(String address) {
        return graph.successors(canonical(address));
    }

    /**
     * Cells this cell's formula reads.
     */
    public Set<String> getDependencies(int column, int row, String sheet) {
        return graph.predecessors(toAddress(column, row, sheet));
    }

    public Set<String> getDependencies(String address) {
        return graph.predecessors(canonical(address));
    }

    // ----------------------------------------------------------------
    // Recalculation and lifecycle
    // ----------------------------------------------------------------

    /**
     * Recomputes everything downstream of the changed cells, in dependency order.
     */
    public List<String> recalculate(Collection<String> changedAddresses) {
        Set<String> changed = new LinkedHashSet<>();
        for (String address : changedAddresses) {
            changed.add(canonical(address));
        }
        return recalculator.recalculateAfter(changed);
    }

    /**
     * Drops every cached result, e.g. after a host abandoned a recalculation midway.
     */
    public void resetCache() {
        store.evictAll();
    }

    public void clear() {
        graph.clear();
        store.clear();
    }

    public GraphSnapshot exportDependencyGraph() {
        return new GraphSnapshot(new ArrayList<>(graph.nodes()), graph.edges());
    }

    public String getDefaultSheet() {
        return defaultSheet;
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    /**
     * Every uncached cell that cell reads, directly or transitively, in
     * post-order (each cell after all of its own sources). Iterative DFS.
     */
    private List<String> uncachedSources(String cell) {
        List<String> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> path = new ArrayDeque<>();
        Deque<Iterator<String>> pending = new ArrayDeque<>();
        visited.add(cell);
        path.push(cell);
        pending.push(graph.predecessors(cell).iterator());

        while (!pending.isEmpty()) {
            Iterator<String> next = pending.peek();
            if (next.hasNext()) {
                String source = next.next();
                if (!store.isCached(source) && visited.add(source)) {
                    path.push(source);
                    pending.push(graph.predecessors(source).iterator());
                }
                continue;
            }
            pending.pop();
            String done = path.pop();
            if (!done.equals(cell)) {
                order.add(done);
            }
        }
        return order;
    }

    private String toAddress(int column, int row, String sheet) {
        if (column < 0 || row < 0) {
            throw new InvalidReferenceException("Column and row must be non-negative, got " + column + "," + row);
        }
        return ReferenceCodec.toAddress(column, row, sheet == null ? defaultSheet : sheet);
    }

    private String canonical(String address) {
        return ReferenceCodec.canonicalize(address, defaultSheet)
                .orElseThrow(() -> new InvalidReferenceException("Not a cell reference: " + address));
    }
}
