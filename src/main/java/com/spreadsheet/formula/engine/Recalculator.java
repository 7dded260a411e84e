package com.spreadsheet.formula.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Re-evaluates everything downstream of a batch of edits, sources first,
 * so every recomputed cell reads already-fresh inputs.
 */
public class Recalculator {

    private static final Logger logger = LoggerFactory.getLogger(Recalculator.class);

    private final DependencyGraph graph;
    private final CellStore store;
    private final FormulaEvaluator evaluator;

    public Recalculator(DependencyGraph graph, CellStore store, FormulaEvaluator evaluator) {
        this.graph = graph;
        this.store = store;
        this.evaluator = evaluator;
    }

    /**
     * Recomputes every transitive dependent of the edited cells, walking the
     * topological order once. Returns the recomputed addresses in that order.
     */
    public List<String> recalculateAfter(Collection<String> editedAddresses) {
        Set<String> dirty = new HashSet<>();
        for (String edited : editedAddresses) {
            for (String dependent : graph.dependentClosure(edited)) {
                if (!dependent.equals(edited)) {
                    dirty.add(dependent);
                }
            }
        }
        if (dirty.isEmpty()) {
            return new ArrayList<>();
        }

        List<String> recomputed = new ArrayList<>(dirty.size());
        for (String address : graph.topologicalOrder()) {
            if (dirty.contains(address)) {
                store.evict(address);
                evaluator.evaluate(address);
                recomputed.add(address);
            }
        }
        logger.debug("Recalculated {} cell(s) after edits to {}", recomputed.size(), editedAddresses);
        return recomputed;
    }
}
