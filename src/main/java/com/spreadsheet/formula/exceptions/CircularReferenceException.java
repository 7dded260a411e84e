package com.spreadsheet.formula.exceptions;

import java.util.List;

/**
 * Thrown when an edit would make a cell depend on itself,
 * directly (A1 = "=A1") or through a loop of other cells.
 * Carries the loop as a list of canonical addresses whose
 * first and last entries are the same cell.
 */
public class CircularReferenceException extends RuntimeException {
    private final List<String> cycle;

    public CircularReferenceException(List<String> cycle) {
        super("Circular dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
