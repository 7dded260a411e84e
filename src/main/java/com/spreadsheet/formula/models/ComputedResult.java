package com.spreadsheet.formula.models;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Outcome of evaluating one cell.
 * Stores:
 * - value: a String or a Double ("" when the cell failed)
 * - error: the full error marker (e.g. "#ERROR: Unknown function: FOO"), or null
 * - dependencies: every address read while computing the value
 * Instances are immutable; a stale result is evicted, never updated.
 */
public class ComputedResult {
    private final Object value;
    private final String error;
    private final Set<String> dependencies;

    private ComputedResult(Object value, String error, Set<String> dependencies) {
        this.value = value;
        this.error = error;
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
    }

    public static ComputedResult of(Object value, Set<String> dependencies) {
        return new ComputedResult(value, null, dependencies);
    }

    public static ComputedResult failed(String error, Set<String> dependencies) {
        return new ComputedResult("", error, dependencies);
    }

    public Object getValue() {
        return value;
    }

    public String getError() {
        return error;
    }

    public boolean isError() {
        return error != null;
    }

    public Set<String> getDependencies() {
        return dependencies;
    }

    /**
     * What a reader sees: the error marker if evaluation failed, else the value.
     */
    public Object getDisplayValue() {
        return error != null ? error : value;
    }
}
