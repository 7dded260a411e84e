package com.spreadsheet.formula.models;

/**
 * A built-in formula function as offered to editors:
 * - name: upper-case function name, e.g. "SUM"
 * - description: one line on what it computes
 * - syntax: argument template, e.g. "ROUND(number, digits)"
 */
public class FunctionInfo {
    private final String name;
    private final String description;
    private final String syntax;

    public FunctionInfo(String name, String description, String syntax) {
        this.name = name;
        this.description = description;
        this.syntax = syntax;
    }

    public String getName() {
        return name;
    }
    public String getDescription() {
        return description;
    }
    public String getSyntax() {
        return syntax;
    }
}
