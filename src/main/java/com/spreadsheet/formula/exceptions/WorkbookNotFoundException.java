package com.spreadsheet.formula.exceptions;

/**
 * Thrown when attempting to access a workbook name
 * that doesn't exist in the in-memory store.
 */
public class WorkbookNotFoundException extends RuntimeException {
    public WorkbookNotFoundException(String message) {
        super(message);
    }
}
