package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a caller names a cell that cannot exist,
 * e.g. "hello" as an address or a negative row index.
 */
public class InvalidReferenceException extends RuntimeException {
    public InvalidReferenceException(String message) {
        super(message);
    }
}
