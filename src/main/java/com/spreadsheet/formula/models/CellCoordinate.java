package com.spreadsheet.formula.models;

import com.spreadsheet.formula.engine.ReferenceCodec;

import java.util.Objects;

/**
 * Structured position of a single cell:
 * - the sheet it lives on
 * - a zero-based column index (0 = "A")
 * - a zero-based row index (0 = row "1")
 * Two coordinates are equal when their canonical addresses are equal.
 */
public class CellCoordinate {
    private final String sheet;
    private final int column;
    private final int row;

    public CellCoordinate(String sheet, int column, int row) {
        this.sheet = sheet;
        this.column = column;
        this.row = row;
    }

    public String getSheet() {
        return sheet;
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    /**
     * Canonical textual key, e.g. "Sheet1!B3".
     */
    public String toAddress() {
        return ReferenceCodec.toAddress(column, row, sheet);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellCoordinate)) {
            return false;
        }
        return toAddress().equals(((CellCoordinate) o).toAddress());
    }

    @Override
    public int hashCode() {
        return Objects.hash(toAddress());
    }

    @Override
    public String toString() {
        return toAddress();
    }
}
