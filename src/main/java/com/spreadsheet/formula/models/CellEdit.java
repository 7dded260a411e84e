package com.spreadsheet.formula.models;

/**
 * One raw cell edit as it arrives from a collaborator
 * (UI, realtime relay, batch import).
 * Column and row are zero-based; rawValue is a literal or "=formula".
 */
public class CellEdit {
    private String sheet;
    private int column;
    private int row;
    private String rawValue;

    // Default constructor needed for JSON (de)serialization
    public CellEdit() {
    }

    public CellEdit(String sheet, int column, int row, String rawValue) {
        this.sheet = sheet;
        this.column = column;
        this.row = row;
        this.rawValue = rawValue;
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
    public String getRawValue() {
        return rawValue;
    }
    public void setSheet(String sheet) {
        this.sheet = sheet;
    }
    public void setColumn(int column) {
        this.column = column;
    }
    public void setRow(int row) {
        this.row = row;
    }
    public void setRawValue(String rawValue) {
        this.rawValue = rawValue;
    }
}
