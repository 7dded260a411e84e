package com.spreadsheet.formula.models;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persistence shape of a workbook, as handed to and from the document store.
 * "worksheets" maps a sheet name to its cells, each keyed by an A1 address
 * without sheet prefix, e.g. { "Sheet1": { "A1": "5", "B1": "=A1*2" } }.
 */
public class WorkbookDocument {
    private String name;
    private Map<String, Map<String, String>> worksheets = new LinkedHashMap<>();
    private Instant createdAt;
    private Instant updatedAt;

    // Default constructor needed for JSON (de)serialization
    public WorkbookDocument() {
    }

    public WorkbookDocument(String name, Map<String, Map<String, String>> worksheets) {
        this.name = name;
        this.worksheets = worksheets;
    }

    public String getName() {
        return name;
    }
    public Map<String, Map<String, String>> getWorksheets() {
        return worksheets;
    }
    public Instant getCreatedAt() {
        return createdAt;
    }
    public Instant getUpdatedAt() {
        return updatedAt;
    }
    public void setName(String name) {
        this.name = name;
    }
    public void setWorksheets(Map<String, Map<String, String>> worksheets) {
        this.worksheets = worksheets;
    }
    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
