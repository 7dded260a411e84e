package com.spreadsheet.formula.models;

import java.time.Instant;

/**
 * Listing entry for a stored workbook: name plus timestamps, no cell data.
 */
public class WorkbookSummary {
    private final String name;
    private final Instant createdAt;
    private final Instant updatedAt;

    public WorkbookSummary(String name, Instant createdAt, Instant updatedAt) {
        this.name = name;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public String getName() {
        return name;
    }
    public Instant getCreatedAt() {
        return createdAt;
    }
    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
