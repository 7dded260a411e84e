package com.spreadsheet.formula.models;

import com.spreadsheet.formula.engine.FormulaEngine;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A stored workbook:
 * - a unique name
 * - its own FormulaEngine (raw contents, dependency graph, result cache)
 * - creation / last update timestamps
 * - a read/write lock serializing access to the engine
 */
public class Workbook {

    private final String name;
    private final FormulaEngine engine;
    private final Instant createdAt;
    private volatile Instant updatedAt;

    // Lock to prevent race conditions when multiple threads use the same engine
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Workbook(String name, FormulaEngine engine, Instant createdAt) {
        this.name = name;
        this.engine = engine;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public String getName() {
        return name;
    }

    public FormulaEngine getEngine() {
        return engine;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Records a content change.
     */
    public void touch() {
        this.updatedAt = Instant.now();
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
