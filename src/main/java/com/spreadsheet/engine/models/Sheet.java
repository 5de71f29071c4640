package com.spreadsheet.engine.models;

import com.spreadsheet.engine.evaluation.DependencyGraph;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The cell store of one spreadsheet:
 * - a unique ID
 * - a map of cellId ("A1") -> Cell, filled lazily on first write
 * - the dependency graph between its cells
 * - a read/write lock; the owner takes the write lock around every mutation
 */
public class Sheet {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final Map<String, Cell> cells = new ConcurrentHashMap<>();
    private final DependencyGraph dependencyGraph = new DependencyGraph();

    // Lock to prevent race conditions when multiple threads update the same Sheet
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet() {
        this.id = ID_GENERATOR.getAndIncrement();
    }

    public long getId() {
        return id;
    }

    public Map<String, Cell> getCells() {
        return cells;
    }

    /**
     * Retrieves the cell, or null if it was never written.
     */
    public Cell getCell(String cellId) {
        return cells.get(cellId);
    }

    public Cell getOrCreateCell(String cellId) {
        return cells.computeIfAbsent(cellId, Cell::new);
    }

    public DependencyGraph getDependencyGraph() {
        return dependencyGraph;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
