package com.spreadsheet.engine.evaluation;

import com.spreadsheet.engine.exceptions.CircularReferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Directed graph of "cell X reads cell Y" edges, kept as two adjacency maps
 * that are exact transposes of each other:
 * - dependencies: X -> cells X reads
 * - dependents:   Y -> cells reading Y
 * <p>
 * The graph never holds a cycle: self-edges and edges closing a loop are rejected
 * before anything is mutated. Traversals are iterative, so a long reference chain
 * cannot overflow the stack.
 * <p>
 * Not thread-safe on its own; the owning sheet's lock serializes writers.
 */
public class DependencyGraph {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyGraph.class);

    // X -> setOfCellsXReads
    private final Map<String, Set<String>> dependencies = new ConcurrentHashMap<>();
    // Y -> setOfCellsThatReadY
    private final Map<String, Set<String>> dependents = new ConcurrentHashMap<>();
    // Y -> cells whose read of Y was rejected as circular; not edges, never part of a cycle check
    private final Map<String, Set<String>> rejectedReaders = new ConcurrentHashMap<>();

    /**
     * Records that 'from' reads 'to'.
     *
     * @throws CircularReferenceException if from == to, or 'to' already depends on 'from'
     */
    public void addDependency(String from, String to) {
        if (wouldCreateCycle(from, to)) {
            LOG.debug("Rejected edge {} -> {}: circular reference", from, to);
            throw new CircularReferenceException(from, to);
        }
        dependencies.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
        dependents.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(from);
    }

    /**
     * Remembers that 'from' tried to read 'to' and was refused, so 'from' can be
     * evaluated again once 'to' changes.
     */
    public void recordRejectedRead(String from, String to) {
        rejectedReaders.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(from);
    }

    /**
     * Cells whose read of 'cellId' was rejected as circular, in the order they were refused.
     */
    public List<String> getRejectedReaders(String cellId) {
        Set<String> readers = rejectedReaders.get(cellId);
        return readers == null ? Collections.emptyList() : new ArrayList<>(readers);
    }

    /**
     * True if adding from -> to would create a cycle: a self-edge,
     * or 'to' already reaching 'from' through existing edges.
     */
    public boolean wouldCreateCycle(String from, String to) {
        if (from.equals(to)) {
            return true;
        }
        return dependsOn(to, from);
    }

    /**
     * True if 'cellId' reads 'target' directly or transitively.
     */
    public boolean dependsOn(String cellId, String target) {
        Deque<String> pending = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        pending.push(cellId);
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (!visited.add(current)) {
                continue;
            }
            Set<String> reads = dependencies.get(current);
            if (reads == null) {
                continue;
            }
            if (reads.contains(target)) {
                return true;
            }
            for (String next : reads) {
                if (!visited.contains(next)) {
                    pending.push(next);
                }
            }
        }
        return false;
    }

    /**
     * Removes every edge going out of 'cellId' (everything it reads), along with
     * any reads of it that were rejected. Edges from cells that read 'cellId' stay,
     * so they still get recalculated.
     */
    public void clearDependencies(String cellId) {
        clearRejectedReads(cellId);
        Set<String> oldTargets = dependencies.remove(cellId);
        if (oldTargets == null) {
            return;
        }
        for (String target : oldTargets) {
            Set<String> readers = dependents.get(target);
            if (readers != null) {
                readers.remove(cellId);
                if (readers.isEmpty()) {
                    dependents.remove(target);
                }
            }
        }
    }

    private void clearRejectedReads(String reader) {
        Iterator<Set<String>> readerSets = rejectedReaders.values().iterator();
        while (readerSets.hasNext()) {
            Set<String> readers = readerSets.next();
            readers.remove(reader);
            if (readers.isEmpty()) {
                readerSets.remove();
            }
        }
    }

    /**
     * Direct dependents only, in edge insertion order.
     */
    public List<String> getDependents(String cellId) {
        Set<String> readers = dependents.get(cellId);
        return readers == null ? Collections.emptyList() : new ArrayList<>(readers);
    }

    /**
     * Cells 'cellId' reads directly, in edge insertion order.
     */
    public List<String> getDependencies(String cellId) {
        Set<String> reads = dependencies.get(cellId);
        return reads == null ? Collections.emptyList() : new ArrayList<>(reads);
    }

    public boolean hasDependency(String from, String to) {
        Set<String> reads = dependencies.get(from);
        return reads != null && reads.contains(to);
    }

    /**
     * The changed cell followed by every cell that transitively reads it, ordered so
     * each cell comes after all the cells it reads within that set.
     * Computed as the reverse of a depth-first post-order over dependents edges;
     * siblings are visited in edge insertion order.
     */
    public List<String> getEvaluationOrder(String changedCell) {
        List<String> postOrder = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> cellStack = new ArrayDeque<>();
        Deque<Iterator<String>> iteratorStack = new ArrayDeque<>();

        visited.add(changedCell);
        cellStack.push(changedCell);
        iteratorStack.push(getDependents(changedCell).iterator());

        while (!cellStack.isEmpty()) {
            Iterator<String> children = iteratorStack.peek();
            if (children.hasNext()) {
                String child = children.next();
                if (visited.add(child)) {
                    cellStack.push(child);
                    iteratorStack.push(getDependents(child).iterator());
                }
            } else {
                iteratorStack.pop();
                postOrder.add(cellStack.pop());
            }
        }

        Collections.reverse(postOrder);
        return postOrder;
    }

    /**
     * Every cell in the graph, each after all the cells it reads.
     */
    public List<String> getTopologicalOrder() {
        Set<String> allCells = new TreeSet<>(dependencies.keySet());
        allCells.addAll(dependents.keySet());
        List<String> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();

        for (String root : allCells) {
            if (visited.contains(root)) {
                continue;
            }
            Deque<String> cellStack = new ArrayDeque<>();
            Deque<Iterator<String>> iteratorStack = new ArrayDeque<>();
            visited.add(root);
            cellStack.push(root);
            iteratorStack.push(getDependencies(root).iterator());
            while (!cellStack.isEmpty()) {
                Iterator<String> reads = iteratorStack.peek();
                if (reads.hasNext()) {
                    String next = reads.next();
                    if (visited.add(next)) {
                        cellStack.push(next);
                        iteratorStack.push(getDependencies(next).iterator());
                    }
                } else {
                    iteratorStack.pop();
                    order.add(cellStack.pop());
                }
            }
        }
        return order;
    }

    /**
     * Copy of the dependencies map (cell -> cells it reads), sorted by cell id.
     */
    public Map<String, Set<String>> getForwardGraph() {
        return copyOf(dependencies);
    }

    /**
     * Copy of the dependents map (cell -> cells that read it), sorted by cell id.
     */
    public Map<String, Set<String>> getReverseGraph() {
        return copyOf(dependents);
    }

    public boolean isEmpty() {
        return dependencies.isEmpty();
    }

    private static Map<String, Set<String>> copyOf(Map<String, Set<String>> source) {
        Map<String, Set<String>> copy = new TreeMap<>();
        for (Map.Entry<String, Set<String>> entry : source.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
        }
        return Collections.unmodifiableMap(copy);
    }
}
