package com.spreadsheet.engine.evaluation;

import com.spreadsheet.engine.exceptions.CircularReferenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        graph = new DependencyGraph();
    }

    @Test
    void testAddDependencyRecordsBothDirections() {
        graph.addDependency("B1", "A1");

        assertEquals(List.of("A1"), graph.getDependencies("B1"));
        assertEquals(List.of("B1"), graph.getDependents("A1"));
        assertTrue(graph.hasDependency("B1", "A1"));
        assertFalse(graph.hasDependency("A1", "B1"));
    }

    @Test
    void testSelfReferenceIsRejected() {
        CircularReferenceException e = assertThrows(CircularReferenceException.class,
                () -> graph.addDependency("A1", "A1"));
        assertEquals("A1", e.getFromCell());
        assertTrue(graph.isEmpty());
    }

    @Test
    void testRejectedReadIsKeptOutsideTheEdges() {
        graph.addDependency("A1", "B1");
        graph.recordRejectedRead("B1", "A1");

        assertEquals(List.of("B1"), graph.getRejectedReaders("A1"));
        assertFalse(graph.hasDependency("B1", "A1"));
        assertEquals(List.of("A1"), graph.getEvaluationOrder("A1"));
        assertFalse(graph.getForwardGraph().containsKey("B1"));
    }

    @Test
    void testClearDependenciesDropsRejectedReadsOfThatCell() {
        graph.recordRejectedRead("B1", "A1");
        graph.recordRejectedRead("C1", "A1");

        graph.clearDependencies("B1");

        assertEquals(List.of("C1"), graph.getRejectedReaders("A1"));
        graph.clearDependencies("C1");
        assertTrue(graph.getRejectedReaders("A1").isEmpty());
    }

    /**
     * C1 -> B1 -> A1, then A1 -> C1 would close the loop.
     */
    @Test
    void testCycleClosingEdgeIsRejectedAndNotStored() {
        graph.addDependency("B1", "A1");
        graph.addDependency("C1", "B1");

        assertTrue(graph.wouldCreateCycle("A1", "C1"));
        assertThrows(CircularReferenceException.class, () -> graph.addDependency("A1", "C1"));
        assertFalse(graph.hasDependency("A1", "C1"));
        assertTrue(graph.getDependencies("A1").isEmpty());
    }

    @Test
    void testDependsOnIsTransitive() {
        graph.addDependency("B1", "A1");
        graph.addDependency("C1", "B1");

        assertTrue(graph.dependsOn("C1", "A1"));
        assertFalse(graph.dependsOn("A1", "C1"));
    }

    @Test
    void testClearDependenciesRemovesOutgoingEdgesOnly() {
        graph.addDependency("B1", "A1");
        graph.addDependency("C1", "B1");

        graph.clearDependencies("B1");

        assertTrue(graph.getDependencies("B1").isEmpty());
        assertTrue(graph.getDependents("A1").isEmpty());
        // C1 still reads B1
        assertEquals(List.of("C1"), graph.getDependents("B1"));
    }

    /**
     * A1 <- B1 <- D1, A1 <- C1 <- D1: D1 must come after both B1 and C1.
     */
    @Test
    void testEvaluationOrderPutsChangedCellFirstAndReadersAfterInputs() {
        graph.addDependency("B1", "A1");
        graph.addDependency("C1", "A1");
        graph.addDependency("D1", "B1");
        graph.addDependency("D1", "C1");

        List<String> order = graph.getEvaluationOrder("A1");

        assertEquals(4, order.size());
        assertEquals("A1", order.get(0));
        assertTrue(order.indexOf("D1") > order.indexOf("B1"));
        assertTrue(order.indexOf("D1") > order.indexOf("C1"));
    }

    @Test
    void testEvaluationOrderOfIsolatedCellIsJustThatCell() {
        assertEquals(List.of("Z9"), graph.getEvaluationOrder("Z9"));
    }

    @Test
    void testLongChainIsTraversedWithoutRecursion() {
        for (int row = 2; row <= 5_000; row++) {
            graph.addDependency("A" + row, "A" + (row - 1));
        }
        List<String> order = graph.getEvaluationOrder("A1");
        assertEquals(5_000, order.size());
        assertEquals("A5000", order.get(order.size() - 1));
    }

    @Test
    void testTopologicalOrderListsInputsFirst() {
        graph.addDependency("C1", "B1");
        graph.addDependency("B1", "A1");

        List<String> order = graph.getTopologicalOrder();

        assertEquals(List.of("A1", "B1", "C1"), order);
    }

    @Test
    void testForwardAndReverseViews() {
        graph.addDependency("B1", "A1");
        graph.addDependency("B1", "A2");

        Map<String, Set<String>> forward = graph.getForwardGraph();
        Map<String, Set<String>> reverse = graph.getReverseGraph();

        assertEquals(Set.of("A1", "A2"), forward.get("B1"));
        assertEquals(Set.of("B1"), reverse.get("A1"));
        assertEquals(Set.of("B1"), reverse.get("A2"));
        assertThrows(UnsupportedOperationException.class, () -> forward.put("X1", Set.of()));
    }
}
