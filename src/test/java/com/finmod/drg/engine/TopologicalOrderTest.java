package com.finmod.drg.engine;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TopologicalOrderTest {

    @Test
    public void testEmptyGraph() {
        TopologicalOrder order = TopologicalOrder.builder().build();
        assertEquals(0, order.nodeCount());
        assertEquals(0, order.edgeCount());
    }

    @Test
    public void testSingleNode() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode("S!A1")
                .build();

        assertEquals(1, order.nodeCount());
        assertEquals("S!A1", order.address(0));
        assertEquals(0, order.topoIndex("S!A1"));
        assertEquals(0, order.childCount(0));
        assertEquals(0, order.parentCount(0));
    }

    @Test
    public void testLinearGraph() {
        // A -> B -> C
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode("A").addNode("B").addNode("C")
                .addEdge("A", "B")
                .addEdge("B", "C")
                .build();

        assertEquals(List.of("A", "B", "C"), order.order());

        // Check CSR edge structures
        assertEquals(1, order.childCount(0)); // A has 1 child (B)
        assertEquals(1, order.childCount(1)); // B has 1 child (C)
        assertEquals(0, order.childCount(2)); // C has 0 children
        assertEquals(1, order.child(0, 0));
        assertEquals(2, order.child(1, 0));

        // Check parents
        assertEquals(0, order.parentCount(0));
        assertEquals(1, order.parentCount(1));
        assertEquals(0, order.parent(1, 0));
        assertEquals(1, order.parent(2, 0));
    }

    @Test
    public void testNodesAddedOutOfOrder() {
        // C reads B reads A, but C is registered first
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode("C").addNode("B").addNode("A")
                .addEdge("B", "C")
                .addEdge("A", "B")
                .build();

        assertTrue(order.topoIndex("A") < order.topoIndex("B"));
        assertTrue(order.topoIndex("B") < order.topoIndex("C"));
    }

    @Test
    public void testDiamondGraph() {
        // A
        // / \
        // B C
        // \ /
        // D
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode("A").addNode("B").addNode("C").addNode("D")
                .addEdge("A", "B")
                .addEdge("A", "C")
                .addEdge("B", "D")
                .addEdge("C", "D")
                .build();

        assertEquals(4, order.nodeCount());
        assertEquals(4, order.edgeCount());
        assertEquals(0, order.topoIndex("A"));

        int idxD = order.topoIndex("D");
        assertTrue(idxD > order.topoIndex("B"));
        assertTrue(idxD > order.topoIndex("C"));
        assertEquals(2, order.childCount(0));
        assertEquals(2, order.parentCount(idxD));
    }

    @Test
    public void testDuplicateEdgeCountedOnce() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addNode("A").addNode("B")
                .addEdge("A", "B")
                .addEdge("A", "B")
                .build();
        assertEquals(1, order.edgeCount());
    }

    @Test
    public void testCycleDetection() {
        try {
            TopologicalOrder.builder()
                    .addNode("X").addNode("Y").addNode("Z")
                    .addEdge("X", "Y")
                    .addEdge("Y", "Z")
                    .addEdge("Z", "X")
                    .build();
            fail("Should have detected cycle");
        } catch (CircularReferenceException e) {
            assertEquals(List.of(List.of("X", "Y", "Z")), e.cycles());
        }
    }

    @Test
    public void testSelfEdgeIsCycle() {
        try {
            TopologicalOrder.builder().addNode("A").addEdge("A", "A").build();
            fail("Should have detected cycle");
        } catch (CircularReferenceException e) {
            assertEquals(List.of(List.of("A")), e.cycles());
        }
    }

    @Test
    public void testCycleSampleSkipsDownstreamNodes() {
        // A <-> B, and C reads B: C is unordered but not on a cycle
        try {
            TopologicalOrder.builder()
                    .addNode("A").addNode("B").addNode("C")
                    .addEdge("A", "B").addEdge("B", "A").addEdge("B", "C")
                    .build();
            fail("Should have detected cycle");
        } catch (CircularReferenceException e) {
            assertEquals(List.of(List.of("A", "B")), e.cycles());
        }
    }

    @Test
    public void testCycleSampleIsBounded() {
        var builder = TopologicalOrder.builder().maxCycleSamples(2);
        for (int i = 0; i < 4; i++) {
            builder.addNode("P" + i).addNode("Q" + i);
            builder.addEdge("P" + i, "Q" + i).addEdge("Q" + i, "P" + i);
        }
        try {
            builder.build();
            fail("Should have detected cycles");
        } catch (CircularReferenceException e) {
            assertEquals(2, e.cycles().size());
            assertEquals(List.of("P0", "Q0"), e.cycles().get(0));
            assertEquals(List.of("P1", "Q1"), e.cycles().get(1));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNode() {
        TopologicalOrder.builder().addNode("A").addNode("A");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownEdgeEndpoint() {
        TopologicalOrder.builder().addNode("A").addEdge("A", "B");
    }

    @Test
    public void testIndexOfUnknown() {
        TopologicalOrder order = TopologicalOrder.builder().addNode("A").build();
        assertEquals(-1, order.indexOf("B"));
        try {
            order.topoIndex("B");
            fail("Should have rejected unknown address");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("B"));
        }
    }
}
