package org.rrview.routing.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.jupiter.api.Test;
import org.rrview.routing.testutil.RouteViewFixtureFactory;

import static org.junit.jupiter.api.Assertions.*;
import static org.rrview.routing.testutil.RouteViewFixtureFactory.*;

class ReverseEdgeIndexTest {

    @Test
    void testFaninMatchesForwardEdges() {
        RRGraph graph = RouteViewFixtureFactory.smallDeviceGraph();
        ReverseEdgeIndex index = ReverseEdgeIndex.build(graph);

        for (int node = 0; node < graph.nodeCount(); node++) {
            IntArrayList expected = new IntArrayList();
            for (int e = 0; e < graph.edgeCount(); e++) {
                if (graph.edgeTarget(e) == node) {
                    expected.add(graph.edgeOrigin(e));
                }
            }
            IntArrayList actual = new IntArrayList();
            index.forEachFanin(node, actual::add);
            assertEquals(expected, actual, "fan-in of node " + node);
            assertEquals(expected.size(), index.inDegree(node));
        }
    }

    @Test
    void testDuplicateEdgesReportedPerEdge() {
        RRGraph.Builder b = RRGraph.builder();
        int sw = b.addSwitch("mux", true);
        int a = b.addWire(RRNodeKind.CHANX, 0, 0, 0, 0, 0, WireDirection.BIDIR);
        int c = b.addWire(RRNodeKind.CHANY, 0, 0, 0, 0, 0, WireDirection.BIDIR);
        b.addEdge(a, c, sw);
        b.addEdge(a, c, sw);
        ReverseEdgeIndex index = ReverseEdgeIndex.build(b.build());

        assertEquals(2, index.inDegree(c));
        assertEquals(0, index.inDegree(a));
    }

    @Test
    void testBounds() {
        ReverseEdgeIndex index = ReverseEdgeIndex.build(RouteViewFixtureFactory.smallDeviceGraph());
        assertEquals(1, index.inDegree(CHANY));
        assertThrows(IndexOutOfBoundsException.class, () -> index.inDegree(99));
    }
}
