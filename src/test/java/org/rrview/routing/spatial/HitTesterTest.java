package org.rrview.routing.spatial;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.testutil.RouteViewFixtureFactory;
import org.rrview.routing.testutil.RouteViewFixtureFactory.FixedLayout;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;
import static org.rrview.routing.testutil.RouteViewFixtureFactory.*;

class HitTesterTest {

    private final RRGraph graph = RouteViewFixtureFactory.smallDeviceGraph();

    // OPIN sits on the vertical wire; both horizontal wires share one line crossing it
    private final FixedLayout layout = new FixedLayout()
            .pin(OPIN, 5.0, 5.0)
            .pin(IPIN_NORTH, 20.0, 20.0)
            .pin(IPIN_NORTH, 30.0, 20.0)
            .wire(CHANY, 5.0, 0.0, 5.0, 10.0)
            .wire(CHANX_A, 0.0, 8.0, 10.0, 8.0)
            .wire(CHANX_B, 0.0, 8.0, 10.0, 8.0);

    private final HitTester hitTester = new HitTester(graph, layout, 0.3, HitTester.DEFAULT_WIRE_TOLERANCE);

    @Test
    @DisplayName("Pins win over wires drawn under them")
    void testPinPriority() {
        assertEquals(OptionalInt.of(OPIN), hitTester.hitTest(5.0, 5.0));
        assertEquals(OptionalInt.of(OPIN), hitTester.hitTest(5.29, 4.75));
    }

    @Test
    @DisplayName("Overlapping wires resolve to the lowest node id")
    void testWireIdOrder() {
        assertEquals(OptionalInt.of(CHANX_A), hitTester.hitTest(5.0, 8.0));
        assertEquals(OptionalInt.of(CHANX_A), hitTester.hitTest(2.0, 8.0));
        assertEquals(OptionalInt.of(CHANY), hitTester.hitTest(5.0, 2.0));
    }

    @Test
    void testWireTolerance() {
        assertEquals(OptionalInt.of(CHANX_A), hitTester.hitTest(2.0, 8.2));
        assertEquals(OptionalInt.of(CHANY), hitTester.hitTest(5.25, 2.0));
        assertEquals(OptionalInt.empty(), hitTester.hitTest(2.0, 8.4));
        assertEquals(OptionalInt.empty(), hitTester.hitTest(5.4, 2.0));
    }

    @Test
    void testEveryAnchorOfAPinIsHittable() {
        assertEquals(OptionalInt.of(IPIN_NORTH), hitTester.hitTest(20.1, 19.9));
        assertEquals(OptionalInt.of(IPIN_NORTH), hitTester.hitTest(29.8, 20.2));
        assertEquals(OptionalInt.empty(), hitTester.hitTest(25.0, 20.0));
    }

    @Test
    void testMissReturnsEmpty() {
        assertFalse(hitTester.hitTest(100.0, 100.0).isPresent());
    }

    @Test
    void testTileGridLayoutQueries() {
        HitTester tiles = new HitTester(graph, RouteViewFixtureFactory.smallDeviceLayout(graph), 0.3, 0.3);

        assertEquals(OptionalInt.of(OPIN), tiles.hitTest(23.0, 15.0));
        assertEquals(OptionalInt.of(CHANY), tiles.hitTest(24.1, 18.0));
        assertEquals(OptionalInt.of(CHANX_B), tiles.hitTest(18.0, 25.2));
    }

    @Test
    void testRejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> hitTester.hitTest(Double.NaN, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new HitTester(graph, layout, -1.0, 0.3));
        assertThrows(IllegalArgumentException.class,
                () -> new HitTester(graph, layout, 0.3, Double.POSITIVE_INFINITY));
    }
}
