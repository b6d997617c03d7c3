package org.rrview.routing.netlist;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.testutil.RouteViewFixtureFactory;

import static org.junit.jupiter.api.Assertions.*;
import static org.rrview.routing.testutil.RouteViewFixtureFactory.*;

class TracebackTest {

    private final RRGraph graph = RouteViewFixtureFactory.smallDeviceGraph();

    @Test
    @DisplayName("A complete multi-branch route validates cleanly")
    void testValidRoute() {
        Traceback.ValidationResult result = RouteViewFixtureFactory.dataTraceback().validate(graph);
        assertTrue(result.isValid(), () -> "Errors: " + result.errors());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void testEmptyRouteIsValidButWarned() {
        Traceback.ValidationResult result = Traceback.empty().validate(graph);
        assertTrue(result.isValid());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void testSingleEntryRejected() {
        assertFalse(Traceback.of(SOURCE).validate(graph).isValid());
    }

    @Test
    void testMustStartAtSource() {
        Traceback.ValidationResult result = Traceback.of(OPIN, CHANX_A, IPIN_EAST, SINK_EAST).validate(graph);
        assertFalse(result.isValid());
        assertTrue(result.errors().get(0).contains("SOURCE"));
    }

    @Test
    void testMissingEdgeInsideBranch() {
        Traceback.ValidationResult result = Traceback.of(SOURCE, OPIN, CHANY, IPIN_NORTH, SINK_NORTH).validate(graph);
        assertFalse(result.isValid());
        assertEquals(1, result.errors().size());
    }

    @Test
    @DisplayName("Branch starts after a SINK need no edge from the SINK")
    void testBranchBoundaryNotEdgeChecked() {
        assertTrue(RouteViewFixtureFactory.dataTraceback().validate(graph).isValid());
        assertFalse(graph.hasEdge(SINK_EAST, CHANX_A));
    }

    @Test
    void testUnknownNodes() {
        assertFalse(Traceback.of(SOURCE, 42).validate(graph).isValid());
    }

    @Test
    void testIncompleteRouteWarned() {
        Traceback.ValidationResult result = Traceback.of(SOURCE, OPIN, CHANX_A).validate(graph);
        assertTrue(result.isValid());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void testAccessors() {
        Traceback tb = RouteViewFixtureFactory.dataTraceback();
        assertEquals(9, tb.size());
        assertEquals(CHANX_A, tb.node(5));
        assertTrue(tb.contains(SINK_NORTH));
        assertFalse(tb.contains(CHANX_B));
        assertThrows(UnsupportedOperationException.class, () -> tb.nodes().add(1));
    }
}
