package org.rrview.routing.selection;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.netlist.RoutedNetlist;
import org.rrview.routing.spatial.HitTester;
import org.rrview.routing.testutil.RouteViewFixtureFactory;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.rrview.routing.testutil.RouteViewFixtureFactory.*;

class SelectionControllerTest {

    // points in the small device's tile-grid layout
    private static final double[] ON_CHANY = {24.1, 18.0};
    private static final double[] ON_CHANX_A = {18.0, 24.0};
    private static final double[] ON_OPIN = {23.0, 15.0};
    private static final double[] EMPTY = {0.5, 0.5};

    private static final String CHANY_SELECTED =
            "Selected node #3: CHANY (1,1) -> (1,1) track: 0, 2 edges, occ: 0, capacity: 1 || Net: 0 (n_data)";

    private RRGraph graph;
    private RoutedNetlist netlist;
    private HitTester hitTester;

    @BeforeEach
    void setUp() {
        graph = RouteViewFixtureFactory.smallDeviceGraph();
        netlist = RouteViewFixtureFactory.smallNetlist();
        hitTester = new HitTester(graph, RouteViewFixtureFactory.smallDeviceLayout(graph), 0.3, 0.3);
    }

    private SelectionController controller(RRDisplayMode display, boolean showNets) {
        return SelectionController.builder()
                .graph(graph)
                .netlist(netlist)
                .hitTester(hitTester)
                .state(new SelectionState(graph, netlist.size()))
                .rrDisplay(display)
                .showNets(showNets)
                .defaultMessage("Ready")
                .build();
    }

    @Test
    @DisplayName("Clicking a wire selects it, marks its fans and highlights its net")
    void testSelect() {
        SelectionController controller = controller(RRDisplayMode.NODES, true);

        SelectionOutcome outcome = controller.click(ON_CHANY[0], ON_CHANY[1]);

        assertTrue(outcome.isHandled());
        assertTrue(outcome.isHit());
        assertEquals(CHANY, outcome.getNode());
        assertEquals(NodeHighlight.PRIMARY_SELECTED, outcome.getState());
        assertEquals(2, outcome.getFanoutTouched());
        assertEquals(1, outcome.getFaninTouched());
        assertEquals(List.of(NET_DATA), outcome.getNets());
        assertEquals(CHANY_SELECTED, outcome.getMessage());

        SelectionState state = controller.state();
        assertEquals(NodeHighlight.FANOUT, state.nodeState(IPIN_NORTH));
        assertEquals(NodeHighlight.FANOUT, state.nodeState(CHANX_B));
        assertEquals(NodeHighlight.FANIN, state.nodeState(CHANX_A));
        assertEquals(NodeHighlight.FANOUT, state.netState(NET_DATA));
        assertEquals(NodeHighlight.DEFAULT, state.netState(NET_CLK));
        assertEquals(NodeHighlight.DEFAULT, state.netState(NET_UNROUTED));
    }

    @Test
    @DisplayName("Clicking the selected node again deselects it and keeps the last selection text")
    void testToggleOff() {
        SelectionController controller = controller(RRDisplayMode.NODES, true);
        controller.click(ON_CHANY[0], ON_CHANY[1]);

        SelectionOutcome outcome = controller.click(ON_CHANY[0], ON_CHANY[1]);

        assertEquals(NodeHighlight.DESELECTED, outcome.getState());
        assertEquals("", outcome.getMessage());
        assertTrue(outcome.getNets().isEmpty());
        SelectionState state = controller.state();
        assertEquals(NodeHighlight.DEFAULT, state.nodeState(IPIN_NORTH));
        assertEquals(NodeHighlight.DEFAULT, state.nodeState(CHANX_A));
        assertEquals(NodeHighlight.DEFAULT, state.netState(NET_DATA));
        assertEquals(Optional.of(CHANY_SELECTED), controller.mouseOver(EMPTY[0], EMPTY[1]));
    }

    @Test
    void testMissClearsSelectionText() {
        SelectionController controller = controller(RRDisplayMode.NODES, true);
        controller.click(ON_CHANY[0], ON_CHANY[1]);
        assertEquals(Optional.of(CHANY_SELECTED), controller.selectionMessage());

        SelectionOutcome miss = controller.click(EMPTY[0], EMPTY[1]);

        assertTrue(miss.isHandled());
        assertFalse(miss.isHit());
        assertEquals("Ready", miss.getMessage());
        assertEquals(Optional.empty(), controller.selectionMessage());
        assertEquals(Optional.of("Ready"), controller.mouseOver(EMPTY[0], EMPTY[1]));
        // the selection itself stays
        assertEquals(NodeHighlight.PRIMARY_SELECTED, controller.state().nodeState(CHANY));
    }

    @Test
    void testHoverText() {
        SelectionController controller = controller(RRDisplayMode.NODES, true);

        assertEquals(Optional.of("Moused over rr node #2: CHANX track: 0 len: 0"),
                controller.mouseOver(ON_CHANX_A[0], ON_CHANX_A[1]));
        assertEquals(Optional.of("Moused over rr node #1: OPIN pin: 0 len: 0"),
                controller.mouseOver(ON_OPIN[0], ON_OPIN[1]));
        assertEquals(Optional.of("Ready"), controller.mouseOver(EMPTY[0], EMPTY[1]));
    }

    @Test
    @DisplayName("Nothing happens when neither rr nodes nor nets are displayed")
    void testIgnoredWhenNothingDisplayed() {
        SelectionController controller = controller(RRDisplayMode.NONE, false);

        SelectionOutcome outcome = controller.click(ON_CHANY[0], ON_CHANY[1]);

        assertFalse(outcome.isHandled());
        assertEquals(NodeHighlight.DEFAULT, controller.state().nodeState(CHANY));
        assertEquals(Optional.empty(), controller.mouseOver(ON_CHANY[0], ON_CHANY[1]));
    }

    @Test
    @DisplayName("With only nets displayed a click skips fans and mouse-over shows nothing")
    void testNetsOnlyDisplaySkipsFans() {
        SelectionController controller = controller(RRDisplayMode.NONE, true);

        SelectionOutcome outcome = controller.click(ON_CHANY[0], ON_CHANY[1]);

        assertEquals(0, outcome.getFanoutTouched());
        assertEquals(NodeHighlight.DEFAULT, controller.state().nodeState(IPIN_NORTH));
        assertEquals(NodeHighlight.PRIMARY_SELECTED, controller.state().netState(NET_DATA));
        assertEquals(Optional.empty(), controller.mouseOver(ON_CHANX_A[0], ON_CHANX_A[1]));
        assertEquals(Optional.empty(), controller.mouseOver(EMPTY[0], EMPTY[1]));
    }

    @Test
    void testNodesOnlyDisplaySkipsNets() {
        SelectionController controller = controller(RRDisplayMode.ALL, false);

        SelectionOutcome outcome = controller.click(ON_CHANY[0], ON_CHANY[1]);

        assertTrue(outcome.getNets().isEmpty());
        assertEquals("Selected node #3: CHANY (1,1) -> (1,1) track: 0, 2 edges, occ: 0, capacity: 1",
                outcome.getMessage());
        assertEquals(NodeHighlight.DEFAULT, controller.state().netState(NET_DATA));
    }

    @Test
    void testDeselectAll() {
        SelectionController controller = controller(RRDisplayMode.NODES, true);
        controller.click(ON_CHANY[0], ON_CHANY[1]);

        controller.deselectAll();

        for (int n = 0; n < graph.nodeCount(); n++) {
            assertEquals(NodeHighlight.DEFAULT, controller.state().nodeState(n));
        }
        assertEquals(NodeHighlight.DEFAULT, controller.state().netState(NET_DATA));
        assertEquals(Optional.empty(), controller.selectionMessage());
        assertEquals(Optional.of("Ready"), controller.mouseOver(EMPTY[0], EMPTY[1]));
    }

    @Test
    void testStateMustMatchDesign() {
        assertThrows(IllegalArgumentException.class, () -> SelectionController.builder()
                .graph(graph)
                .netlist(netlist)
                .hitTester(hitTester)
                .state(new SelectionState(graph, 1))
                .build());
    }
}
