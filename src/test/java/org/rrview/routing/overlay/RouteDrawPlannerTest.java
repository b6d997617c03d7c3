package org.rrview.routing.overlay;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.netlist.RoutedNetlist;
import org.rrview.routing.selection.NodeHighlight;
import org.rrview.routing.selection.SelectionState;
import org.rrview.routing.testutil.RouteViewFixtureFactory;
import org.rrview.routing.trace.ConnectionType;
import org.rrview.routing.trace.RouteDisplayMode;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.rrview.routing.testutil.RouteViewFixtureFactory.*;

class RouteDrawPlannerTest {

    private RRGraph graph;
    private RoutedNetlist netlist;
    private SelectionState state;
    private RouteDrawPlanner planner;

    @BeforeEach
    void setUp() {
        graph = RouteViewFixtureFactory.smallDeviceGraph();
        netlist = RouteViewFixtureFactory.smallNetlist();
        state = new SelectionState(graph, netlist.size());
        planner = new RouteDrawPlanner(graph, netlist, state, RouteDisplayMode.DETAILED);
    }

    @Test
    void testAllNetsSkipsGlobalAndUnrouted() {
        List<NetRoutePlan> plans = planner.plan(DrawNetFilter.ALL_NETS);

        assertEquals(1, plans.size());
        NetRoutePlan plan = plans.get(0);
        assertEquals(NET_DATA, plan.getNetId());
        assertEquals("n_data", plan.getNetName());
        assertEquals(NodeHighlight.DEFAULT, plan.getNetHighlight());
        assertEquals(9, plan.getNodes().size());
        assertEquals(9, plan.getNodeHighlights().size());
        assertEquals(2, plan.getSegments().size());
        assertEquals(ConnectionType.FABRIC_TURN, plan.getSegments().get(1).getHops().get(0).getType());
    }

    @Test
    void testHighlightedOnly() {
        assertTrue(planner.plan(DrawNetFilter.HIGHLIGHTED).isEmpty());

        state.highlight(CHANY, NodeHighlight.PRIMARY_SELECTED);
        state.setNetState(NET_DATA, NodeHighlight.FANOUT);

        List<NetRoutePlan> plans = planner.plan(DrawNetFilter.HIGHLIGHTED);
        assertEquals(1, plans.size());
        NetRoutePlan plan = plans.get(0);
        assertEquals(NodeHighlight.FANOUT, plan.getNetHighlight());
        // own highlight wins over the net's
        assertEquals(NodeHighlight.PRIMARY_SELECTED, plan.getNodeHighlights().get(6));
        assertEquals(NodeHighlight.FANOUT, plan.getNodeHighlights().get(0));
    }
}
