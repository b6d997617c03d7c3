package org.rrview.routing.testutil;

import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.graph.RRNodeKind;
import org.rrview.routing.graph.WireDirection;
import org.rrview.routing.netlist.RoutedNet;
import org.rrview.routing.netlist.RoutedNetlist;
import org.rrview.routing.netlist.Traceback;
import org.rrview.routing.spatial.BoundingBox;
import org.rrview.routing.spatial.LayoutPoint;
import org.rrview.routing.spatial.LayoutProvider;
import org.rrview.routing.spatial.PinSide;
import org.rrview.routing.spatial.TileGridLayout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared test fixture factory for route view tests.
 *
 * <p>The small device is a 3x3 grid. One net ({@code n_data}) is driven from block
 * (1,1) and reaches sinks in blocks (2,1) and (1,2):</p>
 * <pre>
 *   SOURCE(0) -> OPIN(1) -> CHANX(2) -> IPIN(5) -> SINK(6)
 *                           CHANX(2) -> CHANY(3) -> IPIN(7) -> SINK(8)
 *                                       CHANY(3) -> CHANX(4)
 * </pre>
 */
public final class RouteViewFixtureFactory {
    public static final int SOURCE = 0;
    public static final int OPIN = 1;
    public static final int CHANX_A = 2;
    public static final int CHANY = 3;
    public static final int CHANX_B = 4;
    public static final int IPIN_EAST = 5;
    public static final int SINK_EAST = 6;
    public static final int IPIN_NORTH = 7;
    public static final int SINK_NORTH = 8;

    public static final int SW_DELAYLESS = 0;
    public static final int SW_MUX = 1;

    public static final int NET_DATA = 0;
    public static final int NET_CLK = 1;
    public static final int NET_UNROUTED = 2;

    public static final double TILE_WIDTH = 10.0;

    private RouteViewFixtureFactory() {
    }

    public record Fixture(RRGraph graph, RoutedNetlist netlist) {
    }

    public static RRGraph smallDeviceGraph() {
        RRGraph.Builder b = RRGraph.builder();
        b.addSwitch("delayless", false);
        b.addSwitch("mux", true);
        b.addPin(RRNodeKind.SOURCE, 1, 1, 0);
        b.addPin(RRNodeKind.OPIN, 1, 1, 0);
        b.addWire(RRNodeKind.CHANX, 1, 1, 1, 1, 0, WireDirection.INC);
        b.addWire(RRNodeKind.CHANY, 1, 1, 1, 1, 0, WireDirection.INC);
        b.addWire(RRNodeKind.CHANX, 1, 1, 1, 1, 1, WireDirection.DEC);
        b.addPin(RRNodeKind.IPIN, 2, 1, 1);
        b.addPin(RRNodeKind.SINK, 2, 1, 1);
        b.addPin(RRNodeKind.IPIN, 1, 2, 1);
        b.addPin(RRNodeKind.SINK, 1, 2, 1);

        b.addEdge(SOURCE, OPIN, SW_DELAYLESS);
        b.addEdge(OPIN, CHANX_A, SW_MUX);
        b.addEdge(CHANX_A, IPIN_EAST, SW_MUX);
        b.addEdge(CHANX_A, CHANY, SW_MUX);
        b.addEdge(CHANY, IPIN_NORTH, SW_MUX);
        b.addEdge(CHANY, CHANX_B, SW_MUX);
        b.addEdge(IPIN_EAST, SINK_EAST, SW_DELAYLESS);
        b.addEdge(IPIN_NORTH, SINK_NORTH, SW_DELAYLESS);
        return b.build();
    }

    /**
     * Route of {@code n_data}: the east branch first, then the north branch starting
     * again from CHANX_A.
     */
    public static Traceback dataTraceback() {
        return Traceback.of(SOURCE, OPIN, CHANX_A, IPIN_EAST, SINK_EAST,
                CHANX_A, CHANY, IPIN_NORTH, SINK_NORTH);
    }

    public static RoutedNetlist smallNetlist() {
        List<RoutedNet> nets = new ArrayList<>();
        nets.add(new RoutedNet(NET_DATA, "n_data", false,
                new int[]{SOURCE, SINK_EAST, SINK_NORTH}, dataTraceback()));
        nets.add(new RoutedNet(NET_CLK, "clk", true, new int[]{SOURCE, SINK_EAST}, Traceback.empty()));
        nets.add(new RoutedNet(NET_UNROUTED, "n_unrouted", false,
                new int[]{SOURCE, SINK_EAST}, Traceback.empty()));
        return new RoutedNetlist(nets);
    }

    public static Fixture smallDevice() {
        return new Fixture(smallDeviceGraph(), smallNetlist());
    }

    public static final int SPLIT_SOURCE = 0;
    public static final int SPLIT_WIRE_A = 1;
    public static final int SPLIT_SINK_1 = 2;
    public static final int SPLIT_WIRE_W = 3;
    public static final int SPLIT_SINK_2 = 4;

    /**
     * One net whose second branch starts at a wire no routed node connects to:
     * edges are SOURCE->A, A->SINK_1 and W->SINK_2 only, and the traceback is
     * {@code [SOURCE, A, SINK_1, W, SINK_2]}.
     */
    public static Fixture splitBranchDevice() {
        RRGraph.Builder b = RRGraph.builder();
        int sw = b.addSwitch("mux", true);
        b.addPin(RRNodeKind.SOURCE, 0, 0, 0);
        b.addWire(RRNodeKind.CHANX, 0, 1, 0, 0, 0, WireDirection.INC);
        b.addPin(RRNodeKind.SINK, 1, 0, 0);
        b.addWire(RRNodeKind.CHANX, 0, 1, 0, 0, 1, WireDirection.INC);
        b.addPin(RRNodeKind.SINK, 1, 0, 1);
        b.addEdge(SPLIT_SOURCE, SPLIT_WIRE_A, sw);
        b.addEdge(SPLIT_WIRE_A, SPLIT_SINK_1, sw);
        b.addEdge(SPLIT_WIRE_W, SPLIT_SINK_2, sw);

        Traceback traceback = Traceback.of(SPLIT_SOURCE, SPLIT_WIRE_A, SPLIT_SINK_1, SPLIT_WIRE_W, SPLIT_SINK_2);
        RoutedNetlist netlist = new RoutedNetlist(List.of(new RoutedNet(0, "n_split", false,
                new int[]{SPLIT_SOURCE, SPLIT_SINK_1, SPLIT_SINK_2}, traceback)));
        return new Fixture(b.build(), netlist);
    }

    /**
     * Tile-grid layout of the small device: 10-unit tiles and two tracks per channel, so
     * tiles start at 0, 13, 26 and 39 on both axes. Blocks have four pins; pin 0 is on
     * the right side, pin 1 on the left, pin 2 on top and bottom, pin 3 nowhere.
     */
    public static TileGridLayout smallDeviceLayout(RRGraph graph) {
        return new TileGridLayout(graph, new TileGridLayout.BlockPins() {
            @Override
            public int pinCount(int x, int y) {
                return 4;
            }

            @Override
            public int capacity(int x, int y) {
                return 1;
            }

            @Override
            public Set<PinSide> sides(int x, int y, int pin) {
                switch (pin) {
                    case 0:
                        return EnumSet.of(PinSide.RIGHT);
                    case 1:
                        return EnumSet.of(PinSide.LEFT);
                    case 2:
                        return EnumSet.of(PinSide.TOP, PinSide.BOTTOM);
                    default:
                        return EnumSet.noneOf(PinSide.class);
                }
            }
        }, TILE_WIDTH, new int[]{2, 2, 2}, new int[]{2, 2, 2});
    }

    /**
     * Layout with hand-placed geometry, for exact hit-test cases.
     */
    public static final class FixedLayout implements LayoutProvider {
        private final Map<Integer, List<LayoutPoint>> pins = new HashMap<>();
        private final Map<Integer, BoundingBox> wires = new HashMap<>();

        public FixedLayout pin(int node, double x, double y) {
            pins.computeIfAbsent(node, k -> new ArrayList<>()).add(new LayoutPoint(x, y));
            return this;
        }

        public FixedLayout wire(int node, double left, double bottom, double right, double top) {
            wires.put(node, new BoundingBox(left, bottom, right, top));
            return this;
        }

        @Override
        public List<LayoutPoint> pinAnchors(int pinNode) {
            return pins.getOrDefault(pinNode, Collections.emptyList());
        }

        @Override
        public BoundingBox wireBounds(int wireNode) {
            // unplaced wires sit far away from every query point
            return wires.getOrDefault(wireNode, new BoundingBox(-1e9, -1e9, -1e9, -1e9));
        }
    }
}
