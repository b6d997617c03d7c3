package org.rrview.routing.core;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.rrview.core.id.IDMapper;
import org.rrview.routing.core.RouteViewException.Reason;
import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.graph.ReverseEdgeIndex;
import org.rrview.routing.netlist.RoutedNet;
import org.rrview.routing.netlist.RoutedNetlist;
import org.rrview.routing.overlay.ArcOverlay;
import org.rrview.routing.overlay.CongestionReport;
import org.rrview.routing.overlay.CriticalPathHighlighter;
import org.rrview.routing.overlay.DrawNetFilter;
import org.rrview.routing.overlay.NetRoutePlan;
import org.rrview.routing.overlay.RREdge;
import org.rrview.routing.overlay.RREdgeView;
import org.rrview.routing.overlay.RouteDrawPlanner;
import org.rrview.routing.overlay.TimingArc;
import org.rrview.routing.selection.NodeHighlight;
import org.rrview.routing.selection.SelectionController;
import org.rrview.routing.selection.SelectionOutcome;
import org.rrview.routing.selection.SelectionState;
import org.rrview.routing.spatial.HitTester;
import org.rrview.routing.spatial.LayoutProvider;
import org.rrview.routing.trace.ClassifiedSegment;
import org.rrview.routing.trace.ConnectionClassifier;
import org.rrview.routing.trace.PathFinder;
import org.rrview.routing.trace.RouteSegment;
import org.rrview.routing.trace.RouteTree;
import org.rrview.routing.trace.RoutedConnection;
import org.rrview.routing.trace.TracebackSegmenter;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the route view engine.
 *
 * <p>The facade binds one routed design (graph, netlist, layout) to one view
 * configuration and exposes every query the drawing code needs:</p>
 * <ul>
 * <li>segment and classify a net's route for drawing;</li>
 * <li>trace the routed connection between a net's driver and one of its sinks;</li>
 * <li>handle clicks, mouse moves and deselect-all;</li>
 * <li>plan net drawing, list rr edges, report congestion and overlay the critical path.</li>
 * </ul>
 * <p>Contract failures are raised as {@link RouteViewException} with a {@link Reason}.</p>
 * <p><strong>Thread Safety:</strong> not thread-safe; selection state is mutable.</p>
 */
public final class RouteViewCore {
    private static final Logger LOG = Logger.getLogger(RouteViewCore.class.getName());

    @Getter
    @Accessors(fluent = true)
    private final RRGraph graph;
    @Getter
    @Accessors(fluent = true)
    private final RoutedNetlist netlist;
    @Getter
    @Accessors(fluent = true)
    private final RouteViewConfig config;
    @Getter
    @Accessors(fluent = true)
    private final SelectionState selection;

    private final TracebackSegmenter segmenter;
    private final ConnectionClassifier classifier;
    private final SelectionController controller;
    private final RouteDrawPlanner drawPlanner;
    private final RREdgeView edgeView;
    private final CriticalPathHighlighter criticalPath;

    /**
     * @param graph routing resource graph.
     * @param netlist routed nets of the design.
     * @param layout drawing geometry of pins and wires.
     * @param config optional view settings, {@link RouteViewConfig#detailed()} when null.
     */
    @Builder
    public RouteViewCore(RRGraph graph, RoutedNetlist netlist, LayoutProvider layout, RouteViewConfig config) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.netlist = Objects.requireNonNull(netlist, "netlist");
        Objects.requireNonNull(layout, "layout");
        this.config = config == null ? RouteViewConfig.detailed() : config;

        ReverseEdgeIndex reverseIndex = this.config.isReverseIndexEnabled() ? ReverseEdgeIndex.build(graph) : null;
        this.selection = new SelectionState(graph, netlist.size(), reverseIndex);
        this.segmenter = new TracebackSegmenter(graph);
        this.classifier = new ConnectionClassifier(graph, this.config.getRouteMode());
        HitTester hitTester = new HitTester(graph, layout,
                this.config.getPinHalfWidth(), this.config.getWireHitTolerance());
        this.controller = SelectionController.builder()
                .graph(graph)
                .netlist(netlist)
                .hitTester(hitTester)
                .state(selection)
                .rrDisplay(this.config.getRrDisplay())
                .showNets(this.config.isShowNets())
                .defaultMessage(this.config.getDefaultMessage())
                .build();
        this.drawPlanner = new RouteDrawPlanner(graph, netlist, selection, this.config.getRouteMode());
        this.edgeView = new RREdgeView(graph, selection, this.config.getRrDisplay());
        this.criticalPath = new CriticalPathHighlighter(graph, netlist, selection, this.config.getRouteMode());

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("route view bound to " + graph + " and " + netlist.size() + " nets, " + this.config);
        }
    }

    /**
     * Resolves a net by name.
     */
    public RoutedNet net(String name) {
        try {
            return netlist.netByName(name);
        } catch (IDMapper.UnknownIDException ex) {
            throw new RouteViewException(Reason.UNKNOWN_NET, "unknown net name: " + name, ex);
        }
    }

    /**
     * Splits a net's route into branches in route order.
     */
    public List<RouteSegment> segment(int netId) {
        return segmenter.segment(drawableNet(netId).traceback());
    }

    /**
     * Splits a net's route and classifies every hop, one track pass per branch.
     */
    public List<ClassifiedSegment> classify(int netId) {
        return classifier.classifyAll(segment(netId));
    }

    /**
     * Finds the routed path from a net's driver to one of its sinks.
     *
     * @param sinkPin net pin index of the sink, 1 or more.
     * @return the path, or not-found when the sink is not on the route.
     */
    public RoutedConnection traceConnection(int netId, int sinkPin) {
        RoutedNet net = drawableNet(netId);
        if (!net.isRouted()) {
            throw new RouteViewException(Reason.NET_NOT_ROUTED, "net " + net.name() + " has no route");
        }
        if (sinkPin < 1 || sinkPin >= net.pinCount()) {
            throw new RouteViewException(Reason.SINK_PIN_OUT_OF_RANGE,
                    "sink pin " + sinkPin + " out of range [1, " + net.pinCount() + ") for net " + net.name());
        }
        RouteTree tree = RouteTree.build(graph, net.traceback());
        int root = tree.rrNode(tree.root());
        if (root != net.driverTerminal()) {
            throw new RouteViewException(Reason.ROUTE_TREE_ROOT_MISMATCH,
                    "route of net " + net.name() + " starts at rr node " + root
                            + ", driver terminal is " + net.driverTerminal());
        }
        RoutedConnection connection = PathFinder.find(tree, net.terminal(sinkPin));
        if (!connection.isFound()) {
            LOG.warning("net " + net.name() + ": sink pin " + sinkPin + " is not reached by the route");
        }
        return connection;
    }

    public SelectionOutcome click(double x, double y) {
        return controller.click(x, y);
    }

    public Optional<String> mouseOver(double x, double y) {
        return controller.mouseOver(x, y);
    }

    public void deselectAll() {
        controller.deselectAll();
    }

    public NodeHighlight nodeState(int nodeId) {
        return selection.nodeState(checkNode(nodeId));
    }

    public List<NetRoutePlan> planRoutes(DrawNetFilter filter) {
        return drawPlanner.plan(filter);
    }

    public List<RREdge> rrEdges(int nodeId) {
        return edgeView.edgesOf(checkNode(nodeId));
    }

    public CongestionReport congestion() {
        CongestionReport report = CongestionReport.analyze(graph);
        LOG.info(report.rangeMessage());
        return report;
    }

    public List<ArcOverlay> highlightCriticalPath(List<TimingArc> arcs) {
        return criticalPath.highlight(arcs);
    }

    private RoutedNet drawableNet(int netId) {
        if (!netlist.containsNet(netId)) {
            throw new RouteViewException(Reason.UNKNOWN_NET, "unknown net id: " + netId);
        }
        RoutedNet net = netlist.net(netId);
        if (net.global()) {
            throw new RouteViewException(Reason.GLOBAL_NET, "net " + net.name() + " is global and has no drawn route");
        }
        return net;
    }

    private int checkNode(int nodeId) {
        if (!graph.containsNode(nodeId)) {
            throw new RouteViewException(Reason.NODE_OUT_OF_BOUNDS,
                    "rr node " + nodeId + " out of bounds [0, " + graph.nodeCount() + ")");
        }
        return nodeId;
    }
}
