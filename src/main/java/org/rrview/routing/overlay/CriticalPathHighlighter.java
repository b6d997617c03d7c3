package org.rrview.routing.overlay;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntList;
import org.rrview.routing.graph.GraphConsistencyException;
import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.netlist.RoutedNet;
import org.rrview.routing.netlist.RoutedNetlist;
import org.rrview.routing.selection.NodeHighlight;
import org.rrview.routing.selection.SelectionState;
import org.rrview.routing.trace.ClassifiedSegment;
import org.rrview.routing.trace.ConnectionClassifier;
import org.rrview.routing.trace.PathFinder;
import org.rrview.routing.trace.RouteDisplayMode;
import org.rrview.routing.trace.RouteTree;
import org.rrview.routing.trace.RoutedConnection;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Overlays a critical timing path on the routing.
 * <p>
 * Arc {@code i} is drawn with palette entry {@code i % PALETTE_SIZE}, so consecutive
 * arcs are distinguishable. An interconnect arc is traced through its net's route and
 * every rr node on the traced path is marked CRITICAL_PATH; an arc that stays inside
 * a block, or whose routing cannot be traced, is drawn as a flyline.
 */
public final class CriticalPathHighlighter {
    private static final Logger LOG = Logger.getLogger(CriticalPathHighlighter.class.getName());

    /** Size of the max-contrast palette arcs rotate through. */
    public static final int PALETTE_SIZE = 21;
    private static final int NO_TARGET = -1;

    private final RRGraph graph;
    private final RoutedNetlist netlist;
    private final SelectionState state;
    private final ConnectionClassifier classifier;

    public CriticalPathHighlighter(RRGraph graph, RoutedNetlist netlist, SelectionState state, RouteDisplayMode mode) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.netlist = Objects.requireNonNull(netlist, "netlist");
        this.state = Objects.requireNonNull(state, "state");
        this.classifier = new ConnectionClassifier(graph, mode);
    }

    /**
     * @param arcs critical path arcs in path order.
     * @return one overlay per arc, in the same order.
     */
    public List<ArcOverlay> highlight(List<TimingArc> arcs) {
        Objects.requireNonNull(arcs, "arcs");
        Int2ObjectOpenHashMap<RouteTree> trees = new Int2ObjectOpenHashMap<>();
        List<ArcOverlay> overlays = new ArrayList<>(arcs.size());
        int traced = 0;
        for (int i = 0; i < arcs.size(); i++) {
            TimingArc arc = Objects.requireNonNull(arcs.get(i), "arcs[" + i + "]");
            int palette = i % PALETTE_SIZE;
            RoutedConnection connection = trace(i, arc, trees);
            ClassifiedSegment route = connection.isFound() ? classify(i, connection) : null;
            if (route != null) {
                markPath(arc.getNetId(), connection.getPath());
                overlays.add(new ArcOverlay(i, palette, arc, connection, route));
                traced++;
            } else {
                RoutedConnection flyline = connection.isFound()
                        ? RoutedConnection.notFound(connection.getTargetNode())
                        : connection;
                overlays.add(new ArcOverlay(i, palette, arc, flyline, null));
            }
        }
        LOG.info("critical path: " + traced + " of " + arcs.size() + " arcs traced through routing");
        return overlays;
    }

    private RoutedConnection trace(int index, TimingArc arc, Int2ObjectOpenHashMap<RouteTree> trees) {
        if (arc.getKind() != TimingArc.Kind.INTERCONNECT) {
            return RoutedConnection.notFound(NO_TARGET);
        }
        int netId = arc.getNetId();
        if (!netlist.containsNet(netId)) {
            return flyline(index, NO_TARGET, "unknown net " + netId);
        }
        RoutedNet net = netlist.net(netId);
        if (net.global() || !net.isRouted()) {
            return flyline(index, NO_TARGET, "net " + net.name() + " has no drawable routing");
        }
        if (arc.getSinkPin() < 1 || arc.getSinkPin() >= net.pinCount()) {
            return flyline(index, NO_TARGET, "net " + net.name() + " has no sink pin " + arc.getSinkPin());
        }
        int sink = net.terminal(arc.getSinkPin());
        RouteTree tree = trees.get(netId);
        if (tree == null) {
            tree = RouteTree.build(graph, net.traceback());
            trees.put(netId, tree);
        }
        if (tree.rrNode(tree.root()) != net.driverTerminal()) {
            return flyline(index, sink, "route of net " + net.name() + " does not start at its driver");
        }
        RoutedConnection connection = PathFinder.find(tree, sink);
        if (!connection.isFound()) {
            return flyline(index, sink, "sink rr node " + sink + " is not on the route of net " + net.name());
        }
        return connection;
    }

    private ClassifiedSegment classify(int index, RoutedConnection connection) {
        try {
            return classifier.classify(connection.toSegment());
        } catch (GraphConsistencyException ex) {
            LOG.warning("critical path arc " + index + " drawn as flyline: " + ex.getMessage());
            return null;
        }
    }

    private static RoutedConnection flyline(int index, int target, String reason) {
        LOG.warning("critical path arc " + index + " drawn as flyline: " + reason);
        return RoutedConnection.notFound(target);
    }

    private void markPath(int netId, IntList path) {
        for (int i = 0; i < path.size(); i++) {
            state.highlight(path.getInt(i), NodeHighlight.CRITICAL_PATH);
        }
        state.setNetState(netId, NodeHighlight.CRITICAL_PATH);
    }
}
