package org.rrview.routing.overlay;

import it.unimi.dsi.fastutil.ints.IntList;
import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.netlist.RoutedNet;
import org.rrview.routing.netlist.RoutedNetlist;
import org.rrview.routing.selection.NodeHighlight;
import org.rrview.routing.selection.SelectionState;
import org.rrview.routing.trace.ConnectionClassifier;
import org.rrview.routing.trace.RouteDisplayMode;
import org.rrview.routing.trace.TracebackSegmenter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds per-net drawing plans from the routed netlist and the current selection.
 * <p>
 * Global and unrouted nets are skipped. A node that carries its own highlight is
 * drawn with it; every other node takes the net's highlight.
 */
public final class RouteDrawPlanner {
    private static final Logger LOG = Logger.getLogger(RouteDrawPlanner.class.getName());

    private final RoutedNetlist netlist;
    private final SelectionState state;
    private final TracebackSegmenter segmenter;
    private final ConnectionClassifier classifier;

    public RouteDrawPlanner(RRGraph graph, RoutedNetlist netlist, SelectionState state, RouteDisplayMode mode) {
        Objects.requireNonNull(graph, "graph");
        this.netlist = Objects.requireNonNull(netlist, "netlist");
        this.state = Objects.requireNonNull(state, "state");
        this.segmenter = new TracebackSegmenter(graph);
        this.classifier = new ConnectionClassifier(graph, mode);
    }

    public List<NetRoutePlan> plan(DrawNetFilter filter) {
        Objects.requireNonNull(filter, "filter");
        List<NetRoutePlan> plans = new ArrayList<>();
        for (RoutedNet net : netlist.nets()) {
            if (net.global() || !net.isRouted()) {
                continue;
            }
            NodeHighlight netHighlight = state.netState(net.id());
            if (filter == DrawNetFilter.HIGHLIGHTED && !netHighlight.isHighlighted()) {
                continue;
            }
            plans.add(planNet(net, netHighlight));
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("planned " + plans.size() + " of " + netlist.size() + " nets (" + filter + ")");
        }
        return plans;
    }

    private NetRoutePlan planNet(RoutedNet net, NodeHighlight netHighlight) {
        IntList nodes = net.traceback().nodes();
        List<NodeHighlight> nodeHighlights = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            NodeHighlight own = state.nodeState(nodes.getInt(i));
            nodeHighlights.add(own.isHighlighted() ? own : netHighlight);
        }
        return NetRoutePlan.builder()
                .netId(net.id())
                .netName(net.name())
                .netHighlight(netHighlight)
                .nodes(nodes)
                .nodeHighlights(List.copyOf(nodeHighlights))
                .segments(classifier.classifyAll(segmenter.segment(net.traceback())))
                .build();
    }
}
