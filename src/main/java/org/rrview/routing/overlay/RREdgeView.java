package org.rrview.routing.overlay;

import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.graph.RRNodeKind;
import org.rrview.routing.selection.NodeHighlight;
import org.rrview.routing.selection.RRDisplayMode;
import org.rrview.routing.selection.SelectionState;
import org.rrview.routing.trace.ConnectionClassifier;
import org.rrview.routing.trace.RouteDisplayMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outgoing edges of rr nodes as the rr graph display shows them.
 * <p>
 * An edge leaving the selected node takes the target's highlight, an edge entering it
 * takes the source's highlight.
 */
public final class RREdgeView {
    private final RRGraph graph;
    private final SelectionState state;
    private final RRDisplayMode display;
    private final ConnectionClassifier classifier;

    public RREdgeView(RRGraph graph, SelectionState state, RRDisplayMode display) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.state = Objects.requireNonNull(state, "state");
        this.display = Objects.requireNonNull(display, "display");
        this.classifier = new ConnectionClassifier(graph, RouteDisplayMode.DETAILED);
    }

    public List<RREdge> edgesOf(int node) {
        if (display == RRDisplayMode.NONE || display == RRDisplayMode.NODES) {
            return Collections.emptyList();
        }
        RRNodeKind kind = graph.kind(node);
        if (display == RRDisplayMode.NODES_AND_SBOX && kind == RRNodeKind.OPIN) {
            return Collections.emptyList();
        }
        NodeHighlight fromState = state.nodeState(node);
        int end = graph.edgeEnd(node);
        List<RREdge> edges = new ArrayList<>(end - graph.edgeStart(node));
        for (int edge = graph.edgeStart(node); edge < end; edge++) {
            int target = graph.edgeTarget(edge);
            int sw = graph.edgeSwitch(edge);
            edges.add(new RREdge(edge, node, target, sw, graph.switchInfo(sw).isBuffered(),
                    classifier.classify(node, target), hint(fromState, state.nodeState(target))));
        }
        return edges;
    }

    /**
     * Edges of every node in id order.
     */
    public List<RREdge> allEdges() {
        List<RREdge> edges = new ArrayList<>();
        for (int node = 0; node < graph.nodeCount(); node++) {
            edges.addAll(edgesOf(node));
        }
        return edges;
    }

    private static NodeHighlight hint(NodeHighlight from, NodeHighlight to) {
        if (from == NodeHighlight.PRIMARY_SELECTED) {
            return to;
        }
        if (to == NodeHighlight.PRIMARY_SELECTED) {
            return from;
        }
        return NodeHighlight.DEFAULT;
    }
}
