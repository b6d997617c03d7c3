package org.rrview.routing.selection;

import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.graph.RRNodeKind;

import java.util.Objects;
import java.util.Optional;

/**
 * Status-line and log text for rr nodes.
 */
public final class NodeDescriber {
    private final RRGraph graph;

    public NodeDescriber(RRGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /**
     * Status text for a clicked node.
     */
    public String selected(int node) {
        return String.format("Selected node #%d: %s (%d,%d) -> (%d,%d) track: %d, %d edges, occ: %d, capacity: %d",
                node, graph.kind(node),
                graph.xLow(node), graph.yLow(node), graph.xHigh(node), graph.yHigh(node),
                graph.ptcNum(node), graph.outDegree(node),
                graph.occupancy(node), graph.capacity(node));
    }

    /**
     * Hover text for wires and pins; empty for terminals.
     */
    public Optional<String> hover(int node) {
        RRNodeKind kind = graph.kind(node);
        String prefix = "Moused over rr node #" + node + ": " + kind;
        if (kind.isChannel()) {
            return Optional.of(prefix + " track: " + graph.ptcNum(node) + " len: " + graph.length(node));
        }
        if (kind.isPin()) {
            return Optional.of(prefix + " pin: " + graph.ptcNum(node) + " len: " + graph.length(node));
        }
        return Optional.empty();
    }

    /**
     * Multi-line description of a node and its outgoing edges.
     */
    public String dump(int node) {
        StringBuilder sb = new StringBuilder();
        sb.append("rr node ").append(node).append(' ').append(graph.kind(node))
                .append(" x[").append(graph.xLow(node)).append(',').append(graph.xHigh(node)).append(']')
                .append(" y[").append(graph.yLow(node)).append(',').append(graph.yHigh(node)).append(']')
                .append(" ptc=").append(graph.ptcNum(node));
        if (graph.isChannel(node)) {
            sb.append(" dir=").append(graph.direction(node));
        }
        sb.append(" occ=").append(graph.occupancy(node)).append('/').append(graph.capacity(node));
        int end = graph.edgeEnd(node);
        for (int edge = graph.edgeStart(node); edge < end; edge++) {
            int sw = graph.edgeSwitch(edge);
            sb.append(System.lineSeparator())
                    .append("  -> ").append(graph.edgeTarget(edge))
                    .append(" via switch ").append(sw).append(" (").append(graph.switchInfo(sw).getName()).append(')');
        }
        return sb.toString();
    }
}
