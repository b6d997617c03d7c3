package org.rrview.routing.selection;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.graph.ReverseEdgeIndex;
import org.rrview.routing.netlist.Traceback;

import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-node and per-net highlight state of the view.
 * <p>
 * Fan-in lookups scan every edge of the graph unless a {@link ReverseEdgeIndex} is
 * supplied; both give the same result.
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe. Owned by the UI thread.
 */
public final class SelectionState {
    private static final Logger LOG = Logger.getLogger(SelectionState.class.getName());

    private final RRGraph graph;
    private final ReverseEdgeIndex reverseIndex;
    private final byte[] nodeStates;
    private final byte[] netStates;
    @Getter
    @Accessors(fluent = true)
    private final boolean reverseIndexed;

    /**
     * @param reverseIndex optional fan-in index, may be {@code null}.
     */
    public SelectionState(RRGraph graph, int netCount, ReverseEdgeIndex reverseIndex) {
        this.graph = Objects.requireNonNull(graph, "graph");
        if (netCount < 0) {
            throw new IllegalArgumentException("netCount must be >= 0, got " + netCount);
        }
        if (reverseIndex != null && reverseIndex.nodeCount() != graph.nodeCount()) {
            throw new IllegalArgumentException("reverse index built for " + reverseIndex.nodeCount()
                    + " nodes, graph has " + graph.nodeCount());
        }
        this.reverseIndex = reverseIndex;
        this.reverseIndexed = reverseIndex != null;
        this.nodeStates = new byte[graph.nodeCount()];
        this.netStates = new byte[netCount];
    }

    public SelectionState(RRGraph graph, int netCount) {
        this(graph, netCount, null);
    }

    public void highlight(int nodeId, NodeHighlight state) {
        checkNode(nodeId);
        nodeStates[nodeId] = (byte) Objects.requireNonNull(state, "state").ordinal();
    }

    public NodeHighlight nodeState(int nodeId) {
        checkNode(nodeId);
        return NodeHighlight.VALUES[nodeStates[nodeId]];
    }

    public int nodeCount() {
        return nodeStates.length;
    }

    /**
     * Marks every node driven by {@code nodeId}: FANOUT when {@code nodeId} is selected,
     * DEFAULT when it is deselected. Other states leave the fan-out untouched.
     *
     * @return number of fan-out edges whose target was written.
     */
    public int propagateFanout(int nodeId) {
        NodeHighlight marker = markerFor(nodeId, NodeHighlight.FANOUT);
        if (marker == null) {
            return 0;
        }
        byte value = (byte) marker.ordinal();
        int end = graph.edgeEnd(nodeId);
        int touched = 0;
        for (int edge = graph.edgeStart(nodeId); edge < end; edge++) {
            nodeStates[graph.edgeTarget(edge)] = value;
            touched++;
        }
        log("fan-out", nodeId, marker, touched);
        return touched;
    }

    /**
     * Marks every node driving {@code nodeId}: FANIN when {@code nodeId} is selected,
     * DEFAULT when it is deselected.
     *
     * @return number of fan-in edges whose origin was written.
     */
    public int propagateFanin(int nodeId) {
        NodeHighlight marker = markerFor(nodeId, NodeHighlight.FANIN);
        if (marker == null) {
            return 0;
        }
        byte value = (byte) marker.ordinal();
        int touched;
        if (reverseIndex != null) {
            int[] count = new int[1];
            reverseIndex.forEachFanin(nodeId, origin -> {
                nodeStates[origin] = value;
                count[0]++;
            });
            touched = count[0];
        } else {
            touched = 0;
            for (int edge = 0; edge < graph.edgeCount(); edge++) {
                if (graph.edgeTarget(edge) == nodeId) {
                    nodeStates[graph.edgeOrigin(edge)] = value;
                    touched++;
                }
            }
        }
        log("fan-in", nodeId, marker, touched);
        return touched;
    }

    private NodeHighlight markerFor(int nodeId, NodeHighlight selectedMarker) {
        NodeHighlight state = nodeState(nodeId);
        if (state == NodeHighlight.PRIMARY_SELECTED) {
            return selectedMarker;
        }
        if (state == NodeHighlight.DESELECTED) {
            return NodeHighlight.DEFAULT;
        }
        return null;
    }

    /**
     * Recomputes one net's highlight from the nodes of its route.
     * <p>
     * The route is scanned in order. A highlighted node copies its state to the net and
     * the scan continues, so the last highlighted node wins. A deselected node resets
     * the net to DEFAULT and ends the scan, even if highlighted nodes follow it. When no
     * node is highlighted or deselected, the previous net state is kept.
     *
     * @return the net state after the scan.
     */
    public NodeHighlight aggregateNet(int netId, Traceback traceback) {
        checkNet(netId);
        Objects.requireNonNull(traceback, "traceback");
        for (int i = 0; i < traceback.size(); i++) {
            NodeHighlight state = nodeState(traceback.node(i));
            if (state.isSpecial()) {
                netStates[netId] = (byte) state.ordinal();
            } else if (state == NodeHighlight.DESELECTED) {
                netStates[netId] = (byte) NodeHighlight.DEFAULT.ordinal();
                break;
            }
        }
        return netState(netId);
    }

    public NodeHighlight netState(int netId) {
        checkNet(netId);
        return NodeHighlight.VALUES[netStates[netId]];
    }

    public void setNetState(int netId, NodeHighlight state) {
        checkNet(netId);
        netStates[netId] = (byte) Objects.requireNonNull(state, "state").ordinal();
    }

    public int netCount() {
        return netStates.length;
    }

    /**
     * Resets every node and net to DEFAULT.
     */
    public void clear() {
        Arrays.fill(nodeStates, (byte) 0);
        Arrays.fill(netStates, (byte) 0);
        LOG.fine("selection cleared");
    }

    private void log(String direction, int nodeId, NodeHighlight marker, int touched) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("%s of rr node %d set %d nodes to %s", direction, nodeId, touched, marker));
        }
    }

    private void checkNode(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeStates.length) {
            throw new IndexOutOfBoundsException("nodeId out of bounds: " + nodeId);
        }
    }

    private void checkNet(int netId) {
        if (netId < 0 || netId >= netStates.length) {
            throw new IndexOutOfBoundsException("netId out of bounds: " + netId);
        }
    }
}
