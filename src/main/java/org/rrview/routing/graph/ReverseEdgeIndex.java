package org.rrview.routing.graph;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * Immutable reverse adjacency for fan-in queries.
 *
 * <p>The graph itself only stores outgoing edges, so finding the drivers of a node
 * otherwise means scanning every edge. This index is built once per graph; each node
 * maps to a contiguous range of {@code incomingSources} holding the origin node of
 * every incoming edge, in ascending edge-id order.</p>
 */
public final class ReverseEdgeIndex {
    private final int nodeCount;
    private final int[] firstIncomingByNode;
    private final int[] incomingSources;

    private ReverseEdgeIndex(int nodeCount, int[] firstIncomingByNode, int[] incomingSources) {
        this.nodeCount = nodeCount;
        this.firstIncomingByNode = firstIncomingByNode;
        this.incomingSources = incomingSources;
    }

    /**
     * Builds the reverse adjacency of one graph.
     */
    public static ReverseEdgeIndex build(RRGraph graph) {
        Objects.requireNonNull(graph, "graph");
        int nodeCount = graph.nodeCount();
        int edgeCount = graph.edgeCount();

        int[] firstIncoming = new int[nodeCount + 1];
        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            firstIncoming[graph.edgeTarget(edgeId) + 1]++;
        }
        for (int nodeId = 0; nodeId < nodeCount; nodeId++) {
            firstIncoming[nodeId + 1] += firstIncoming[nodeId];
        }

        int[] fillCursor = Arrays.copyOf(firstIncoming, nodeCount);
        int[] sources = new int[edgeCount];
        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            int target = graph.edgeTarget(edgeId);
            sources[fillCursor[target]++] = graph.edgeOrigin(edgeId);
        }
        return new ReverseEdgeIndex(nodeCount, firstIncoming, sources);
    }

    public int inDegree(int nodeId) {
        validateNode(nodeId);
        return firstIncomingByNode[nodeId + 1] - firstIncomingByNode[nodeId];
    }

    /**
     * Calls {@code action} with the origin of every edge ending at {@code nodeId}.
     * A driver connected through duplicate edges is reported once per edge.
     */
    public void forEachFanin(int nodeId, IntConsumer action) {
        validateNode(nodeId);
        int end = firstIncomingByNode[nodeId + 1];
        for (int i = firstIncomingByNode[nodeId]; i < end; i++) {
            action.accept(incomingSources[i]);
        }
    }

    public int nodeCount() {
        return nodeCount;
    }

    private void validateNode(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IndexOutOfBoundsException("nodeId out of bounds: " + nodeId);
        }
    }
}
