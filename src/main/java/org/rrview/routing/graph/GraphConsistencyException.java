package org.rrview.routing.graph;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when a traceback or route tree presents an adjacency the routing-resource
 * graph does not contain.
 *
 * <p>The routing data and the graph disagree. Route drawing treats this as fatal; the
 * critical path overlay draws the affected arc as a flyline instead.</p>
 */
@Getter
@Accessors(fluent = true)
public final class GraphConsistencyException extends RuntimeException {
    private final int fromNode;
    private final int toNode;

    public GraphConsistencyException(int fromNode, int toNode, String message) {
        super(message);
        this.fromNode = fromNode;
        this.toNode = toNode;
    }

    /**
     * Creates the failure for a missing {@code from -> to} edge.
     */
    public static GraphConsistencyException edgeNotFound(int fromNode, int toNode) {
        return new GraphConsistencyException(fromNode, toNode,
                "Edge not found: rr node " + fromNode + " has no edge to rr node " + toNode);
    }
}
