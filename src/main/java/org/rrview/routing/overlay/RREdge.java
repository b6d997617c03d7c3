package org.rrview.routing.overlay;

import lombok.Value;
import org.rrview.routing.selection.NodeHighlight;
import org.rrview.routing.trace.ConnectionType;

/**
 * One drawable rr graph edge.
 */
@Value
public class RREdge {
    int edgeId;
    int fromNode;
    int toNode;
    int switchId;
    boolean buffered;
    ConnectionType type;
    /** DEFAULT unless one end of the edge is the selected node. */
    NodeHighlight highlight;
}
