package org.rrview.routing.trace;

import lombok.Builder;
import lombok.Value;

/**
 * One classified connection {@code fromNode -> toNode} of a route segment.
 */
@Value
@Builder
public class ClassifiedHop {
    public static final int NO_TRACK = -1;

    int fromNode;
    int toNode;
    ConnectionType type;
    /** Set for {@link ConnectionType#FABRIC_TURN}, {@link ChannelTurn#NONE} otherwise. */
    ChannelTurn turn;
    int switchId;
    boolean buffered;
    /** Track of the from-node, or {@link #NO_TRACK} for pins and terminals. */
    int fromTrack;
    /** Track of the to-node, or {@link #NO_TRACK} for pins and terminals. */
    int toTrack;
}
