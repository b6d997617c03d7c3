package org.rrview.routing.trace;

import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.graph.RRNodeKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Names the connection between consecutive route nodes and attaches switch and track
 * information for drawing.
 */
public final class ConnectionClassifier {
    private final RRGraph graph;
    private final RouteDisplayMode mode;

    public ConnectionClassifier(RRGraph graph, RouteDisplayMode mode) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    /**
     * Classifies the hop {@code prev -> cur} from node kinds alone.
     */
    public ConnectionType classify(int prev, int cur) {
        RRNodeKind prevKind = graph.kind(prev);
        RRNodeKind curKind = graph.kind(cur);
        if (prevKind.isChannel() && curKind.isChannel()) {
            return prevKind == curKind ? ConnectionType.FABRIC_STRAIGHT : ConnectionType.FABRIC_TURN;
        }
        if (prevKind.isChannel() || curKind.isChannel()) {
            return ConnectionType.PIN_TO_FABRIC;
        }
        return ConnectionType.PIN_ENTRY;
    }

    /**
     * Classifies every hop of one segment in a fresh track pass.
     */
    public ClassifiedSegment classify(RouteSegment segment) {
        return classify(segment, TrackAssigner.openPass(graph, mode));
    }

    /**
     * Classifies every hop of one segment using the caller's track pass.
     *
     * @throws org.rrview.routing.graph.GraphConsistencyException if two consecutive
     *         nodes are not connected in the graph.
     */
    public ClassifiedSegment classify(RouteSegment segment, TrackAssigner tracks) {
        Objects.requireNonNull(segment, "segment");
        Objects.requireNonNull(tracks, "tracks");
        if (tracks.mode() != mode) {
            throw new IllegalArgumentException("Track pass mode " + tracks.mode() + " does not match " + mode);
        }
        List<ClassifiedHop> hops = new ArrayList<>(Math.max(0, segment.size() - 1));
        for (int i = 1; i < segment.size(); i++) {
            hops.add(classifyHop(segment.node(i - 1), segment.node(i), tracks));
        }
        return new ClassifiedSegment(segment, List.copyOf(hops));
    }

    /**
     * Classifies each segment in its own pass.
     */
    public List<ClassifiedSegment> classifyAll(List<RouteSegment> segments) {
        List<ClassifiedSegment> result = new ArrayList<>(segments.size());
        for (RouteSegment segment : segments) {
            result.add(classify(segment));
        }
        return result;
    }

    private ClassifiedHop classifyHop(int prev, int cur, TrackAssigner tracks) {
        int switchId = graph.findSwitch(prev, cur);
        ConnectionType type = classify(prev, cur);

        // the current wire is visited before the previous one is looked up
        int toTrack = graph.isChannel(cur) ? tracks.assign(cur) : ClassifiedHop.NO_TRACK;
        int fromTrack = graph.isChannel(prev) ? tracks.trackOf(prev) : ClassifiedHop.NO_TRACK;

        ChannelTurn turn = ChannelTurn.NONE;
        if (type == ConnectionType.FABRIC_TURN) {
            turn = graph.kind(prev) == RRNodeKind.CHANX ? ChannelTurn.FROM_X_TO_Y : ChannelTurn.FROM_Y_TO_X;
        }

        return ClassifiedHop.builder()
                .fromNode(prev)
                .toNode(cur)
                .type(type)
                .turn(turn)
                .switchId(switchId)
                .buffered(graph.switchInfo(switchId).isBuffered())
                .fromTrack(fromTrack)
                .toTrack(toTrack)
                .build();
    }
}
