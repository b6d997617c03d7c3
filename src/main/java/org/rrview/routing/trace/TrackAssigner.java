package org.rrview.routing.trace;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.graph.RRNodeKind;

import java.util.Arrays;
import java.util.Objects;

/**
 * Track numbering context for one drawing pass.
 * <p>
 * In {@link RouteDisplayMode#DETAILED} mode a wire's track is its ptc number and the
 * assigner holds no state. In {@link RouteDisplayMode#GLOBAL} mode the assigner keeps
 * one counter per horizontal and per vertical channel cell, keyed by the wire's
 * (xlow, ylow): the first wire visited in a cell gets track 0, the next one track 1,
 * and so on.
 * <p>
 * An assigner belongs to exactly one pass. Open a new one (or call {@link #reset()})
 * before every pass; counters from an earlier pass must not be reused.
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe.
 */
public final class TrackAssigner {

    private static final int UNVISITED = ClassifiedHop.NO_TRACK;

    private final RRGraph graph;
    @Getter
    @Accessors(fluent = true)
    private final RouteDisplayMode mode;
    private final int gridHeight;
    private final int[] chanxNext;
    private final int[] chanyNext;

    private TrackAssigner(RRGraph graph, RouteDisplayMode mode) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.gridHeight = Math.max(1, graph.gridHeight());
        if (mode == RouteDisplayMode.GLOBAL) {
            int cells = Math.max(1, graph.gridWidth()) * gridHeight;
            this.chanxNext = new int[cells];
            this.chanyNext = new int[cells];
            reset();
        } else {
            this.chanxNext = null;
            this.chanyNext = null;
        }
    }

    /**
     * Opens a fresh pass with all counters cleared.
     */
    public static TrackAssigner openPass(RRGraph graph, RouteDisplayMode mode) {
        return new TrackAssigner(graph, mode);
    }

    /**
     * Clears every counter so the next visit in any cell returns 0.
     */
    public void reset() {
        if (chanxNext != null) {
            Arrays.fill(chanxNext, UNVISITED);
            Arrays.fill(chanyNext, UNVISITED);
        }
    }

    /**
     * Visits a channel wire and returns its track.
     * In global mode this claims the next free id of the wire's cell.
     */
    public int assign(int nodeId) {
        if (mode == RouteDisplayMode.DETAILED) {
            return detailedTrack(nodeId);
        }
        int[] counters = countersFor(nodeId);
        int cell = cellOf(nodeId);
        return ++counters[cell];
    }

    /**
     * Returns the track most recently handed out in the wire's cell without claiming a
     * new one, or {@link ClassifiedHop#NO_TRACK} if the cell has not been visited in
     * this pass. Never changes the counters.
     */
    public int trackOf(int nodeId) {
        if (mode == RouteDisplayMode.DETAILED) {
            return detailedTrack(nodeId);
        }
        return countersFor(nodeId)[cellOf(nodeId)];
    }

    private int detailedTrack(int nodeId) {
        requireChannel(nodeId);
        return graph.ptcNum(nodeId);
    }

    private int[] countersFor(int nodeId) {
        return requireChannel(nodeId) == RRNodeKind.CHANX ? chanxNext : chanyNext;
    }

    // Global rr graphs only have unit-length wires, so (xlow, ylow) names the cell.
    private int cellOf(int nodeId) {
        return graph.xLow(nodeId) * gridHeight + graph.yLow(nodeId);
    }

    private RRNodeKind requireChannel(int nodeId) {
        RRNodeKind kind = graph.kind(nodeId);
        if (!kind.isChannel()) {
            throw new IllegalArgumentException("Track requested for rr node " + nodeId + " of kind " + kind);
        }
        return kind;
    }
}
