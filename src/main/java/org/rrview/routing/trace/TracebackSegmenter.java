package org.rrview.routing.trace;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.graph.RRNodeKind;
import org.rrview.routing.netlist.Traceback;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Splits a traceback into its branches.
 *
 * <p>Nodes accumulate into the current segment until a SINK is appended, which closes
 * it. The entry following a SINK seeds the next segment as-is; no branch point is
 * inferred that the traceback does not list. Concatenating the returned segments
 * reproduces the traceback exactly.</p>
 */
public final class TracebackSegmenter {
    private final RRGraph graph;

    public TracebackSegmenter(RRGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    public List<RouteSegment> segment(Traceback traceback) {
        Objects.requireNonNull(traceback, "traceback");
        if (traceback.isEmpty()) {
            return Collections.emptyList();
        }

        List<RouteSegment> segments = new ArrayList<>();
        IntArrayList current = new IntArrayList();
        for (int i = 0; i < traceback.size(); i++) {
            int node = traceback.node(i);
            current.add(node);
            if (graph.kind(node) == RRNodeKind.SINK) {
                segments.add(new RouteSegment(current.toIntArray(), true));
                current.clear();
            }
        }
        if (!current.isEmpty()) {
            segments.add(new RouteSegment(current.toIntArray(), false));
        }
        return segments;
    }
}
