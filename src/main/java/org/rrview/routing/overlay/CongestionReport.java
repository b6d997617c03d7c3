package org.rrview.routing.overlay;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.graph.RRNodeKind;

import java.util.Locale;
import java.util.Objects;

/**
 * Overused pins and wires of a routed design.
 * <p>
 * A node is overused when its occupancy exceeds its capacity. The overuse range is
 * reported as {@code (1, max]}; with no overuse it collapses to {@code (1, 1]}.
 */
@Getter
@Accessors(fluent = true)
public final class CongestionReport {
    public static final double MIN_RATIO = 1.0;

    private final RRGraph graph;
    private final IntList overusedNodes;
    private final double maxRatio;

    private CongestionReport(RRGraph graph, IntList overusedNodes, double maxRatio) {
        this.graph = graph;
        this.overusedNodes = overusedNodes;
        this.maxRatio = maxRatio;
    }

    public static CongestionReport analyze(RRGraph graph) {
        Objects.requireNonNull(graph, "graph");
        IntArrayList overused = new IntArrayList();
        double max = MIN_RATIO;
        for (int node = 0; node < graph.nodeCount(); node++) {
            RRNodeKind kind = graph.kind(node);
            if ((!kind.isPin() && !kind.isChannel()) || graph.capacity(node) <= 0) {
                continue;
            }
            double ratio = ratio(graph, node);
            max = Math.max(max, ratio);
            if (ratio > MIN_RATIO) {
                overused.add(node);
            }
        }
        return new CongestionReport(graph, IntLists.unmodifiable(overused), max);
    }

    public boolean isCongested() {
        return !overusedNodes.isEmpty();
    }

    public double minRatio() {
        return MIN_RATIO;
    }

    /**
     * occupancy / capacity of a node.
     */
    public double ratioOf(int node) {
        if (graph.capacity(node) <= 0) {
            throw new IllegalArgumentException("rr node " + node + " has no capacity");
        }
        return ratio(graph, node);
    }

    /**
     * Position of a node's ratio within the overuse range, for a color map: 0 at the
     * bottom of the range, 1 at the top.
     */
    public double normalized(int node) {
        double span = maxRatio - MIN_RATIO;
        if (span <= 0.0) {
            return 0.0;
        }
        double t = (ratioOf(node) - MIN_RATIO) / span;
        return Math.max(0.0, Math.min(1.0, t));
    }

    public String rangeMessage() {
        return String.format(Locale.ROOT, "Overuse ratio range (%.2f, %.2f]", MIN_RATIO, maxRatio);
    }

    private static double ratio(RRGraph graph, int node) {
        return (double) graph.occupancy(node) / graph.capacity(node);
    }
}
