package org.rrview.routing.trace;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * One branch of a traceback: a run of rr nodes from the branch start to a SINK.
 *
 * <p>A segment that does not end at a SINK comes from a partially routed net and is
 * flagged {@link #complete()} {@code == false}.</p>
 */
public final class RouteSegment {
    private final int[] nodes;
    @Getter
    @Accessors(fluent = true)
    private final boolean complete;

    RouteSegment(int[] nodes, boolean complete) {
        if (nodes.length == 0) {
            throw new IllegalArgumentException("segment must contain at least one node");
        }
        this.nodes = nodes;
        this.complete = complete;
    }

    public int size() {
        return nodes.length;
    }

    public int node(int index) {
        return nodes[index];
    }

    public int first() {
        return nodes[0];
    }

    public int last() {
        return nodes[nodes.length - 1];
    }

    public IntList nodes() {
        return IntLists.unmodifiable(IntArrayList.wrap(nodes));
    }

    @Override
    public String toString() {
        return (complete ? "Segment" : "PartialSegment") + nodes();
    }
}
