package org.rrview.routing.trace;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.graph.RRNodeKind;
import org.rrview.routing.netlist.Traceback;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Explicit tree form of a traceback.
 * <p>
 * Tree nodes live in an arena and are addressed by index; index 0 is the root (the
 * traceback's first entry). Each tree node stores its rr node, its parent index and
 * its children as an index list, so traversals never follow raw links and cannot
 * loop.
 * <p>
 * A branch that starts with an rr node already in the tree continues from that tree
 * node. A branch whose first node is not in the tree is attached to the closest
 * ancestor of the previous SINK that has a graph edge into it. When no such ancestor
 * exists the branch is kept as a detached subtree: its nodes are indexed but cannot be
 * reached from the root, so every tree edge stays a graph edge.
 */
public final class RouteTree {
    public static final int NO_PARENT = -1;

    private final IntArrayList rrNodes = new IntArrayList();
    private final IntArrayList parents = new IntArrayList();
    private final List<IntArrayList> children = new ArrayList<>();
    private final Int2IntOpenHashMap treeIndexByRrNode = new Int2IntOpenHashMap();

    private RouteTree() {
        treeIndexByRrNode.defaultReturnValue(NO_PARENT);
    }

    /**
     * Builds the tree of one routed net.
     *
     * @throws IllegalArgumentException if the traceback is empty.
     */
    public static RouteTree build(RRGraph graph, Traceback traceback) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(traceback, "traceback");
        if (traceback.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a route tree from an empty traceback");
        }

        RouteTree tree = new RouteTree();
        int current = tree.add(traceback.node(0), NO_PARENT);
        for (int i = 1; i < traceback.size(); i++) {
            int rrNode = traceback.node(i);
            if (graph.kind(traceback.node(i - 1)) == RRNodeKind.SINK) {
                int existing = tree.treeIndexOf(rrNode);
                if (existing != NO_PARENT) {
                    current = existing;
                } else {
                    current = tree.add(rrNode, tree.connectedAncestor(graph, current, rrNode));
                }
                continue;
            }
            current = tree.add(rrNode, current);
        }
        return tree;
    }

    public int root() {
        return 0;
    }

    public int size() {
        return rrNodes.size();
    }

    public int rrNode(int treeIndex) {
        return rrNodes.getInt(treeIndex);
    }

    public int parent(int treeIndex) {
        return parents.getInt(treeIndex);
    }

    public IntList children(int treeIndex) {
        return IntLists.unmodifiable(children.get(treeIndex));
    }

    /**
     * Tree index of the first tree node holding {@code rrNode}, or {@link #NO_PARENT}.
     */
    public int treeIndexOf(int rrNode) {
        return treeIndexByRrNode.get(rrNode);
    }

    public boolean containsRrNode(int rrNode) {
        return treeIndexByRrNode.containsKey(rrNode);
    }

    /**
     * Walks up from the parent of {@code closedSink} and returns the first tree node
     * with an edge to {@code rrNode}, or {@link #NO_PARENT} when there is none.
     */
    private int connectedAncestor(RRGraph graph, int closedSink, int rrNode) {
        for (int index = parents.getInt(closedSink); index != NO_PARENT; index = parents.getInt(index)) {
            if (graph.hasEdge(rrNodes.getInt(index), rrNode)) {
                return index;
            }
        }
        return NO_PARENT;
    }

    private int add(int rrNode, int parent) {
        int index = rrNodes.size();
        rrNodes.add(rrNode);
        parents.add(parent);
        children.add(new IntArrayList(2));
        if (parent != NO_PARENT) {
            children.get(parent).add(index);
        }
        treeIndexByRrNode.putIfAbsent(rrNode, index);
        return index;
    }
}
