package org.rrview.routing.graph;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.shorts.ShortArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * Immutable routing-resource graph of one device.
 * <p>
 * Layout notes:
 * <p>
 * - Node properties are stored column-wise (one primitive array per property).
 * - Outgoing edges are stored in CSR form; edges of one node keep the order in
 *   which the routing engine produced them, which makes {@link #findSwitch(int, int)}
 *   deterministic when duplicate edges exist.
 * - An edge-origin column gives O(1) edge-to-source lookup.
 * <p>
 * The graph never changes once built, so any number of readers may share it.
 */
public final class RRGraph {

    // ========================================================================
    // NODE COLUMNS
    // ========================================================================

    private final byte[] kinds;
    private final short[] xLow;
    private final short[] xHigh;
    private final short[] yLow;
    private final short[] yHigh;
    private final int[] ptcNums;
    private final byte[] directions;
    private final short[] occupancy;
    private final short[] capacity;

    // ========================================================================
    // EDGE COLUMNS (CSR)
    // ========================================================================

    // firstEdge[node] -> start index in edge arrays, firstEdge[nodeCount] == edgeCount
    private final int[] firstEdge;
    private final int[] edgeTarget;
    private final int[] edgeSwitch;
    private final int[] edgeOrigin;

    private final List<RRSwitch> switches;

    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;
    /** Number of grid columns spanned by the graph (max xhigh + 1). */
    @Getter
    @Accessors(fluent = true)
    private final int gridWidth;
    /** Number of grid rows spanned by the graph (max yhigh + 1). */
    @Getter
    @Accessors(fluent = true)
    private final int gridHeight;

    private RRGraph(Builder builder, int[] firstEdge, int[] edgeTarget, int[] edgeSwitch, int[] edgeOrigin) {
        this.nodeCount = builder.kinds.size();
        this.edgeCount = edgeTarget.length;
        this.kinds = builder.kinds.toByteArray();
        this.xLow = builder.xLow.toShortArray();
        this.xHigh = builder.xHigh.toShortArray();
        this.yLow = builder.yLow.toShortArray();
        this.yHigh = builder.yHigh.toShortArray();
        this.ptcNums = builder.ptcNums.toIntArray();
        this.directions = builder.directions.toByteArray();
        this.occupancy = builder.occupancy.toShortArray();
        this.capacity = builder.capacity.toShortArray();
        this.firstEdge = firstEdge;
        this.edgeTarget = edgeTarget;
        this.edgeSwitch = edgeSwitch;
        this.edgeOrigin = edgeOrigin;
        this.switches = Collections.unmodifiableList(new ArrayList<>(builder.switches));

        int maxX = 0;
        int maxY = 0;
        for (int n = 0; n < nodeCount; n++) {
            maxX = Math.max(maxX, xHigh[n]);
            maxY = Math.max(maxY, yHigh[n]);
        }
        this.gridWidth = nodeCount == 0 ? 0 : maxX + 1;
        this.gridHeight = nodeCount == 0 ? 0 : maxY + 1;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // NODE ACCESSORS
    // ========================================================================

    public RRNodeKind kind(int nodeId) {
        checkNode(nodeId);
        return RRNodeKind.fromOrdinal(kinds[nodeId]);
    }

    public boolean isChannel(int nodeId) {
        return kind(nodeId).isChannel();
    }

    public boolean isPin(int nodeId) {
        return kind(nodeId).isPin();
    }

    public int xLow(int nodeId) {
        checkNode(nodeId);
        return xLow[nodeId];
    }

    public int xHigh(int nodeId) {
        checkNode(nodeId);
        return xHigh[nodeId];
    }

    public int yLow(int nodeId) {
        checkNode(nodeId);
        return yLow[nodeId];
    }

    public int yHigh(int nodeId) {
        checkNode(nodeId);
        return yHigh[nodeId];
    }

    /**
     * Track index for wires, pin index for pins, class index for terminals.
     */
    public int ptcNum(int nodeId) {
        checkNode(nodeId);
        return ptcNums[nodeId];
    }

    public WireDirection direction(int nodeId) {
        checkNode(nodeId);
        return WireDirection.fromOrdinal(directions[nodeId]);
    }

    public int occupancy(int nodeId) {
        checkNode(nodeId);
        return occupancy[nodeId];
    }

    public int capacity(int nodeId) {
        checkNode(nodeId);
        return capacity[nodeId];
    }

    /**
     * Wire length in grid cells; zero for pins and terminals.
     */
    public int length(int nodeId) {
        checkNode(nodeId);
        return (xHigh[nodeId] - xLow[nodeId]) + (yHigh[nodeId] - yLow[nodeId]);
    }

    public boolean containsNode(int nodeId) {
        return nodeId >= 0 && nodeId < nodeCount;
    }

    // ========================================================================
    // EDGE ACCESSORS
    // ========================================================================

    public int outDegree(int nodeId) {
        checkNode(nodeId);
        return firstEdge[nodeId + 1] - firstEdge[nodeId];
    }

    /**
     * First edge id (inclusive) of a node's outgoing range.
     */
    public int edgeStart(int nodeId) {
        checkNode(nodeId);
        return firstEdge[nodeId];
    }

    /**
     * Last edge id (exclusive) of a node's outgoing range.
     */
    public int edgeEnd(int nodeId) {
        checkNode(nodeId);
        return firstEdge[nodeId + 1];
    }

    /**
     * UNCHECKED - caller must pass an edge id from a valid range.
     */
    public int edgeTarget(int edgeId) {
        assert edgeId >= 0 && edgeId < edgeCount : "Edge " + edgeId + " out of bounds";
        return edgeTarget[edgeId];
    }

    public int edgeSwitch(int edgeId) {
        assert edgeId >= 0 && edgeId < edgeCount : "Edge " + edgeId + " out of bounds";
        return edgeSwitch[edgeId];
    }

    public int edgeOrigin(int edgeId) {
        if (edgeId < 0 || edgeId >= edgeCount) {
            throw new IndexOutOfBoundsException("Edge " + edgeId + " out of bounds [0, " + edgeCount + ")");
        }
        return edgeOrigin[edgeId];
    }

    public RRSwitch switchInfo(int switchId) {
        if (switchId < 0 || switchId >= switches.size()) {
            throw new IndexOutOfBoundsException("Switch " + switchId + " out of bounds [0, " + switches.size() + ")");
        }
        return switches.get(switchId);
    }

    public List<RRSwitch> switches() {
        return switches;
    }

    /**
     * Calls {@code action} with the target of every outgoing edge of {@code nodeId}, in edge order.
     */
    public void forEachFanout(int nodeId, IntConsumer action) {
        int end = edgeEnd(nodeId);
        for (int e = firstEdge[nodeId]; e < end; e++) {
            action.accept(edgeTarget[e]);
        }
    }

    // ========================================================================
    // SWITCH LOOKUP
    // ========================================================================

    /**
     * Returns the switch of the first {@code from -> to} edge.
     *
     * @throws GraphConsistencyException when no such edge exists.
     */
    public int findSwitch(int fromNode, int toNode) {
        int edgeId = findEdge(fromNode, toNode);
        if (edgeId < 0) {
            throw GraphConsistencyException.edgeNotFound(fromNode, toNode);
        }
        return edgeSwitch[edgeId];
    }

    public boolean hasEdge(int fromNode, int toNode) {
        return findEdge(fromNode, toNode) >= 0;
    }

    /**
     * Returns the id of the first {@code from -> to} edge, or -1.
     */
    public int findEdge(int fromNode, int toNode) {
        int end = edgeEnd(fromNode);
        for (int e = firstEdge[fromNode]; e < end; e++) {
            if (edgeTarget[e] == toNode) {
                return e;
            }
        }
        return -1;
    }

    public EdgeIterator iterator() {
        return new EdgeIterator(this);
    }

    /**
     * Reusable cursor over one node's outgoing edge ids.
     */
    public static final class EdgeIterator {
        private final RRGraph graph;
        private int current;
        private int end;

        EdgeIterator(RRGraph graph) {
            this.graph = graph;
        }

        public EdgeIterator resetForNode(int nodeId) {
            graph.checkNode(nodeId);
            this.current = graph.firstEdge[nodeId];
            this.end = graph.firstEdge[nodeId + 1];
            return this;
        }

        public boolean hasNext() {
            return current < end;
        }

        public int next() {
            if (current >= end) throw new NoSuchElementException();
            return current++;
        }
    }

    // ========================================================================
    // DEBUG & VALIDATION
    // ========================================================================

    @Override
    public String toString() {
        return String.format("RRGraph[nodes=%d, edges=%d, switches=%d, grid=%dx%d]",
                nodeCount, edgeCount, switches.size(), gridWidth, gridHeight);
    }

    public record ValidationResult(boolean isValid, List<String> errors, List<String> warnings) {}

    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (int e = 0; e < edgeCount; e++) {
            int sw = edgeSwitch[e];
            if (sw < 0 || sw >= switches.size()) {
                errors.add("Edge " + e + " references unknown switch " + sw);
                if (errors.size() > 10) { errors.add("..."); break; }
            }
        }

        for (int n = 0; n < nodeCount; n++) {
            if (xLow[n] > xHigh[n] || yLow[n] > yHigh[n]) {
                errors.add("Node " + n + " has inverted extent");
            }
            RRNodeKind kind = RRNodeKind.fromOrdinal(kinds[n]);
            if (!kind.isChannel() && (xLow[n] != xHigh[n] || yLow[n] != yHigh[n])) {
                warnings.add("Node " + n + " (" + kind + ") spans more than one cell");
            }
            if (errors.size() > 20) break;
        }

        int isolatedNodes = 0;
        for (int n = 0; n < nodeCount; n++) {
            if (firstEdge[n + 1] == firstEdge[n] && RRNodeKind.fromOrdinal(kinds[n]) != RRNodeKind.SINK) {
                isolatedNodes++;
            }
        }
        if (isolatedNodes > 0) {
            warnings.add("Graph contains " + isolatedNodes + " non-sink nodes without fanout");
        }

        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    private void checkNode(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IndexOutOfBoundsException("Node " + nodeId + " out of bounds [0, " + nodeCount + ")");
        }
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    /**
     * Accumulates nodes, switches and edges handed over by the routing engine.
     * Edges may be added in any node order; per-node edge order is preserved.
     */
    public static final class Builder {
        private final ByteArrayList kinds = new ByteArrayList();
        private final ShortArrayList xLow = new ShortArrayList();
        private final ShortArrayList xHigh = new ShortArrayList();
        private final ShortArrayList yLow = new ShortArrayList();
        private final ShortArrayList yHigh = new ShortArrayList();
        private final IntArrayList ptcNums = new IntArrayList();
        private final ByteArrayList directions = new ByteArrayList();
        private final ShortArrayList occupancy = new ShortArrayList();
        private final ShortArrayList capacity = new ShortArrayList();

        private final IntArrayList edgeFrom = new IntArrayList();
        private final IntArrayList edgeTo = new IntArrayList();
        private final IntArrayList edgeSw = new IntArrayList();
        private final List<RRSwitch> switches = new ArrayList<>();

        private Builder() {
        }

        public int addSwitch(String name, boolean buffered) {
            int id = switches.size();
            switches.add(new RRSwitch(id, Objects.requireNonNull(name, "name"), buffered));
            return id;
        }

        /**
         * Adds a pin or terminal node located at one grid cell, with capacity 1.
         */
        public int addPin(RRNodeKind kind, int x, int y, int ptcNum) {
            if (kind.isChannel()) {
                throw new IllegalArgumentException("addPin called with channel kind " + kind);
            }
            return addNode(kind, x, x, y, y, ptcNum, WireDirection.BIDIR, 1);
        }

        /**
         * Adds a channel wire spanning {@code [xLow, xHigh] x [yLow, yHigh]}, with capacity 1.
         */
        public int addWire(RRNodeKind kind, int xLow, int xHigh, int yLow, int yHigh,
                           int track, WireDirection direction) {
            if (!kind.isChannel()) {
                throw new IllegalArgumentException("addWire called with non-channel kind " + kind);
            }
            return addNode(kind, xLow, xHigh, yLow, yHigh, track, direction, 1);
        }

        public int addNode(RRNodeKind kind, int xLow, int xHigh, int yLow, int yHigh,
                           int ptcNum, WireDirection direction, int nodeCapacity) {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(direction, "direction");
            if (xLow < 0 || yLow < 0 || xHigh > Short.MAX_VALUE || yHigh > Short.MAX_VALUE) {
                throw new IllegalArgumentException("Node extent out of range: (" + xLow + "," + yLow
                        + ") -> (" + xHigh + "," + yHigh + ")");
            }
            if (nodeCapacity < 0 || nodeCapacity > Short.MAX_VALUE) {
                throw new IllegalArgumentException("Node capacity out of range: " + nodeCapacity);
            }
            int id = kinds.size();
            kinds.add((byte) kind.ordinal());
            this.xLow.add((short) xLow);
            this.xHigh.add((short) xHigh);
            this.yLow.add((short) yLow);
            this.yHigh.add((short) yHigh);
            ptcNums.add(ptcNum);
            directions.add((byte) direction.ordinal());
            occupancy.add((short) 0);
            capacity.add((short) nodeCapacity);
            return id;
        }

        public Builder occupancy(int nodeId, int occ) {
            checkBuilderNode(nodeId);
            if (occ < 0 || occ > Short.MAX_VALUE) {
                throw new IllegalArgumentException("Occupancy out of range for rr node " + nodeId + ": " + occ);
            }
            occupancy.set(nodeId, (short) occ);
            return this;
        }

        public Builder addEdge(int fromNode, int toNode, int switchId) {
            checkBuilderNode(fromNode);
            checkBuilderNode(toNode);
            if (switchId < 0 || switchId >= switches.size()) {
                throw new IllegalArgumentException("Unknown switch id " + switchId);
            }
            edgeFrom.add(fromNode);
            edgeTo.add(toNode);
            edgeSw.add(switchId);
            return this;
        }

        public RRGraph build() {
            int nodeCount = kinds.size();
            int edgeCount = edgeFrom.size();

            int[] firstEdge = new int[nodeCount + 1];
            for (int i = 0; i < edgeCount; i++) {
                firstEdge[edgeFrom.getInt(i) + 1]++;
            }
            for (int n = 0; n < nodeCount; n++) {
                firstEdge[n + 1] += firstEdge[n];
            }

            // stable counting sort keeps per-node insertion order
            int[] cursor = Arrays.copyOf(firstEdge, nodeCount);
            int[] targets = new int[edgeCount];
            int[] sws = new int[edgeCount];
            int[] origins = new int[edgeCount];
            for (int i = 0; i < edgeCount; i++) {
                int from = edgeFrom.getInt(i);
                int slot = cursor[from]++;
                targets[slot] = edgeTo.getInt(i);
                sws[slot] = edgeSw.getInt(i);
                origins[slot] = from;
            }
            return new RRGraph(this, firstEdge, targets, sws, origins);
        }

        private void checkBuilderNode(int nodeId) {
            if (nodeId < 0 || nodeId >= kinds.size()) {
                throw new IllegalArgumentException("Unknown node id " + nodeId);
            }
        }
    }
}
