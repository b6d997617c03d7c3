package org.rrview.routing.spatial;

import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.graph.RRNodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@link LayoutProvider} for a regular island-style grid.
 * <p>
 * Tiles are {@code tileWidth} square. The channel to the right of column {@code i}
 * holds {@code channelWidthY[i]} vertical tracks and the channel above row {@code j}
 * holds {@code channelWidthX[j]} horizontal tracks; N tracks take N + 1 units of
 * space. Track {@code t} is drawn {@code t + 1} units past the tile edge.
 * <p>
 * Pins are spread evenly along the block sides reported by {@link BlockPins}.
 */
public final class TileGridLayout implements LayoutProvider {

    /**
     * Block pin metadata for the tile at a grid location.
     */
    public interface BlockPins {
        /** Total pins of the block type at (x, y), across all sub-tiles. */
        int pinCount(int x, int y);

        /** Number of sub-tiles (block capacity) at (x, y). */
        int capacity(int x, int y);

        /** Sides of the block on which pin {@code pin} is present. */
        Set<PinSide> sides(int x, int y, int pin);
    }

    private final RRGraph graph;
    private final BlockPins blockPins;
    private final double tileWidth;
    private final double[] tileX;
    private final double[] tileY;

    /**
     * @param channelWidthY vertical track count per column channel, length {@code nx + 1}.
     * @param channelWidthX horizontal track count per row channel, length {@code ny + 1}.
     */
    public TileGridLayout(RRGraph graph, BlockPins blockPins, double tileWidth,
                          int[] channelWidthY, int[] channelWidthX) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.blockPins = Objects.requireNonNull(blockPins, "blockPins");
        if (!(tileWidth > 0.0) || !Double.isFinite(tileWidth)) {
            throw new IllegalArgumentException("tileWidth must be finite and > 0");
        }
        this.tileWidth = tileWidth;
        this.tileX = tileOrigins(Objects.requireNonNull(channelWidthY, "channelWidthY"), tileWidth);
        this.tileY = tileOrigins(Objects.requireNonNull(channelWidthX, "channelWidthX"), tileWidth);
    }

    private static double[] tileOrigins(int[] channelWidths, double tileWidth) {
        double[] origins = new double[channelWidths.length + 1];
        int offset = 0;
        for (int i = 0; i < channelWidths.length; i++) {
            origins[i] = i * tileWidth + offset;
            offset += channelWidths[i] + 1;
        }
        origins[channelWidths.length] = channelWidths.length * tileWidth + offset;
        return origins;
    }

    public double tileX(int column) {
        return tileX[column];
    }

    public double tileY(int row) {
        return tileY[row];
    }

    public double tileWidth() {
        return tileWidth;
    }

    /**
     * Pin half-width small enough that the pins of the busiest block do not overlap.
     */
    public static double pinHalfWidth(double tileWidth, int maxPinsPerBlock) {
        double size = 0.3;
        if (maxPinsPerBlock > 0) {
            size = Math.min(size, tileWidth / (4.0 * maxPinsPerBlock));
        }
        return size;
    }

    @Override
    public List<LayoutPoint> pinAnchors(int pinNode) {
        if (!graph.isPin(pinNode)) {
            throw new IllegalArgumentException("rr node " + pinNode + " is not a pin: " + graph.kind(pinNode));
        }
        int x = graph.xLow(pinNode);
        int y = graph.yLow(pinNode);
        int pin = graph.ptcNum(pinNode);
        Set<PinSide> sides = blockPins.sides(x, y, pin);
        if (sides.isEmpty()) {
            return Collections.emptyList();
        }

        int pinCount = blockPins.pinCount(x, y);
        int capacity = Math.max(1, blockPins.capacity(x, y));
        int pinsPerSubTile = Math.max(1, pinCount / capacity);
        int subTile = pin / pinsPerSubTile;
        // each sub-tile gets one extra step of padding
        double step = tileWidth / (pinCount + capacity);
        double offset = (pin + subTile + 1) * step;

        List<LayoutPoint> anchors = new ArrayList<>(sides.size());
        for (PinSide side : PinSide.values()) {
            if (!sides.contains(side)) {
                continue;
            }
            double xc = tileX[x];
            double yc = tileY[y];
            switch (side) {
                case LEFT -> yc += offset;
                case RIGHT -> {
                    xc += tileWidth;
                    yc += offset;
                }
                case BOTTOM -> xc += offset;
                case TOP -> {
                    xc += offset;
                    yc += tileWidth;
                }
            }
            anchors.add(new LayoutPoint(xc, yc));
        }
        return anchors;
    }

    @Override
    public BoundingBox wireBounds(int wireNode) {
        RRNodeKind kind = graph.kind(wireNode);
        double trackOffset = 1.0 + graph.ptcNum(wireNode);
        if (kind == RRNodeKind.CHANX) {
            double y = tileY[graph.yLow(wireNode)] + tileWidth + trackOffset;
            return new BoundingBox(tileX[graph.xLow(wireNode)], y, tileX[graph.xHigh(wireNode)] + tileWidth, y);
        }
        if (kind == RRNodeKind.CHANY) {
            double x = tileX[graph.xLow(wireNode)] + tileWidth + trackOffset;
            return new BoundingBox(x, tileY[graph.yLow(wireNode)], x, tileY[graph.yHigh(wireNode)] + tileWidth);
        }
        throw new IllegalArgumentException("rr node " + wireNode + " is not a wire: " + kind);
    }
}
