package org.rrview.routing.spatial;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.graph.RRNodeKind;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps a point in drawing coordinates to the routing-resource node under it.
 * <p>
 * Pins (OPIN, IPIN) are tested before wires (CHANX, CHANY), so a pin drawn on top of
 * a wire wins. Within each class the lowest node id wins. A pin is hit inside the
 * square of half-width {@code pinHalfWidth} around any of its anchors; a wire is hit
 * inside its drawn box grown by {@code wireTolerance}.
 * <p>
 * Node ids per class are collected once at construction; geometry is read from the
 * {@link LayoutProvider} on every query.
 */
public final class HitTester {
    private static final Logger LOG = Logger.getLogger(HitTester.class.getName());

    public static final double DEFAULT_WIRE_TOLERANCE = 0.3;

    private final LayoutProvider layout;
    private final double pinHalfWidth;
    private final double wireTolerance;
    private final int[] pinNodes;
    private final int[] wireNodes;

    public HitTester(RRGraph graph, LayoutProvider layout, double pinHalfWidth, double wireTolerance) {
        Objects.requireNonNull(graph, "graph");
        this.layout = Objects.requireNonNull(layout, "layout");
        if (!(pinHalfWidth >= 0.0) || !Double.isFinite(pinHalfWidth)) {
            throw new IllegalArgumentException("pinHalfWidth must be finite and >= 0");
        }
        if (!(wireTolerance >= 0.0) || !Double.isFinite(wireTolerance)) {
            throw new IllegalArgumentException("wireTolerance must be finite and >= 0");
        }
        this.pinHalfWidth = pinHalfWidth;
        this.wireTolerance = wireTolerance;

        IntArrayList pins = new IntArrayList();
        IntArrayList wires = new IntArrayList();
        for (int n = 0; n < graph.nodeCount(); n++) {
            RRNodeKind kind = graph.kind(n);
            if (kind.isPin()) {
                pins.add(n);
            } else if (kind.isChannel()) {
                wires.add(n);
            }
        }
        this.pinNodes = pins.toIntArray();
        this.wireNodes = wires.toIntArray();
    }

    /**
     * @return the hit node, or empty when the point is over nothing selectable.
     */
    public OptionalInt hitTest(double x, double y) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("query point must be finite, got (" + x + ", " + y + ")");
        }
        for (int node : pinNodes) {
            if (hitsPin(node, x, y)) {
                return hit(node, x, y);
            }
        }
        for (int node : wireNodes) {
            if (layout.wireBounds(node).expand(wireTolerance).contains(x, y)) {
                return hit(node, x, y);
            }
        }
        return OptionalInt.empty();
    }

    private boolean hitsPin(int node, double x, double y) {
        List<LayoutPoint> anchors = layout.pinAnchors(node);
        for (LayoutPoint anchor : anchors) {
            if (x >= anchor.getX() - pinHalfWidth && x <= anchor.getX() + pinHalfWidth
                    && y >= anchor.getY() - pinHalfWidth && y <= anchor.getY() + pinHalfWidth) {
                return true;
            }
        }
        return false;
    }

    private static OptionalInt hit(int node, double x, double y) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("hit rr node %d at (%.3f, %.3f)", node, x, y));
        }
        return OptionalInt.of(node);
    }
}
