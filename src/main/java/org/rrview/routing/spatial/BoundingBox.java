package org.rrview.routing.spatial;

import lombok.Value;

/**
 * Axis-aligned rectangle in drawing coordinates. Degenerate (zero width or height)
 * boxes are allowed; a channel wire is drawn as a line.
 */
@Value
public class BoundingBox {
    double left;
    double bottom;
    double right;
    double top;

    public boolean contains(double x, double y) {
        return x >= left && x <= right && y >= bottom && y <= top;
    }

    /**
     * Returns this box grown by {@code margin} on every side.
     */
    public BoundingBox expand(double margin) {
        return new BoundingBox(left - margin, bottom - margin, right + margin, top + margin);
    }

    public double width() {
        return right - left;
    }

    public double height() {
        return top - bottom;
    }
}
