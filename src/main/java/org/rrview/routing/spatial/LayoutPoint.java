package org.rrview.routing.spatial;

import lombok.Value;

/**
 * A point in drawing (world) coordinates.
 */
@Value
public class LayoutPoint {
    double x;
    double y;

    @Override
    public String toString() {
        return String.format("(%.3f, %.3f)", x, y);
    }
}
