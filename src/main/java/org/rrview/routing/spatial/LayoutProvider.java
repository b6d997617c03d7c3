package org.rrview.routing.spatial;

import java.util.List;

/**
 * Geometry of routing resources in drawing coordinates, supplied by the view.
 */
public interface LayoutProvider {

    /**
     * Centres of every drawn instance of an OPIN/IPIN node; a pin present on several
     * sides of its block yields one anchor per side.
     */
    List<LayoutPoint> pinAnchors(int pinNode);

    /**
     * Drawn extent of a CHANX/CHANY node.
     */
    BoundingBox wireBounds(int wireNode);
}
