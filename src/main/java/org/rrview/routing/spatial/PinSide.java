package org.rrview.routing.spatial;

/**
 * Side of a block on which a physical pin is located.
 */
public enum PinSide {
    TOP,
    RIGHT,
    BOTTOM,
    LEFT
}
