package org.rrview.routing.trace;

/**
 * Kind of physical connection between two consecutive nodes of a route.
 */
public enum ConnectionType {
    /** Neither end is a channel wire: OPIN to IPIN directly, or a hop into/out of a terminal. */
    PIN_ENTRY,
    /** A pin (or terminal) and a channel wire, in either order. */
    PIN_TO_FABRIC,
    /** CHANX to CHANY or CHANY to CHANX. */
    FABRIC_TURN,
    /** Between two wires of the same channel direction. */
    FABRIC_STRAIGHT
}
