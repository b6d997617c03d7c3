package org.rrview.routing.trace;

/**
 * How routed wires are addressed when drawn.
 */
public enum RouteDisplayMode {
    /** Every wire has an explicit track index (its ptc number). */
    DETAILED,
    /**
     * Wires are abstract unit-length channel slots; track ids are synthesized per
     * channel cell so distinct wires in one cell do not overlap.
     */
    GLOBAL
}
