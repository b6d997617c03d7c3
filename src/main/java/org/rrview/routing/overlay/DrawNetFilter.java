package org.rrview.routing.overlay;

/**
 * Which nets a route drawing pass covers.
 */
public enum DrawNetFilter {
    ALL_NETS,
    /** Only nets whose aggregate highlight is not DEFAULT. */
    HIGHLIGHTED
}
