package org.rrview.routing.selection;

/**
 * Display highlight of an rr node or of a whole net.
 */
public enum NodeHighlight {
    DEFAULT,
    /** The clicked node. */
    PRIMARY_SELECTED,
    /** A previously selected node that was clicked again. */
    DESELECTED,
    /** Drives the selected node. */
    FANIN,
    /** Driven by the selected node. */
    FANOUT,
    CRITICAL_PATH;

    static final NodeHighlight[] VALUES = values();

    /**
     * True for the highlights that mark a net as highlighted when found on its route.
     */
    public boolean isSpecial() {
        return this != DEFAULT && this != DESELECTED;
    }

    public boolean isHighlighted() {
        return this != DEFAULT;
    }
}
