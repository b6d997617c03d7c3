package org.rrview.routing.graph;

/**
 * Kind of a routing-resource node.
 */
public enum RRNodeKind {
    /** Virtual net source behind a block's output pins. */
    SOURCE,
    /** Virtual net sink behind a block's input pins. */
    SINK,
    /** Block output pin. */
    OPIN,
    /** Block input pin. */
    IPIN,
    /** Horizontal channel wire. */
    CHANX,
    /** Vertical channel wire. */
    CHANY;

    private static final RRNodeKind[] VALUES = values();

    /**
     * Returns true for CHANX/CHANY.
     */
    public boolean isChannel() {
        return this == CHANX || this == CHANY;
    }

    /**
     * Returns true for OPIN/IPIN.
     */
    public boolean isPin() {
        return this == OPIN || this == IPIN;
    }

    static RRNodeKind fromOrdinal(int ordinal) {
        return VALUES[ordinal];
    }
}
