package org.rrview.routing.graph;

/**
 * Signal direction of a channel wire. Pins and terminals report {@link #BIDIR}.
 */
public enum WireDirection {
    INC,
    DEC,
    BIDIR;

    private static final WireDirection[] VALUES = values();

    static WireDirection fromOrdinal(int ordinal) {
        return VALUES[ordinal];
    }
}
