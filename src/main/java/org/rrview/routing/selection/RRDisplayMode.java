package org.rrview.routing.selection;

/**
 * How much of the routing-resource graph the view shows.
 */
public enum RRDisplayMode {
    NONE,
    /** Nodes only, no edges. */
    NODES,
    /** Nodes and switch-box edges; edges leaving OPINs are hidden. */
    NODES_AND_SBOX,
    ALL;

    public boolean showsNodes() {
        return this != NONE;
    }
}
