package org.rrview.routing.trace;

/**
 * Orientation of a {@link ConnectionType#FABRIC_TURN} hop.
 */
public enum ChannelTurn {
    NONE,
    FROM_X_TO_Y,
    FROM_Y_TO_X
}
