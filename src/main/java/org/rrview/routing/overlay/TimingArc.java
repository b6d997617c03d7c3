package org.rrview.routing.overlay;

import lombok.Builder;
import lombok.Value;

/**
 * One edge of a critical timing path, in path order.
 */
@Value
@Builder
public class TimingArc {
    public static final int NO_NET = -1;

    public enum Kind {
        /** Crosses the routing between two blocks. */
        INTERCONNECT,
        /** Stays inside a block; never traced through routing. */
        INTRA_BLOCK
    }

    Kind kind;
    /** Net carrying an interconnect arc, or {@link #NO_NET}. */
    @Builder.Default
    int netId = NO_NET;
    /** Net pin index of the arc's sink (1 or more). */
    int sinkPin;
    /** Incremental delay of the arc in seconds. */
    double delay;
}
