package org.rrview.routing.overlay;

import lombok.Value;
import org.rrview.routing.trace.ClassifiedSegment;
import org.rrview.routing.trace.RoutedConnection;

/**
 * Drawing instructions for one timing arc of the critical path.
 */
@Value
public class ArcOverlay {
    int arcIndex;
    /** Index into the max-contrast palette. */
    int paletteIndex;
    TimingArc arc;
    /** Traced routing; not-found for flylines. */
    RoutedConnection connection;
    /** Classified routing of a traced arc, {@code null} for flylines. */
    ClassifiedSegment route;

    public boolean isFlyline() {
        return !connection.isFound();
    }
}
