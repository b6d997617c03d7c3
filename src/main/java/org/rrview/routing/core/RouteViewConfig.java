package org.rrview.routing.core;

import lombok.Builder;
import lombok.Value;
import org.rrview.routing.selection.RRDisplayMode;
import org.rrview.routing.spatial.HitTester;
import org.rrview.routing.trace.RouteDisplayMode;

/**
 * View settings bound once when a {@link RouteViewCore} is created.
 */
@Value
@Builder
public class RouteViewConfig {

    /**
     * Detailed routing shows real track numbers; global routing synthesizes them.
     */
    @Builder.Default
    RouteDisplayMode routeMode = RouteDisplayMode.DETAILED;

    @Builder.Default
    RRDisplayMode rrDisplay = RRDisplayMode.NONE;

    @Builder.Default
    boolean showNets = true;

    /**
     * Half side of the square a pin is clickable in, in drawing units.
     */
    @Builder.Default
    double pinHalfWidth = 0.3;

    @Builder.Default
    double wireHitTolerance = HitTester.DEFAULT_WIRE_TOLERANCE;

    /**
     * Builds a reverse edge index so fan-in lookups avoid a full edge scan.
     */
    boolean reverseIndexEnabled;

    /**
     * Status text shown when nothing is hovered or selected.
     */
    @Builder.Default
    String defaultMessage = "";

    /**
     * Detailed routing with nets shown and the rr graph hidden.
     */
    public static RouteViewConfig detailed() {
        return RouteViewConfig.builder().build();
    }

    /**
     * Global routing with nets shown and the rr graph hidden.
     */
    public static RouteViewConfig global() {
        return RouteViewConfig.builder()
                .routeMode(RouteDisplayMode.GLOBAL)
                .build();
    }
}
