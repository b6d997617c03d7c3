package org.rrview.routing.trace;

import lombok.Value;

import java.util.List;

/**
 * A route segment together with its classified hops, ready for the renderer.
 */
@Value
public class ClassifiedSegment {
    RouteSegment segment;
    List<ClassifiedHop> hops;
}
