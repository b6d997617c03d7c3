package org.rrview.routing.overlay;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.Builder;
import lombok.Value;
import org.rrview.routing.selection.NodeHighlight;
import org.rrview.routing.trace.ClassifiedSegment;

import java.util.List;

/**
 * Everything the renderer needs to draw one net's route.
 */
@Value
@Builder
public class NetRoutePlan {
    int netId;
    String netName;
    NodeHighlight netHighlight;
    /** Traceback nodes in route order. */
    IntList nodes;
    /** Highlight to draw each node of {@link #nodes} with, index-aligned. */
    List<NodeHighlight> nodeHighlights;
    List<ClassifiedSegment> segments;
}
