package org.rrview.routing.selection;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of one click on the view.
 */
@Value
@Builder
public class SelectionOutcome {
    public static final int NO_NODE = -1;

    /** False when the click was ignored because nothing selectable is displayed. */
    boolean handled;
    /** Clicked rr node, or {@link #NO_NODE} on a miss. */
    @Builder.Default
    int node = NO_NODE;
    /** State of the clicked node after the click; DEFAULT on a miss. */
    @Builder.Default
    NodeHighlight state = NodeHighlight.DEFAULT;
    int fanoutTouched;
    int faninTouched;
    /** Nets whose route holds the selected node, in net-id order. */
    @Singular
    List<Integer> nets;
    @Builder.Default
    String message = "";

    public boolean isHit() {
        return node != NO_NODE;
    }

    static SelectionOutcome ignored() {
        return SelectionOutcome.builder().handled(false).build();
    }
}
