package org.rrview.routing.graph;

import lombok.Value;

/**
 * Programmable switch connecting two routing-resource nodes.
 */
@Value
public class RRSwitch {
    /** Dense switch id. */
    int id;
    /** Architecture name of the switch. */
    String name;
    /** True for a unidirectional buffer, false for a bidirectional pass element. */
    boolean buffered;
}
