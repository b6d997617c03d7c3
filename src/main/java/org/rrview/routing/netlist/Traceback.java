package org.rrview.routing.netlist;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.graph.RRNodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * A net's routed tree as produced by the router: a pre-order walk over rr node ids.
 *
 * <p>Branches are implicit. A SINK always ends a branch, and the entry after it (if any)
 * starts the next branch, normally by repeating the node the branch grows from.</p>
 */
public final class Traceback {

    private static final Traceback EMPTY = new Traceback(new int[0]);

    private final int[] nodes;

    private Traceback(int[] nodes) {
        this.nodes = nodes;
    }

    public static Traceback of(int... nodes) {
        if (nodes == null || nodes.length == 0) {
            return EMPTY;
        }
        return new Traceback(nodes.clone());
    }

    public static Traceback of(IntList nodes) {
        return nodes.isEmpty() ? EMPTY : new Traceback(nodes.toIntArray());
    }

    public static Traceback empty() {
        return EMPTY;
    }

    public int size() {
        return nodes.length;
    }

    public boolean isEmpty() {
        return nodes.length == 0;
    }

    public int node(int index) {
        if (index < 0 || index >= nodes.length) {
            throw new IndexOutOfBoundsException("Traceback index " + index + " out of bounds [0, " + nodes.length + ")");
        }
        return nodes[index];
    }

    public boolean contains(int nodeId) {
        for (int n : nodes) {
            if (n == nodeId) {
                return true;
            }
        }
        return false;
    }

    /**
     * Read-only view of the walk.
     */
    public IntList nodes() {
        return IntLists.unmodifiable(IntArrayList.wrap(nodes));
    }

    public record ValidationResult(boolean isValid, List<String> errors, List<String> warnings) {}

    /**
     * Checks the walk against the routing-resource graph.
     * <p>
     * Errors: a single-entry walk, a first node that is not a SOURCE, unknown node ids,
     * and consecutive nodes inside one branch with no connecting edge. A walk whose
     * last branch does not reach a SINK is only warned about, since partially routed
     * nets are still drawable.
     */
    public ValidationResult validate(RRGraph graph) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (nodes.length == 0) {
            warnings.add("Traceback is empty (net not routed)");
            return new ValidationResult(true, errors, warnings);
        }
        if (nodes.length < 2) {
            errors.add("Non-empty traceback must have at least 2 entries, got " + nodes.length);
        }
        for (int i = 0; i < nodes.length; i++) {
            if (!graph.containsNode(nodes[i])) {
                errors.add("Entry " + i + " references unknown rr node " + nodes[i]);
            }
        }
        if (!errors.isEmpty()) {
            return new ValidationResult(false, errors, warnings);
        }

        if (graph.kind(nodes[0]) != RRNodeKind.SOURCE) {
            errors.add("Traceback must start at a SOURCE, got " + graph.kind(nodes[0]));
        }
        for (int i = 1; i < nodes.length; i++) {
            int prev = nodes[i - 1];
            if (graph.kind(prev) == RRNodeKind.SINK) {
                continue; // branch boundary
            }
            if (!graph.hasEdge(prev, nodes[i])) {
                errors.add("Entries " + (i - 1) + "->" + i + ": no edge " + prev + " -> " + nodes[i]);
                if (errors.size() > 10) { errors.add("..."); break; }
            }
        }
        if (graph.kind(nodes[nodes.length - 1]) != RRNodeKind.SINK) {
            warnings.add("Last branch does not end at a SINK (incomplete routing)");
        }
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    @Override
    public String toString() {
        return "Traceback" + nodes();
    }
}
