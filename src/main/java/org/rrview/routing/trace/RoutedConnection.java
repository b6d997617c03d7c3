package org.rrview.routing.trace;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of a source-to-sink path query over one net's route tree.
 *
 * <p>When {@code found=false}, {@code path} is empty. A partial path is never
 * returned.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RoutedConnection {
    boolean found;
    int targetNode;
    /** rr nodes from the tree root to the target, inclusive. */
    IntList path;

    public static RoutedConnection found(int targetNode, IntArrayList path) {
        return new RoutedConnection(true, targetNode, IntLists.unmodifiable(path));
    }

    public static RoutedConnection notFound(int targetNode) {
        return new RoutedConnection(false, targetNode, IntLists.emptyList());
    }

    /**
     * The found path as a drawable segment ending at the target.
     *
     * @throws IllegalStateException if no path was found.
     */
    public RouteSegment toSegment() {
        if (!found) {
            throw new IllegalStateException("no routed path to rr node " + targetNode);
        }
        return new RouteSegment(path.toIntArray(), true);
    }
}
