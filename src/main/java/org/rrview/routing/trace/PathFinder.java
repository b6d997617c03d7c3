package org.rrview.routing.trace;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.Objects;

/**
 * Extracts the root-to-target node sequence from a {@link RouteTree}.
 *
 * <p>Search is a depth-first walk in child order, driven by an explicit stack. Once the
 * target is reached the path is collected target-to-root through parent indices and
 * reversed before returning.</p>
 */
public final class PathFinder {

    private PathFinder() {
    }

    /**
     * @param tree route tree of one net.
     * @param targetRrNode rr node to reach, normally one of the net's SINK terminals.
     * @return the found path, or {@link RoutedConnection#notFound(int)} when the target is
     *         not part of the tree.
     */
    public static RoutedConnection find(RouteTree tree, int targetRrNode) {
        Objects.requireNonNull(tree, "tree");

        int hit = RouteTree.NO_PARENT;
        IntArrayList stack = new IntArrayList();
        stack.push(tree.root());
        while (!stack.isEmpty()) {
            int index = stack.popInt();
            if (tree.rrNode(index) == targetRrNode) {
                hit = index;
                break;
            }
            IntList children = tree.children(index);
            for (int c = children.size() - 1; c >= 0; c--) {
                stack.push(children.getInt(c));
            }
        }
        if (hit == RouteTree.NO_PARENT) {
            return RoutedConnection.notFound(targetRrNode);
        }

        IntArrayList path = new IntArrayList();
        for (int index = hit; index != RouteTree.NO_PARENT; index = tree.parent(index)) {
            path.add(tree.rrNode(index));
        }
        reverse(path);
        return RoutedConnection.found(targetRrNode, path);
    }

    private static void reverse(IntArrayList list) {
        for (int i = 0, j = list.size() - 1; i < j; i++, j--) {
            int tmp = list.getInt(i);
            list.set(i, list.getInt(j));
            list.set(j, tmp);
        }
    }
}
