package model;

import java.util.List;

/**
 * A traced rectangle. {@code name} is the label embedded in the top border,
 * or {@code null} when the border is plain dashes.
 */
public record Box(String name, Bounds bounds, List<Box> children) {

    public Box {
        children = List.copyOf(children);
    }

    public Box(String name, Bounds bounds) {
        this(name, bounds, List.of());
    }

    public Box withChildren(List<Box> newChildren) {
        return new Box(name, bounds, newChildren);
    }

    /** Number of boxes on the longest path from this box to a leaf, counting this one. */
    public int depth() {
        int max = 0;
        for (Box child : children) max = Math.max(max, child.depth());
        return max + 1;
    }
}
