package mazesolver.planning;

import mazesolver.domain.Action;
import mazesolver.domain.Position;

/**
 * Node in the search tree, stored in the per-run node arena of
 * {@link SearchEngine}. The parent is the arena index of the node this one
 * was expanded from, or {@link #NO_PARENT} for the root.
 */
public final class SearchNode {

    /** Parent index of the root node */
    public static final int NO_PARENT = -1;

    /** Index of this node in the arena */
    public final int index;

    /** Cell this node stands on */
    public final Position state;

    /** Arena index of the parent node */
    public final int parentIndex;

    /** Move taken from the parent (null for the root) */
    public final Action action;

    SearchNode(int index, Position state, int parentIndex, Action action) {
        this.index = index;
        this.state = state;
        this.parentIndex = parentIndex;
        this.action = action;
    }

    /**
     * Creates a root node (no parent, no action).
     */
    static SearchNode root(int index, Position state) {
        return new SearchNode(index, state, NO_PARENT, null);
    }

    public boolean isRoot() {
        return parentIndex == NO_PARENT;
    }

    @Override
    public String toString() {
        return "SearchNode[" + index + " " + state + " via " + action + " from " + parentIndex + "]";
    }
}
