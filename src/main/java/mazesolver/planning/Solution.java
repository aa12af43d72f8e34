package mazesolver.planning;

import mazesolver.domain.Action;
import mazesolver.domain.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered (action, cell) sequence leading from the start (exclusive) to the
 * goal (inclusive). Immutable.
 */
public final class Solution {

    private final List<Action> actions;
    private final List<Position> cells;
    private final Set<Position> cellSet;

    /**
     * @param actions moves in start-to-goal order
     * @param cells cells reached by each move, same length as actions
     */
    public Solution(List<Action> actions, List<Position> cells) {
        if (actions.size() != cells.size()) {
            throw new IllegalArgumentException("Solution needs one cell per action: " +
                actions.size() + " actions, " + cells.size() + " cells");
        }
        this.actions = Collections.unmodifiableList(new ArrayList<>(actions));
        this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
        this.cellSet = Collections.unmodifiableSet(new HashSet<>(cells));
    }

    public List<Action> actions() {
        return actions;
    }

    public List<Position> cells() {
        return cells;
    }

    /**
     * @return number of moves from start to goal
     */
    public int length() {
        return actions.size();
    }

    /**
     * @param cell the cell to check
     * @return true if the path passes through (or ends on) this cell
     */
    public boolean contains(Position cell) {
        return cellSet.contains(cell);
    }

    @Override
    public String toString() {
        return "Solution[length=" + actions.size() + ", actions=" + actions + "]";
    }
}
