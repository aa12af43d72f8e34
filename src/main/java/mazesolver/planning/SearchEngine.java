package mazesolver.planning;

import mazesolver.domain.Action;
import mazesolver.domain.Grid;
import mazesolver.domain.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Uninformed search from a grid's start cell to its goal cell.
 *
 * The traversal loop is the same for every policy; only the {@link Frontier}
 * removal order changes. LIFO gives depth-first search, FIFO breadth-first
 * search. Neither uses a cost model, and LIFO does not guarantee a shortest
 * path.
 *
 * A cell is added to the frontier at most once per run and expanded at most
 * once, so a run finishes in O(reachable cells) iterations.
 *
 * Not thread-safe: use one engine per thread. Grids may be shared.
 */
public class SearchEngine {

    /**
     * Lifecycle of the engine: READY until the first run, RUNNING during
     * {@link #solve}, then the terminal state of the last run. The terminal
     * states mirror {@link SearchOutcome.Status} one to one.
     */
    public enum Status {
        READY,
        RUNNING,
        SOLVED,
        UNSOLVABLE;

        /**
         * @param terminal status of a finished run
         * @return the engine state after that run
         */
        public static Status of(SearchOutcome.Status terminal) {
            return switch (terminal) {
                case SOLVED -> SOLVED;
                case UNSOLVABLE -> UNSOLVABLE;
            };
        }
    }

    private final SearchConfig config;

    private Status status = Status.READY;

    public SearchEngine() {
        this(SearchConfig.defaults());
    }

    public SearchEngine(SearchConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Search config cannot be null");
        }
        this.config = config;
    }

    public Status getStatus() {
        return status;
    }

    public SearchConfig getConfig() {
        return config;
    }

    /**
     * Searches with the configured removal policy.
     *
     * @param grid the maze to search
     * @return SOLVED with a solution, or UNSOLVABLE if the goal cannot be reached
     */
    public SearchOutcome solve(Grid grid) {
        return solve(grid, config.getPolicy());
    }

    /**
     * Searches from {@code grid.getStart()} to {@code grid.getGoal()}.
     *
     * An exhausted frontier is a normal outcome and is returned, not thrown.
     *
     * @param grid the maze to search
     * @param policy frontier removal order for this run
     * @return SOLVED with a solution, or UNSOLVABLE if the goal cannot be reached
     */
    public SearchOutcome solve(Grid grid, RemovalPolicy policy) {
        if (grid == null) {
            throw new IllegalArgumentException("Grid cannot be null");
        }
        status = Status.RUNNING;

        // Per-run state
        List<SearchNode> arena = new ArrayList<>();
        Set<Position> explored = new HashSet<>();
        int exploredCount = 0;

        Frontier frontier = new Frontier(policy);
        SearchNode root = SearchNode.root(arena.size(), grid.getStart());
        arena.add(root);
        frontier.add(root);

        Position goal = grid.getGoal();
        int logInterval = config.getProgressLogInterval();

        while (true) {
            if (frontier.isEmpty()) {
                SearchOutcome outcome = SearchOutcome.unsolvable(policy, exploredCount, arena.size(), explored);
                status = Status.of(outcome.status);
                if (SearchConfig.isNormal()) {
                    System.err.println("[SearchEngine] " + policy + " explored " + exploredCount +
                        " states in '" + grid.getName() + "' without reaching the goal");
                }
                return outcome;
            }

            SearchNode node = frontier.remove();
            exploredCount++;

            if (node.state.equals(goal)) {
                Solution solution = reconstructPath(arena, node);
                SearchOutcome outcome = SearchOutcome.solved(solution, policy, exploredCount, arena.size(), explored);
                status = Status.of(outcome.status);
                if (SearchConfig.isNormal()) {
                    System.err.println("[SearchEngine] " + policy + " solved '" + grid.getName() +
                        "': length " + solution.length() + ", explored " + exploredCount);
                }
                return outcome;
            }

            explored.add(node.state);

            if (SearchConfig.isVerbose() && exploredCount % logInterval == 0) {
                System.err.println("[SearchEngine] explored " + exploredCount +
                    ", frontier " + frontier.size());
            }

            for (Map.Entry<Action, Position> neighbor : grid.neighbors(node.state)) {
                Position next = neighbor.getValue();
                if (explored.contains(next) || frontier.containsState(next)) {
                    continue;
                }
                SearchNode child = new SearchNode(arena.size(), next, node.index, neighbor.getKey());
                arena.add(child);
                frontier.add(child);
            }
        }
    }

    /**
     * Reconstructs the path from start to goal by following parent indices.
     *
     * @param arena all nodes created in this run
     * @param goalNode the node standing on the goal
     * @return the (action, cell) sequence from start to goal
     */
    private Solution reconstructPath(List<SearchNode> arena, SearchNode goalNode) {
        List<Action> actions = new ArrayList<>();
        List<Position> cells = new ArrayList<>();
        SearchNode current = goalNode;

        while (!current.isRoot()) {
            actions.add(current.action);
            cells.add(current.state);
            current = arena.get(current.parentIndex);
        }

        Collections.reverse(actions);
        Collections.reverse(cells);
        return new Solution(actions, cells);
    }
}
