package mazesolver.planning;

import mazesolver.domain.Position;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Result of one {@link SearchEngine#solve} run.
 *
 * Carries the terminal status together with the run's own statistics, so
 * nothing about a search survives in the engine once the call returns.
 */
public final class SearchOutcome {

    /**
     * Terminal state of a search run.
     */
    public enum Status {
        SOLVED,
        UNSOLVABLE
    }

    public final Status status;

    /** Path to the goal, null unless solved */
    public final Solution solution;

    public final RemovalPolicy policy;

    /** Number of nodes removed from the frontier, goal node included */
    public final int exploredCount;

    /** Number of nodes created in the arena, root included */
    public final int nodesCreated;

    private final Set<Position> explored;

    private SearchOutcome(Status status, Solution solution, RemovalPolicy policy,
                          int exploredCount, int nodesCreated, Set<Position> explored) {
        this.status = status;
        this.solution = solution;
        this.policy = policy;
        this.exploredCount = exploredCount;
        this.nodesCreated = nodesCreated;
        this.explored = Collections.unmodifiableSet(new HashSet<>(explored));
    }

    public static SearchOutcome solved(Solution solution, RemovalPolicy policy,
                                       int exploredCount, int nodesCreated, Set<Position> explored) {
        if (solution == null) {
            throw new IllegalArgumentException("Solved outcome needs a solution");
        }
        return new SearchOutcome(Status.SOLVED, solution, policy, exploredCount, nodesCreated, explored);
    }

    public static SearchOutcome unsolvable(RemovalPolicy policy,
                                           int exploredCount, int nodesCreated, Set<Position> explored) {
        return new SearchOutcome(Status.UNSOLVABLE, null, policy, exploredCount, nodesCreated, explored);
    }

    public boolean isSolved() {
        return status == Status.SOLVED;
    }

    /**
     * Cells expanded during the run. The goal cell is never in here: the run
     * stops as soon as the goal node is removed.
     */
    public Set<Position> getExplored() {
        return explored;
    }

    @Override
    public String toString() {
        if (isSolved()) {
            return "SearchOutcome[SOLVED, " + policy + ", length=" + solution.length() +
                   ", explored=" + exploredCount + "]";
        }
        return "SearchOutcome[UNSOLVABLE, " + policy + ", explored=" + exploredCount + "]";
    }
}
