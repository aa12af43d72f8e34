package mazesolver.planning;

import mazesolver.domain.Position;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Ordered collection of search nodes waiting to be expanded.
 *
 * Nodes are kept in insertion order; {@link #remove()} takes from the back
 * (LIFO) or the front (FIFO) depending on the configured policy. A count per
 * state keeps {@link #containsState(Position)} O(1).
 */
public final class Frontier {

    private final RemovalPolicy policy;

    private final Deque<SearchNode> nodes = new ArrayDeque<>();

    /** Number of held nodes per state */
    private final Map<Position, Integer> stateCounts = new HashMap<>();

    /**
     * Creates an empty frontier.
     *
     * @param policy which end {@link #remove()} takes from
     */
    public Frontier(RemovalPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Removal policy cannot be null");
        }
        this.policy = policy;
    }

    public RemovalPolicy getPolicy() {
        return policy;
    }

    /**
     * Appends a node. Always succeeds.
     *
     * @param node the node to add
     */
    public void add(SearchNode node) {
        nodes.addLast(node);
        stateCounts.merge(node.state, 1, Integer::sum);
    }

    /**
     * @param state the cell to look for
     * @return true iff some node currently held has this state
     */
    public boolean containsState(Position state) {
        return stateCounts.containsKey(state);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Removes and returns one node according to the policy.
     *
     * @return the most recently added node (LIFO) or the earliest added one (FIFO)
     * @throws EmptyFrontierException if the frontier is empty
     */
    public SearchNode remove() {
        if (nodes.isEmpty()) {
            throw new EmptyFrontierException();
        }
        SearchNode node = switch (policy) {
            case LIFO -> nodes.removeLast();
            case FIFO -> nodes.removeFirst();
        };
        stateCounts.computeIfPresent(node.state, (state, count) -> count == 1 ? null : count - 1);
        return node;
    }

    @Override
    public String toString() {
        return "Frontier[" + policy + ", size=" + nodes.size() + "]";
    }
}
