package mazesolver.planning;

/**
 * Order in which a {@link Frontier} hands nodes back.
 * The one axis that separates depth-first from breadth-first search.
 */
public enum RemovalPolicy {
    /** Stack: most recently added node first (depth-first search) */
    LIFO,

    /** Queue: earliest added node first (breadth-first search) */
    FIFO
}
