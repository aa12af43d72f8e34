package mazesolver.planning;

/**
 * Thrown by {@link Frontier#remove()} when there is nothing left to remove.
 * The search loop checks {@link Frontier#isEmpty()} before removing, so this
 * only surfaces on misuse.
 */
public class EmptyFrontierException extends IllegalStateException {

    public EmptyFrontierException() {
        super("empty frontier");
    }
}
