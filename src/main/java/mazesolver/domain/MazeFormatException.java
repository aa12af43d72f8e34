package mazesolver.domain;

/**
 * Thrown when a maze source cannot be turned into a {@link Grid}, most
 * commonly because it does not hold exactly one start and one goal marker.
 * No search may be attempted on a source that raised this.
 */
public class MazeFormatException extends IllegalArgumentException {

    public MazeFormatException(String message) {
        super(message);
    }
}
