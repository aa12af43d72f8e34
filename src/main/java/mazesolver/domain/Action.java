package mazesolver.domain;

/**
 * Enum representing the four cardinal moves between adjacent cells.
 * Each action has associated row and column deltas.
 *
 * Declaration order is the order in which {@link Grid#neighbors(Position)}
 * evaluates candidates, so it decides tie-breaks during search.
 */
public enum Action {
    /** Move up (decrease row) */
    UP(-1, 0, "up"),

    /** Move down (increase row) */
    DOWN(1, 0, "down"),

    /** Move left (decrease column) */
    LEFT(0, -1, "left"),

    /** Move right (increase column) */
    RIGHT(0, 1, "right");

    /** Row delta when taking this action */
    public final int dRow;

    /** Column delta when taking this action */
    public final int dCol;

    private final String label;

    Action(int dRow, int dCol, String label) {
        this.dRow = dRow;
        this.dCol = dCol;
        this.label = label;
    }

    /**
     * @return the lower-case name of this action (up, down, left, right)
     */
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label();
    }
}
