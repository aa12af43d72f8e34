package mazesolver.domain;

/**
 * Immutable class representing a cell (coordinate) on the maze grid.
 * Uses row and column indices where (0,0) is the top-left corner.
 * Row increases downward, column increases rightward.
 */
public final class Position {

    /** The row index (vertical position, 0-indexed from top) */
    public final int row;

    /** The column index (horizontal position, 0-indexed from left) */
    public final int col;

    /**
     * Creates a new Position with the specified row and column.
     *
     * @param row the row index (0-indexed)
     * @param col the column index (0-indexed)
     */
    public Position(int row, int col) {
        this.row = row;
        this.col = col;
    }

    /**
     * Factory equivalent of the constructor, reads better at call sites.
     */
    public static Position of(int row, int col) {
        return new Position(row, col);
    }

    /**
     * Returns the Position reached by taking the given action from here.
     * No bounds check is made.
     *
     * @param action the move to apply
     * @return the adjacent Position
     */
    public Position move(Action action) {
        return new Position(row + action.dRow, col + action.dCol);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Position position = (Position) obj;
        return row == position.row && col == position.col;
    }

    @Override
    public int hashCode() {
        return 31 * row + col;
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
