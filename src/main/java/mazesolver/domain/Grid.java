package mazesolver.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Represents the static (unchanging) information about a maze.
 * This includes walls, dimensions, the start cell and the goal cell.
 *
 * The grid uses a coordinate system where:
 * - Row 0 is the top
 * - Column 0 is the left
 * - Positions are accessed as (row, col)
 *
 * Instances are immutable and can be shared between threads without locking.
 */
public final class Grid {

    /** Maze name, usually the source file name */
    private final String name;

    /** Number of rows in the maze */
    private final int rows;

    /** Number of columns in the maze */
    private final int cols;

    /**
     * Wall positions. walls[row][col] is true if there's a wall at (row, col).
     */
    private final boolean[][] walls;

    /** Cell marked 'A' in the source */
    private final Position start;

    /** Cell marked 'B' in the source */
    private final Position goal;

    /**
     * Creates a new Grid with the specified parameters.
     *
     * @param name maze name
     * @param rows number of rows (positive)
     * @param cols number of columns (positive)
     * @param walls wall positions, rows x cols (will be copied)
     * @param start start cell, in bounds and not a wall
     * @param goal goal cell, in bounds and not a wall
     * @throws IllegalArgumentException if any of the above does not hold
     */
    public Grid(String name, int rows, int cols, boolean[][] walls, Position start, Position goal) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + rows + "x" + cols);
        }
        if (walls == null || walls.length != rows) {
            throw new IllegalArgumentException("Wall matrix must have " + rows + " rows");
        }
        if (start == null || goal == null) {
            throw new IllegalArgumentException("Grid needs both a start and a goal");
        }

        this.name = name;
        this.rows = rows;
        this.cols = cols;

        // Deep copy walls
        this.walls = new boolean[rows][cols];
        for (int r = 0; r < rows; r++) {
            if (walls[r] == null || walls[r].length != cols) {
                throw new IllegalArgumentException("Wall row " + r + " must have " + cols + " columns");
            }
            System.arraycopy(walls[r], 0, this.walls[r], 0, cols);
        }

        if (!isFree(start)) {
            throw new IllegalArgumentException("Start " + start + " is out of bounds or a wall");
        }
        if (!isFree(goal)) {
            throw new IllegalArgumentException("Goal " + goal + " is out of bounds or a wall");
        }
        this.start = start;
        this.goal = goal;
    }

    /**
     * @return the maze name
     */
    public String getName() {
        return name;
    }

    /**
     * @return number of rows in the maze
     */
    public int getRows() {
        return rows;
    }

    /**
     * @return number of columns in the maze
     */
    public int getCols() {
        return cols;
    }

    public Position getStart() {
        return start;
    }

    public Position getGoal() {
        return goal;
    }

    /**
     * Checks if there is a wall at the specified position.
     *
     * @param row the row index
     * @param col the column index
     * @return true if there is a wall at (row, col)
     */
    public boolean isWall(int row, int col) {
        if (!inBounds(row, col)) {
            return true; // Out of bounds is treated as wall
        }
        return walls[row][col];
    }

    /**
     * Checks if there is a wall at the specified position.
     *
     * @param pos the position to check
     * @return true if there is a wall at the position
     */
    public boolean isWall(Position pos) {
        return isWall(pos.row, pos.col);
    }

    /**
     * Checks if a position is within bounds and not a wall.
     *
     * @param pos the position to check
     * @return true if the position is passable
     */
    public boolean isFree(Position pos) {
        return inBounds(pos.row, pos.col) && !walls[pos.row][pos.col];
    }

    private boolean inBounds(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    /**
     * Returns the moves available from a cell.
     *
     * Candidates are evaluated in the fixed order up, down, left, right
     * ({@link Action} declaration order); a candidate is kept iff it is in
     * bounds and not a wall. The order of the result is significant: it is
     * the tie-break order of every search run on this grid.
     *
     * @param state an in-bounds cell
     * @return (action, resulting cell) pairs, never null
     */
    public List<Map.Entry<Action, Position>> neighbors(Position state) {
        List<Map.Entry<Action, Position>> result = new ArrayList<>(4);
        for (Action action : Action.values()) {
            Position next = state.move(action);
            if (isFree(next)) {
                result.add(Map.entry(action, next));
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return "Grid{name='" + name + "', rows=" + rows + ", cols=" + cols +
               ", start=" + start + ", goal=" + goal + "}";
    }
}
