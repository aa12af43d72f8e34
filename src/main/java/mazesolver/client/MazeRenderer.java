package mazesolver.client;

import mazesolver.domain.Grid;
import mazesolver.domain.Position;
import mazesolver.planning.SearchConfig;
import mazesolver.planning.Solution;

import java.io.PrintStream;

/**
 * Draws a grid as text, optionally with a solution path overlaid.
 *
 * Each cell gets the first glyph that applies: wall, start, goal, path, open.
 */
public class MazeRenderer {

    /**
     * Renders the grid, one line per row, each terminated by a newline.
     *
     * @param grid the maze
     * @param solution path to overlay, or null for the bare maze
     * @return the rendered block
     */
    public String render(Grid grid, Solution solution) {
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < grid.getRows(); row++) {
            for (int col = 0; col < grid.getCols(); col++) {
                Position pos = Position.of(row, col);

                if (grid.isWall(pos)) {
                    sb.append(SearchConfig.WALL_GLYPH);
                } else if (pos.equals(grid.getStart())) {
                    sb.append(SearchConfig.START_GLYPH);
                } else if (pos.equals(grid.getGoal())) {
                    sb.append(SearchConfig.GOAL_GLYPH);
                } else if (solution != null && solution.contains(pos)) {
                    sb.append(SearchConfig.PATH_GLYPH);
                } else {
                    sb.append(SearchConfig.OPEN_GLYPH);
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Prints the rendered grid framed by blank lines.
     */
    public void print(PrintStream out, Grid grid, Solution solution) {
        out.println();
        out.print(render(grid, solution));
        out.println();
    }
}
