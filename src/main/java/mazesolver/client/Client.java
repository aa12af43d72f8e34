package mazesolver.client;

import mazesolver.domain.Grid;
import mazesolver.domain.MazeFormatException;
import mazesolver.planning.SearchConfig;
import mazesolver.planning.SearchEngine;
import mazesolver.planning.SearchOutcome;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Console entry point: load a maze, print it, solve it, print the solution.
 *
 * Usage: {@code Client [maze-file]}, defaulting to {@code maze1.txt}.
 *
 * The maze goes to stdout. Diagnostics go to stderr.
 */
public class Client {

    /** Exit status for a solved maze */
    public static final int EXIT_OK = 0;

    /** Exit status for an unreadable or malformed maze, or one with no solution */
    public static final int EXIT_FAILURE = 1;

    /** Output stream for the rendered maze */
    private final PrintStream out;

    /** Debug output stream */
    private final PrintStream debugOut;

    /** Search configuration */
    private final SearchConfig config;

    private final MazeParser parser = new MazeParser();
    private final MazeRenderer renderer = new MazeRenderer();

    /**
     * Creates a new Client with standard I/O streams.
     * The maze goes out as UTF-8 whatever the platform charset is.
     */
    public Client() {
        this(utf8(System.out), System.err, SearchConfig.defaults());
    }

    /**
     * Wraps a byte stream so the wall glyph survives non-UTF-8 locales.
     *
     * @param sink the underlying stream
     * @return an auto-flushing UTF-8 print stream over it
     */
    static PrintStream utf8(OutputStream sink) {
        return new PrintStream(sink, true, StandardCharsets.UTF_8);
    }

    /**
     * Creates a new Client with custom streams and config (for testing).
     *
     * @param out    output stream
     * @param debug  debug output stream
     * @param config search configuration
     */
    public Client(PrintStream out, PrintStream debug, SearchConfig config) {
        this.out = out;
        this.debugOut = debug;
        this.config = config;
    }

    /**
     * Main entry point.
     *
     * @param args optional maze file path
     */
    public static void main(String[] args) {
        String file = args.length > 0 ? args[0] : SearchConfig.DEFAULT_MAZE_FILE;
        int status = new Client().run(Paths.get(file));
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Loads, prints, solves and prints the maze at the given path.
     *
     * @param mazeFile the maze source
     * @return {@link #EXIT_OK} if solved, {@link #EXIT_FAILURE} otherwise
     */
    public int run(Path mazeFile) {
        Grid grid;
        try {
            grid = parser.parse(mazeFile);
        } catch (MazeFormatException e) {
            debugOut.println("Invalid maze " + mazeFile + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            debugOut.println("Could not read maze " + mazeFile + ": " + e.getMessage());
            return EXIT_FAILURE;
        }

        if (SearchConfig.isVerbose()) {
            debugOut.println("[Client] Loaded " + grid);
        }

        out.println("Maze:");
        renderer.print(out, grid, null);

        out.println("Solving...");
        SearchEngine engine = new SearchEngine(config);
        SearchOutcome outcome = engine.solve(grid);

        if (!outcome.isSolved()) {
            out.println("No solution.");
            if (SearchConfig.isMinimal()) {
                debugOut.println("[Client] No path from " + grid.getStart() + " to " + grid.getGoal() +
                    " after exploring " + outcome.exploredCount + " states");
            }
            return EXIT_FAILURE;
        }

        out.println("States Explored: " + outcome.exploredCount);
        out.println("Solution:");
        renderer.print(out, grid, outcome.solution);
        return EXIT_OK;
    }
}
