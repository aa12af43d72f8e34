package mazesolver.planning;

/**
 * Configuration for maze search and the console client.
 * Centralizes all configurable parameters to avoid hardcoding.
 */
public class SearchConfig {

    /** Removal policy used when none is given (depth-first) */
    public static final RemovalPolicy DEFAULT_POLICY = RemovalPolicy.LIFO;

    /** Maze file loaded by the client when no path argument is given */
    public static final String DEFAULT_MAZE_FILE = "maze1.txt";

    /** Progress logging interval (log every N explored states) */
    public static final int PROGRESS_LOG_INTERVAL = 10_000;

    // ========== Maze Source Characters ==========

    public static final char START_CHAR = 'A';
    public static final char GOAL_CHAR = 'B';
    public static final char WALL_CHAR = '#';

    // ========== Rendering Glyphs ==========

    public static final char WALL_GLYPH = '█';
    public static final char START_GLYPH = 'A';
    public static final char GOAL_GLYPH = 'B';
    public static final char PATH_GLYPH = '*';
    public static final char OPEN_GLYPH = ' ';

    // ========== Logging Configuration ==========

    /**
     * Log level for controlling output verbosity on stderr.
     * 0 = SILENT (no output except critical errors)
     * 1 = MINIMAL (only final result)
     * 2 = NORMAL (+ one summary line per search)
     * 3 = VERBOSE (+ progress lines during search)
     */
    public static final int LOG_LEVEL = 2;

    /** Helper method to check if verbose logging is enabled */
    public static boolean isVerbose() { return LOG_LEVEL >= 3; }

    /** Helper method to check if normal logging is enabled */
    public static boolean isNormal() { return LOG_LEVEL >= 2; }

    /** Helper method to check if minimal logging is enabled */
    public static boolean isMinimal() { return LOG_LEVEL >= 1; }

    // Instance configuration
    private RemovalPolicy policy = DEFAULT_POLICY;
    private int progressLogInterval = PROGRESS_LOG_INTERVAL;

    public SearchConfig() {}

    public SearchConfig(RemovalPolicy policy) {
        setPolicy(policy);
    }

    /**
     * Creates a SearchConfig with default values.
     * Factory method for cleaner API.
     */
    public static SearchConfig defaults() {
        return new SearchConfig();
    }

    public RemovalPolicy getPolicy() { return policy; }
    public void setPolicy(RemovalPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Removal policy cannot be null");
        }
        this.policy = policy;
    }

    public int getProgressLogInterval() { return progressLogInterval; }
    public void setProgressLogInterval(int progressLogInterval) {
        if (progressLogInterval <= 0) {
            throw new IllegalArgumentException("Progress log interval must be positive: " + progressLogInterval);
        }
        this.progressLogInterval = progressLogInterval;
    }
}
