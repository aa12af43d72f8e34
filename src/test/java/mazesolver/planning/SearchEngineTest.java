package mazesolver.planning;

import mazesolver.client.MazeParser;
import mazesolver.domain.Action;
import mazesolver.domain.Grid;
import mazesolver.domain.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SearchEngine Tests")
class SearchEngineTest {

    private final MazeParser parser = new MazeParser();

    private Grid maze(String... lines) {
        return parser.parseFromStrings(List.of(lines));
    }

    private static void assertWalk(Grid grid, Solution solution) {
        Position current = grid.getStart();
        for (int i = 0; i < solution.length(); i++) {
            Position next = solution.cells().get(i);
            assertEquals(current.move(solution.actions().get(i)), next, "step " + i);
            assertTrue(grid.isFree(next), "step " + i + " lands on a wall");
            current = next;
        }
        assertEquals(grid.getGoal(), current);
    }

    @ParameterizedTest
    @EnumSource(RemovalPolicy.class)
    @DisplayName("Trivial: start next to goal gives a one-step solution")
    void testAdjacentGoal(RemovalPolicy policy) {
        Grid grid = maze("AB");

        SearchOutcome outcome = new SearchEngine().solve(grid, policy);

        assertTrue(outcome.isSolved());
        assertEquals(1, outcome.solution.length());
        assertEquals(Action.RIGHT, outcome.solution.actions().get(0));
        assertEquals(grid.getGoal(), grid.getStart().move(outcome.solution.actions().get(0)));
        assertEquals(2, outcome.exploredCount);
    }

    @ParameterizedTest
    @EnumSource(RemovalPolicy.class)
    @DisplayName("Enclosed goal: outcome is UNSOLVABLE, not an exception")
    void testEnclosedGoal(RemovalPolicy policy) {
        Grid grid = maze(
            "A  #",
            "   #",
            "####",
            "  #B");
        SearchEngine engine = new SearchEngine();

        SearchOutcome outcome = engine.solve(grid, policy);

        assertFalse(outcome.isSolved());
        assertEquals(SearchOutcome.Status.UNSOLVABLE, outcome.status);
        assertNull(outcome.solution);
        assertEquals(6, outcome.exploredCount);
        assertEquals(6, outcome.getExplored().size());
        assertFalse(outcome.getExplored().contains(grid.getGoal()));
        assertEquals(SearchEngine.Status.UNSOLVABLE, engine.getStatus());
    }

    @Test
    @DisplayName("LIFO: small maze follows depth-first tie-break order")
    void testDepthFirstPath() {
        Grid grid = maze(
            "A #",
            "  #",
            " B");

        SearchOutcome outcome = new SearchEngine().solve(grid, RemovalPolicy.LIFO);

        assertTrue(outcome.isSolved());
        assertEquals(List.of(Action.RIGHT, Action.DOWN, Action.DOWN), outcome.solution.actions());
        assertEquals(List.of(Position.of(0, 1), Position.of(1, 1), Position.of(2, 1)),
            outcome.solution.cells());
        assertEquals(4, outcome.exploredCount);
    }

    @Test
    @DisplayName("FIFO: small maze follows breadth-first order")
    void testBreadthFirstPath() {
        Grid grid = maze(
            "A #",
            "  #",
            " B");

        SearchOutcome outcome = new SearchEngine().solve(grid, RemovalPolicy.FIFO);

        assertTrue(outcome.isSolved());
        assertEquals(List.of(Action.DOWN, Action.DOWN, Action.RIGHT), outcome.solution.actions());
        assertEquals(6, outcome.exploredCount);
    }

    @Test
    @DisplayName("FIFO: finds a shortest path where LIFO wanders")
    void testBreadthFirstIsShortest() {
        Grid grid = maze(
            "     ",
            "  A  ",
            "     ",
            "  B  ");

        SearchOutcome bfs = new SearchEngine().solve(grid, RemovalPolicy.FIFO);
        SearchOutcome dfs = new SearchEngine().solve(grid, RemovalPolicy.LIFO);

        assertEquals(2, bfs.solution.length());
        assertTrue(dfs.solution.length() >= bfs.solution.length());
        assertWalk(grid, bfs.solution);
        assertWalk(grid, dfs.solution);
    }

    @ParameterizedTest
    @EnumSource(RemovalPolicy.class)
    @DisplayName("Solution is a walk from start to goal through open cells")
    void testSolutionIsWalk(RemovalPolicy policy) {
        Grid grid = maze(
            "#####B#",
            "##### #",
            "####  #",
            "#### ##",
            "     ##",
            "A######");

        SearchOutcome outcome = new SearchEngine().solve(grid, policy);

        assertTrue(outcome.isSolved());
        assertEquals(10, outcome.solution.length());
        assertWalk(grid, outcome.solution);
    }

    @ParameterizedTest
    @EnumSource(RemovalPolicy.class)
    @DisplayName("Determinism: repeated runs give identical results")
    void testDeterminism(RemovalPolicy policy) {
        Grid grid = maze(
            "A     #   ",
            " ## # # # ",
            "    #   #B",
            "### ##### ",
            "          ");
        SearchEngine engine = new SearchEngine();

        SearchOutcome first = engine.solve(grid, policy);
        SearchOutcome second = engine.solve(grid, policy);

        assertTrue(first.isSolved());
        assertEquals(first.exploredCount, second.exploredCount);
        assertEquals(first.nodesCreated, second.nodesCreated);
        assertEquals(first.solution.actions(), second.solution.actions());
        assertEquals(first.solution.cells(), second.solution.cells());
        assertEquals(first.getExplored(), second.getExplored());
    }

    @Test
    @DisplayName("Padded row tail is walkable")
    void testRaggedRowsArePadded() {
        Grid grid = maze(
            "A",
            "#B");

        SearchOutcome outcome = new SearchEngine().solve(grid);

        assertTrue(outcome.isSolved());
        assertEquals(List.of(Action.RIGHT, Action.DOWN), outcome.solution.actions());
    }

    @Test
    @DisplayName("Status: READY before first run, terminal state after each run")
    void testStatusTransitions() {
        SearchEngine engine = new SearchEngine();
        assertEquals(SearchEngine.Status.READY, engine.getStatus());

        engine.solve(maze("A#B"));
        assertEquals(SearchEngine.Status.UNSOLVABLE, engine.getStatus());

        engine.solve(maze("A B"));
        assertEquals(SearchEngine.Status.SOLVED, engine.getStatus());
    }

    @Test
    @DisplayName("Config: default policy is LIFO and solve(grid) uses the configured one")
    void testConfiguredPolicy() {
        Grid grid = maze(
            "A #",
            "  #",
            " B");

        assertEquals(RemovalPolicy.LIFO, new SearchEngine().getConfig().getPolicy());
        SearchOutcome outcome = new SearchEngine(new SearchConfig(RemovalPolicy.FIFO)).solve(grid);

        assertEquals(RemovalPolicy.FIFO, outcome.policy);
        assertEquals(6, outcome.exploredCount);
    }

    @Test
    @DisplayName("Per-run state does not leak between runs")
    void testRunStateReset() {
        SearchEngine engine = new SearchEngine();
        SearchOutcome big = engine.solve(maze(
            "A    ",
            "     ",
            "    B"), RemovalPolicy.FIFO);
        SearchOutcome small = engine.solve(maze("AB"), RemovalPolicy.FIFO);

        assertTrue(big.exploredCount > small.exploredCount);
        assertEquals(1, small.getExplored().size());
        assertEquals(2, small.nodesCreated);
    }

    @ParameterizedTest
    @EnumSource(SearchOutcome.Status.class)
    @DisplayName("Status: engine terminal state matches the returned outcome")
    void testTerminalStatusFollowsOutcome(SearchOutcome.Status terminal) {
        SearchEngine.Status engineStatus = SearchEngine.Status.of(terminal);
        assertEquals(terminal.name(), engineStatus.name());

        SearchEngine engine = new SearchEngine();
        SearchOutcome outcome = engine.solve(terminal == SearchOutcome.Status.SOLVED ? maze("A B") : maze("A#B"));
        assertEquals(terminal, outcome.status);
        assertEquals(engineStatus, engine.getStatus());
    }
}
