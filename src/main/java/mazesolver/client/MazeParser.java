package mazesolver.client;

import mazesolver.domain.Grid;
import mazesolver.domain.MazeFormatException;
import mazesolver.domain.Position;
import mazesolver.planning.SearchConfig;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses maze files from their plain text format.
 *
 * Maze format:
 * <pre>
 * ###   #
 * #A# # #
 * # # #B#
 * #   ###
 * </pre>
 *
 * Grid symbols:
 * - 'A' : Start (exactly one)
 * - 'B' : Goal (exactly one)
 * - '#' : Wall
 * - anything else : Open floor
 *
 * Lines may differ in length. The grid is as wide as the longest line and
 * the missing tail of a shorter line is open floor.
 */
public class MazeParser {

    /**
     * Parses a maze file.
     *
     * @param file the file to read (UTF-8)
     * @return the parsed Grid, named after the file
     * @throws IOException if reading fails
     * @throws MazeFormatException if the start or goal marker is missing or repeated
     */
    public Grid parse(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Path fileName = file.getFileName();
            return parse(reader, fileName != null ? fileName.toString() : file.toString());
        }
    }

    /**
     * Parses a maze from a BufferedReader, reading to end of stream.
     *
     * @param reader the reader to read from
     * @param name name given to the resulting Grid
     * @return the parsed Grid
     * @throws IOException if reading fails
     * @throws MazeFormatException if the start or goal marker is missing or repeated
     */
    public Grid parse(BufferedReader reader, String name) throws IOException {
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            lines.add(line);
        }
        return build(lines, name);
    }

    /**
     * Parses a maze from a list of strings (for testing).
     *
     * @param lines the maze rows
     * @return the parsed Grid
     */
    public Grid parseFromStrings(List<String> lines) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append("\n");
        }

        try {
            return parse(new BufferedReader(new StringReader(sb.toString())), "inline");
        } catch (IOException e) {
            // StringReader does not fail
            throw new IllegalStateException("Unexpected I/O failure on in-memory maze", e);
        }
    }

    private Grid build(List<String> lines, String name) {
        int rows = lines.size();
        int cols = 0;
        for (String gridLine : lines) {
            cols = Math.max(cols, gridLine.length());
        }

        boolean[][] walls = new boolean[rows][cols];
        Position start = null;
        Position goal = null;
        int startCount = 0;
        int goalCount = 0;

        for (int r = 0; r < rows; r++) {
            String gridLine = lines.get(r);
            for (int c = 0; c < cols; c++) {
                // Past the end of a short line is open floor
                char ch = c < gridLine.length() ? gridLine.charAt(c) : ' ';

                if (ch == SearchConfig.START_CHAR) {
                    start = Position.of(r, c);
                    startCount++;
                } else if (ch == SearchConfig.GOAL_CHAR) {
                    goal = Position.of(r, c);
                    goalCount++;
                } else if (ch == SearchConfig.WALL_CHAR) {
                    walls[r][c] = true;
                }
            }
        }

        if (startCount != 1) {
            throw new MazeFormatException("maze must have exactly one start point (found " + startCount + ")");
        }
        if (goalCount != 1) {
            throw new MazeFormatException("maze must have exactly one goal (found " + goalCount + ")");
        }

        return new Grid(name, rows, cols, walls, start, goal);
    }
}
