package org.gridroute.app;

import lombok.Builder;
import lombok.Value;
import org.gridroute.grid.Coordinate;
import org.gridroute.routing.heuristic.HeuristicType;
import org.gridroute.routing.search.SearchMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parsed command-line options.
 *
 * <p>Every option is a {@code --key=value} flag; anything else is rejected.</p>
 */
@Value
@Builder
public class CliOptions {
    public static final int DEFAULT_SIZE = 10;
    public static final int DEFAULT_RANDOM_OBSTACLES = 20;
    /** Largest side whose cell count still fits an {@code int}. */
    public static final int MAX_SIZE = 46_340;

    /** Fixed obstacles of the default 10x10 delivery scenario. */
    static final List<Coordinate> DEFAULT_FIXED_OBSTACLES = List.of(
            Coordinate.of(9, 7), Coordinate.of(8, 7), Coordinate.of(6, 7), Coordinate.of(6, 8)
    );

    int size;
    Coordinate start;
    Coordinate goal;
    List<Coordinate> obstacles;
    int randomObstacles;
    Long seed;
    SearchMode mode;
    HeuristicType heuristicType;
    boolean help;

    /**
     * Parses the argument vector, filling defaults for anything not given.
     *
     * @throws IllegalArgumentException for unknown flags or malformed values.
     */
    public static CliOptions parse(String[] args) {
        Integer size = null;
        Coordinate start = null;
        Coordinate goal = null;
        List<Coordinate> obstacles = null;
        int randomObstacles = DEFAULT_RANDOM_OBSTACLES;
        Long seed = null;
        SearchMode mode = SearchMode.RELAXED;
        HeuristicType heuristicType = HeuristicType.CHEBYSHEV;
        boolean help = false;

        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                help = true;
                continue;
            }
            if (!arg.startsWith("--") || arg.indexOf('=') < 0) {
                throw new IllegalArgumentException("expected --key=value but got: " + arg);
            }
            String key = arg.substring(2, arg.indexOf('='));
            String value = arg.substring(arg.indexOf('=') + 1);
            switch (key) {
                case "size" -> size = parseInt(key, value);
                case "start" -> start = Coordinate.parse(value);
                case "goal" -> goal = Coordinate.parse(value);
                case "obstacles" -> obstacles = parseCoordinates(value);
                case "random" -> randomObstacles = parseInt(key, value);
                case "seed" -> seed = parseLong(key, value);
                case "mode" -> mode = SearchMode.parse(value);
                case "heuristic" -> heuristicType = HeuristicType.valueOf(value.strip().toUpperCase(Locale.ROOT));
                default -> throw new IllegalArgumentException("unknown option: --" + key);
            }
        }

        int side = size == null ? DEFAULT_SIZE : size;
        if (side <= 0 || side > MAX_SIZE) {
            throw new IllegalArgumentException("--size must be in [1, " + MAX_SIZE + "], got " + side);
        }
        if (randomObstacles < 0) {
            throw new IllegalArgumentException("--random must be non-negative, got " + randomObstacles);
        }

        return CliOptions.builder()
                .size(side)
                .start(start == null ? Coordinate.of(0, 0) : start)
                .goal(goal == null ? Coordinate.of(side - 1, side - 1) : goal)
                .obstacles(obstacles == null ? defaultObstacles(side) : obstacles)
                .randomObstacles(randomObstacles)
                .seed(seed)
                .mode(mode)
                .heuristicType(heuristicType)
                .help(help)
                .build();
    }

    static String usage() {
        return String.join(System.lineSeparator(),
                "Usage: gridroute [--size=N] [--start=x,y] [--goal=x,y] [--obstacles=x,y;x,y...]",
                "                 [--random=n] [--seed=s] [--mode=strict|relaxed] [--heuristic=chebyshev|none]");
    }

    private static List<Coordinate> defaultObstacles(int side) {
        List<Coordinate> fitting = new ArrayList<>();
        for (Coordinate cell : DEFAULT_FIXED_OBSTACLES) {
            if (cell.x() < side && cell.y() < side) {
                fitting.add(cell);
            }
        }
        return fitting;
    }

    private static List<Coordinate> parseCoordinates(String value) {
        List<Coordinate> cells = new ArrayList<>();
        for (String part : value.split(";")) {
            if (!part.isBlank()) {
                cells.add(Coordinate.parse(part));
            }
        }
        return cells;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("--" + key + " expects an integer, got: " + value, ex);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.strip());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("--" + key + " expects an integer, got: " + value, ex);
        }
    }
}
