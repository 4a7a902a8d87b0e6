package org.gridroute.app;

import org.gridroute.grid.Coordinate;
import org.gridroute.grid.Grid;
import org.gridroute.grid.GridRenderer;
import org.gridroute.grid.ObstaclePlacer;
import org.gridroute.routing.core.GridRouter;
import org.gridroute.routing.core.RouteRequest;
import org.gridroute.routing.core.RouteResponse;
import org.gridroute.routing.core.RouteSearchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Command-line delivery-route demo.
 *
 * <p>Builds a grid, places the configured fixed obstacles plus a number of random ones, routes
 * from start to goal and prints the grid with the route drawn on it.</p>
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_FOUND = 0;
    static final int EXIT_NOT_FOUND = 1;
    static final int EXIT_USAGE = 2;

    /**
     * Launches the CLI.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * Runs one CLI invocation and returns its exit code.
     */
    static int run(String[] args, PrintStream out) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException ex) {
            out.println(ex.getMessage());
            out.println(CliOptions.usage());
            return EXIT_USAGE;
        }
        if (options.isHelp()) {
            out.println(CliOptions.usage());
            return EXIT_FOUND;
        }

        Grid grid = new Grid(options.getSize());
        List<Coordinate> placed = new ArrayList<>();
        for (Coordinate cell : options.getObstacles()) {
            if (!grid.inBounds(cell)) {
                out.println("obstacle " + cell + " lies outside the " + grid.side() + "x" + grid.side() + " grid");
                return EXIT_USAGE;
            }
            if (cell.equals(options.getStart()) || cell.equals(options.getGoal())) {
                out.println("obstacle " + cell + " would block the start or the delivery point");
                return EXIT_USAGE;
            }
            if (grid.placeObstacle(cell)) {
                placed.add(cell);
            }
        }

        Random random = options.getSeed() == null ? new Random() : new Random(options.getSeed());
        List<Coordinate> randomCells = new ObstaclePlacer(random)
                .place(grid, options.getRandomObstacles(), options.getStart(), options.getGoal());
        placed.addAll(randomCells);
        log.info("Placed {} fixed and {} random obstacles", placed.size() - randomCells.size(), randomCells.size());

        out.println("Obstacles were placed at:");
        out.println(GridRenderer.formatCoordinates(placed));
        out.println();

        RouteResponse response;
        try {
            response = GridRouter.builder().grid(grid).build().route(RouteRequest.builder()
                    .start(options.getStart())
                    .goal(options.getGoal())
                    .mode(options.getMode())
                    .heuristicType(options.getHeuristicType())
                    .build());
        } catch (RouteSearchException ex) {
            out.println(ex.getMessage());
            return EXIT_USAGE;
        }

        if (!response.isReachable()) {
            out.println("Unable to reach delivery point: no route from " + options.getStart()
                    + " to " + options.getGoal() + " avoids every obstacle");
            out.println();
            out.print(GridRenderer.render(grid));
            return EXIT_NOT_FOUND;
        }

        if (response.getObstaclesCrossed() > 0) {
            out.println("Unable to reach delivery point without crossing obstacles");
            out.println();
        }
        out.println("This is a path from the start to the destination traversing "
                + response.getObstaclesCrossed() + " obstacle(s)");
        out.println();
        out.print(GridRenderer.render(grid, response.getPath()));
        out.println();
        out.println(GridRenderer.formatCoordinates(response.getPath()));
        out.println();
        out.println("This is " + response.getSteps() + " steps");
        out.println();
        out.println("Obstacles were traversed at:");
        out.println(GridRenderer.formatCoordinates(response.getObstacleCells()));
        return EXIT_FOUND;
    }
}
