package org.pathrace.app;

import lombok.extern.slf4j.Slf4j;
import org.pathrace.graph.Graph;
import org.pathrace.graph.GraphGenerator;
import org.pathrace.race.RaceSession;
import org.pathrace.race.RaceVerdict;
import org.pathrace.traversal.AlgorithmResult;
import org.pathrace.traversal.TraversalSettings;
import org.pathrace.traversal.TraversalStrategy;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Random;

/**
 * Command-line smoke run: races two strategies corner to corner on a seeded grid.
 *
 * <p>Usage: {@code [LEFT RIGHT [rows cols seed]]}, defaults {@code DIJKSTRA A_STAR 8 8 42}.</p>
 *
 * <p>Grid cells are {@code 750 / cols} units wide. Under the default heuristic scale of 20
 * A* is only admissible once cells are narrower than 20 units; on coarser grids set
 * {@code -Dpathrace.astar.heuristicScale} to at least the cell width and height for an
 * optimal A*.</p>
 */
@Slf4j
public class Main {
    static final String USAGE = "usage: [LEFT RIGHT [rows cols seed]] with LEFT/RIGHT in DIJKSTRA, A_STAR, BFS, DFS";

    /**
     * Runs the race and prints a summary to standard output.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        PrintStream out = System.out;
        RaceOptions options;
        try {
            options = RaceOptions.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println(ex.getMessage());
            System.err.println(USAGE);
            return;
        }

        Graph graph = GraphGenerator.grid(options.rows(), options.cols(), new Random(options.seed()));
        String startId = GraphGenerator.gridId(0, 0);
        String endId = GraphGenerator.gridId(options.rows() - 1, options.cols() - 1);
        log.info("Racing {} vs {} on a {}x{} grid (seed {})",
                options.left(), options.right(), options.rows(), options.cols(), options.seed());

        RaceSession session = RaceSession.start(
                graph, startId, endId, options.left(), options.right(), TraversalSettings.defaults());
        RaceVerdict verdict = session.finish();

        out.printf("Race %s -> %s (%s)%n", startId, endId, session.fairness());
        printSide(out, "left", session.left());
        printSide(out, "right", session.right());
        out.printf("Winner: %s%n", verdict);
    }

    private static void printSide(PrintStream out, String side, AlgorithmResult result) {
        out.printf(Locale.ROOT, "%-5s %-22s steps=%d visited=%d distance=%.0f path=%s%n",
                side,
                result.getStrategy().displayName(),
                result.getSteps().size(),
                result.getVisitedNodes().size(),
                result.getDistance(),
                result.getPath());
    }

    record RaceOptions(TraversalStrategy left, TraversalStrategy right, int rows, int cols, long seed) {

        static RaceOptions parse(String[] args) {
            if (args.length == 1 || args.length == 3 || args.length == 4 || args.length > 5) {
                throw new IllegalArgumentException("unexpected argument count: " + args.length);
            }
            TraversalStrategy left = TraversalStrategy.DIJKSTRA;
            TraversalStrategy right = TraversalStrategy.A_STAR;
            int rows = 8;
            int cols = 8;
            long seed = 42L;
            if (args.length >= 2) {
                left = strategy(args[0]);
                right = strategy(args[1]);
            }
            if (args.length >= 5) {
                rows = Integer.parseInt(args[2]);
                cols = Integer.parseInt(args[3]);
                seed = Long.parseLong(args[4]);
            }
            if (rows <= 0 || cols <= 0) {
                throw new IllegalArgumentException("rows and cols must be > 0");
            }
            return new RaceOptions(left, right, rows, cols, seed);
        }

        private static TraversalStrategy strategy(String raw) {
            String key = raw.trim().toUpperCase(Locale.ROOT);
            if (key.equals("ASTAR") || key.equals("A*")) {
                key = TraversalStrategy.A_STAR.name();
            }
            try {
                return TraversalStrategy.valueOf(key);
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("unknown strategy: " + raw, ex);
            }
        }
    }
}
