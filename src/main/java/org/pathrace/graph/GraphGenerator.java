package org.pathrace.graph;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Seeded sample-graph generators laid out on a 750x550 canvas.
 *
 * <p>All randomness is drawn from the supplied {@link Random}, so equal seeds give
 * equal graphs.</p>
 */
@UtilityClass
public class GraphGenerator {
    static final double CANVAS_WIDTH = 750.0d;
    static final double CANVAS_HEIGHT = 550.0d;
    static final double PADDING = 50.0d;
    static final double MIN_NODE_SPACING = 60.0d;
    static final int MAX_PLACEMENT_ATTEMPTS = 100;
    static final int MAX_GRID_WEIGHT = 10;
    static final int MAX_SPATIAL_WEIGHT = 20;
    static final double DISTANCE_PER_WEIGHT_UNIT = 20.0d;

    /**
     * Builds a {@code rows x cols} lattice with right and down edges of random weight in {@code [1, 10]}.
     *
     * <p>Node ids are {@code node-r-c} with label {@code r,c}.</p>
     */
    public static Graph grid(int rows, int cols, Random random) {
        requirePositive("rows", rows);
        requirePositive("cols", cols);
        Objects.requireNonNull(random, "random");

        double cellWidth = CANVAS_WIDTH / cols;
        double cellHeight = CANVAS_HEIGHT / rows;
        List<Node> nodes = new ArrayList<>(rows * cols);
        List<Edge> edges = new ArrayList<>(2 * rows * cols);

        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                nodes.add(new Node(
                        gridId(r, c),
                        c * cellWidth + cellWidth / 2.0d + PADDING,
                        r * cellHeight + cellHeight / 2.0d + PADDING,
                        r + "," + c
                ));
            }
        }
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (c < cols - 1) {
                    edges.add(new Edge(gridId(r, c), gridId(r, c + 1), random.nextInt(MAX_GRID_WEIGHT) + 1));
                }
                if (r < rows - 1) {
                    edges.add(new Edge(gridId(r, c), gridId(r + 1, c), random.nextInt(MAX_GRID_WEIGHT) + 1));
                }
            }
        }
        return Graph.of(nodes, edges);
    }

    /**
     * Returns the id {@link #grid(int, int, Random)} assigns to one cell.
     */
    public static String gridId(int row, int col) {
        return "node-" + row + "-" + col;
    }

    /**
     * Builds a connected random graph with a Gaussian node cloud and distance-biased edges.
     *
     * <p>Edge {@code (i, j)} is drawn with probability {@code density * (1 - 0.7 * d / diagonal)}
     * and weighted {@code min(floor(d / 20) + 1, 20)}. Nodes left unreachable from
     * {@code node-0} are then attached to their nearest reachable node.</p>
     *
     * @param nodeCount number of nodes, ids {@code node-0 .. node-(n-1)}.
     * @param edgeDensity base edge probability in {@code [0, 1]}.
     * @param random randomness source.
     */
    public static Graph random(int nodeCount, double edgeDensity, Random random) {
        requirePositive("nodeCount", nodeCount);
        if (!(edgeDensity >= 0.0d && edgeDensity <= 1.0d)) {
            throw new GraphContractException(
                    GraphContractException.REASON_GENERATOR_ARGUMENT,
                    "edgeDensity must be in [0, 1], got " + edgeDensity
            );
        }
        Objects.requireNonNull(random, "random");

        List<Node> nodes = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            double[] position = placeNode(nodes, random);
            nodes.add(new Node("node-" + i, position[0], position[1], Integer.toString(i)));
        }

        double diagonal = Math.hypot(CANVAS_WIDTH, CANVAS_HEIGHT);
        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < nodeCount; i++) {
            for (int j = i + 1; j < nodeCount; j++) {
                double distance = distance(nodes.get(i), nodes.get(j));
                double probability = edgeDensity * (1.0d - (distance / diagonal) * 0.7d);
                if (random.nextDouble() < probability) {
                    edges.add(new Edge(nodes.get(i).id(), nodes.get(j).id(), spatialWeight(distance)));
                }
            }
        }

        connectStragglers(nodes, edges);
        return Graph.of(nodes, edges);
    }

    private static double[] placeNode(List<Node> placed, Random random) {
        for (int attempt = 0; attempt < MAX_PLACEMENT_ATTEMPTS; attempt++) {
            double x = clamp(random.nextGaussian() * (CANVAS_WIDTH / 4.0d) + CANVAS_WIDTH / 2.0d, CANVAS_WIDTH);
            double y = clamp(random.nextGaussian() * (CANVAS_HEIGHT / 4.0d) + CANVAS_HEIGHT / 2.0d, CANVAS_HEIGHT);
            if (isSpacedFrom(placed, x, y)) {
                return new double[]{x, y};
            }
        }
        return new double[]{
                PADDING + random.nextDouble() * (CANVAS_WIDTH - 2.0d * PADDING),
                PADDING + random.nextDouble() * (CANVAS_HEIGHT - 2.0d * PADDING)
        };
    }

    private static boolean isSpacedFrom(List<Node> placed, double x, double y) {
        for (Node node : placed) {
            if (Math.hypot(node.x() - x, node.y() - y) < MIN_NODE_SPACING) {
                return false;
            }
        }
        return true;
    }

    private static void connectStragglers(List<Node> nodes, List<Edge> edges) {
        AdjacencyIndex adjacency = AdjacencyIndex.build(Graph.of(nodes, edges));
        BitSet reached = new BitSet(nodes.size());
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        reached.set(0);
        queue.enqueue(0);
        while (!queue.isEmpty()) {
            int current = queue.dequeueInt();
            for (int p = adjacency.start(current); p < adjacency.end(current); p++) {
                int neighbor = adjacency.neighborAt(p);
                if (!reached.get(neighbor)) {
                    reached.set(neighbor);
                    queue.enqueue(neighbor);
                }
            }
        }

        for (int i = 0; i < nodes.size(); i++) {
            if (reached.get(i)) {
                continue;
            }
            Node straggler = nodes.get(i);
            int nearest = -1;
            double nearestDistance = Double.POSITIVE_INFINITY;
            for (int j = reached.nextSetBit(0); j >= 0; j = reached.nextSetBit(j + 1)) {
                double distance = distance(straggler, nodes.get(j));
                if (distance < nearestDistance) {
                    nearestDistance = distance;
                    nearest = j;
                }
            }
            edges.add(new Edge(straggler.id(), nodes.get(nearest).id(), spatialWeight(nearestDistance)));
            reached.set(i);
        }
    }

    private static int spatialWeight(double distance) {
        return Math.min((int) Math.floor(distance / DISTANCE_PER_WEIGHT_UNIT) + 1, MAX_SPATIAL_WEIGHT);
    }

    private static double distance(Node a, Node b) {
        return Math.hypot(a.x() - b.x(), a.y() - b.y());
    }

    private static double clamp(double value, double extent) {
        return Math.max(PADDING, Math.min(extent - PADDING, value));
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new GraphContractException(
                    GraphContractException.REASON_GENERATOR_ARGUMENT,
                    name + " must be > 0, got " + value
            );
        }
    }
}
