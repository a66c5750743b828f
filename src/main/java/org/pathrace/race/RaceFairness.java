package org.pathrace.race;

import org.pathrace.traversal.TraversalStrategy;

import java.util.Objects;

/**
 * How comparable two strategies are in a race.
 */
public enum RaceFairness {
    /** Both strategies guarantee a minimum-weight path; only speed and efficiency differ. */
    FAIR,
    /** Exactly one strategy guarantees a minimum-weight path. */
    MIXED,
    /** Neither strategy considers edge weights. */
    UNWEIGHTED;

    public static RaceFairness classify(TraversalStrategy left, TraversalStrategy right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        boolean leftOptimal = left.guaranteesShortestPath();
        boolean rightOptimal = right.guaranteesShortestPath();
        if (leftOptimal && rightOptimal) {
            return FAIR;
        }
        if (leftOptimal || rightOptimal) {
            return MIXED;
        }
        return UNWEIGHTED;
    }
}
