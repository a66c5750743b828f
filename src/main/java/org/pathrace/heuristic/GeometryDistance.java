package org.pathrace.heuristic;

import lombok.experimental.UtilityClass;

/**
 * Numeric helpers for planar distance computations.
 */
@UtilityClass
final class GeometryDistance {

    /**
     * Computes Euclidean distance in cartesian coordinate space.
     */
    static double euclideanDistance(double x1, double y1, double x2, double y2) {
        return Math.hypot(x2 - x1, y2 - y1);
    }
}
