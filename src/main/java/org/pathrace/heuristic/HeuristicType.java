package org.pathrace.heuristic;

/**
 * Supported heuristic modes.
 *
 * <p>{@code NONE} disables heuristic guidance (pure Dijkstra behavior).</p>
 * <p>{@code EUCLIDEAN} derives a lower bound from scaled straight-line node distance.</p>
 */
public enum HeuristicType {
    NONE,
    EUCLIDEAN
}
