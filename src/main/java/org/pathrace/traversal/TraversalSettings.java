package org.pathrace.traversal;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Tunables shared by traversal engines.
 */
@Slf4j
@Getter
@Accessors(fluent = true)
public final class TraversalSettings {
    public static final double DEFAULT_HEURISTIC_SCALE = 20.0d;

    static final String PROP_HEURISTIC_SCALE = "pathrace.astar.heuristicScale";

    /** Distance units per unit of cost used by the A* Euclidean estimate. */
    private final double heuristicScale;

    private TraversalSettings(double heuristicScale) {
        this.heuristicScale = heuristicScale;
    }

    /**
     * Creates settings with an explicit heuristic scale.
     *
     * @throws IllegalArgumentException if the scale is not finite and positive.
     */
    public static TraversalSettings of(double heuristicScale) {
        if (!isValidScale(heuristicScale)) {
            throw new IllegalArgumentException("heuristicScale must be finite and > 0, got " + heuristicScale);
        }
        return new TraversalSettings(heuristicScale);
    }

    /**
     * Loads settings from system properties, falling back to defaults for missing or invalid values.
     */
    public static TraversalSettings defaults() {
        return new TraversalSettings(readScale());
    }

    private static double readScale() {
        String raw = System.getProperty(PROP_HEURISTIC_SCALE);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_HEURISTIC_SCALE;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (isValidScale(value)) {
                return value;
            }
        } catch (NumberFormatException ex) {
            log.warn("Ignoring non-numeric {}={}", PROP_HEURISTIC_SCALE, raw);
            return DEFAULT_HEURISTIC_SCALE;
        }
        log.warn("Ignoring out-of-range {}={}, using {}", PROP_HEURISTIC_SCALE, raw, DEFAULT_HEURISTIC_SCALE);
        return DEFAULT_HEURISTIC_SCALE;
    }

    private static boolean isValidScale(double value) {
        return Double.isFinite(value) && value > 0.0d;
    }
}
