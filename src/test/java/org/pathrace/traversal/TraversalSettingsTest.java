package org.pathrace.traversal;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TraversalSettings Tests")
class TraversalSettingsTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(TraversalSettings.PROP_HEURISTIC_SCALE);
    }

    @Test
    @DisplayName("Defaults to a scale of 20")
    void testDefault() {
        assertEquals(TraversalSettings.DEFAULT_HEURISTIC_SCALE, TraversalSettings.defaults().heuristicScale());
    }

    @Test
    @DisplayName("Reads the scale from system properties")
    void testProperty() {
        System.setProperty(TraversalSettings.PROP_HEURISTIC_SCALE, " 12.5 ");
        assertEquals(12.5, TraversalSettings.defaults().heuristicScale());
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "0", "-3", "NaN", "Infinity", ""})
    @DisplayName("Invalid property values fall back to the default")
    void testInvalidProperty(String raw) {
        System.setProperty(TraversalSettings.PROP_HEURISTIC_SCALE, raw);
        assertEquals(TraversalSettings.DEFAULT_HEURISTIC_SCALE, TraversalSettings.defaults().heuristicScale());
    }

    @Test
    @DisplayName("Explicit scales are validated")
    void testExplicit() {
        assertEquals(5.0, TraversalSettings.of(5.0).heuristicScale());
        assertThrows(IllegalArgumentException.class, () -> TraversalSettings.of(0.0));
        assertThrows(IllegalArgumentException.class, () -> TraversalSettings.of(Double.POSITIVE_INFINITY));
    }
}
