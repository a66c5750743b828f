package org.pathrace.race;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.pathrace.graph.Graph;
import org.pathrace.traversal.AlgorithmResult;
import org.pathrace.traversal.PathStep;
import org.pathrace.traversal.TraversalEngine;
import org.pathrace.traversal.TraversalEngines;
import org.pathrace.traversal.TraversalSettings;
import org.pathrace.traversal.TraversalStrategy;

import java.util.Objects;
import java.util.Optional;

/**
 * Two independent traversals of one graph replayed side by side.
 *
 * <p>Each side runs on its own engine to completion when the session starts; the
 * session then only moves a shared cursor over both traces. The verdict stays
 * {@link RaceVerdict#UNDECIDED} until the cursor reaches the end of the longer trace.</p>
 */
@Slf4j
@Getter
@Accessors(fluent = true)
public final class RaceSession {
    private final String startId;
    private final String endId;
    private final AlgorithmResult left;
    private final AlgorithmResult right;
    private final RaceFairness fairness;
    private final TraceCursor cursor;

    private RaceSession(String startId, String endId, AlgorithmResult left, AlgorithmResult right) {
        this.startId = startId;
        this.endId = endId;
        this.left = left;
        this.right = right;
        this.fairness = RaceFairness.classify(left.getStrategy(), right.getStrategy());
        this.cursor = TraceCursor.over(Math.max(left.stepCount(), right.stepCount()));
    }

    /**
     * Runs both strategies and opens a session at the first step.
     */
    public static RaceSession start(
            Graph graph,
            String startId,
            String endId,
            TraversalStrategy leftStrategy,
            TraversalStrategy rightStrategy,
            TraversalSettings settings
    ) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(startId, "startId");
        Objects.requireNonNull(endId, "endId");
        AlgorithmResult left = run(TraversalEngines.create(leftStrategy, settings), graph, startId, endId);
        AlgorithmResult right = run(TraversalEngines.create(rightStrategy, settings), graph, startId, endId);
        log.debug("Race {} vs {} from {} to {}: {} vs {} steps",
                leftStrategy, rightStrategy, startId, endId, left.stepCount(), right.stepCount());
        return new RaceSession(startId, endId, left, right);
    }

    public static RaceSession start(
            Graph graph,
            String startId,
            String endId,
            TraversalStrategy leftStrategy,
            TraversalStrategy rightStrategy
    ) {
        return start(graph, startId, endId, leftStrategy, rightStrategy, TraversalSettings.defaults());
    }

    private static AlgorithmResult run(TraversalEngine engine, Graph graph, String startId, String endId) {
        engine.init(graph, startId, endId);
        return engine.runToCompletion();
    }

    /**
     * @return left snapshot at the cursor; a finished side keeps showing its last step.
     */
    public Optional<PathStep> leftStep() {
        return cursor.current(left.getSteps());
    }

    public Optional<PathStep> rightStep() {
        return cursor.current(right.getSteps());
    }

    /**
     * @return verdict at the current cursor position.
     */
    public RaceVerdict verdict() {
        return RaceJudge.judgeAt(left, right, startId, endId, cursor.position());
    }

    /**
     * Moves the cursor to the end and returns the final verdict.
     */
    public RaceVerdict finish() {
        cursor.fastForward();
        return verdict();
    }
}
