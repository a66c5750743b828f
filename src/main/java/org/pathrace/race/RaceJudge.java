package org.pathrace.race;

import lombok.experimental.UtilityClass;
import org.pathrace.traversal.AlgorithmResult;
import org.pathrace.traversal.PathStep;

import java.util.List;
import java.util.Objects;

/**
 * Decides the winner between two traversals of the same start/target pair.
 *
 * <p>Both results must be terminal; otherwise the verdict is {@link RaceVerdict#UNDECIDED}.
 * Rules, first match wins:</p>
 * <ol>
 * <li>Exactly one side has a final path from start to target: that side wins.</li>
 * <li>Neither side has one: tie.</li>
 * <li>The side whose completion flag was set at the lower step index wins.</li>
 * <li>The side with the smaller visited set wins.</li>
 * <li>Otherwise: tie.</li>
 * </ol>
 */
@UtilityClass
public class RaceJudge {

    /**
     * Judges two completed results, using the start and target recorded on the left result.
     *
     * @throws IllegalArgumentException when the two results do not share a start/target pair.
     */
    public static RaceVerdict judge(AlgorithmResult left, AlgorithmResult right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        if (!left.getStartId().equals(right.getStartId()) || !left.getEndId().equals(right.getEndId())) {
            throw new IllegalArgumentException(
                    "results race different endpoints: " + left.getStartId() + "->" + left.getEndId()
                            + " vs " + right.getStartId() + "->" + right.getEndId()
            );
        }
        return judge(left, right, left.getStartId(), left.getEndId());
    }

    /**
     * Judges two completed results for an explicit start/target pair.
     *
     * @return {@link RaceVerdict#UNDECIDED} while either result is partial.
     */
    public static RaceVerdict judge(AlgorithmResult left, AlgorithmResult right, String startId, String endId) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(startId, "startId");
        Objects.requireNonNull(endId, "endId");
        if (!left.isTerminal() || !right.isTerminal()) {
            return RaceVerdict.UNDECIDED;
        }

        boolean leftFound = connects(left.getPath(), startId, endId);
        boolean rightFound = connects(right.getPath(), startId, endId);
        if (leftFound != rightFound) {
            return leftFound ? RaceVerdict.LEFT : RaceVerdict.RIGHT;
        }
        if (!leftFound) {
            return RaceVerdict.TIE;
        }

        int leftFinish = firstCompleteIndex(left.getSteps());
        int rightFinish = firstCompleteIndex(right.getSteps());
        if (leftFinish != AlgorithmResult.NOT_COMPLETED && rightFinish != AlgorithmResult.NOT_COMPLETED) {
            if (leftFinish < rightFinish) {
                return RaceVerdict.LEFT;
            }
            if (rightFinish < leftFinish) {
                return RaceVerdict.RIGHT;
            }
        }

        int byVisited = Integer.compare(left.getVisitedNodes().size(), right.getVisitedNodes().size());
        if (byVisited < 0) {
            return RaceVerdict.LEFT;
        }
        if (byVisited > 0) {
            return RaceVerdict.RIGHT;
        }
        return RaceVerdict.TIE;
    }

    /**
     * Judges at a shared replay cursor.
     *
     * @param cursor zero-based step index shown for both sides.
     * @return {@link RaceVerdict#UNDECIDED} while either result is partial or the cursor has
     * not reached the last step of the longer trace, then the verdict of {@link #judge(AlgorithmResult, AlgorithmResult, String, String)}.
     */
    public static RaceVerdict judgeAt(
            AlgorithmResult left,
            AlgorithmResult right,
            String startId,
            String endId,
            int cursor
    ) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        int lastIndex = Math.max(left.stepCount(), right.stepCount()) - 1;
        if (cursor < lastIndex) {
            return RaceVerdict.UNDECIDED;
        }
        return judge(left, right, startId, endId);
    }

    private static boolean connects(List<String> path, String startId, String endId) {
        return !path.isEmpty()
                && path.get(0).equals(startId)
                && path.get(path.size() - 1).equals(endId);
    }

    private static int firstCompleteIndex(List<PathStep> steps) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).complete()) {
                return i;
            }
        }
        return AlgorithmResult.NOT_COMPLETED;
    }
}
