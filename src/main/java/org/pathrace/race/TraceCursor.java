package org.pathrace.race;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.pathrace.traversal.PathStep;

import java.util.List;
import java.util.Optional;

/**
 * Bounded replay position over a step trace of fixed length.
 *
 * <p>Positions run from {@code 0} to {@code length - 1}; moves that would leave that
 * range are refused. A cursor over an empty trace stays at {@code 0}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class TraceCursor {
    private final int length;
    private int position;

    private TraceCursor(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0, got " + length);
        }
        this.length = length;
    }

    public static TraceCursor over(int length) {
        return new TraceCursor(length);
    }

    public static TraceCursor over(List<PathStep> steps) {
        return new TraceCursor(steps.size());
    }

    /**
     * Moves one step forward.
     *
     * @return whether the cursor moved.
     */
    public boolean next() {
        if (position < length - 1) {
            position++;
            return true;
        }
        return false;
    }

    /**
     * Moves one step back.
     *
     * @return whether the cursor moved.
     */
    public boolean previous() {
        if (position > 0) {
            position--;
            return true;
        }
        return false;
    }

    /**
     * Jumps to a position, clamped into range.
     */
    public void seek(int target) {
        position = Math.max(0, Math.min(target, length - 1));
    }

    public void rewind() {
        position = 0;
    }

    public void fastForward() {
        seek(length - 1);
    }

    public boolean atEnd() {
        return position >= length - 1;
    }

    /**
     * Returns the step a trace shows at this position; shorter traces hold their last step.
     */
    public Optional<PathStep> current(List<PathStep> steps) {
        if (steps.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(steps.get(Math.min(position, steps.size() - 1)));
    }
}
