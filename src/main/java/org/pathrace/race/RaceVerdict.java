package org.pathrace.race;

/**
 * Outcome of comparing two traversals.
 *
 * <p>{@code UNDECIDED} is reported while either traversal is still running, or while a
 * replay cursor has not yet reached the end of the longer trace.</p>
 */
public enum RaceVerdict {
    LEFT,
    RIGHT,
    TIE,
    UNDECIDED
}
