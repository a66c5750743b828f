package org.pathrace.search;

/**
 * Thrown when attempting to extract from an empty {@link PriorityFrontier}.
 */
public class EmptyFrontierException extends IllegalStateException {
    public EmptyFrontierException(String message) {
        super(message);
    }
}
