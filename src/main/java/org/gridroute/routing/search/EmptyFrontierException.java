package org.gridroute.routing.search;

/**
 * Thrown when attempting to pop from an empty {@link Frontier}.
 */
public class EmptyFrontierException extends IllegalStateException {
    public EmptyFrontierException(String message) {
        super(message);
    }
}
