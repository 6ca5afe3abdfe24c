package org.patternlab.behavioral.strategy;

/**
 * Strategy contract for building directions between two places.
 */
public interface RouteStrategy {

    /**
     * Stable strategy identifier.
     */
    String id();

    /**
     * Builds a human-readable route description from {@code origin} to {@code destination}.
     */
    String computeRoute(String origin, String destination);
}
