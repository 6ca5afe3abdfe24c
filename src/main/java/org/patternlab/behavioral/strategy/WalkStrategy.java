package org.patternlab.behavioral.strategy;

/**
 * Walking directions through the park.
 */
public final class WalkStrategy implements RouteStrategy {

    @Override
    public String id() {
        return RouteStrategyRegistry.STRATEGY_WALK;
    }

    @Override
    public String computeRoute(String origin, String destination) {
        return "Walking from " + origin + " to " + destination + ": Walk through the park, takes 2 hours";
    }
}
