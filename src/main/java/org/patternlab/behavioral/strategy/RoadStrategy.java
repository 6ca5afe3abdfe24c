package org.patternlab.behavioral.strategy;

/**
 * Driving directions over the highway network.
 */
public final class RoadStrategy implements RouteStrategy {

    @Override
    public String id() {
        return RouteStrategyRegistry.STRATEGY_ROAD;
    }

    @Override
    public String computeRoute(String origin, String destination) {
        return "Road Route from " + origin + " to " + destination + " : Drive I-95, takes 30 mins";
    }
}
