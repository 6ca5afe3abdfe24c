package org.patternlab.behavioral.strategy;

import lombok.Builder;
import lombok.Value;

/**
 * Startup choice of travel mode for a {@link Navigator}.
 */
@Value
@Builder
public class NavigatorRuntimeConfig {

    /**
     * Travel mode the navigator starts with; matched case-insensitively.
     */
    @Builder.Default
    String initialStrategyId = RouteStrategyRegistry.STRATEGY_ROAD;

    /**
     * Travel mode used instead when the initial one is not registered. Null means no fallback.
     */
    String fallbackStrategyId;

    public static NavigatorRuntimeConfig startingWith(String strategyId) {
        return NavigatorRuntimeConfig.builder().initialStrategyId(strategyId).build();
    }

    /**
     * Driving first, no fallback.
     */
    public static NavigatorRuntimeConfig defaultRuntime() {
        return NavigatorRuntimeConfig.builder().build();
    }
}
