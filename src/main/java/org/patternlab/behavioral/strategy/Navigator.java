package org.patternlab.behavioral.strategy;

import lombok.extern.slf4j.Slf4j;
import org.patternlab.core.PatternContractException;

/**
 * Strategy context holding exactly one active {@link RouteStrategy}.
 *
 * <p>The active strategy is a single slot: {@link #setStrategy(RouteStrategy)} replaces it
 * unconditionally and {@link #getDirections(String, String)} always delegates to whatever
 * occupies the slot at call time. Strategy failures propagate to the caller untranslated.</p>
 *
 * <p>Not thread-safe. Hosts sharing one navigator across threads must guard it externally.</p>
 */
@Slf4j
public final class Navigator {
    public static final String REASON_STRATEGY_REQUIRED = "STRATEGY_REQUIRED";

    private RouteStrategy strategy;
    private long switchCount;

    /**
     * Creates a navigator with its initial strategy.
     *
     * @param initialStrategy strategy used until the first replacement.
     */
    public Navigator(RouteStrategy initialStrategy) {
        this.strategy = requireStrategy(initialStrategy, "initialStrategy");
    }

    /**
     * Replaces the active strategy.
     *
     * @param newStrategy strategy used by subsequent direction requests.
     */
    public void setStrategy(RouteStrategy newStrategy) {
        RouteStrategy nonNullStrategy = requireStrategy(newStrategy, "newStrategy");
        RouteStrategy previous = strategy;
        this.strategy = nonNullStrategy;
        this.switchCount++;
        log.info("----Switching strategy from {} to {}------", kindOf(previous), kindOf(nonNullStrategy));
    }

    /**
     * Computes directions with the active strategy and returns its result unchanged.
     */
    public String getDirections(String origin, String destination) {
        return strategy.computeRoute(origin, destination);
    }

    /**
     * Returns the active strategy.
     */
    public RouteStrategy activeStrategy() {
        return strategy;
    }

    /**
     * Returns an immutable snapshot of the current navigator state.
     */
    public NavigatorTelemetry telemetry() {
        return NavigatorTelemetry.builder()
                .activeStrategyId(strategy.id())
                .activeStrategyType(strategy.getClass().getSimpleName())
                .strategySwitchCount(switchCount)
                .build();
    }

    private static RouteStrategy requireStrategy(RouteStrategy strategy, String fieldName) {
        if (strategy == null) {
            throw PatternContractException.invalidArgument(REASON_STRATEGY_REQUIRED, fieldName + " must be provided");
        }
        return strategy;
    }

    // Class names only; strategy code is not invoked for diagnostics.
    private static String kindOf(RouteStrategy strategy) {
        String name = strategy.getClass().getSimpleName();
        return name.isEmpty() ? strategy.getClass().getName() : name;
    }
}
