package org.patternlab.behavioral.strategy;

import org.patternlab.core.PatternContractException;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable lookup of route strategies by travel-mode id.
 *
 * <p>Ids are travel modes such as {@code ROAD} or {@code WALK} and are matched after trimming
 * and upper-casing, so {@code " walk "} finds the walking strategy. Custom modes may replace a
 * built-in one; declaring the same mode twice in one batch is rejected.</p>
 */
public final class RouteStrategyRegistry {
    public static final String STRATEGY_ROAD = "ROAD";
    public static final String STRATEGY_WALK = "WALK";

    public static final String REASON_STRATEGY_ID_REQUIRED = "STRATEGY_ID_REQUIRED";
    public static final String REASON_UNKNOWN_ROUTE_STRATEGY = "UNKNOWN_ROUTE_STRATEGY";

    private final Map<String, RouteStrategy> strategiesByMode;

    private RouteStrategyRegistry(Map<String, RouteStrategy> strategiesByMode) {
        this.strategiesByMode = Collections.unmodifiableMap(strategiesByMode);
    }

    /**
     * Returns a registry holding ROAD and WALK.
     */
    public static RouteStrategyRegistry defaultRegistry() {
        return withCustomStrategies(Set.of());
    }

    /**
     * Returns a registry holding the built-ins plus {@code customStrategies}; a custom mode with
     * a built-in id replaces the built-in.
     */
    public static RouteStrategyRegistry withCustomStrategies(Collection<? extends RouteStrategy> customStrategies) {
        Objects.requireNonNull(customStrategies, "customStrategies");
        LinkedHashMap<String, RouteStrategy> modes = new LinkedHashMap<>();
        modes.put(STRATEGY_ROAD, new RoadStrategy());
        modes.put(STRATEGY_WALK, new WalkStrategy());

        Set<String> declared = new HashSet<>();
        for (RouteStrategy strategy : customStrategies) {
            RouteStrategy nonNullStrategy = Objects.requireNonNull(strategy, "strategy");
            String mode = normalizeId(nonNullStrategy.id());
            if (mode == null) {
                throw new IllegalArgumentException("strategy.id must be non-blank for " + nonNullStrategy.getClass().getName());
            }
            if (!declared.add(mode)) {
                throw new IllegalArgumentException("travel mode declared twice: " + mode);
            }
            modes.put(mode, nonNullStrategy);
        }
        return new RouteStrategyRegistry(modes);
    }

    /**
     * Returns the strategy for {@code strategyId}, or null when the id is blank or unknown.
     */
    public RouteStrategy strategy(String strategyId) {
        String mode = normalizeId(strategyId);
        return mode == null ? null : strategiesByMode.get(mode);
    }

    /**
     * Returns the strategy for {@code strategyId}.
     *
     * @throws PatternContractException INVALID_ARGUMENT when the id is blank, NOT_FOUND when no
     *                                  strategy serves that travel mode.
     */
    public RouteStrategy require(String strategyId) {
        String mode = normalizeId(strategyId);
        if (mode == null) {
            throw PatternContractException.invalidArgument(REASON_STRATEGY_ID_REQUIRED, "strategy id must be provided");
        }
        RouteStrategy strategy = strategiesByMode.get(mode);
        if (strategy == null) {
            throw PatternContractException.notFound(
                    REASON_UNKNOWN_ROUTE_STRATEGY,
                    "unknown route strategy id: " + mode + " (known: " + strategiesByMode.keySet() + ")"
            );
        }
        return strategy;
    }

    /**
     * Returns registered travel modes in registration order.
     */
    public Set<String> strategyIds() {
        return strategiesByMode.keySet();
    }

    /**
     * Canonical travel-mode form: trimmed and upper-cased, or null when blank.
     */
    static String normalizeId(String id) {
        if (id == null) {
            return null;
        }
        String trimmed = id.trim();
        return trimmed.isEmpty() ? null : trimmed.toUpperCase(Locale.ROOT);
    }
}
