package org.patternlab.behavioral.strategy;

import lombok.extern.slf4j.Slf4j;
import org.patternlab.core.PatternContractException;

import java.util.Objects;

/**
 * Builds a {@link Navigator} from a {@link NavigatorRuntimeConfig}.
 *
 * <p>The initial travel mode is resolved through {@link RouteStrategyRegistry#require(String)}.
 * When that mode is unknown and the config names a fallback, the fallback is resolved the same way;
 * a blank initial id is never replaced by the fallback.</p>
 */
@Slf4j
public final class NavigatorRuntimeBinder {
    public static final String REASON_STRATEGY_CONFIG_REQUIRED = "STRATEGY_CONFIG_REQUIRED";

    public Navigator bind(NavigatorRuntimeConfig runtimeConfig, RouteStrategyRegistry strategyRegistry) {
        if (runtimeConfig == null) {
            throw PatternContractException.invalidArgument(
                    REASON_STRATEGY_CONFIG_REQUIRED,
                    "navigatorRuntimeConfig must be provided"
            );
        }
        RouteStrategyRegistry registry = Objects.requireNonNull(strategyRegistry, "strategyRegistry");
        return new Navigator(resolveInitial(runtimeConfig, registry));
    }

    private static RouteStrategy resolveInitial(NavigatorRuntimeConfig config, RouteStrategyRegistry registry) {
        try {
            return registry.require(config.getInitialStrategyId());
        } catch (PatternContractException ex) {
            String fallback = RouteStrategyRegistry.normalizeId(config.getFallbackStrategyId());
            if (!ex.isNotFound() || fallback == null) {
                throw ex;
            }
            log.warn("Initial route strategy unavailable, falling back to {}: {}", fallback, ex.getMessage());
            return registry.require(fallback);
        }
    }
}
