package org.patternlab.behavioral.strategy;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable navigator telemetry snapshot.
 */
@Value
@Builder
public class NavigatorTelemetry {

    /**
     * Id of the strategy active when the snapshot was taken.
     */
    String activeStrategyId;

    /**
     * Simple class name of the active strategy.
     */
    String activeStrategyType;

    /**
     * Number of successful strategy replacements since construction.
     */
    long strategySwitchCount;
}
