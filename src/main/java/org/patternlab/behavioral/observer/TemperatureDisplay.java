package org.patternlab.behavioral.observer;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Base display that shows the most recent temperature it was given.
 */
@Slf4j
@Getter
@Accessors(fluent = true)
public abstract class TemperatureDisplay implements Observer<Integer> {
    private Integer lastTemperature;
    private int updateCount;

    @Override
    public final void onValueChanged(Integer temperature) {
        this.lastTemperature = temperature;
        this.updateCount++;
        log.info("{} updated to {} temperature", displayName(), temperature);
    }

    /**
     * Human-readable display name used in log lines, e.g. "Phone display".
     */
    protected abstract String displayName();

    @Override
    public String toString() {
        return displayName();
    }
}
