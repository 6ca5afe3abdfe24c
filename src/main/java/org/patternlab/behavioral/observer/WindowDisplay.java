package org.patternlab.behavioral.observer;

/**
 * Temperature display mounted in a window.
 */
public final class WindowDisplay extends TemperatureDisplay {

    @Override
    protected String displayName() {
        return "Window display";
    }
}
