package org.patternlab.behavioral.observer;

/**
 * Temperature display on a phone.
 */
public final class PhoneDisplay extends TemperatureDisplay {

    @Override
    protected String displayName() {
        return "Phone display";
    }
}
