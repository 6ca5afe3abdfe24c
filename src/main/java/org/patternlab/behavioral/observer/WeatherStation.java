package org.patternlab.behavioral.observer;

import java.util.List;

/**
 * Temperature subject publishing every reading to its attached displays.
 */
public final class WeatherStation {
    public static final int INITIAL_TEMPERATURE = 0;

    private final SubjectRegistry<Integer> registry = new SubjectRegistry<>(INITIAL_TEMPERATURE);

    public void attach(Observer<? super Integer> observer) {
        registry.attach(observer);
    }

    public void detach(Observer<? super Integer> observer) {
        registry.detach(observer);
    }

    /**
     * Records a new temperature and notifies every attached display.
     */
    public void updateTemperature(int temperature) {
        registry.setValue(temperature);
    }

    /**
     * Pushes the current temperature again, e.g. to prime newly attached displays.
     */
    public void notifyObservers() {
        registry.notifyObservers();
    }

    public int getTemperature() {
        return registry.getValue();
    }

    public List<Observer<? super Integer>> observers() {
        return registry.observers();
    }
}
