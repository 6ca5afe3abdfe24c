package org.patternlab.behavioral.observer;

/**
 * Listener notified whenever a subject's watched value changes.
 *
 * @param <T> watched value type.
 */
@FunctionalInterface
public interface Observer<T> {

    /**
     * Receives the subject's current value. Invoked synchronously on the broadcasting thread.
     */
    void onValueChanged(T value);
}
