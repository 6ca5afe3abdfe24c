package org.patternlab.behavioral.observer;

import lombok.extern.slf4j.Slf4j;
import org.patternlab.core.PatternContractException;

import java.util.ArrayList;
import java.util.List;

/**
 * Subject holding one value and an ordered audience of {@link Observer}s.
 *
 * <p>Contract summary:</p>
 * <ul>
 * <li>Observers are kept in attachment order; attaching the same observer twice delivers twice.</li>
 * <li>{@link #detach(Observer)} removes the first matching entry and rejects strangers with
 * {@link #REASON_OBSERVER_NOT_ATTACHED}.</li>
 * <li>Broadcasts iterate a snapshot taken when the broadcast starts, so attach/detach from inside
 * a notification only affects later broadcasts.</li>
 * <li>Observer exceptions propagate to the caller and end the broadcast in progress.</li>
 * <li>Not thread-safe.</li>
 * </ul>
 *
 * @param <T> watched value type.
 */
@Slf4j
public final class SubjectRegistry<T> {
    public static final String REASON_OBSERVER_REQUIRED = "OBSERVER_REQUIRED";
    public static final String REASON_OBSERVER_NOT_ATTACHED = "OBSERVER_NOT_ATTACHED";

    private final List<Observer<? super T>> observers = new ArrayList<>();
    private T value;

    /**
     * Creates a registry whose value starts as {@code null}.
     */
    public SubjectRegistry() {
        this(null);
    }

    /**
     * Creates a registry with an initial value. No broadcast happens on construction.
     */
    public SubjectRegistry(T initialValue) {
        this.value = initialValue;
    }

    /**
     * Appends an observer to the audience.
     */
    public void attach(Observer<? super T> observer) {
        if (observer == null) {
            throw PatternContractException.invalidArgument(REASON_OBSERVER_REQUIRED, "observer must be provided");
        }
        observers.add(observer);
        log.debug("Attached observer {} ({} attached)", observer, observers.size());
    }

    /**
     * Removes the first entry equal to {@code observer}.
     */
    public void detach(Observer<? super T> observer) {
        if (observer == null) {
            throw PatternContractException.invalidArgument(REASON_OBSERVER_REQUIRED, "observer must be provided");
        }
        if (!observers.remove(observer)) {
            throw PatternContractException.notFound(
                    REASON_OBSERVER_NOT_ATTACHED,
                    "observer was never attached: " + observer
            );
        }
        log.debug("Detached observer {} ({} attached)", observer, observers.size());
    }

    /**
     * Stores a new value and broadcasts it to every attached observer.
     */
    public void setValue(T newValue) {
        this.value = newValue;
        notifyObservers();
    }

    /**
     * Re-broadcasts the current value without changing it.
     */
    public void notifyObservers() {
        List<Observer<? super T>> snapshot = List.copyOf(observers);
        T current = value;
        for (Observer<? super T> observer : snapshot) {
            observer.onValueChanged(current);
        }
    }

    /**
     * Returns the current value.
     */
    public T getValue() {
        return value;
    }

    /**
     * Returns number of attached entries, duplicates included.
     */
    public int observerCount() {
        return observers.size();
    }

    /**
     * Returns an immutable snapshot of attached observers in attachment order.
     */
    public List<Observer<? super T>> observers() {
        return List.copyOf(observers);
    }
}
