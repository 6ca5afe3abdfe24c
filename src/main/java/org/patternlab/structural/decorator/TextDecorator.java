package org.patternlab.structural.decorator;

import java.util.Objects;

/**
 * Base decorator delegating to the wrapped publisher.
 *
 * <p>Subclasses transform the result of {@code super.publish()}.</p>
 */
public abstract class TextDecorator implements TextPublisher {
    private final TextPublisher component;

    protected TextDecorator(TextPublisher component) {
        this.component = Objects.requireNonNull(component, "component");
    }

    @Override
    public String publish() {
        return component.publish();
    }
}
