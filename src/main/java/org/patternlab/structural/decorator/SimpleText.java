package org.patternlab.structural.decorator;

import java.util.Objects;

/**
 * Concrete component publishing a fixed text.
 */
public final class SimpleText implements TextPublisher {
    private final String text;

    public SimpleText(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    @Override
    public String publish() {
        return text;
    }
}
