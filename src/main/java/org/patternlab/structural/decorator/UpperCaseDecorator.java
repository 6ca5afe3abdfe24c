package org.patternlab.structural.decorator;

import java.util.Locale;

/**
 * Upper-cases published text.
 */
public final class UpperCaseDecorator extends TextDecorator {

    public UpperCaseDecorator(TextPublisher component) {
        super(component);
    }

    @Override
    public String publish() {
        return super.publish().toUpperCase(Locale.ROOT);
    }
}
