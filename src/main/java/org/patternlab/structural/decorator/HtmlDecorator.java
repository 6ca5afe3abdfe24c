package org.patternlab.structural.decorator;

/**
 * Wraps published text in an {@code <html>} element.
 */
public final class HtmlDecorator extends TextDecorator {

    public HtmlDecorator(TextPublisher component) {
        super(component);
    }

    @Override
    public String publish() {
        return "<html>" + super.publish() + "</html>";
    }
}
