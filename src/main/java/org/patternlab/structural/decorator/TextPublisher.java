package org.patternlab.structural.decorator;

/**
 * Component contract for anything that publishes text.
 */
public interface TextPublisher {

    String publish();
}
