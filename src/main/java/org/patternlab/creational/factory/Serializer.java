package org.patternlab.creational.factory;

/**
 * Product contract produced by {@link SerializerFactory}.
 */
public interface Serializer {

    /**
     * Stable format identifier, lower-case (for example {@code json}).
     */
    String format();

    String serialize(String data);
}
