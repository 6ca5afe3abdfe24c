package org.patternlab.creational.factory;

/**
 * Illustrative JSON-shaped output. No escaping is performed.
 */
public final class JsonSerializer implements Serializer {

    @Override
    public String format() {
        return SerializerFactory.FORMAT_JSON;
    }

    @Override
    public String serialize(String data) {
        return "JSON representation : {'data':'" + data + "'}";
    }
}
