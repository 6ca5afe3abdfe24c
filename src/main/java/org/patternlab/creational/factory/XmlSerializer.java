package org.patternlab.creational.factory;

/**
 * Illustrative XML-shaped output. No escaping is performed.
 */
public final class XmlSerializer implements Serializer {

    @Override
    public String format() {
        return SerializerFactory.FORMAT_XML;
    }

    @Override
    public String serialize(String data) {
        return "XML representation: <data>" + data + "</data>";
    }
}
