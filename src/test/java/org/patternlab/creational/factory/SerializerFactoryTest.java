package org.patternlab.creational.factory;

import org.patternlab.core.PatternContractException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SerializerFactory Tests")
class SerializerFactoryTest {

    @Test
    @DisplayName("json and xml serializers produce their representations")
    void testBuiltInFormats() {
        assertEquals(
                "JSON representation : {'data':'My business data'}",
                SerializerFactory.getSerializer("json").serialize("My business data")
        );
        assertEquals(
                "XML representation: <data>My business data</data>",
                SerializerFactory.getSerializer("xml").serialize("My business data")
        );
    }

    @ParameterizedTest
    @CsvSource({
            "json, json",
            "' JSON ', json",
            "Xml, xml"
    })
    @DisplayName("Format lookup is trimmed and case-insensitive")
    void testLookupNormalized(String requested, String expectedFormat) {
        assertEquals(expectedFormat, SerializerFactory.getSerializer(requested).format());
    }

    @ParameterizedTest
    @ValueSource(strings = {"yaml", "", "   "})
    @DisplayName("Unknown formats are rejected with UNKNOWN_SERIALIZER_FORMAT")
    void testUnknownFormatRejected(String format) {
        PatternContractException ex = assertThrows(
                PatternContractException.class,
                () -> SerializerFactory.getSerializer(format)
        );
        assertEquals(PatternContractException.Category.NOT_FOUND, ex.category());
        assertEquals(SerializerFactory.REASON_UNKNOWN_SERIALIZER_FORMAT, ex.reasonCode());
        assertTrue(ex.getMessage().contains("Unknown format: " + format));
    }

    @Test
    @DisplayName("Null format is rejected like an unknown one")
    void testNullFormatRejected() {
        PatternContractException ex = assertThrows(
                PatternContractException.class,
                () -> SerializerFactory.getSerializer(null)
        );
        assertEquals(SerializerFactory.REASON_UNKNOWN_SERIALIZER_FORMAT, ex.reasonCode());
    }

    @Test
    @DisplayName("Supported formats list json and xml")
    void testSupportedFormats() {
        assertEquals(2, SerializerFactory.supportedFormats().size());
        assertTrue(SerializerFactory.supportedFormats().contains(SerializerFactory.FORMAT_JSON));
        assertTrue(SerializerFactory.supportedFormats().contains(SerializerFactory.FORMAT_XML));
    }
}
