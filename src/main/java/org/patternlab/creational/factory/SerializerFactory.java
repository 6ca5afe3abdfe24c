package org.patternlab.creational.factory;

import lombok.experimental.UtilityClass;
import org.patternlab.core.PatternContractException;

import java.util.Locale;
import java.util.Set;

/**
 * Creates serializers by format name.
 */
@UtilityClass
public final class SerializerFactory {
    public static final String FORMAT_JSON = "json";
    public static final String FORMAT_XML = "xml";
    public static final String REASON_UNKNOWN_SERIALIZER_FORMAT = "UNKNOWN_SERIALIZER_FORMAT";

    private static final Set<String> SUPPORTED_FORMATS = Set.of(FORMAT_JSON, FORMAT_XML);

    /**
     * Returns a new serializer for {@code formatType}; lookup is trimmed and case-insensitive.
     *
     * @param formatType requested format, {@code json} or {@code xml}.
     * @return serializer for the format.
     */
    public static Serializer getSerializer(String formatType) {
        String normalized = formatType == null ? "" : formatType.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case FORMAT_JSON -> new JsonSerializer();
            case FORMAT_XML -> new XmlSerializer();
            default -> throw PatternContractException.notFound(
                    REASON_UNKNOWN_SERIALIZER_FORMAT,
                    "Unknown format: " + formatType
            );
        };
    }

    public static Set<String> supportedFormats() {
        return SUPPORTED_FORMATS;
    }
}
