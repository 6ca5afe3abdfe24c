package org.patternlab.creational.singleton;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable application settings shared process-wide through {@link AppConfigHolder}.
 */
@Value
@Builder
public class AppConfig {
    public static final String DEFAULT_URL = "https://localhost:4999";
    public static final String DEFAULT_USER_NAME = "suriya";

    /**
     * Service endpoint.
     */
    String url;

    String userName;

    /**
     * Returns the settings used when nothing was installed explicitly.
     */
    public static AppConfig defaults() {
        return AppConfig.builder()
                .url(DEFAULT_URL)
                .userName(DEFAULT_USER_NAME)
                .build();
    }
}
